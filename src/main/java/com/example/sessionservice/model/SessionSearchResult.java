package com.example.sessionservice.model;

import lombok.Value;

import java.util.List;

/**
 * One page of search matches plus the number of sessions that matched overall.
 */
@Value
public class SessionSearchResult {
    List<Session> sessions;
    int total;
}
