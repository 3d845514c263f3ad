package com.example.sessionservice.model.dto;

import lombok.Value;

import java.util.List;

@Value
public class SessionListResponse {
    List<SessionResponse> sessions;
    long total;
    int limit;
    int offset;
}
