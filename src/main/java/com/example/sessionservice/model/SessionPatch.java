package com.example.sessionservice.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Partial update for a session. A {@code null} field is left untouched. {@code title} and
 * {@code status} replace the stored value; {@code context} and {@code metadata} are merged
 * key by key into the stored maps.
 */
@Value
@Builder
public class SessionPatch {
    String title;
    String status;
    Map<String, Object> context;
    Map<String, Object> metadata;

    public static SessionPatch status(String status) {
        return SessionPatch.builder().status(status).build();
    }
}
