package com.example.sessionservice.model.dto;

import com.example.sessionservice.model.Session;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionResponse {
    String sessionId;
    String userId;
    String title;
    String clientId;
    Instant createdAt;
    Instant updatedAt;
    Instant lastActivityAt;
    String status;
    int messageCount;
    Map<String, Object> metadata;

    public static SessionResponse from(Session s) {
        return SessionResponse.builder()
                .sessionId(s.getSessionId())
                .userId(s.getUserId())
                .title(s.getTitle())
                .clientId(s.getClientId())
                .createdAt(s.getCreatedAt())
                .updatedAt(s.getUpdatedAt())
                .lastActivityAt(s.getLastActivityAt())
                .status(s.getStatus())
                .messageCount(s.getMessages().size())
                .metadata(s.getMetadata())
                .build();
    }
}
