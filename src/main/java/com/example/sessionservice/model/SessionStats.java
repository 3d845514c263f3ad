package com.example.sessionservice.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionStats {
    String sessionId;
    int messageCount;
    long durationSeconds; // lastActivityAt - createdAt
    String status;
    Instant createdAt;
    Instant lastActivityAt;
}
