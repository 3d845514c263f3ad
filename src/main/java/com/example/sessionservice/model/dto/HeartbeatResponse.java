package com.example.sessionservice.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HeartbeatResponse {
    String sessionId;
    Instant lastActivityAt;
    String status;
    String message;

    public HeartbeatResponse(String sessionId, Instant lastActivityAt, String status) {
        this(sessionId, lastActivityAt, status, "Heartbeat updated");
    }
}
