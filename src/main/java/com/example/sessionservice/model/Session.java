package com.example.sessionservice.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A troubleshooting session as persisted under {@code session:{sessionId}}.
 * {@code sessionId}, {@code userId} and {@code createdAt} never change after creation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Session {
    private String sessionId;
    private String userId;
    private String title;
    private String clientId;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastActivityAt;
    @Builder.Default
    private String status = SessionStatus.ACTIVE;
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();
    @Builder.Default
    private List<Message> messages = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
