package com.example.sessionservice.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Message {
    private String messageId;
    private String role; // user, assistant, system
    private String content;
    private Instant timestamp;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
