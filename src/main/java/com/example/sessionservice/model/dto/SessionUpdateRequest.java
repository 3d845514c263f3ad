package com.example.sessionservice.model.dto;

import com.example.sessionservice.model.SessionPatch;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of PUT /sessions/{id}. Fields other than these four are dropped on read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionUpdateRequest {
    private String title;
    private String status;
    private Map<String, Object> context;
    private Map<String, Object> metadata;

    public SessionPatch toPatch() {
        return SessionPatch.builder()
                .title(title)
                .status(status)
                .context(context)
                .metadata(metadata)
                .build();
    }
}
