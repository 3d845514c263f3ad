package com.example.sessionservice.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageRequest {
    private String role;
    private String content;
    private Map<String, Object> metadata;
}
