package com.example.sessionservice.model.dto;

import lombok.Value;

import java.time.Instant;

@Value
public class ApiError {
    String errorId;
    int status;
    String error;
    String message;
    String path;
    Instant timestamp;
}
