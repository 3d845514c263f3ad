package com.example.sessionservice.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionSearchRequest {
    private String status;
    private String query;
    private Integer limit;
}
