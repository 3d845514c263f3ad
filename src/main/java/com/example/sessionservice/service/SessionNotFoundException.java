package com.example.sessionservice.service;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session " + sessionId + " not found");
    }
}
