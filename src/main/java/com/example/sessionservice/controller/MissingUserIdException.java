package com.example.sessionservice.controller;

public class MissingUserIdException extends RuntimeException {

    public MissingUserIdException() {
        super("X-User-ID header is required (should be added by API Gateway)");
    }
}
