package com.example.sessionservice.controller;

/**
 * The session exists but belongs to a different user than the one named in X-User-ID.
 */
public class SessionAccessDeniedException extends RuntimeException {

    public SessionAccessDeniedException(String message) {
        super(message);
    }
}
