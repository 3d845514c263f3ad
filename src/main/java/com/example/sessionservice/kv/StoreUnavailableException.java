package com.example.sessionservice.kv;

/**
 * The key-value store failed to answer (timeout, refused connection, command error).
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
