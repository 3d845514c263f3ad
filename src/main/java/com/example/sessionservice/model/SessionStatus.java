package com.example.sessionservice.model;

/**
 * Conventional status values. Status is stored as a plain string and any value may be
 * written through an update; only archive/restore move between states on their own.
 */
public final class SessionStatus {

    public static final String ACTIVE = "active";
    public static final String IN_PROGRESS = "in_progress";
    public static final String COMPLETED = "completed";
    public static final String ARCHIVED = "archived";
    public static final String ABANDONED = "abandoned";

    private SessionStatus() {
    }
}
