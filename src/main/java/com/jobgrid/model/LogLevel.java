package com.jobgrid.model;

import java.util.Locale;

/**
 * Severity of a job log entry. {@link #DEBUG} is the default for entries written without a level.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    SUCCESS,
    WARNING,
    FAILURE;

    /**
     * Resolves a level by its case-insensitive name.
     *
     * @throws IllegalArgumentException if the name is not a known level
     */
    public static LogLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Unknown logging level: " + name);
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown logging level: " + name);
    }
}
