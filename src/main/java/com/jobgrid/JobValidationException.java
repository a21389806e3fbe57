package com.jobgrid;

/**
 * Raised when a job definition, schedule or job hook fails validation.
 * Carries the name of the offending field so callers can report it next to the input.
 */
public class JobValidationException extends RuntimeException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public JobValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
