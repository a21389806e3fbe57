package com.jobgrid.scheduling;

/**
 * A due schedule entry could not be sent.
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
