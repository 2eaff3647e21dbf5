package com.heronix.scheduler.exception;

/**
 * Exception thrown when a scheduling entity would break a scheduling rule,
 * such as overlapping periods or a room booked twice in a period.
 */
public class SchedulingValidationException extends RuntimeException {

    public SchedulingValidationException(String message) {
        super(message);
    }

    public SchedulingValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
