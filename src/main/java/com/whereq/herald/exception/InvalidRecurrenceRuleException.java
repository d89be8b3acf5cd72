package com.whereq.herald.exception;

/**
 * Exception thrown when a recurrence rule is malformed or does not advance time
 */
public class InvalidRecurrenceRuleException extends RuntimeException {
    public InvalidRecurrenceRuleException(String message) {
        super(message);
    }

    public InvalidRecurrenceRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
