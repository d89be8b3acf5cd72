package com.whereq.herald.exception;

/**
 * Exception raised by a dispatcher when a notification could not be delivered
 */
public class DispatchFailureException extends RuntimeException {
    public DispatchFailureException(String message) {
        super(message);
    }

    public DispatchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
