package com.whereq.herald.exception;

import java.time.Instant;

/**
 * Exception thrown when a one-shot notification is submitted for a time that has already passed
 */
public class PastScheduleTimeException extends RuntimeException {

    private final Instant scheduleTime;

    public PastScheduleTimeException(Instant scheduleTime, Instant now) {
        super("Schedule time must be in the future: " + scheduleTime + " is not after " + now);
        this.scheduleTime = scheduleTime;
    }

    public Instant getScheduleTime() {
        return scheduleTime;
    }
}
