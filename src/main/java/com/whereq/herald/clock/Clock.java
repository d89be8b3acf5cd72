package com.whereq.herald.clock;

import reactor.core.Disposable;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and timer primitive used by the scheduler.
 * Tests plug in virtual time so that days of schedule can elapse instantly.
 */
public interface Clock {

    /**
     * Current instant
     */
    Instant now();

    /**
     * Run the task once after the given delay.
     * A zero or negative delay runs the task as soon as possible.
     *
     * @param delay time to wait
     * @param task task to run
     * @return handle whose {@code dispose()} cancels the pending wait
     */
    Disposable after(Duration delay, Runnable task);
}
