package com.whereq.herald.clock;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Clock backed by a Reactor {@link Scheduler}: both time and timers come from it,
 * so a {@code VirtualTimeScheduler} drives the whole scheduler in tests.
 */
public final class ReactorClock implements Clock {

    private final Scheduler scheduler;

    public ReactorClock(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    @Override
    public Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    @Override
    public Disposable after(Duration delay, Runnable task) {
        long millis = Math.max(0L, delay.toMillis());
        return scheduler.schedule(task, millis, TimeUnit.MILLISECONDS);
    }
}
