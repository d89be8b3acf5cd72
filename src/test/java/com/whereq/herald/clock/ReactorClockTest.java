package com.whereq.herald.clock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReactorClockTest {

    private final VirtualTimeScheduler virtualTime = VirtualTimeScheduler.create();
    private final Clock clock = new ReactorClock(virtualTime);

    @AfterEach
    void tearDown() {
        virtualTime.dispose();
    }

    @Test
    void now_followsSchedulerTime() {
        Instant start = Instant.parse("2024-05-01T08:00:00Z");
        virtualTime.advanceTimeTo(start);

        assertThat(clock.now()).isEqualTo(start);

        virtualTime.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(clock.now()).isEqualTo(start.plus(Duration.ofMinutes(5)));
    }

    @Test
    void after_runsTaskOnceDelayElapses() {
        AtomicInteger runs = new AtomicInteger();
        clock.after(Duration.ofSeconds(10), runs::incrementAndGet);

        virtualTime.advanceTimeBy(Duration.ofSeconds(9));
        assertThat(runs).hasValue(0);

        virtualTime.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(runs).hasValue(1);
    }

    @Test
    void after_disposedTaskNeverRuns() {
        AtomicInteger runs = new AtomicInteger();
        Disposable timer = clock.after(Duration.ofSeconds(10), runs::incrementAndGet);

        timer.dispose();
        virtualTime.advanceTimeBy(Duration.ofMinutes(1));

        assertThat(runs).hasValue(0);
    }

    @Test
    void after_negativeDelayRunsImmediately() {
        AtomicInteger runs = new AtomicInteger();
        clock.after(Duration.ofSeconds(-5), runs::incrementAndGet);

        virtualTime.advanceTime();

        assertThat(runs).hasValue(1);
    }
}
