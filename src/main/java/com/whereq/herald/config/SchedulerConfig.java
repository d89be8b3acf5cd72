package com.whereq.herald.config;

import com.whereq.herald.clock.Clock;
import com.whereq.herald.clock.ReactorClock;
import com.whereq.herald.recurrence.RecurrenceCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Timer and recurrence beans used by the notification scheduler
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler heraldTimerScheduler(HeraldProperties properties) {
        int threadCap = properties.getTimer().getThreadCap();
        log.info("Creating timer scheduler with thread cap {}", threadCap);
        return Schedulers.newBoundedElastic(
            threadCap,
            Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
            "herald-timer");
    }

    @Bean
    public Clock heraldClock(Scheduler heraldTimerScheduler) {
        return new ReactorClock(heraldTimerScheduler);
    }

    @Bean
    public RecurrenceCalculator recurrenceCalculator(HeraldProperties properties) {
        return new RecurrenceCalculator(properties.getZoneOffset());
    }
}
