package com.whereq.herald.service;

import com.whereq.herald.clock.Clock;
import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.RecurrenceKind;
import com.whereq.herald.model.RecurrenceRule;
import com.whereq.herald.recurrence.RecurrenceCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Common recurring schedules expressed as wall-clock times.
 * Each shortcut picks the first occurrence strictly after now and submits a recurring job.
 */
@Slf4j
@Service
public class SchedulingShortcuts {

    private final NotificationScheduler scheduler;
    private final Clock clock;
    private final ZoneOffset offset;

    public SchedulingShortcuts(NotificationScheduler scheduler, Clock clock, RecurrenceCalculator recurrenceCalculator) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.offset = recurrenceCalculator.getOffset();
    }

    /**
     * Every day at the given time
     */
    public String dailyAt(NotificationPayload payload, LocalTime time) {
        Instant first = firstDailyOccurrence(time);
        log.debug("Daily shortcut at {} starts {}", time, first);
        return scheduler.submit(payload, first, RecurrenceRule.daily(1));
    }

    /**
     * Every week on the given day at the given time
     */
    public String weeklyOn(NotificationPayload payload, DayOfWeek dayOfWeek, LocalTime time) {
        Instant first = firstWeeklyOccurrence(dayOfWeek, time);
        RecurrenceRule rule = RecurrenceRule.builder()
            .kind(RecurrenceKind.WEEKLY)
            .interval(1)
            .anchorDayOfWeek(dayOfWeek)
            .build();
        log.debug("Weekly shortcut on {} at {} starts {}", dayOfWeek, time, first);
        return scheduler.submit(payload, first, rule);
    }

    /**
     * Every month on the given day at the given time; short months use their last day
     */
    public String monthlyOn(NotificationPayload payload, int dayOfMonth, LocalTime time) {
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new IllegalArgumentException("Day of month must be within 1..31, got " + dayOfMonth);
        }
        Instant first = firstMonthlyOccurrence(dayOfMonth, time);
        RecurrenceRule rule = RecurrenceRule.builder()
            .kind(RecurrenceKind.MONTHLY)
            .interval(1)
            .anchorDayOfMonth(dayOfMonth)
            .build();
        log.debug("Monthly shortcut on day {} at {} starts {}", dayOfMonth, time, first);
        return scheduler.submit(payload, first, rule);
    }

    Instant firstDailyOccurrence(LocalTime time) {
        OffsetDateTime now = clock.now().atOffset(offset);
        OffsetDateTime candidate = now.toLocalDate().atTime(time).atOffset(offset);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    Instant firstWeeklyOccurrence(DayOfWeek dayOfWeek, LocalTime time) {
        OffsetDateTime now = clock.now().atOffset(offset);
        int daysUntil = (dayOfWeek.getValue() - now.getDayOfWeek().getValue() + 7) % 7;
        OffsetDateTime candidate = now.toLocalDate().plusDays(daysUntil).atTime(time).atOffset(offset);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate.toInstant();
    }

    Instant firstMonthlyOccurrence(int dayOfMonth, LocalTime time) {
        OffsetDateTime now = clock.now().atOffset(offset);
        YearMonth month = YearMonth.from(now);
        OffsetDateTime candidate = atClampedDay(month, dayOfMonth, time);
        if (!candidate.isAfter(now)) {
            candidate = atClampedDay(month.plusMonths(1), dayOfMonth, time);
        }
        return candidate.toInstant();
    }

    private OffsetDateTime atClampedDay(YearMonth month, int dayOfMonth, LocalTime time) {
        LocalDate date = month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
        return date.atTime(time).atOffset(offset);
    }
}
