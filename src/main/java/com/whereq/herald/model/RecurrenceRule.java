package com.whereq.herald.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.DayOfWeek;
import java.time.Instant;

/**
 * Describes how a recurring job advances after each firing.
 */
@Value
@Builder
@Jacksonized
public class RecurrenceRule {

    RecurrenceKind kind;

    /**
     * Days, weeks, months or milliseconds depending on {@link #kind}
     */
    long interval;

    /**
     * No occurrence is scheduled after this instant (optional)
     */
    Instant endTime;

    /**
     * Weekly rules only: occurrences are moved forward onto this weekday
     */
    DayOfWeek anchorDayOfWeek;

    /**
     * Monthly rules only: occurrences land on this day, clamped to the month length
     */
    Integer anchorDayOfMonth;

    public static RecurrenceRule daily(long days) {
        return RecurrenceRule.builder().kind(RecurrenceKind.DAILY).interval(days).build();
    }

    public static RecurrenceRule weekly(long weeks) {
        return RecurrenceRule.builder().kind(RecurrenceKind.WEEKLY).interval(weeks).build();
    }

    public static RecurrenceRule monthly(long months) {
        return RecurrenceRule.builder().kind(RecurrenceKind.MONTHLY).interval(months).build();
    }

    public static RecurrenceRule custom(long millis) {
        return RecurrenceRule.builder().kind(RecurrenceKind.CUSTOM).interval(millis).build();
    }

    /**
     * Check whether the given candidate occurrence lies past the end of this rule
     */
    public boolean isPastEnd(Instant candidate) {
        return endTime != null && candidate.isAfter(endTime);
    }
}
