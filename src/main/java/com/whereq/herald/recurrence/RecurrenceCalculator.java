package com.whereq.herald.recurrence;

import com.whereq.herald.exception.InvalidRecurrenceRuleException;
import com.whereq.herald.model.RecurrenceRule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Computes the next occurrence of a recurring job.
 *
 * Calendar units (days, weeks, months) are applied at a fixed UTC offset,
 * so "same time of day" means the same wall-clock time at that offset.
 * Custom intervals are plain durations.
 */
public final class RecurrenceCalculator {

    private final ZoneOffset offset;

    public RecurrenceCalculator(ZoneOffset offset) {
        this.offset = Objects.requireNonNull(offset);
    }

    public RecurrenceCalculator() {
        this(ZoneOffset.UTC);
    }

    /**
     * Next fire time after {@code from}.
     *
     * @param from instant to advance from, normally the time of the last firing
     * @param rule recurrence rule
     * @return an instant strictly after {@code from}
     * @throws InvalidRecurrenceRuleException if the rule is malformed or does not advance time
     */
    public Instant next(Instant from, RecurrenceRule rule) {
        validate(rule);

        Instant next;
        try {
            next = advance(from.atOffset(offset), rule).toInstant();
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidRecurrenceRuleException(
                "Recurrence rule leaves the supported time range: " + rule + " from " + from, e);
        }
        if (!next.isAfter(from)) {
            throw new InvalidRecurrenceRuleException(
                "Recurrence rule does not advance time: " + rule + " from " + from);
        }
        return next;
    }

    /**
     * Reject rules that are malformed, or whose first advance from {@code from} cannot be computed.
     *
     * @param rule recurrence rule
     * @param from instant the rule will first advance from
     * @throws InvalidRecurrenceRuleException if the rule is unusable
     */
    public void validate(RecurrenceRule rule, Instant from) {
        next(from, rule);
    }

    /**
     * Reject rules that could never produce a valid occurrence.
     *
     * @param rule recurrence rule
     * @throws InvalidRecurrenceRuleException if the rule is malformed
     */
    public void validate(RecurrenceRule rule) {
        if (rule == null) {
            throw new InvalidRecurrenceRuleException("Recurrence rule must not be null");
        }
        if (rule.getKind() == null) {
            throw new InvalidRecurrenceRuleException("Recurrence kind is required");
        }
        if (rule.getInterval() <= 0) {
            throw new InvalidRecurrenceRuleException(
                "Recurrence interval must be positive, got " + rule.getInterval());
        }
        Integer dayOfMonth = rule.getAnchorDayOfMonth();
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new InvalidRecurrenceRuleException(
                "Anchor day of month must be within 1..31, got " + dayOfMonth);
        }
    }

    public ZoneOffset getOffset() {
        return offset;
    }

    private OffsetDateTime advance(OffsetDateTime start, RecurrenceRule rule) {
        return switch (rule.getKind()) {
            case DAILY -> start.plusDays(rule.getInterval());
            case WEEKLY -> alignToWeekday(start.plusWeeks(rule.getInterval()), rule);
            case MONTHLY -> alignToDayOfMonth(start.plusMonths(rule.getInterval()), rule);
            case CUSTOM -> start.plus(Duration.ofMillis(rule.getInterval()));
        };
    }

    // forward only: 0..6 days
    private OffsetDateTime alignToWeekday(OffsetDateTime candidate, RecurrenceRule rule) {
        if (rule.getAnchorDayOfWeek() == null) {
            return candidate;
        }
        int anchor = rule.getAnchorDayOfWeek().getValue();
        int current = candidate.getDayOfWeek().getValue();
        int daysToAdd = (anchor - current + 7) % 7;
        return candidate.plusDays(daysToAdd);
    }

    private OffsetDateTime alignToDayOfMonth(OffsetDateTime candidate, RecurrenceRule rule) {
        if (rule.getAnchorDayOfMonth() == null) {
            return candidate;
        }
        int lastDay = candidate.toLocalDate().lengthOfMonth();
        return candidate.withDayOfMonth(Math.min(rule.getAnchorDayOfMonth(), lastDay));
    }
}
