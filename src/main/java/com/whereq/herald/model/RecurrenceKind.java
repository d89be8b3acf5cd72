package com.whereq.herald.model;

/**
 * Unit in which a recurrence interval is expressed.
 */
public enum RecurrenceKind {
    /**
     * Interval counts days
     */
    DAILY,

    /**
     * Interval counts weeks
     */
    WEEKLY,

    /**
     * Interval counts calendar months
     */
    MONTHLY,

    /**
     * Interval is a plain duration in milliseconds
     */
    CUSTOM
}
