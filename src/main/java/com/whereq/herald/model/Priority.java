package com.whereq.herald.model;

/**
 * Delivery priority of a notification, passed through to the dispatcher.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH
}
