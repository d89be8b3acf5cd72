package com.whereq.herald.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One dispatch attempt, successful or not. Append-only.
 */
@Value
@Builder
@Jacksonized
public class HistoryEntry {

    String id;

    /**
     * Job that fired, null for immediate sends
     */
    String jobId;

    Instant firedAt;

    boolean success;

    /**
     * Failure description when {@link #success} is false
     */
    String errorDetail;

    /**
     * Destination the attempt was made against
     */
    String destinationEcho;

    /**
     * Identifier reported by the dispatcher on success (optional)
     */
    String deliveryId;
}
