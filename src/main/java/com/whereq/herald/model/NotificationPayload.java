package com.whereq.herald.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * What gets delivered when a job fires.
 * Immutable: editing a notification means cancelling it and submitting a new one.
 */
@Value
@Builder
@Jacksonized
public class NotificationPayload {

    /**
     * Notification title
     */
    String title;

    /**
     * Notification body
     */
    String message;

    /**
     * Opaque delivery target, interpreted by the dispatcher
     */
    String destination;

    @Builder.Default
    Priority priority = Priority.MEDIUM;

    /**
     * Free-form attributes carried through to delivery
     */
    @Builder.Default
    Map<String, String> metadata = Map.of();
}
