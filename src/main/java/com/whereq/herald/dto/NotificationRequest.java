package com.whereq.herald.dto;

import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.Priority;
import com.whereq.herald.model.RecurrenceRule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request to send or schedule a notification.
 *
 * Without a schedule time the notification is delivered immediately.
 * With a schedule time and no recurrence it fires once, which requires the time to be in the future.
 * With a recurrence it fires at the schedule time (or right away if that has passed) and then
 * at every occurrence computed from the moment of the previous firing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {

    @NotBlank
    private String title;

    @NotBlank
    private String message;

    /**
     * Delivery target: absolute webhook URL or path relative to the configured base URL
     */
    @NotBlank
    private String destination;

    @Builder.Default
    private Priority priority = Priority.MEDIUM;

    /**
     * Free-form attributes; values must not be null
     */
    private Map<String, @NotNull String> metadata;

    /**
     * First occurrence; omit for immediate delivery
     */
    private Instant scheduleTime;

    /**
     * Recurrence rule; omit for a one-shot notification
     */
    private RecurrenceRule recurrence;

    public NotificationPayload toPayload() {
        return NotificationPayload.builder()
            .title(title)
            .message(message)
            .destination(destination)
            .priority(priority != null ? priority : Priority.MEDIUM)
            .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
            .build();
    }
}
