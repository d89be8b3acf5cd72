package com.whereq.herald.dto;

import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.Priority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Map;

/**
 * Request for a daily, weekly or monthly notification at a wall-clock time
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShortcutRequest {

    @NotBlank
    private String title;

    @NotBlank
    private String message;

    @NotBlank
    private String destination;

    @Builder.Default
    private Priority priority = Priority.MEDIUM;

    /**
     * Free-form attributes; values must not be null
     */
    private Map<String, @NotNull String> metadata;

    /**
     * Time of day, e.g. "09:30"
     */
    @NotNull
    private LocalTime time;

    /**
     * Required for weekly shortcuts
     */
    private DayOfWeek dayOfWeek;

    /**
     * Required for monthly shortcuts (1-31)
     */
    private Integer dayOfMonth;

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
