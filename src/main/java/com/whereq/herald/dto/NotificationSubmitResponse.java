package com.whereq.herald.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.herald.model.DispatchResult;
import com.whereq.herald.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for a notification submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationSubmitResponse {
    /**
     * Job identifier (absent for immediate sends)
     */
    private String jobId;

    /**
     * Job status after submission
     */
    private JobStatus status;

    /**
     * When the request was accepted
     */
    private Instant submittedAt;

    /**
     * First scheduled occurrence
     */
    private Instant nextFireTime;

    /**
     * Delivery outcome (immediate sends only)
     */
    private DispatchResult dispatch;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static NotificationSubmitResponse error(String message) {
        return NotificationSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
