package com.whereq.herald.dto;

import com.whereq.herald.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for cancel, pause and resume
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobActionResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Status after the action
     */
    private JobStatus status;

    /**
     * Next occurrence after the action, if any
     */
    private Instant nextFireTime;

    /**
     * When the action was applied
     */
    private Instant actedAt;

    private String message;
}
