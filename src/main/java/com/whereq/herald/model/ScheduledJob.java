package com.whereq.herald.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A scheduled notification together with its current firing state.
 * Instances held by the scheduler are mutated only under that job's lock;
 * everything handed to callers is a copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {
    /**
     * Unique job identifier
     */
    private String id;

    private NotificationPayload payload;

    /**
     * First (or only) occurrence
     */
    private Instant firstFireTime;

    /**
     * Absent for one-shot jobs
     */
    private RecurrenceRule recurrence;

    /**
     * Next pending occurrence, null once the job has none left
     */
    private Instant nextFireTime;

    /**
     * Time of the last dispatch attempt, successful or not
     */
    private Instant lastFireTime;

    private boolean active;

    @Builder.Default
    private JobStatus status = JobStatus.SCHEDULED;

    private Instant createdTime;

    @JsonIgnore
    public boolean isRecurring() {
        return recurrence != null;
    }

    /**
     * Move to a new status, keeping {@link #active} in step with it
     */
    public void transitionTo(JobStatus newStatus) {
        this.status = newStatus;
        this.active = newStatus.isActive();
    }

    public ScheduledJob copy() {
        return toBuilder().build();
    }
}
