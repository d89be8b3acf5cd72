package com.whereq.herald.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * SCHEDULED → {COMPLETED, EXPIRED}       (firing protocol)
 * SCHEDULED → {PAUSED, CANCELLED}        (caller)
 * PAUSED, CANCELLED → SCHEDULED          (resume)
 */
public enum JobStatus {
    /**
     * Armed, or waiting to be armed on the next recovery
     */
    SCHEDULED,

    /**
     * Stopped by the caller, keeps its next occurrence
     */
    PAUSED,

    /**
     * Stopped by the caller
     */
    CANCELLED,

    /**
     * One-shot job after its single dispatch attempt
     */
    COMPLETED,

    /**
     * Recurring job whose next occurrence would fall past its end time
     */
    EXPIRED;

    /**
     * Check if the job can never fire again
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED;
    }

    /**
     * Check if the job should be armed
     */
    public boolean isActive() {
        return this == SCHEDULED;
    }
}
