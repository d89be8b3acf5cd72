package com.whereq.herald.exception;

/**
 * Exception thrown when the store could not persist a change.
 * The in-memory state (and any armed timer) already reflects the change;
 * only its durability is in doubt.
 */
public class StoreFailureException extends RuntimeException {

    private final String jobId;

    public StoreFailureException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    /**
     * Job affected by the failed write, null when the write was not job-specific
     */
    public String getJobId() {
        return jobId;
    }
}
