package com.whereq.herald.exception;

/**
 * Exception thrown when resuming a job that has no occurrence left to fire
 */
public class CannotResumeCompletedJobException extends RuntimeException {

    private final String jobId;

    public CannotResumeCompletedJobException(String jobId, String reason) {
        super("Cannot resume job " + jobId + ": " + reason);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
