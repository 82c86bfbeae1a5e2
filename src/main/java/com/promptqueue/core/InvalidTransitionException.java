package com.promptqueue.core;

/**
 * Exception thrown when a job is asked to move along an edge the state machine does not have.
 *
 * <p>Every status change in the scheduler is checked through
 * {@link JobStatus#canTransitionTo(JobStatus)}; this exception surfaces a programming
 * error or a record that was changed underneath the scheduler.</p>
 *
 * @see JobStatus
 */
public class InvalidTransitionException extends RuntimeException {

    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    /**
     * Create a new InvalidTransitionException.
     *
     * @param jobId the job whose transition was rejected
     * @param from the current status
     * @param to the requested status
     */
    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
