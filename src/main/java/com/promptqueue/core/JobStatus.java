package com.promptqueue.core;

/**
 * Enum representing the states a job moves through during its lifecycle.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>QUEUED → EXECUTING: Job selected by the scheduler</li>
 *   <li>QUEUED → CANCELLED: Job cancelled before execution started</li>
 *   <li>EXECUTING → COMPLETED: Agent run succeeded</li>
 *   <li>EXECUTING → QUEUED: Agent was throttled, or failed with retries remaining,
 *       or the record was found in flight at startup</li>
 *   <li>EXECUTING → FAILED: Agent run failed and retries are exhausted</li>
 *   <li>EXECUTING → CANCELLED: Job cancelled while its run was in flight</li>
 * </ul>
 *
 * <p>COMPLETED and CANCELLED are terminal. FAILED has no outgoing edge either;
 * a failed job is only ever re-run as a new job.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    QUEUED("queued"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the lowercase name used in record headers and CLI output.
     *
     * @return the display name (e.g., "queued", "failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this status represents a terminal state.
     *
     * @return true for COMPLETED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Check if a job in this status still lives in the pending bucket.
     *
     * @return true for QUEUED and EXECUTING
     */
    public boolean isActive() {
        return this == QUEUED || this == EXECUTING;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p>Key Invariant: nothing leaves COMPLETED, FAILED or CANCELLED.</p>
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        return switch (this) {
            case QUEUED -> newStatus == EXECUTING || newStatus == CANCELLED;
            case EXECUTING -> newStatus == COMPLETED || newStatus == QUEUED
                    || newStatus == FAILED || newStatus == CANCELLED;
            default -> false;
        };
    }

    /**
     * Look up a status by its display name, ignoring case.
     *
     * @param name the display name or enum constant name
     * @return the matching status
     * @throws IllegalArgumentException if no status matches
     */
    public static JobStatus fromDisplayName(String name) {
        for (JobStatus status : values()) {
            if (status.displayName.equalsIgnoreCase(name) || status.name().equalsIgnoreCase(name)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
