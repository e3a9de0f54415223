package homelab.orchestrator.model;

/**
 * Job lifecycle status.
 */
public enum JobStatus {
    /** Waiting for a dispatch slot (new, or re-queued after a retryable failure) */
    QUEUED,
    /** Promoted by a dispatch pass */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Failed with no retries left */
    FAILED,
    /** Cancelled while queued, or by stopping its subagent */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether the scheduler may move a job from this status to {@code next}.
     * RUNNING -> QUEUED is the retry path of a failure with retries left.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == QUEUED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
