package homelab.orchestrator.model;

/**
 * Result of failing a job.
 */
public enum JobFailResult {
    /** Job failed and was re-queued for another attempt */
    RETRIED,

    /** Job failed permanently (max retries reached) */
    FAILED,

    /** Job was already in a terminal state - nothing changed */
    ALREADY_TERMINAL,

    /** Job is still queued and was never started */
    NOT_RUNNING,

    /** Job not found */
    NOT_FOUND
}
