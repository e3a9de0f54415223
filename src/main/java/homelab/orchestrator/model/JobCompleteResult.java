package homelab.orchestrator.model;

/**
 * Result of completing a job.
 */
public enum JobCompleteResult {
    /** Job moved to COMPLETED */
    COMPLETED,

    /** Job was already terminal - nothing changed */
    ALREADY_TERMINAL,

    /** Job is still queued and was never started */
    NOT_RUNNING,

    /** Job not found */
    NOT_FOUND
}
