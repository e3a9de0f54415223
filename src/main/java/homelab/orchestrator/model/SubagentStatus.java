package homelab.orchestrator.model;

/**
 * Subagent status. BUSY/IDLE follow the running-task counter; STOPPED and ERROR are explicit.
 */
public enum SubagentStatus {
    IDLE,
    BUSY,
    STOPPED,
    ERROR
}
