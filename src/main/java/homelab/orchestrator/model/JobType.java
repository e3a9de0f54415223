package homelab.orchestrator.model;

/**
 * Kind of work a job carries. Opaque to the scheduler.
 */
public enum JobType {
    CODE_ANALYSIS,
    CODE_FIX,
    FILE_OPERATION,
    COMMAND_EXECUTION,
    AI_GENERATION,
    SUBAGENT_TASK,
    OPENCODE_TASK;

    public static JobType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job type: " + value);
        }
    }
}
