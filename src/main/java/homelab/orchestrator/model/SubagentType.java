package homelab.orchestrator.model;

public enum SubagentType {
    CODE,
    RESEARCH,
    AUTOMATION,
    CREATIVE;

    public static SubagentType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("subagent type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown subagent type: " + value);
        }
    }
}
