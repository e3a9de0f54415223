package homelab.orchestrator.model;

/**
 * Job priority class. Dispatch sorts queued jobs by {@link #weight()} descending.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(10),
    HIGH(100),
    CRITICAL(1000);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /** Parse a priority name, case-insensitive. Null or blank means NORMAL. */
    public static JobPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + value);
        }
    }
}
