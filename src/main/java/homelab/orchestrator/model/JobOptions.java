package homelab.orchestrator.model;

import java.time.Duration;

/**
 * Optional settings for a new job. Null fields fall back to the configured defaults.
 */
public record JobOptions(
        JobPriority priority,
        Duration timeout,
        Integer maxRetries,
        Boolean notifyOnComplete,
        String subagentId) {

    public static JobOptions defaults() {
        return new JobOptions(null, null, null, null, null);
    }

    public static JobOptions withPriority(JobPriority priority) {
        return defaults().priority(priority);
    }

    public JobOptions priority(JobPriority value) {
        return new JobOptions(value, timeout, maxRetries, notifyOnComplete, subagentId);
    }

    public JobOptions timeout(Duration value) {
        return new JobOptions(priority, value, maxRetries, notifyOnComplete, subagentId);
    }

    public JobOptions maxRetries(int value) {
        return new JobOptions(priority, timeout, value, notifyOnComplete, subagentId);
    }

    public JobOptions notifyOnComplete(boolean value) {
        return new JobOptions(priority, timeout, maxRetries, value, subagentId);
    }

    public JobOptions subagentId(String value) {
        return new JobOptions(priority, timeout, maxRetries, notifyOnComplete, value);
    }
}
