package homelab.orchestrator.model;

public record OrchestratorStats(
        int totalJobs,
        int completedJobs,
        int failedJobs,
        int runningJobs,
        int queuedJobs,
        int activeSubagents,
        boolean localAIAvailable,
        boolean cloudAIAvailable) {
}
