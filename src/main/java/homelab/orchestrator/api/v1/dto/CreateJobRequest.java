package homelab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.model.JobOptions;
import homelab.orchestrator.model.JobPriority;
import homelab.orchestrator.model.JobType;

import java.time.Duration;
import java.util.Map;

/**
 * Request DTO for queueing a job.
 * POST /api/v1/jobs
 */
public record CreateJobRequest(
        @JsonProperty("type") String type,
        @JsonProperty("priority") String priority,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("notifyOnComplete") Boolean notifyOnComplete,
        @JsonProperty("subagentId") String subagentId) {

    public JobType jobType() {
        return JobType.parse(type);
    }

    public JobOptions toOptions() {
        JobOptions options = JobOptions.withPriority(JobPriority.parse(priority));
        if (maxRetries != null) {
            options = options.maxRetries(maxRetries);
        }
        if (timeoutMs != null) {
            options = options.timeout(Duration.ofMillis(timeoutMs));
        }
        if (notifyOnComplete != null) {
            options = options.notifyOnComplete(notifyOnComplete);
        }
        if (subagentId != null && !subagentId.isBlank()) {
            options = options.subagentId(subagentId);
        }
        return options;
    }

    public void validate() {
        jobType();
        JobPriority.parse(priority);
        if (maxRetries != null && maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }
}
