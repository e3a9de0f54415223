package homelab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.model.Job;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("type") String type,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("progress") int progress,
        @JsonProperty("retries") int retries,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("subagentId") String subagentId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("result") Object result,
        @JsonProperty("error") String error) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.type().name().toLowerCase(),
                job.status().name().toLowerCase(),
                job.priority().name().toLowerCase(),
                job.progress(),
                job.retries(),
                job.maxRetries(),
                job.subagentId(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.params(),
                job.result(),
                job.error());
    }

    /** Without params and result, for list responses */
    public JobResponse compact() {
        return new JobResponse(jobId, type, status, priority, progress, retries, maxRetries, subagentId,
                createdAt, startedAt, completedAt, null, null, error);
    }
}
