package homelab.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of an orchestrated job.
 * The scheduler replaces the stored snapshot on every transition.
 */
public final class Job {
    private final String id;
    private final JobType type;
    private final JobPriority priority;
    private final JobStatus status;
    private final int progress;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Map<String, Object> params;
    private final Object result;
    private final String error;
    private final String subagentId;
    private final int retries;
    private final int maxRetries;
    private final Duration timeout; // advisory only, never enforced by the scheduler
    private final boolean notifyOnComplete;
    private final long sequence;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = Math.min(100, Math.max(0, builder.progress));
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.params = builder.params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.result = builder.result;
        this.error = builder.error;
        this.subagentId = builder.subagentId;
        this.retries = builder.retries;
        this.maxRetries = builder.maxRetries;
        this.timeout = builder.timeout;
        this.notifyOnComplete = builder.notifyOnComplete;
        this.sequence = builder.sequence;
    }

    // Getters
    public String id() {
        return id;
    }

    public JobType type() {
        return type;
    }

    public JobPriority priority() {
        return priority;
    }

    public JobStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Map<String, Object> params() {
        return params;
    }

    public Object result() {
        return result;
    }

    public String error() {
        return error;
    }

    public String subagentId() {
        return subagentId;
    }

    public int retries() {
        return retries;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean notifyOnComplete() {
        return notifyOnComplete;
    }

    public long sequence() {
        return sequence;
    }

    /** Check if another failure would still be retried */
    public boolean canRetry() {
        return retries + 1 < maxRetries;
    }

    /** Queued again after at least one failed attempt */
    public boolean isRetry() {
        return status == JobStatus.QUEUED && retries > 0;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .priority(priority)
                .status(status)
                .progress(progress)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .params(params)
                .result(result)
                .error(error)
                .subagentId(subagentId)
                .retries(retries)
                .maxRetries(maxRetries)
                .timeout(timeout)
                .notifyOnComplete(notifyOnComplete)
                .sequence(sequence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobType type;
        private JobPriority priority = JobPriority.NORMAL;
        private JobStatus status = JobStatus.QUEUED;
        private int progress;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Map<String, Object> params;
        private Object result;
        private String error;
        private String subagentId;
        private int retries;
        private int maxRetries = 2;
        private Duration timeout = Duration.ofMinutes(2);
        private boolean notifyOnComplete;
        private long sequence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder subagentId(String subagentId) {
            this.subagentId = subagentId;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder notifyOnComplete(boolean notifyOnComplete) {
            this.notifyOnComplete = notifyOnComplete;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', type=" + type + ", priority=" + priority
                + ", status=" + status + ", retries=" + retries + "/" + maxRetries + "}";
    }
}
