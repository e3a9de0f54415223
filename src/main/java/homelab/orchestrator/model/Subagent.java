package homelab.orchestrator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a logical long-lived worker.
 */
public final class Subagent {
    private final String id;
    private final String name;
    private final SubagentType type;
    private final SubagentStatus status;
    private final String currentJobId;
    private final Set<String> capabilities;
    private final boolean preferLocalAI;
    private final Instant createdAt;
    private final Instant lastActiveAt;
    private final int tasksCompleted;
    private final int tasksRunning;

    private Subagent(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.currentJobId = builder.currentJobId;
        this.capabilities = builder.capabilities == null ? Set.of() : Set.copyOf(builder.capabilities);
        this.preferLocalAI = builder.preferLocalAI;
        this.createdAt = builder.createdAt;
        this.lastActiveAt = builder.lastActiveAt;
        this.tasksCompleted = builder.tasksCompleted;
        this.tasksRunning = Math.max(0, builder.tasksRunning);
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public SubagentType type() {
        return type;
    }

    public SubagentStatus status() {
        return status;
    }

    public String currentJobId() {
        return currentJobId;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public boolean preferLocalAI() {
        return preferLocalAI;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActiveAt() {
        return lastActiveAt;
    }

    public int tasksCompleted() {
        return tasksCompleted;
    }

    public int tasksRunning() {
        return tasksRunning;
    }

    /** Idle or busy, i.e. neither stopped nor in error */
    public boolean isActive() {
        return status == SubagentStatus.IDLE || status == SubagentStatus.BUSY;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .status(status)
                .currentJobId(currentJobId)
                .capabilities(capabilities)
                .preferLocalAI(preferLocalAI)
                .createdAt(createdAt)
                .lastActiveAt(lastActiveAt)
                .tasksCompleted(tasksCompleted)
                .tasksRunning(tasksRunning);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private SubagentType type;
        private SubagentStatus status = SubagentStatus.IDLE;
        private String currentJobId;
        private Set<String> capabilities;
        private boolean preferLocalAI = true;
        private Instant createdAt;
        private Instant lastActiveAt;
        private int tasksCompleted;
        private int tasksRunning;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(SubagentType type) {
            this.type = type;
            return this;
        }

        public Builder status(SubagentStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentJobId(String currentJobId) {
            this.currentJobId = currentJobId;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder preferLocalAI(boolean preferLocalAI) {
            this.preferLocalAI = preferLocalAI;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastActiveAt(Instant lastActiveAt) {
            this.lastActiveAt = lastActiveAt;
            return this;
        }

        public Builder tasksCompleted(int tasksCompleted) {
            this.tasksCompleted = tasksCompleted;
            return this;
        }

        public Builder tasksRunning(int tasksRunning) {
            this.tasksRunning = tasksRunning;
            return this;
        }

        public Subagent build() {
            return new Subagent(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Subagent subagent))
            return false;
        return Objects.equals(id, subagent.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Subagent{id='" + id + "', name='" + name + "', status=" + status
                + ", running=" + tasksRunning + "}";
    }
}
