package homelab.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a registered cluster node.
 * After registration only status, latency and lastSeen change.
 */
public final class ClusterNode {
    private final String id;
    private final String name;
    private final NodeType type;
    private final NodeStatus status;
    private final String host;
    private final int port;
    private final List<NodeCapability> capabilities;
    private final Instant lastSeen;
    private final Long latencyMs;
    private final boolean supportsWol;
    private final NodeDescriptor descriptor;

    private ClusterNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.host = builder.host;
        this.port = builder.port;
        this.capabilities = builder.capabilities == null ? List.of() : List.copyOf(builder.capabilities);
        this.lastSeen = builder.lastSeen;
        this.latencyMs = builder.latencyMs;
        this.supportsWol = builder.supportsWol;
        this.descriptor = builder.descriptor;
        if (status == NodeStatus.SLEEPING && !supportsWol) {
            throw new IllegalStateException("node " + id + " cannot be sleeping without wake-on-LAN support");
        }
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public NodeType type() {
        return type;
    }

    public NodeStatus status() {
        return status;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public List<NodeCapability> capabilities() {
        return capabilities;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    public Long latencyMs() {
        return latencyMs;
    }

    public boolean supportsWol() {
        return supportsWol;
    }

    public NodeDescriptor descriptor() {
        return descriptor;
    }

    public boolean isOnline() {
        return status == NodeStatus.ONLINE;
    }

    /** Sleeping and wake-on-LAN capable */
    public boolean isWakeable() {
        return status == NodeStatus.SLEEPING && supportsWol;
    }

    public Optional<NodeCapability> capability(String capabilityId) {
        return capabilities.stream().filter(c -> c.id().equals(capabilityId)).findFirst();
    }

    /** Declared priority of a capability on this node, 0 when the node does not list it */
    public int capabilityPriority(String capabilityId) {
        return capability(capabilityId).map(NodeCapability::priority).orElse(0);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .status(status)
                .host(host)
                .port(port)
                .capabilities(capabilities)
                .lastSeen(lastSeen)
                .latencyMs(latencyMs)
                .supportsWol(supportsWol)
                .descriptor(descriptor);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private NodeType type = NodeType.LINUX;
        private NodeStatus status = NodeStatus.UNKNOWN;
        private String host;
        private int port;
        private List<NodeCapability> capabilities;
        private Instant lastSeen;
        private Long latencyMs;
        private boolean supportsWol;
        private NodeDescriptor descriptor;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder capabilities(List<NodeCapability> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder latencyMs(Long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder supportsWol(boolean supportsWol) {
            this.supportsWol = supportsWol;
            return this;
        }

        public Builder descriptor(NodeDescriptor descriptor) {
            this.descriptor = descriptor;
            return this;
        }

        public ClusterNode build() {
            return new ClusterNode(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClusterNode node))
            return false;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ClusterNode{id='" + id + "', type=" + type + ", status=" + status
                + ", host=" + host + ":" + port + "}";
    }
}
