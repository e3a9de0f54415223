package homelab.orchestrator.model;

/**
 * Liveness of a cluster node, as last observed by a reachability probe.
 */
public enum NodeStatus {
    ONLINE,
    OFFLINE,
    DEGRADED,
    /** Unreachable but wake-on-LAN capable */
    SLEEPING,
    /** Registered, not yet probed */
    UNKNOWN;

    public String label() {
        return name().toLowerCase();
    }
}
