package homelab.orchestrator.model;

public enum ResourceStatus {
    AVAILABLE,
    BUSY,
    OFFLINE
}
