package homelab.orchestrator.model;

public enum ResourceType {
    LOCAL,
    CLOUD
}
