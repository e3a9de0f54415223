package homelab.orchestrator.model;

public enum CapabilityCategory {
    AI,
    DOCKER,
    VIRTUALIZATION,
    MEDIA,
    STORAGE,
    NETWORK,
    COMPUTE,
    DEPLOYMENT;

    public String label() {
        return name().toLowerCase();
    }
}
