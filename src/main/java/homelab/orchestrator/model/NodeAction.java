package homelab.orchestrator.model;

/**
 * Operation requested against a cluster node. Each node type maps every constant
 * to a concrete remote command or agent endpoint.
 */
public enum NodeAction {
    EXECUTE_COMMAND,
    DOCKER_ACTION,
    DEPLOY_SERVICE,
    RESTART_SERVICE,
    GIT_PULL,
    CHECK_STATUS,
    AI_GENERATE,
    VM_CONTROL,
    WAKE,
    CUSTOM;

    /** Wire name, e.g. {@code execute_command} */
    public String wireName() {
        return name().toLowerCase();
    }

    public static NodeAction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown node action: " + value);
        }
    }
}
