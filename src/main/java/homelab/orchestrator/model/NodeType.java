package homelab.orchestrator.model;

/**
 * Transport family of a cluster node.
 */
public enum NodeType {
    /** POSIX host reached over SSH */
    LINUX,
    /** Windows host reached through its HTTP control agent */
    WINDOWS;

    /** Directory server types other than "windows" are treated as Linux hosts. */
    public static NodeType fromServerType(String serverType) {
        return "windows".equalsIgnoreCase(serverType) ? WINDOWS : LINUX;
    }
}
