package homelab.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only node entry as listed by the node directory.
 * Windows hosts are reached on {@code agentPort}, all others on {@code port} over SSH.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeDescriptor(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("serverType") String serverType,
        @JsonProperty("host") String host,
        @JsonProperty("tailscaleIp") String tailscaleIp,
        @JsonProperty("port") Integer port,
        @JsonProperty("agentPort") Integer agentPort,
        @JsonProperty("supportsWol") boolean supportsWol,
        @JsonProperty("macAddress") String macAddress,
        @JsonProperty("broadcastAddress") String broadcastAddress,
        @JsonProperty("wolRelayServer") String wolRelayServer,
        @JsonProperty("deployPath") String deployPath,
        @JsonProperty("agentToken") String agentToken,
        @JsonProperty("user") String user) {

    public static final int DEFAULT_SSH_PORT = 22;
    public static final int DEFAULT_AGENT_PORT = 9765;

    public NodeType nodeType() {
        return NodeType.fromServerType(serverType);
    }

    /** Overlay address when present, otherwise the plain host. */
    public String effectiveHost() {
        return tailscaleIp != null && !tailscaleIp.isBlank() ? tailscaleIp : host;
    }

    public int effectivePort() {
        if (nodeType() == NodeType.WINDOWS) {
            return agentPort != null ? agentPort : DEFAULT_AGENT_PORT;
        }
        return port != null ? port : DEFAULT_SSH_PORT;
    }

    public boolean hasMacAddress() {
        return macAddress != null && !macAddress.isBlank();
    }
}
