package homelab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.NodeCapability;

import java.time.Instant;
import java.util.List;

/**
 * Public view of a cluster node. Connection secrets stay out of it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("status") String status,
        @JsonProperty("host") String host,
        @JsonProperty("port") int port,
        @JsonProperty("supportsWol") boolean supportsWol,
        @JsonProperty("latencyMs") Long latencyMs,
        @JsonProperty("lastSeen") Instant lastSeen,
        @JsonProperty("capabilities") List<String> capabilities) {

    public static NodeResponse from(ClusterNode node) {
        return new NodeResponse(
                node.id(),
                node.name(),
                node.type().name().toLowerCase(),
                node.status().label(),
                node.host(),
                node.port(),
                node.supportsWol(),
                node.latencyMs(),
                node.lastSeen(),
                node.capabilities().stream().map(NodeCapability::id).toList());
    }
}
