package homelab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.model.ClusterStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/cluster
 */
public record ClusterStatusResponse(
        @JsonProperty("totalNodes") int totalNodes,
        @JsonProperty("onlineNodes") int onlineNodes,
        @JsonProperty("offlineNodes") int offlineNodes,
        @JsonProperty("nodes") List<NodeResponse> nodes,
        @JsonProperty("capabilities") Map<String, List<String>> capabilities,
        @JsonProperty("lastRefresh") Instant lastRefresh) {

    public static ClusterStatusResponse from(ClusterStatus status) {
        return new ClusterStatusResponse(
                status.totalNodes(),
                status.onlineNodes(),
                status.offlineNodes(),
                status.nodes().stream().map(NodeResponse::from).toList(),
                status.capabilities(),
                status.lastRefresh());
    }
}
