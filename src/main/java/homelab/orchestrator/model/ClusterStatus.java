package homelab.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view of the cluster after a liveness refresh.
 *
 * @param capabilities category label to "nodeId:capabilityId" entries of online nodes
 */
public record ClusterStatus(
        List<ClusterNode> nodes,
        int totalNodes,
        int onlineNodes,
        int offlineNodes,
        Map<String, List<String>> capabilities,
        Instant lastRefresh) {
}
