package homelab.orchestrator.wake;

import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.model.NodeAction;
import homelab.orchestrator.model.NodeDescriptor;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.service.ClusterNodeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Brings a sleeping node online through the wake primitive.
 *
 * Blocks the calling thread for up to the configured wake timeout; never runs
 * under the scheduler monitor.
 */
public class WakeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WakeCoordinator.class);

    private final ClusterNodeRegistry nodes;
    private final WakePrimitive primitive;
    private final OrchestratorConfig config;

    public WakeCoordinator(ClusterNodeRegistry nodes, WakePrimitive primitive, OrchestratorConfig config) {
        this.nodes = nodes;
        this.primitive = primitive;
        this.config = config;
    }

    public NodeExecutionResult wakeNode(String nodeId) {
        long start = System.currentTimeMillis();
        Optional<ClusterNode> found = nodes.getNode(nodeId);
        if (found.isEmpty()) {
            return NodeExecutionResult.failure(nodeId, NodeAction.WAKE, ExecutionErrorKind.NOT_FOUND,
                    "Node '" + nodeId + "' not found", 0);
        }

        ClusterNode node = found.get();
        NodeDescriptor descriptor = node.descriptor();
        if (!node.supportsWol() || descriptor == null || !descriptor.hasMacAddress()) {
            return NodeExecutionResult.failure(nodeId, NodeAction.WAKE, ExecutionErrorKind.CONFIGURATION,
                    "WoL not configured", 0);
        }

        log.info("Waking node {} ({})", nodeId, descriptor.macAddress());
        WakeResponse response;
        try {
            response = primitive.wake(new WakeRequest(
                    descriptor.macAddress(),
                    descriptor.broadcastAddress(),
                    descriptor.wolRelayServer(),
                    node.host(),
                    node.port(),
                    config.wakeTimeout()));
        } catch (RuntimeException e) {
            log.error("Wake primitive failed for node {}", nodeId, e);
            return NodeExecutionResult.failure(nodeId, NodeAction.WAKE, ExecutionErrorKind.TRANSPORT,
                    e.getMessage(), elapsed(start));
        }

        if (response.online()) {
            nodes.markOnline(nodeId);
            log.info("Node {} is online: {}", nodeId, response.message());
        }
        if (response.success()) {
            return NodeExecutionResult.ok(nodeId, NodeAction.WAKE, response.message(), elapsed(start));
        }

        ExecutionErrorKind kind = response.failureKind() != null ? response.failureKind()
                : ExecutionErrorKind.WAKE_TIMEOUT;
        log.warn("Wake of node {} failed ({}): {}", nodeId, kind, response.error());
        return NodeExecutionResult.failure(nodeId, NodeAction.WAKE, kind, response.error(), elapsed(start));
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
