package homelab.orchestrator.service;

import homelab.orchestrator.execution.NodeExecutionAdapter;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.model.NodeAction;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.model.NodeStatus;
import homelab.orchestrator.wake.WakeCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the node that should serve a capability.
 *
 * Online candidates win, ranked by the priority the node's own catalog gives the
 * capability (ties keep routing-table order). With no online candidate, the first
 * sleeping wake-capable node is returned so the caller can wake it.
 */
public class CapabilityRouter {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRouter.class);

    public static final String NO_NODE = "none";

    private final ClusterNodeRegistry nodes;
    private final WakeCoordinator wakeCoordinator;
    private final NodeExecutionAdapter executor;

    public CapabilityRouter(ClusterNodeRegistry nodes, WakeCoordinator wakeCoordinator,
            NodeExecutionAdapter executor) {
        this.nodes = nodes;
        this.wakeCoordinator = wakeCoordinator;
        this.executor = executor;
    }

    /**
     * @return the chosen node, empty when nothing can serve the capability
     */
    public Optional<ClusterNode> routeJobToNode(String capability) {
        List<ClusterNode> candidates = nodes.getNodesByCapability(capability);

        List<ClusterNode> online = candidates.stream()
                .filter(ClusterNode::isOnline)
                .toList();
        if (online.isEmpty()) {
            return candidates.stream()
                    .filter(n -> n.status() == NodeStatus.SLEEPING && n.supportsWol())
                    .findFirst();
        }

        // stable sort: equal priorities keep table order
        return online.stream()
                .sorted(Comparator.comparingInt((ClusterNode n) -> n.capabilityPriority(capability)).reversed())
                .findFirst();
    }

    /**
     * Route, wake the chosen node if it sleeps and {@code wakeIfSleeping} is set, then execute.
     */
    public NodeExecutionResult routeAndExecute(String capability, NodeAction action, Map<String, Object> params,
            boolean wakeIfSleeping) {
        Optional<ClusterNode> routed = routeJobToNode(capability);
        if (routed.isEmpty()) {
            log.info("No node available with capability '{}'", capability);
            return NodeExecutionResult.failure(NO_NODE, action, ExecutionErrorKind.NO_CAPACITY,
                    "No node available with capability '" + capability + "'", 0);
        }

        ClusterNode node = routed.get();
        if (node.status() == NodeStatus.SLEEPING && wakeIfSleeping) {
            log.info("Waking node {} for capability {}", node.id(), capability);
            NodeExecutionResult wake = wakeCoordinator.wakeNode(node.id());
            if (!wake.success()) {
                return wake;
            }
        }

        return executor.executeOnNode(node.id(), action, params);
    }
}
