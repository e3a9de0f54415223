package homelab.orchestrator.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.model.NodeAction;
import homelab.orchestrator.model.NodeDescriptor;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.service.ClusterNodeRegistry;
import homelab.orchestrator.wake.WakeCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Executes node actions over the transport that matches the node type:
 * SSH for Linux hosts, the HTTP control agent for Windows hosts.
 *
 * A node that is not online only accepts a wake; everything else fails
 * immediately without touching a transport.
 */
public class NodeExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(NodeExecutionAdapter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ClusterNodeRegistry nodes;
    private final WakeCoordinator wakeCoordinator;
    private final ShellTransport shell;
    private final KeyMaterialSource keys;
    private final AgentTransport agent;
    private final OrchestratorConfig config;

    public NodeExecutionAdapter(ClusterNodeRegistry nodes, WakeCoordinator wakeCoordinator, ShellTransport shell,
            KeyMaterialSource keys, AgentTransport agent, OrchestratorConfig config) {
        this.nodes = nodes;
        this.wakeCoordinator = wakeCoordinator;
        this.shell = shell;
        this.keys = keys;
        this.agent = agent;
        this.config = config;
    }

    public NodeExecutionResult executeOnNode(String nodeId, NodeAction action, Map<String, Object> params) {
        long start = System.currentTimeMillis();
        Optional<ClusterNode> found = nodes.getNode(nodeId);
        if (found.isEmpty()) {
            return NodeExecutionResult.failure(nodeId, action, ExecutionErrorKind.NOT_FOUND,
                    "Node '" + nodeId + "' not found", elapsed(start));
        }

        ClusterNode node = found.get();
        if (action == NodeAction.WAKE) {
            if (node.isOnline()) {
                return NodeExecutionResult.ok(nodeId, action, "already online", elapsed(start));
            }
            return wakeCoordinator.wakeNode(nodeId);
        }
        if (!node.isOnline()) {
            return NodeExecutionResult.failure(nodeId, action, ExecutionErrorKind.NODE_UNAVAILABLE,
                    "Node '" + nodeId + "' is " + node.status().label(), elapsed(start));
        }

        try {
            NodeExecutionResult result = switch (node.type()) {
                case LINUX -> executeOnLinux(node, action, params, start);
                case WINDOWS -> executeOnWindows(node, action, params, start);
            };
            if (result.success()) {
                log.debug("{} on {} succeeded in {}ms", action.wireName(), nodeId, result.executionTimeMs());
            } else {
                log.warn("{} on {} failed ({}): {}", action.wireName(), nodeId, result.errorKind(), result.error());
            }
            return result;
        } catch (IllegalArgumentException e) {
            return NodeExecutionResult.failure(nodeId, action, ExecutionErrorKind.CONFIGURATION, e.getMessage(),
                    elapsed(start));
        } catch (RuntimeException e) {
            log.error("{} on {} failed unexpectedly", action.wireName(), nodeId, e);
            return NodeExecutionResult.failure(nodeId, action, ExecutionErrorKind.TRANSPORT,
                    e.getMessage() != null ? e.getMessage() : e.toString(), elapsed(start));
        }
    }

    private NodeExecutionResult executeOnLinux(ClusterNode node, NodeAction action, Map<String, Object> params,
            long start) {
        NodeDescriptor d = node.descriptor();
        String command = LinuxCommands.forAction(action, params, d != null ? d.deployPath() : null);

        String user = d != null ? d.user() : null;
        if (user == null || user.isBlank()) {
            return NodeExecutionResult.failure(node.id(), action, ExecutionErrorKind.CONFIGURATION,
                    "SSH user not configured", elapsed(start));
        }
        Optional<byte[]> key = keys.privateKey();
        if (key.isEmpty()) {
            return NodeExecutionResult.failure(node.id(), action, ExecutionErrorKind.CONFIGURATION,
                    "SSH key not found", elapsed(start));
        }

        try {
            ShellResult result = shell.exec(new ShellTarget(node.host(), node.port(), user), key.get(), command,
                    config.sshTimeout());
            if (result.isSuccess()) {
                return NodeExecutionResult.ok(node.id(), action, result.stdout(), elapsed(start));
            }
            return NodeExecutionResult.failure(node.id(), action, ExecutionErrorKind.REMOTE_FAILURE,
                    result.failureMessage(), elapsed(start));
        } catch (TransportException e) {
            return NodeExecutionResult.failure(node.id(), action, e.kind(), e.getMessage(), elapsed(start));
        }
    }

    private NodeExecutionResult executeOnWindows(ClusterNode node, NodeAction action, Map<String, Object> params,
            long start) {
        NodeDescriptor d = node.descriptor();
        AgentCall call = WindowsAgentCalls.forAction(action, params, d != null ? d.deployPath() : null);

        String token = d != null && d.agentToken() != null && !d.agentToken().isBlank()
                ? d.agentToken()
                : config.defaultAgentToken();
        if (token == null || token.isBlank()) {
            return NodeExecutionResult.failure(node.id(), action, ExecutionErrorKind.CONFIGURATION,
                    "Agent token not configured", elapsed(start));
        }

        String baseUrl = "http://" + node.host() + ":" + node.port();
        try {
            AgentResponse response = agent.call(baseUrl, token, call, config.agentTimeout());
            if (!response.isSuccess()) {
                return NodeExecutionResult.failure(node.id(), action, ExecutionErrorKind.REMOTE_FAILURE,
                        "Agent returned " + response.status() + ": " + response.body(), elapsed(start));
            }
            return NodeExecutionResult.ok(node.id(), action, agentOutput(response.body()), elapsed(start));
        } catch (TransportException e) {
            return NodeExecutionResult.failure(node.id(), action, e.kind(), e.getMessage(), elapsed(start));
        }
    }

    /** The agent's {@code output} field when present, otherwise the whole body. */
    static String agentOutput(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode json = MAPPER.readTree(body);
            JsonNode output = json != null ? json.get("output") : null;
            if (output != null && !output.isNull() && !output.asText().isEmpty()) {
                return output.asText();
            }
            return body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
