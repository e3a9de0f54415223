package homelab.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import homelab.orchestrator.api.Controller;
import homelab.orchestrator.api.v1.dto.ClusterStatusResponse;
import homelab.orchestrator.api.v1.dto.ExecuteRequest;
import homelab.orchestrator.api.v1.dto.NodeResponse;
import homelab.orchestrator.api.v1.dto.RouteRequest;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.server.RouterHandler;
import homelab.orchestrator.service.Orchestrator;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cluster endpoints.
 *
 * GET /api/v1/cluster - Refreshed cluster status
 * POST /api/v1/nodes/{nodeId}/execute - Run an action on a node
 * POST /api/v1/nodes/{nodeId}/wake - Wake a sleeping node
 * POST /api/v1/route - Resolve a capability to a node, optionally executing there
 */
public class ClusterController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ClusterController.class);

    private static final String CLUSTER_PATH = "/api/v1/cluster";
    private static final String ROUTE_PATH = "/api/v1/route";
    private static final Pattern EXECUTE_PATTERN = Pattern.compile("^/api/v1/nodes/([^/]+)/execute$");
    private static final Pattern WAKE_PATTERN = Pattern.compile("^/api/v1/nodes/([^/]+)/wake$");

    private final Orchestrator orchestrator;

    public ClusterController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return CLUSTER_PATH.equals(path);
        }
        if (method.equals(HttpMethod.POST)) {
            return ROUTE_PATH.equals(path)
                    || EXECUTE_PATTERN.matcher(path).matches()
                    || WAKE_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CLUSTER_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        ClusterStatusResponse.from(orchestrator.getClusterStatus())));
            }
            if (ROUTE_PATH.equals(path)) {
                return handleRoute(req);
            }

            Matcher execute = EXECUTE_PATTERN.matcher(path);
            if (execute.matches()) {
                ExecuteRequest request = readBody(req, ExecuteRequest.class);
                return result(orchestrator.executeOnNode(execute.group(1), request.nodeAction(),
                        request.paramsOrEmpty()));
            }

            Matcher wake = WAKE_PATTERN.matcher(path);
            if (wake.matches()) {
                return result(orchestrator.wakeNode(wake.group(1)));
            }

            return ControllerResponse.notFound("unknown cluster endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Cluster controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleRoute(FullHttpRequest req) throws Exception {
        RouteRequest request = readBody(req, RouteRequest.class);
        request.validate();

        if (request.hasAction()) {
            return result(orchestrator.routeAndExecute(request.capability(), request.nodeAction(),
                    request.paramsOrEmpty(), request.shouldWake()));
        }

        Optional<ClusterNode> node = orchestrator.routeJobToNode(request.capability());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("capability", request.capability());
        response.put("success", node.isPresent());
        node.ifPresent(n -> response.put("node", NodeResponse.from(n)));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private static <T> T readBody(FullHttpRequest req, Class<T> type) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            return RouterHandler.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getOriginalMessage());
        }
    }

    /** Failed results keep their envelope; the HTTP status follows the failure kind. */
    private static ControllerResponse result(NodeExecutionResult result) throws Exception {
        return ControllerResponse.json(statusFor(result), RouterHandler.mapper().writeValueAsString(result));
    }

    static HttpResponseStatus statusFor(NodeExecutionResult result) {
        if (result.success()) {
            return HttpResponseStatus.OK;
        }
        ExecutionErrorKind kind = result.errorKind();
        if (kind == null) {
            return HttpResponseStatus.BAD_GATEWAY;
        }
        return switch (kind) {
            case NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
            case CONFIGURATION -> HttpResponseStatus.UNPROCESSABLE_ENTITY;
            case NODE_UNAVAILABLE, NO_CAPACITY -> HttpResponseStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT, WAKE_TIMEOUT -> HttpResponseStatus.GATEWAY_TIMEOUT;
            case TRANSPORT, REMOTE_FAILURE, RELAY_FAILURE -> HttpResponseStatus.BAD_GATEWAY;
        };
    }
}
