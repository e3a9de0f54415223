package homelab.orchestrator.api.v1;

import homelab.orchestrator.api.Controller;
import homelab.orchestrator.server.RouterHandler;
import homelab.orchestrator.service.Orchestrator;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * GET /api/v1/stats - job and subagent counters
 * GET /api/v1/resources - AI resources with their current status
 */
public class StatsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StatsController.class);

    private final Orchestrator orchestrator;

    public StatsController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/stats".equals(path) || "/api/v1/resources".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if ("/api/v1/stats".equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(orchestrator.getStats()));
            }
            Map<String, Object> response = Map.of(
                    "resources", orchestrator.getResources(),
                    "services", orchestrator.checkAllAIServices());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Stats controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
