package homelab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.model.NodeAction;

import java.util.Map;

/**
 * Route a capability to a node and optionally run an action there.
 * POST /api/v1/route
 */
public record RouteRequest(
        @JsonProperty("capability") String capability,
        @JsonProperty("action") String action,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("wakeIfSleeping") Boolean wakeIfSleeping) {

    public void validate() {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability is required");
        }
    }

    /** Without an action the request only resolves the target node. */
    public boolean hasAction() {
        return action != null && !action.isBlank();
    }

    public NodeAction nodeAction() {
        return NodeAction.parse(action);
    }

    public Map<String, Object> paramsOrEmpty() {
        return params != null ? params : Map.of();
    }

    public boolean shouldWake() {
        return wakeIfSleeping == null || wakeIfSleeping;
    }
}
