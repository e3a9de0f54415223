package homelab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.model.NodeAction;

import java.util.Map;

/**
 * POST /api/v1/nodes/{nodeId}/execute
 */
public record ExecuteRequest(
        @JsonProperty("action") String action,
        @JsonProperty("params") Map<String, Object> params) {

    public NodeAction nodeAction() {
        return NodeAction.parse(action);
    }

    public Map<String, Object> paramsOrEmpty() {
        return params != null ? params : Map.of();
    }
}
