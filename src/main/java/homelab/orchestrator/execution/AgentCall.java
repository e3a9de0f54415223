package homelab.orchestrator.execution;

import java.util.Map;

/**
 * One request to a Windows control agent.
 *
 * @param body JSON body for POST, null for GET
 */
public record AgentCall(String method, String path, Map<String, Object> body) {

    public static AgentCall get(String path) {
        return new AgentCall("GET", path, null);
    }

    public static AgentCall post(String path, Map<String, Object> body) {
        return new AgentCall("POST", path, body);
    }

    public static AgentCall command(String command) {
        return post("/api/execute", Map.of("command", command));
    }
}
