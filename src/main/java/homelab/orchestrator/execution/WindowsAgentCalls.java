package homelab.orchestrator.execution;

import homelab.orchestrator.model.NodeAction;

import java.util.Map;

import static homelab.orchestrator.execution.LinuxCommands.required;
import static homelab.orchestrator.execution.LinuxCommands.text;

/**
 * Agent endpoint for each node action on a Windows host.
 */
public final class WindowsAgentCalls {

    public static final String DEFAULT_DEPLOY_PATH = "C:\\HomeLabHub";

    private static final Map<String, String> SERVICE_RESTARTS = Map.of(
            "ollama", "net stop ollama && net start ollama",
            "comfyui", "taskkill /F /IM python.exe /FI \"WINDOWTITLE eq ComfyUI\" & cd C:\\AI\\ComfyUI"
                    + " && start python main.py",
            "stable-diffusion", "taskkill /F /IM python.exe /FI \"WINDOWTITLE eq Stable*\""
                    + " & cd C:\\AI\\stable-diffusion-webui && start webui.bat",
            "sunshine", "net stop sunshine && net start sunshine");

    private WindowsAgentCalls() {
    }

    /**
     * @throws IllegalArgumentException if a required parameter is missing or the action is not an agent call
     */
    public static AgentCall forAction(NodeAction action, Map<String, Object> params, String deployPath) {
        Map<String, Object> p = params != null ? params : Map.of();
        String path = deployPath != null && !deployPath.isBlank() ? deployPath : DEFAULT_DEPLOY_PATH;

        return switch (action) {
            case EXECUTE_COMMAND -> AgentCall.command(required(p, "command"));
            case CHECK_STATUS -> AgentCall.get("/api/health");
            case AI_GENERATE -> AgentCall.post("/api/ai/generate", p);
            case RESTART_SERVICE -> AgentCall.command(restartCommand(required(p, "service")));
            case GIT_PULL -> AgentCall.command("cd " + path + " && git pull");
            case DOCKER_ACTION, DEPLOY_SERVICE, VM_CONTROL, CUSTOM -> AgentCall.command(text(p, "command", "echo ok"));
            case WAKE -> throw new IllegalArgumentException("wake is not an agent call");
        };
    }

    static String restartCommand(String service) {
        String known = SERVICE_RESTARTS.get(service);
        return known != null ? known : "net stop " + service + " & net start " + service;
    }
}
