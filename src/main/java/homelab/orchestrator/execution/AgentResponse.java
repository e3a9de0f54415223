package homelab.orchestrator.execution;

/**
 * Raw HTTP answer of a control agent.
 */
public record AgentResponse(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
