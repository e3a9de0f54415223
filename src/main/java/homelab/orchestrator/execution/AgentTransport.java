package homelab.orchestrator.execution;

import java.time.Duration;

/**
 * HTTP control-plane transport for Windows hosts.
 */
public interface AgentTransport {

    /**
     * @param baseUrl e.g. {@code http://10.0.0.5:9765}
     * @param token   bearer token
     * @throws TransportException if the agent could not be reached or did not answer in time
     */
    AgentResponse call(String baseUrl, String token, AgentCall call, Duration timeout) throws TransportException;
}
