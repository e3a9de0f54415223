package homelab.orchestrator.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Control agent transport on {@link HttpClient}.
 */
public class HttpAgentTransport implements AgentTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentTransport.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;

    public HttpAgentTransport(Duration connectTimeout) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public AgentResponse call(String baseUrl, String token, AgentCall call, Duration timeout)
            throws TransportException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + call.path()))
                .timeout(timeout)
                .header("Content-Type", "application/json");
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        if ("POST".equals(call.method())) {
            request.POST(HttpRequest.BodyPublishers.ofString(toJson(call), StandardCharsets.UTF_8));
        } else {
            request.GET();
        }

        try {
            HttpResponse<String> response = http.send(request.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("{} {}{} -> {}", call.method(), baseUrl, call.path(), response.statusCode());
            return new AgentResponse(response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            throw TransportException.timeout("Request timed out");
        } catch (IOException e) {
            throw TransportException.unreachable("Failed to reach agent: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.unreachable("Failed to reach agent: interrupted", e);
        }
    }

    private static String toJson(AgentCall call) throws TransportException {
        try {
            return MAPPER.writeValueAsString(call.body() != null ? call.body() : Map.of());
        } catch (JsonProcessingException e) {
            throw TransportException.unreachable("Cannot encode agent request: " + e.getOriginalMessage(), e);
        }
    }
}
