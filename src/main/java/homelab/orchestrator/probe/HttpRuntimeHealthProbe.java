package homelab.orchestrator.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import homelab.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Probes ollama, stable-diffusion and comfyui over HTTP, all three concurrently.
 */
public class HttpRuntimeHealthProbe implements RuntimeHealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpRuntimeHealthProbe.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final OrchestratorConfig config;

    public HttpRuntimeHealthProbe(OrchestratorConfig config) {
        this.config = config;
        this.http = HttpClient.newBuilder()
                .connectTimeout(config.probeTimeout())
                .build();
    }

    @Override
    public List<RuntimeHealth> checkAll() {
        CompletableFuture<RuntimeHealth> ollama = check("ollama", config.ollamaUrl(), "/api/tags");
        CompletableFuture<RuntimeHealth> sd = check("stable-diffusion", config.stableDiffusionUrl(),
                "/sdapi/v1/sd-models");
        CompletableFuture<RuntimeHealth> comfy = check("comfyui", config.comfyUiUrl(), "/system_stats");
        return List.of(ollama.join(), sd.join(), comfy.join());
    }

    private CompletableFuture<RuntimeHealth> check(String provider, String baseUrl, String path) {
        long start = System.currentTimeMillis();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                    .timeout(config.probeTimeout())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    RuntimeHealth.offline(provider, baseUrl, "invalid url: " + e.getMessage()));
        }

        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> {
                    if (response.statusCode() / 100 != 2) {
                        return RuntimeHealth.offline(provider, baseUrl, "HTTP " + response.statusCode());
                    }
                    long latency = System.currentTimeMillis() - start;
                    return RuntimeHealth.online(provider, baseUrl, latency, countModels(provider, response.body()));
                })
                .exceptionally(t -> {
                    Throwable cause = t.getCause() != null ? t.getCause() : t;
                    log.debug("{} health check failed: {}", provider, cause.toString());
                    return RuntimeHealth.offline(provider, baseUrl,
                            cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
                });
    }

    /** Models listed by the runtime; comfyui does not list any. */
    static int countModels(String provider, String body) {
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root == null) {
                return 0;
            }
            if ("ollama".equals(provider)) {
                JsonNode models = root.get("models");
                return models != null && models.isArray() ? models.size() : 0;
            }
            if ("stable-diffusion".equals(provider)) {
                return root.isArray() ? root.size() : 0;
            }
            return 0;
        } catch (Exception e) {
            log.debug("Unparseable {} health body: {}", provider, e.getMessage());
            return 0;
        }
    }
}
