package homelab.orchestrator.service;

import homelab.orchestrator.assistant.CodeAssistant;
import homelab.orchestrator.config.CredentialSource;
import homelab.orchestrator.model.AIResource;
import homelab.orchestrator.model.AIServicesReport;
import homelab.orchestrator.model.ResourceStatus;
import homelab.orchestrator.model.ResourceType;
import homelab.orchestrator.probe.RuntimeHealth;
import homelab.orchestrator.probe.RuntimeHealthProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the AI provider that should serve a capability.
 *
 * Local runtimes start offline until the first refresh; cloud providers start
 * available and are downgraded when their credential is missing.
 */
public class AIResourceSelector {

    private static final Logger log = LoggerFactory.getLogger(AIResourceSelector.class);

    static final String[] OPENAI_KEYS = {"OPENAI_API_KEY", "AI_INTEGRATIONS_OPENAI_API_KEY"};
    static final String REPLICATE_KEY = "REPLICATE_API_TOKEN";
    static final String ANTHROPIC_KEY = "ANTHROPIC_API_KEY";

    private final RuntimeHealthProbe runtimeProbe;
    private final CodeAssistant codeAssistant;
    private final CredentialSource credentials;

    // guarded by this, insertion order = seed order
    private final Map<String, AIResource> resources = new LinkedHashMap<>();

    public AIResourceSelector(RuntimeHealthProbe runtimeProbe, CodeAssistant codeAssistant,
            CredentialSource credentials) {
        this.runtimeProbe = runtimeProbe;
        this.codeAssistant = codeAssistant;
        this.credentials = credentials;
        seed();
    }

    private void seed() {
        put(local("ollama", "Ollama", 100, "text-generation", "code-completion", "embedding"));
        put(local("stable-diffusion", "Stable Diffusion WebUI", 100, "image-generation"));
        put(local("comfyui", "ComfyUI", 100, "image-generation", "video-generation"));
        put(local("opencode", "Code Assistant", 110,
                "code-generation", "code-refactoring", "code-review", "feature-development"));
        put(new AIResource("openai", "OpenAI", "openai", ResourceType.CLOUD, ResourceStatus.AVAILABLE,
                Set.of("text-generation", "image-generation", "code-completion", "embedding"), 50, null, 0.01,
                null));
        put(new AIResource("replicate", "Replicate", "replicate", ResourceType.CLOUD, ResourceStatus.AVAILABLE,
                Set.of("image-generation", "video-generation"), 40, null, 0.05, null));
    }

    private static AIResource local(String provider, String name, int priority, String... capabilities) {
        return new AIResource(provider, name, provider, ResourceType.LOCAL, ResourceStatus.OFFLINE,
                Set.of(capabilities), priority, null, null, null);
    }

    private synchronized void put(AIResource resource) {
        resources.put(resource.id(), resource);
    }

    /**
     * Highest-priority available provider for {@code capability}. With
     * {@code preferLocal} every local candidate ranks ahead of every cloud one.
     */
    public synchronized Optional<AIResource> selectBestResource(String capability, boolean preferLocal) {
        Comparator<AIResource> order = Comparator.comparingInt(AIResource::priority).reversed();
        if (preferLocal) {
            order = Comparator.comparing((AIResource r) -> !r.isLocal()).thenComparing(order);
        }
        return resources.values().stream()
                .filter(AIResource::isAvailable)
                .filter(r -> r.supports(capability))
                .sorted(order)
                .findFirst();
    }

    public Optional<AIResource> selectBestResource(String capability) {
        return selectBestResource(capability, true);
    }

    public synchronized List<AIResource> getResources() {
        return new ArrayList<>(resources.values());
    }

    /**
     * Probe local runtimes, check the code assistant and look up cloud credentials.
     * Each source is refreshed independently; one failing leaves the others updated.
     */
    public void refreshResourceStatus() {
        try {
            for (RuntimeHealth health : runtimeProbe.checkAll()) {
                update(health.provider(), health.isOnline() ? ResourceStatus.AVAILABLE : ResourceStatus.OFFLINE,
                        health.latencyMs());
            }
        } catch (RuntimeException e) {
            log.error("Runtime health refresh failed", e);
        }

        try {
            boolean installed = codeAssistant.checkInstallation();
            update("opencode", installed ? ResourceStatus.AVAILABLE : ResourceStatus.OFFLINE, null);
        } catch (RuntimeException e) {
            log.error("Code assistant check failed", e);
            update("opencode", ResourceStatus.OFFLINE, null);
        }

        update("openai", credentials.first(OPENAI_KEYS).isPresent() ? ResourceStatus.AVAILABLE
                : ResourceStatus.OFFLINE, null);
        update("replicate", credentials.get(REPLICATE_KEY).isPresent() ? ResourceStatus.AVAILABLE
                : ResourceStatus.OFFLINE, null);

        log.debug("AI resources refreshed: {}", getResources().stream()
                .map(r -> r.provider() + "=" + r.status())
                .toList());
    }

    private synchronized void update(String provider, ResourceStatus status, Long latencyMs) {
        AIResource current = resources.get(provider);
        if (current == null) {
            return;
        }
        if (current.status() != status) {
            log.info("AI resource {} is now {}", provider, status);
        }
        resources.put(provider, current.withStatus(status, latencyMs, Instant.now()));
    }

    public AIServicesReport checkAllAIServices() {
        List<RuntimeHealth> local;
        try {
            local = runtimeProbe.checkAll();
        } catch (RuntimeException e) {
            log.error("Runtime health check failed", e);
            local = List.of();
        }
        List<AIServicesReport.CloudService> cloud = List.of(
                AIServicesReport.CloudService.of("openai", credentials.first(OPENAI_KEYS).isPresent()),
                AIServicesReport.CloudService.of("replicate", credentials.get(REPLICATE_KEY).isPresent()),
                AIServicesReport.CloudService.of("anthropic", credentials.get(ANTHROPIC_KEY).isPresent()));
        return new AIServicesReport(local, cloud);
    }

    /** Any local provider currently available */
    public synchronized boolean isLocalAvailable() {
        return resources.values().stream().anyMatch(r -> r.isLocal() && r.isAvailable());
    }

    public synchronized boolean isCloudAvailable() {
        return resources.values().stream().anyMatch(r -> !r.isLocal() && r.isAvailable());
    }
}
