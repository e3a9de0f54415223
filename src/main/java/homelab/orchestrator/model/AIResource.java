package homelab.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * AI inference provider tagged with the capabilities it serves.
 * {@code lastCheck} is null until the first status refresh.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AIResource(
        String id,
        String name,
        String provider,
        ResourceType type,
        ResourceStatus status,
        Set<String> capabilities,
        int priority,
        Long latencyMs,
        Double costPerRequest,
        Instant lastCheck) {

    public AIResource {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(status, "status is required");
        name = name == null ? id : name;
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean isAvailable() {
        return status == ResourceStatus.AVAILABLE;
    }

    public boolean isLocal() {
        return type == ResourceType.LOCAL;
    }

    public boolean supports(String capability) {
        return capabilities.contains(capability);
    }

    /** New status as observed at {@code checkedAt}; a null latency keeps the previous one. */
    public AIResource withStatus(ResourceStatus newStatus, Long newLatencyMs, Instant checkedAt) {
        return new AIResource(id, name, provider, type, newStatus, capabilities, priority,
                newLatencyMs != null ? newLatencyMs : latencyMs, costPerRequest, checkedAt);
    }
}
