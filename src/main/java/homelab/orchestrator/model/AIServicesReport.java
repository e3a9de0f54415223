package homelab.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import homelab.orchestrator.probe.RuntimeHealth;

import java.util.List;

/**
 * Health of local AI runtimes plus credential presence of cloud providers.
 */
public record AIServicesReport(
        @JsonProperty("local") List<RuntimeHealth> local,
        @JsonProperty("cloud") List<CloudService> cloud) {

    public record CloudService(
            @JsonProperty("provider") String provider,
            @JsonProperty("status") String status,
            @JsonProperty("hasKey") boolean hasKey) {

        public static CloudService of(String provider, boolean hasKey) {
            return new CloudService(provider, hasKey ? "configured" : "not_configured", hasKey);
        }
    }
}
