package homelab.orchestrator.probe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health of one local AI runtime.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeHealth(
        @JsonProperty("provider") String provider,
        @JsonProperty("status") Status status,
        @JsonProperty("url") String url,
        @JsonProperty("latencyMs") Long latencyMs,
        @JsonProperty("modelsLoaded") int modelsLoaded,
        @JsonProperty("error") String error) {

    public enum Status {
        ONLINE, OFFLINE, DEGRADED
    }

    public static RuntimeHealth online(String provider, String url, long latencyMs, int modelsLoaded) {
        return new RuntimeHealth(provider, Status.ONLINE, url, latencyMs, modelsLoaded, null);
    }

    public static RuntimeHealth offline(String provider, String url, String error) {
        return new RuntimeHealth(provider, Status.OFFLINE, url, null, 0, error);
    }

    public boolean isOnline() {
        return status == Status.ONLINE;
    }
}
