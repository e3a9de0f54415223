package homelab.orchestrator.config;

import java.util.Optional;

/**
 * Looks up API credentials by name.
 */
@FunctionalInterface
public interface CredentialSource {

    /** @return the non-blank value of {@code name}, or empty */
    Optional<String> get(String name);

    /** First of {@code names} that is set. */
    default Optional<String> first(String... names) {
        for (String name : names) {
            Optional<String> value = get(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /** Credentials from the process environment. */
    static CredentialSource environment() {
        return name -> Optional.ofNullable(System.getenv(name)).filter(v -> !v.isBlank());
    }
}
