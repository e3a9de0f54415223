package homelab.orchestrator.execution;

import java.util.Optional;

/**
 * Process-wide SSH private key.
 */
@FunctionalInterface
public interface KeyMaterialSource {

    /** @return the key bytes, or empty when no key is configured */
    Optional<byte[]> privateKey();
}
