package homelab.orchestrator.model;

import java.util.Objects;

/**
 * A named function a node can perform, with its placement priority on that node.
 */
public record NodeCapability(
        String id,
        String name,
        CapabilityCategory category,
        String description,
        int priority) {

    public NodeCapability {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(category, "category is required");
    }
}
