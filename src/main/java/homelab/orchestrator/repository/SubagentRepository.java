package homelab.orchestrator.repository;

import homelab.orchestrator.model.Subagent;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for subagent snapshots.
 */
public interface SubagentRepository {

    void save(Subagent subagent);

    Optional<Subagent> findById(String subagentId);

    /** All subagents in creation order */
    List<Subagent> findAll();

    boolean delete(String subagentId);

    String generateId();
}
