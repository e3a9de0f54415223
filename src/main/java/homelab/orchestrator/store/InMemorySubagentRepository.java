package homelab.orchestrator.store;

import homelab.orchestrator.model.Subagent;
import homelab.orchestrator.repository.SubagentRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local subagent store.
 */
public class InMemorySubagentRepository implements SubagentRepository {

    private final Map<String, Subagent> subagents = new ConcurrentHashMap<>();

    @Override
    public void save(Subagent subagent) {
        subagents.put(subagent.id(), subagent);
    }

    @Override
    public Optional<Subagent> findById(String subagentId) {
        if (subagentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(subagents.get(subagentId));
    }

    @Override
    public List<Subagent> findAll() {
        List<Subagent> list = new ArrayList<>(subagents.values());
        list.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        return list;
    }

    @Override
    public boolean delete(String subagentId) {
        return subagents.remove(subagentId) != null;
    }

    @Override
    public String generateId() {
        return "agent-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
