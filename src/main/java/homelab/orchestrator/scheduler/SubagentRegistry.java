package homelab.orchestrator.scheduler;

import homelab.orchestrator.model.Subagent;
import homelab.orchestrator.model.SubagentStatus;
import homelab.orchestrator.model.SubagentType;
import homelab.orchestrator.repository.SubagentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks logical workers and their task counters.
 *
 * Not synchronized on its own: every mutation is made by {@link JobScheduler}
 * while it holds its monitor, so counter updates stay atomic with the job
 * transition that caused them.
 */
public class SubagentRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubagentRegistry.class);

    private final SubagentRepository repository;

    public SubagentRegistry(SubagentRepository repository) {
        this.repository = repository;
    }

    Subagent create(String name, SubagentType type, Set<String> capabilities, boolean preferLocalAI) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("subagent name is required");
        }
        Instant now = Instant.now();
        Subagent subagent = Subagent.builder()
                .id(repository.generateId())
                .name(name)
                .type(Objects.requireNonNull(type, "subagent type is required"))
                .status(SubagentStatus.IDLE)
                .capabilities(capabilities)
                .preferLocalAI(preferLocalAI)
                .createdAt(now)
                .lastActiveAt(now)
                .build();
        repository.save(subagent);
        log.info("Created subagent {} ({}) of type {}", subagent.id(), name, type);
        return subagent;
    }

    public Optional<Subagent> find(String subagentId) {
        return repository.findById(subagentId);
    }

    public List<Subagent> findAll() {
        return repository.findAll();
    }

    public List<Subagent> findActive() {
        return repository.findAll().stream().filter(Subagent::isActive).toList();
    }

    void onJobStarted(String subagentId, String jobId) {
        find(subagentId).filter(s -> s.status() != SubagentStatus.STOPPED).ifPresent(s -> repository.save(
                s.toBuilder()
                        .tasksRunning(s.tasksRunning() + 1)
                        .status(SubagentStatus.BUSY)
                        .currentJobId(jobId)
                        .lastActiveAt(Instant.now())
                        .build()));
    }

    void onJobCompleted(String subagentId, String jobId) {
        find(subagentId).ifPresent(s -> {
            int running = Math.max(0, s.tasksRunning() - 1);
            repository.save(s.toBuilder()
                    .tasksCompleted(s.tasksCompleted() + 1)
                    .tasksRunning(running)
                    .status(statusFor(s.status(), running))
                    .currentJobId(jobId.equals(s.currentJobId()) ? null : s.currentJobId())
                    .lastActiveAt(Instant.now())
                    .build());
        });
    }

    void onJobFailed(String subagentId, String jobId, boolean terminal) {
        find(subagentId).ifPresent(s -> {
            int running = Math.max(0, s.tasksRunning() - 1);
            SubagentStatus status = terminal && s.status() != SubagentStatus.STOPPED
                    ? SubagentStatus.ERROR
                    : statusFor(s.status(), running);
            repository.save(s.toBuilder()
                    .tasksRunning(running)
                    .status(status)
                    .currentJobId(jobId.equals(s.currentJobId()) ? null : s.currentJobId())
                    .lastActiveAt(Instant.now())
                    .build());
        });
    }

    /** Mark stopped; counters and history are kept, nothing runs any more. */
    Optional<Subagent> markStopped(String subagentId) {
        return find(subagentId).map(s -> {
            Subagent stopped = s.toBuilder()
                    .status(SubagentStatus.STOPPED)
                    .tasksRunning(0)
                    .currentJobId(null)
                    .build();
            repository.save(stopped);
            log.info("Stopped subagent {} ({})", s.id(), s.name());
            return stopped;
        });
    }

    boolean delete(String subagentId) {
        return repository.delete(subagentId);
    }

    /** STOPPED sticks; otherwise busy iff something runs. */
    private static SubagentStatus statusFor(SubagentStatus current, int running) {
        if (current == SubagentStatus.STOPPED) {
            return SubagentStatus.STOPPED;
        }
        return running > 0 ? SubagentStatus.BUSY : SubagentStatus.IDLE;
    }
}
