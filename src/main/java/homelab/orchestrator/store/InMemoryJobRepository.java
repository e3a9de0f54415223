package homelab.orchestrator.store;

import homelab.orchestrator.model.Job;
import homelab.orchestrator.model.JobStatus;
import homelab.orchestrator.repository.JobRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local job store. Contents do not survive a restart.
 * Reads are safe from any thread; writers are serialized by the job scheduler.
 */
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<Job> findById(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> findAll() {
        List<Job> list = new ArrayList<>(jobs.values());
        list.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));
        return list;
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return findAll().stream()
                .filter(j -> j.status() == status)
                .toList();
    }

    @Override
    public List<Job> findBySubagent(String subagentId) {
        return findAll().stream()
                .filter(j -> Objects.equals(j.subagentId(), subagentId))
                .toList();
    }

    @Override
    public List<Job> findTerminalCompletedBefore(Instant completedBefore) {
        return findAll().stream()
                .filter(Job::isTerminal)
                .filter(j -> j.completedAt() != null && j.completedAt().isBefore(completedBefore))
                .toList();
    }

    @Override
    public boolean delete(String jobId) {
        return jobs.remove(jobId) != null;
    }

    @Override
    public int countByStatus(JobStatus status) {
        return (int) jobs.values().stream().filter(j -> j.status() == status).count();
    }

    @Override
    public int count() {
        return jobs.size();
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
