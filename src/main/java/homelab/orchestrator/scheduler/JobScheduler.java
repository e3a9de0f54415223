package homelab.orchestrator.scheduler;

import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.core.JobEventBus;
import homelab.orchestrator.core.Subscription;
import homelab.orchestrator.model.Job;
import homelab.orchestrator.model.JobCompleteResult;
import homelab.orchestrator.model.JobFailResult;
import homelab.orchestrator.model.JobOptions;
import homelab.orchestrator.model.JobPriority;
import homelab.orchestrator.model.JobStatus;
import homelab.orchestrator.model.JobType;
import homelab.orchestrator.model.Subagent;
import homelab.orchestrator.model.SubagentType;
import homelab.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Priority job queue with bounded concurrency and a bounded retry policy.
 *
 * All job and subagent mutations happen while holding this scheduler's monitor,
 * so a dispatch pass never observes a half-updated job. Dispatch is edge-triggered
 * by create, complete, fail and subagent stop; a trigger that arrives while a pass
 * is in progress makes that pass loop once more instead of starting a nested one.
 *
 * The job timeout is stored as advisory metadata and never enforced here.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    /** Weight descending, then oldest first, then creation order */
    static final Comparator<Job> DISPATCH_ORDER = Comparator
            .comparingInt((Job j) -> j.priority().weight()).reversed()
            .thenComparing(Job::createdAt)
            .thenComparingLong(Job::sequence);

    private final Object monitor = new Object();
    private final JobRepository jobRepository;
    private final SubagentRegistry subagents;
    private final JobEventBus events;
    private final OrchestratorConfig config;
    private final AtomicLong sequence = new AtomicLong();

    // guarded by monitor
    private boolean dispatching;
    private boolean dispatchRequested;
    private int holds;

    public JobScheduler(JobRepository jobRepository, SubagentRegistry subagents, JobEventBus events,
            OrchestratorConfig config) {
        this.jobRepository = jobRepository;
        this.subagents = subagents;
        this.events = events;
        this.config = config;
    }

    // ---- JOBS ----

    /**
     * Queue a new job and trigger dispatch.
     *
     * @throws IllegalArgumentException if the type is missing, maxRetries is below 1 or the timeout is not positive
     */
    public Job createJob(JobType type, Map<String, Object> params, JobOptions options) {
        if (type == null) {
            throw new IllegalArgumentException("job type is required");
        }
        JobOptions opts = options != null ? options : JobOptions.defaults();
        if (opts.maxRetries() != null && opts.maxRetries() < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (opts.timeout() != null && (opts.timeout().isNegative() || opts.timeout().isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        synchronized (monitor) {
            Job job = Job.builder()
                    .id(jobRepository.generateId())
                    .type(type)
                    .priority(opts.priority() != null ? opts.priority() : JobPriority.NORMAL)
                    .status(JobStatus.QUEUED)
                    .createdAt(Instant.now())
                    .params(params)
                    .maxRetries(opts.maxRetries() != null ? opts.maxRetries() : config.defaultRetries())
                    .timeout(opts.timeout() != null ? opts.timeout() : config.defaultJobTimeout())
                    .notifyOnComplete(Boolean.TRUE.equals(opts.notifyOnComplete()))
                    .subagentId(opts.subagentId())
                    .sequence(sequence.incrementAndGet())
                    .build();

            jobRepository.save(job);
            log.info("Created job {} of type {} with priority {}", job.id(), type, job.priority());

            requestDispatch();
            return jobRepository.findById(job.id()).orElse(job);
        }
    }

    /**
     * Cancel a job. Only queued jobs can be cancelled; running work is never interrupted.
     *
     * @return true if the job was queued and is now cancelled
     */
    public boolean cancelJob(String jobId) {
        synchronized (monitor) {
            Optional<Job> found = jobRepository.findById(jobId);
            if (found.isEmpty() || found.get().status() != JobStatus.QUEUED) {
                return false;
            }
            Job cancelled = transition(found.get(), JobStatus.CANCELLED)
                    .completedAt(Instant.now())
                    .build();
            save(cancelled);
            log.info("Cancelled job {}", jobId);
            return true;
        }
    }

    /**
     * Record progress (clamped to 0..100) and optionally an intermediate result.
     *
     * @return false if the job is unknown or already terminal
     */
    public boolean updateProgress(String jobId, int progress, Object result) {
        synchronized (monitor) {
            Optional<Job> found = jobRepository.findById(jobId);
            if (found.isEmpty() || found.get().isTerminal()) {
                return false;
            }
            Job.Builder builder = found.get().toBuilder().progress(Math.min(100, Math.max(0, progress)));
            if (result != null) {
                builder.result(result);
            }
            save(builder.build());
            return true;
        }
    }

    public JobCompleteResult completeJob(String jobId, Object result) {
        synchronized (monitor) {
            Optional<Job> found = jobRepository.findById(jobId);
            if (found.isEmpty()) {
                return JobCompleteResult.NOT_FOUND;
            }
            Job job = found.get();
            if (job.isTerminal()) {
                log.debug("Job {} already terminal ({})", jobId, job.status());
                return JobCompleteResult.ALREADY_TERMINAL;
            }
            if (job.status() != JobStatus.RUNNING) {
                log.warn("Refusing to complete job {} in status {}", jobId, job.status());
                return JobCompleteResult.NOT_RUNNING;
            }

            Job completed = transition(job, JobStatus.COMPLETED)
                    .progress(100)
                    .result(result)
                    .completedAt(Instant.now())
                    .build();
            save(completed);
            log.info("Job {} completed successfully", jobId);

            if (job.subagentId() != null) {
                subagents.onJobCompleted(job.subagentId(), jobId);
            }
            requestDispatch();
            return JobCompleteResult.COMPLETED;
        }
    }

    /**
     * Report a failed attempt. The job is re-queued while retries remain,
     * otherwise it becomes terminally FAILED.
     */
    public JobFailResult failJob(String jobId, String error) {
        synchronized (monitor) {
            Optional<Job> found = jobRepository.findById(jobId);
            if (found.isEmpty()) {
                return JobFailResult.NOT_FOUND;
            }
            Job job = found.get();
            if (job.isTerminal()) {
                return JobFailResult.ALREADY_TERMINAL;
            }
            if (job.status() != JobStatus.RUNNING) {
                log.warn("Refusing to fail job {} in status {}", jobId, job.status());
                return JobFailResult.NOT_RUNNING;
            }

            int retries = job.retries() + 1;
            boolean retry = retries < job.maxRetries();
            JobFailResult outcome;
            if (retry) {
                save(transition(job, JobStatus.QUEUED)
                        .retries(retries)
                        .error(error)
                        .build());
                log.info("Job {} failed, retrying ({}/{})", jobId, retries, job.maxRetries());
                outcome = JobFailResult.RETRIED;
            } else {
                save(transition(job, JobStatus.FAILED)
                        .retries(retries)
                        .error(error)
                        .completedAt(Instant.now())
                        .build());
                log.warn("Job {} failed permanently: {}", jobId, error);
                outcome = JobFailResult.FAILED;
            }

            if (job.subagentId() != null) {
                subagents.onJobFailed(job.subagentId(), jobId, !retry);
            }
            requestDispatch();
            return outcome;
        }
    }

    public Optional<Job> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> getAllJobs() {
        return jobRepository.findAll();
    }

    public List<Job> getJobsByStatus(JobStatus status) {
        return jobRepository.findByStatus(status);
    }

    public List<Job> getJobsBySubagent(String subagentId) {
        return jobRepository.findBySubagent(subagentId);
    }

    public int countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    public int countJobs() {
        return jobRepository.count();
    }

    public Subscription onJobUpdate(String jobId, Consumer<Job> listener) {
        return events.onJobUpdate(jobId, listener);
    }

    /**
     * Remove terminal jobs whose completion is older than {@code olderThan}.
     * Queued, running and recently finished jobs are kept.
     *
     * @return number of jobs removed
     */
    public int clearCompletedJobs(Duration olderThan) {
        synchronized (monitor) {
            Instant cutoff = Instant.now().minus(olderThan);
            int cleared = 0;
            for (Job job : jobRepository.findTerminalCompletedBefore(cutoff)) {
                if (jobRepository.delete(job.id())) {
                    events.forget(job.id());
                    cleared++;
                }
            }
            if (cleared > 0) {
                log.info("Cleared {} finished jobs older than {}", cleared, olderThan);
            }
            return cleared;
        }
    }

    // ---- SUBAGENTS ----

    public Subagent createSubagent(String name, SubagentType type, Set<String> capabilities,
            boolean preferLocalAI) {
        synchronized (monitor) {
            return subagents.create(name, type, capabilities, preferLocalAI);
        }
    }

    public Optional<Subagent> getSubagent(String subagentId) {
        return subagents.find(subagentId);
    }

    public List<Subagent> getAllSubagents() {
        return subagents.findAll();
    }

    public List<Subagent> getActiveSubagents() {
        return subagents.findActive();
    }

    /**
     * Stop a subagent and cancel its queued and running jobs. History is kept.
     */
    public boolean stopSubagent(String subagentId) {
        synchronized (monitor) {
            if (subagents.markStopped(subagentId).isEmpty()) {
                return false;
            }
            int cancelled = 0;
            Instant now = Instant.now();
            for (Job job : jobRepository.findBySubagent(subagentId)) {
                if (job.status() == JobStatus.QUEUED || job.status() == JobStatus.RUNNING) {
                    save(transition(job, JobStatus.CANCELLED).completedAt(now).build());
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                log.info("Cancelled {} jobs of stopped subagent {}", cancelled, subagentId);
            }
            requestDispatch();
            return true;
        }
    }

    public boolean removeSubagent(String subagentId) {
        synchronized (monitor) {
            stopSubagent(subagentId);
            return subagents.delete(subagentId);
        }
    }

    // ---- DISPATCH ----

    /**
     * Suspend dispatch until the returned hold is closed; triggers raised meanwhile
     * collapse into a single pass on release. Holds may nest.
     */
    public Hold holdDispatch() {
        synchronized (monitor) {
            holds++;
        }
        boolean[] released = {false};
        return () -> {
            synchronized (monitor) {
                if (released[0]) {
                    return;
                }
                released[0] = true;
                holds--;
                if (holds == 0 && dispatchRequested) {
                    requestDispatch();
                }
            }
        };
    }

    /**
     * Run dispatch now.
     *
     * @return number of jobs promoted to running
     */
    public int dispatch() {
        synchronized (monitor) {
            if (dispatching || holds > 0) {
                dispatchRequested = true;
                return 0;
            }
            dispatching = true;
            try {
                dispatchRequested = false;
                int promoted = runPass();
                while (dispatchRequested) {
                    dispatchRequested = false;
                    promoted += runPass();
                }
                return promoted;
            } finally {
                dispatching = false;
            }
        }
    }

    private void requestDispatch() {
        dispatchRequested = true;
        if (!dispatching && holds == 0) {
            dispatch();
        }
    }

    private int runPass() {
        int slots = config.maxConcurrent() - jobRepository.countByStatus(JobStatus.RUNNING);
        if (slots <= 0) {
            return 0;
        }

        List<Job> next = jobRepository.findByStatus(JobStatus.QUEUED).stream()
                .sorted(DISPATCH_ORDER)
                .limit(slots)
                .toList();

        Instant now = Instant.now();
        for (Job job : next) {
            save(transition(job, JobStatus.RUNNING).startedAt(now).build());
            if (job.subagentId() != null) {
                subagents.onJobStarted(job.subagentId(), job.id());
            }
        }
        if (!next.isEmpty()) {
            log.debug("Dispatch promoted {} job(s), {} slot(s) were free", next.size(), slots);
        }
        return next.size();
    }

    private static Job.Builder transition(Job job, JobStatus next) {
        if (!job.status().canTransitionTo(next)) {
            throw new IllegalStateException("illegal transition " + job.status() + " -> " + next
                    + " for job " + job.id());
        }
        return job.toBuilder().status(next);
    }

    private void save(Job job) {
        jobRepository.save(job);
        events.publish(job);
    }

    /**
     * Releases a dispatch hold. Closing twice is a no-op.
     */
    @FunctionalInterface
    public interface Hold extends AutoCloseable {
        @Override
        void close();
    }
}
