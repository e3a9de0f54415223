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
import homelab.orchestrator.model.SubagentStatus;
import homelab.orchestrator.model.SubagentType;
import homelab.orchestrator.store.InMemoryJobRepository;
import homelab.orchestrator.store.InMemorySubagentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    private JobEventBus events;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = OrchestratorConfig.defaults().withMaxConcurrent(2);
        events = new JobEventBus();
        scheduler = new JobScheduler(new InMemoryJobRepository(),
                new SubagentRegistry(new InMemorySubagentRepository()), events, config);
    }

    private Job create(JobPriority priority) {
        return scheduler.createJob(JobType.COMMAND_EXECUTION, Map.of("command", "uptime"),
                JobOptions.withPriority(priority));
    }

    private JobStatus statusOf(Job job) {
        return scheduler.getJob(job.id()).orElseThrow().status();
    }

    @Test
    @DisplayName("New job is promoted straight away when a slot is free")
    void createdJobRunsImmediately() {
        Job job = scheduler.createJob(JobType.CODE_ANALYSIS, null, null);

        assertEquals(JobStatus.RUNNING, job.status());
        assertNotNull(job.startedAt());
        assertEquals(JobPriority.NORMAL, job.priority());
        assertEquals(2, job.maxRetries());
        assertEquals(Duration.ofMinutes(2), job.timeout());
        assertTrue(job.params().isEmpty());
    }

    @Test
    @DisplayName("Running jobs never exceed the concurrency limit")
    void concurrencyIsBounded() {
        Job a = create(JobPriority.NORMAL);
        Job b = create(JobPriority.NORMAL);
        Job c = create(JobPriority.CRITICAL);

        assertEquals(JobStatus.RUNNING, statusOf(a));
        assertEquals(JobStatus.RUNNING, statusOf(b));
        assertEquals(JobStatus.QUEUED, statusOf(c));
        assertEquals(2, scheduler.countByStatus(JobStatus.RUNNING));

        assertEquals(JobCompleteResult.COMPLETED, scheduler.completeJob(a.id(), "ok"));
        assertEquals(JobStatus.RUNNING, statusOf(c), "freed slot goes to the queued job");
    }

    @Test
    @DisplayName("Held dispatch promotes the highest priorities first")
    void priorityOrderUnderHold() {
        Job low;
        Job critical1;
        Job normal;
        Job high;
        Job critical2;
        try (JobScheduler.Hold hold = scheduler.holdDispatch()) {
            low = create(JobPriority.LOW);
            critical1 = create(JobPriority.CRITICAL);
            normal = create(JobPriority.NORMAL);
            high = create(JobPriority.HIGH);
            critical2 = create(JobPriority.CRITICAL);

            assertEquals(0, scheduler.countByStatus(JobStatus.RUNNING), "nothing runs while held");
        }

        assertEquals(JobStatus.RUNNING, statusOf(critical1));
        assertEquals(JobStatus.RUNNING, statusOf(critical2));
        assertEquals(JobStatus.QUEUED, statusOf(high));
        assertEquals(JobStatus.QUEUED, statusOf(normal));
        assertEquals(JobStatus.QUEUED, statusOf(low));

        scheduler.completeJob(critical1.id(), null);
        assertEquals(JobStatus.RUNNING, statusOf(high));
        assertEquals(JobStatus.QUEUED, statusOf(normal));
    }

    @Test
    @DisplayName("Equal priorities run in creation order")
    void equalPriorityIsFifo() {
        List<Job> created = new ArrayList<>();
        try (JobScheduler.Hold hold = scheduler.holdDispatch()) {
            for (int i = 0; i < 4; i++) {
                created.add(create(JobPriority.HIGH));
            }
        }

        assertEquals(JobStatus.RUNNING, statusOf(created.get(0)));
        assertEquals(JobStatus.RUNNING, statusOf(created.get(1)));
        assertEquals(JobStatus.QUEUED, statusOf(created.get(2)));
        assertEquals(JobStatus.QUEUED, statusOf(created.get(3)));
    }

    @Test
    @DisplayName("Closing a hold twice does not release another hold")
    void nestedHolds() {
        JobScheduler.Hold outer = scheduler.holdDispatch();
        JobScheduler.Hold inner = scheduler.holdDispatch();
        Job job = create(JobPriority.NORMAL);

        inner.close();
        inner.close();
        assertEquals(JobStatus.QUEUED, statusOf(job), "outer hold still active");

        outer.close();
        assertEquals(JobStatus.RUNNING, statusOf(job));
    }

    @Test
    @DisplayName("Only queued jobs can be cancelled")
    void cancelOnlyQueued() {
        Job running = create(JobPriority.NORMAL);
        create(JobPriority.NORMAL);
        Job queued = create(JobPriority.NORMAL);

        assertFalse(scheduler.cancelJob(running.id()));
        assertEquals(JobStatus.RUNNING, statusOf(running));

        assertTrue(scheduler.cancelJob(queued.id()));
        Job cancelled = scheduler.getJob(queued.id()).orElseThrow();
        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertNotNull(cancelled.completedAt());

        assertFalse(scheduler.cancelJob(queued.id()), "already cancelled");
        assertFalse(scheduler.cancelJob("job-missing"));
    }

    @Test
    @DisplayName("Failure is retried while attempts remain, then fails permanently")
    void failRetriesThenFails() {
        Job job = create(JobPriority.NORMAL);

        assertEquals(JobFailResult.RETRIED, scheduler.failJob(job.id(), "boom 1"));
        Job retried = scheduler.getJob(job.id()).orElseThrow();
        assertEquals(JobStatus.RUNNING, retried.status(), "re-queued and promoted again");
        assertEquals(1, retried.retries());
        assertEquals("boom 1", retried.error());

        assertEquals(JobFailResult.FAILED, scheduler.failJob(job.id(), "boom 2"));
        Job failed = scheduler.getJob(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(2, failed.retries());
        assertEquals("boom 2", failed.error());
        assertNotNull(failed.completedAt());

        assertEquals(JobFailResult.ALREADY_TERMINAL, scheduler.failJob(job.id(), "again"));
    }

    @Test
    @DisplayName("maxRetries of one fails on the first error")
    void singleAttempt() {
        Job job = scheduler.createJob(JobType.AI_GENERATION, Map.of(), JobOptions.defaults().maxRetries(1));

        assertEquals(JobFailResult.FAILED, scheduler.failJob(job.id(), "no gpu"));
        assertEquals(JobStatus.FAILED, statusOf(job));
    }

    @Test
    @DisplayName("Complete and fail reject queued, terminal and unknown jobs")
    void illegalTransitionsAreRejected() {
        create(JobPriority.NORMAL);
        create(JobPriority.NORMAL);
        Job queued = create(JobPriority.LOW);

        assertEquals(JobCompleteResult.NOT_RUNNING, scheduler.completeJob(queued.id(), null));
        assertEquals(JobFailResult.NOT_RUNNING, scheduler.failJob(queued.id(), "x"));
        assertEquals(JobCompleteResult.NOT_FOUND, scheduler.completeJob("job-missing", null));
        assertEquals(JobFailResult.NOT_FOUND, scheduler.failJob("job-missing", "x"));

        scheduler.cancelJob(queued.id());
        assertEquals(JobCompleteResult.ALREADY_TERMINAL, scheduler.completeJob(queued.id(), null));
    }

    @Test
    @DisplayName("Progress is clamped and frozen once terminal")
    void progressUpdates() {
        Job job = create(JobPriority.NORMAL);

        assertTrue(scheduler.updateProgress(job.id(), 150, Map.of("status", "almost")));
        Job updated = scheduler.getJob(job.id()).orElseThrow();
        assertEquals(100, updated.progress());
        assertEquals(Map.of("status", "almost"), updated.result());

        assertTrue(scheduler.updateProgress(job.id(), -5, null));
        assertEquals(0, statusProgress(job));

        scheduler.completeJob(job.id(), "final");
        assertFalse(scheduler.updateProgress(job.id(), 10, null));
        assertEquals(100, statusProgress(job));
        assertFalse(scheduler.updateProgress("job-missing", 10, null));
    }

    private int statusProgress(Job job) {
        return scheduler.getJob(job.id()).orElseThrow().progress();
    }

    @Test
    @DisplayName("Listeners see every transition until their subscription is closed")
    void listenersFollowTransitions() {
        List<JobStatus> seen = new ArrayList<>();
        Job job;
        Subscription subscription;
        try (JobScheduler.Hold hold = scheduler.holdDispatch()) {
            job = create(JobPriority.NORMAL);
            subscription = scheduler.onJobUpdate(job.id(), j -> seen.add(j.status()));
        }

        scheduler.updateProgress(job.id(), 40, null);
        subscription.close();
        subscription.close();
        scheduler.completeJob(job.id(), null);

        assertEquals(List.of(JobStatus.RUNNING, JobStatus.RUNNING), seen);
        assertEquals(0, events.listenerCount(job.id()));
    }

    @Test
    @DisplayName("A throwing listener does not break the transition")
    void throwingListenerIsIsolated() {
        Job job = create(JobPriority.NORMAL);
        scheduler.onJobUpdate(job.id(), j -> {
            throw new IllegalStateException("listener bug");
        });

        assertEquals(JobCompleteResult.COMPLETED, scheduler.completeJob(job.id(), "ok"));
        assertEquals(JobStatus.COMPLETED, statusOf(job));
    }

    @Test
    @DisplayName("Only terminal jobs older than the cutoff are cleared")
    void clearCompletedJobs() throws InterruptedException {
        Job done = create(JobPriority.NORMAL);
        scheduler.completeJob(done.id(), null);
        Job running = create(JobPriority.NORMAL);
        scheduler.onJobUpdate(done.id(), j -> {
        });

        assertEquals(0, scheduler.clearCompletedJobs(Duration.ofHours(1)));

        Thread.sleep(20);
        assertEquals(1, scheduler.clearCompletedJobs(Duration.ofMillis(5)));
        assertTrue(scheduler.getJob(done.id()).isEmpty());
        assertEquals(0, events.listenerCount(done.id()));
        assertTrue(scheduler.getJob(running.id()).isPresent());
    }

    @Test
    @DisplayName("Subagent counters follow the jobs it owns")
    void subagentCounters() {
        Subagent agent = scheduler.createSubagent("coder", SubagentType.CODE, Set.of("code-generation"), true);
        assertEquals(SubagentStatus.IDLE, agent.status());

        Job job = scheduler.createJob(JobType.SUBAGENT_TASK, Map.of(), JobOptions.defaults().subagentId(agent.id()));
        Subagent busy = scheduler.getSubagent(agent.id()).orElseThrow();
        assertEquals(SubagentStatus.BUSY, busy.status());
        assertEquals(1, busy.tasksRunning());
        assertEquals(job.id(), busy.currentJobId());

        scheduler.completeJob(job.id(), null);
        Subagent idle = scheduler.getSubagent(agent.id()).orElseThrow();
        assertEquals(SubagentStatus.IDLE, idle.status());
        assertEquals(0, idle.tasksRunning());
        assertEquals(1, idle.tasksCompleted());
        assertNull(idle.currentJobId());
        assertEquals(List.of(job.id()), scheduler.getJobsBySubagent(agent.id()).stream().map(Job::id).toList());
    }

    @Test
    @DisplayName("Terminal failure puts the subagent in error")
    void subagentErrorOnTerminalFailure() {
        Subagent agent = scheduler.createSubagent("researcher", SubagentType.RESEARCH, Set.of(), false);
        Job job = scheduler.createJob(JobType.SUBAGENT_TASK, Map.of(),
                JobOptions.defaults().subagentId(agent.id()).maxRetries(1));

        scheduler.failJob(job.id(), "bad");

        Subagent failed = scheduler.getSubagent(agent.id()).orElseThrow();
        assertEquals(SubagentStatus.ERROR, failed.status());
        assertEquals(0, failed.tasksRunning());
        assertFalse(scheduler.getActiveSubagents().contains(failed));
    }

    @Test
    @DisplayName("Stopping a subagent cancels its queued and running jobs")
    void stopSubagentCancelsJobs() {
        Subagent agent = scheduler.createSubagent("bot", SubagentType.AUTOMATION, Set.of(), false);
        JobOptions owned = JobOptions.defaults().subagentId(agent.id());
        Job first = scheduler.createJob(JobType.SUBAGENT_TASK, Map.of(), owned);
        Job second = scheduler.createJob(JobType.SUBAGENT_TASK, Map.of(), owned);
        Job third = scheduler.createJob(JobType.SUBAGENT_TASK, Map.of(), owned);
        Job other = create(JobPriority.LOW);

        assertTrue(scheduler.stopSubagent(agent.id()));

        assertEquals(JobStatus.CANCELLED, statusOf(first));
        assertEquals(JobStatus.CANCELLED, statusOf(second));
        assertEquals(JobStatus.CANCELLED, statusOf(third));
        assertEquals(JobStatus.RUNNING, statusOf(other), "freed slots are reused");

        Subagent stopped = scheduler.getSubagent(agent.id()).orElseThrow();
        assertEquals(SubagentStatus.STOPPED, stopped.status());
        assertEquals(0, stopped.tasksRunning());

        assertEquals(JobCompleteResult.ALREADY_TERMINAL, scheduler.completeJob(first.id(), null));
        assertFalse(scheduler.stopSubagent("agent-missing"));
    }

    @Test
    @DisplayName("Removing a subagent deletes it but keeps its job history")
    void removeSubagent() {
        Subagent agent = scheduler.createSubagent("artist", SubagentType.CREATIVE, Set.of(), true);
        Job job = scheduler.createJob(JobType.AI_GENERATION, Map.of(), JobOptions.defaults().subagentId(agent.id()));

        assertTrue(scheduler.removeSubagent(agent.id()));

        assertTrue(scheduler.getSubagent(agent.id()).isEmpty());
        assertEquals(JobStatus.CANCELLED, statusOf(job));
        assertFalse(scheduler.removeSubagent(agent.id()));
    }

    @Test
    @DisplayName("Subagent name and type are required")
    void subagentValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.createSubagent(" ", SubagentType.CODE, Set.of(), false));
        assertThrows(NullPointerException.class,
                () -> scheduler.createSubagent("x", null, Set.of(), false));
        assertThrows(IllegalArgumentException.class, () -> scheduler.createJob(null, Map.of(), null));
    }

    @Test
    @DisplayName("Job options are validated before anything is queued")
    void jobOptionValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.createJob(JobType.CODE_FIX, Map.of(), JobOptions.defaults().maxRetries(0)));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.createJob(JobType.CODE_FIX, Map.of(), JobOptions.defaults().timeout(Duration.ZERO)));
        assertTrue(scheduler.getAllJobs().isEmpty());

        Job single = scheduler.createJob(JobType.CODE_FIX, Map.of(), JobOptions.defaults().maxRetries(1));
        assertEquals(JobFailResult.FAILED, scheduler.failJob(single.id(), "boom"));
        Job failed = scheduler.getJob(single.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertTrue(failed.retries() <= failed.maxRetries());
    }
}
