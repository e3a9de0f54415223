package homelab.orchestrator.service;

import homelab.orchestrator.assistant.BugFixResult;
import homelab.orchestrator.assistant.CodeAssistant;
import homelab.orchestrator.assistant.CodeAssistantException;
import homelab.orchestrator.assistant.CodeGenerationResult;
import homelab.orchestrator.assistant.CodeReviewResult;
import homelab.orchestrator.assistant.CodeTask;
import homelab.orchestrator.assistant.FeatureDevelopmentResult;
import homelab.orchestrator.core.JobEventBus;
import homelab.orchestrator.core.Subscription;
import homelab.orchestrator.execution.NodeExecutionAdapter;
import homelab.orchestrator.model.AIResource;
import homelab.orchestrator.model.AIServicesReport;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ClusterStatus;
import homelab.orchestrator.model.Job;
import homelab.orchestrator.model.JobCompleteResult;
import homelab.orchestrator.model.JobFailResult;
import homelab.orchestrator.model.JobOptions;
import homelab.orchestrator.model.JobPriority;
import homelab.orchestrator.model.JobStatus;
import homelab.orchestrator.model.JobType;
import homelab.orchestrator.model.NodeAction;
import homelab.orchestrator.model.NodeCapability;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.model.OrchestratorStats;
import homelab.orchestrator.model.Subagent;
import homelab.orchestrator.model.SubagentType;
import homelab.orchestrator.scheduler.JobScheduler;
import homelab.orchestrator.scheduler.Scheduler;
import homelab.orchestrator.wake.WakeCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Single entry point over jobs, subagents, cluster nodes and AI resources.
 *
 * Code workflows are queued as ordinary jobs. Their body runs on a worker
 * thread each time the scheduler promotes the job to RUNNING, so a retried
 * attempt runs the body again.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final Duration CODE_TASK_TIMEOUT = Duration.ofMinutes(5);
    static final Duration FEATURE_TIMEOUT = Duration.ofMinutes(10);

    private final JobScheduler jobs;
    private final ClusterNodeRegistry nodes;
    private final NodeExecutionAdapter executor;
    private final WakeCoordinator wakeCoordinator;
    private final CapabilityRouter router;
    private final AIResourceSelector resources;
    private final CodeAssistant codeAssistant;
    private final Scheduler scheduler;

    private final Map<String, Consumer<String>> workflows = new ConcurrentHashMap<>();
    private final Set<String> startedAttempts = ConcurrentHashMap.newKeySet();
    private final ExecutorService workflowExecutor;
    private final Subscription workflowTrigger;

    public Orchestrator(JobScheduler jobs, JobEventBus events, ClusterNodeRegistry nodes,
            NodeExecutionAdapter executor, WakeCoordinator wakeCoordinator, CapabilityRouter router,
            AIResourceSelector resources, CodeAssistant codeAssistant, Scheduler scheduler) {
        this.jobs = jobs;
        this.nodes = nodes;
        this.executor = executor;
        this.wakeCoordinator = wakeCoordinator;
        this.router = router;
        this.resources = resources;
        this.codeAssistant = codeAssistant;
        this.scheduler = scheduler;

        AtomicInteger threads = new AtomicInteger();
        this.workflowExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "workflow-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.workflowTrigger = events.onAnyJobUpdate(this::onJobUpdate);
    }

    // ---- JOBS ----

    public Job createJob(JobType type, Map<String, Object> params, JobOptions options) {
        return jobs.createJob(type, params, options);
    }

    public boolean cancelJob(String jobId) {
        return jobs.cancelJob(jobId);
    }

    public Optional<Job> getJob(String jobId) {
        return jobs.getJob(jobId);
    }

    public List<Job> getAllJobs() {
        return jobs.getAllJobs();
    }

    public List<Job> getJobsByStatus(JobStatus status) {
        return jobs.getJobsByStatus(status);
    }

    public List<Job> getJobsBySubagent(String subagentId) {
        return jobs.getJobsBySubagent(subagentId);
    }

    public Subscription onJobUpdate(String jobId, Consumer<Job> listener) {
        return jobs.onJobUpdate(jobId, listener);
    }

    public boolean updateJobProgress(String jobId, int progress, Object result) {
        return jobs.updateProgress(jobId, progress, result);
    }

    public JobCompleteResult completeJob(String jobId, Object result) {
        return jobs.completeJob(jobId, result);
    }

    public JobFailResult failJob(String jobId, String error) {
        return jobs.failJob(jobId, error);
    }

    public int clearCompletedJobs(Duration olderThan) {
        return jobs.clearCompletedJobs(olderThan);
    }

    // ---- SUBAGENTS ----

    public Subagent createSubagent(String name, SubagentType type, Set<String> capabilities, boolean preferLocalAI) {
        return jobs.createSubagent(name, type, capabilities, preferLocalAI);
    }

    public Optional<Subagent> getSubagent(String subagentId) {
        return jobs.getSubagent(subagentId);
    }

    public boolean stopSubagent(String subagentId) {
        return jobs.stopSubagent(subagentId);
    }

    public boolean removeSubagent(String subagentId) {
        return jobs.removeSubagent(subagentId);
    }

    public List<Subagent> getAllSubagents() {
        return jobs.getAllSubagents();
    }

    public List<Subagent> getActiveSubagents() {
        return jobs.getActiveSubagents();
    }

    // ---- CLUSTER ----

    public List<ClusterNode> registerNodes() {
        return nodes.registerNodes();
    }

    public List<ClusterNode> refreshNodeStatus() {
        return nodes.refreshNodeStatus();
    }

    public ClusterStatus getClusterStatus() {
        return nodes.getClusterStatus();
    }

    public Optional<ClusterNode> getNode(String nodeId) {
        return nodes.getNode(nodeId);
    }

    public List<ClusterNode> getAllNodes() {
        return nodes.getAllNodes();
    }

    public List<ClusterNode> getOnlineNodes() {
        return nodes.getOnlineNodes();
    }

    public List<NodeCapability> getNodeCapabilities(String nodeId) {
        return nodes.getNodeCapabilities(nodeId);
    }

    public List<ClusterNode> getNodesByCapability(String capability) {
        return nodes.getNodesByCapability(capability);
    }

    public NodeExecutionResult executeOnNode(String nodeId, NodeAction action, Map<String, Object> params) {
        return executor.executeOnNode(nodeId, action, params);
    }

    public NodeExecutionResult wakeNode(String nodeId) {
        return wakeCoordinator.wakeNode(nodeId);
    }

    public Optional<ClusterNode> routeJobToNode(String capability) {
        return router.routeJobToNode(capability);
    }

    public NodeExecutionResult routeAndExecute(String capability, NodeAction action, Map<String, Object> params,
            boolean wakeIfSleeping) {
        return router.routeAndExecute(capability, action, params, wakeIfSleeping);
    }

    // ---- AI RESOURCES ----

    public Optional<AIResource> selectBestResource(String capability, boolean preferLocal) {
        return resources.selectBestResource(capability, preferLocal);
    }

    public List<AIResource> getResources() {
        return resources.getResources();
    }

    public void refreshResourceStatus() {
        resources.refreshResourceStatus();
    }

    public AIServicesReport checkAllAIServices() {
        return resources.checkAllAIServices();
    }

    public void startResourceMonitoring(Duration interval) {
        scheduler.startResourceMonitoring(interval);
    }

    public void stopResourceMonitoring() {
        scheduler.stopResourceMonitoring();
    }

    public OrchestratorStats getStats() {
        return new OrchestratorStats(
                jobs.countJobs(),
                jobs.countByStatus(JobStatus.COMPLETED),
                jobs.countByStatus(JobStatus.FAILED),
                jobs.countByStatus(JobStatus.RUNNING),
                jobs.countByStatus(JobStatus.QUEUED),
                jobs.getActiveSubagents().size(),
                resources.isLocalAvailable(),
                resources.isCloudAvailable());
    }

    // ---- CODE WORKFLOWS ----

    /**
     * Queue a single code assistant task. Defaults: NORMAL priority, five minute
     * advisory timeout, notify on completion.
     */
    public Job executeOpenCodeTask(CodeTask task, JobOptions options) {
        JobOptions opts = withDefaults(options, JobPriority.NORMAL, CODE_TASK_TIMEOUT);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("task", task);
        return submitWorkflow(JobType.OPENCODE_TASK, params, opts, jobId -> {
            jobs.updateProgress(jobId, 10, Map.of("status", "Starting code task"));
            CodeGenerationResult result = codeAssistant.execute(task);
            if (result.success()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("output", result.output());
                out.put("changes", result.changes());
                jobs.completeJob(jobId, out);
            } else {
                jobs.failJob(jobId, result.error() != null ? result.error() : "Code task failed");
            }
        });
    }

    public Job developFeature(String specification, JobPriority priority) {
        if (specification == null || specification.isBlank()) {
            throw new IllegalArgumentException("feature specification is required");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", "develop_feature");
        params.put("spec", specification);
        return submitWorkflow(JobType.OPENCODE_TASK, params,
                withDefaults(JobOptions.withPriority(priority), JobPriority.NORMAL, FEATURE_TIMEOUT), jobId -> {
                    jobs.updateProgress(jobId, 10, Map.of("status", "Analyzing feature requirements"));
                    FeatureDevelopmentResult result = codeAssistant.developFeature(specification);
                    jobs.updateProgress(jobId, 50, Map.of("status", "Feature generated", "files",
                            result.files().size()));
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("files", result.files());
                    out.put("commands", result.commands());
                    out.put("tests", result.tests());
                    jobs.completeJob(jobId, out);
                });
    }

    public Job fixCodeBugs(String description, List<String> files) {
        return fixCodeBugs(description, files, JobPriority.HIGH);
    }

    public Job fixCodeBugs(String description, List<String> files, JobPriority priority) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("bug description is required");
        }
        List<String> targets = files != null ? List.copyOf(files) : List.of();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", "fix_bugs");
        params.put("description", description);
        params.put("files", targets);
        return submitWorkflow(JobType.OPENCODE_TASK, params,
                withDefaults(JobOptions.withPriority(priority), JobPriority.HIGH, CODE_TASK_TIMEOUT), jobId -> {
                    jobs.updateProgress(jobId, 10, Map.of("status", "Analyzing bugs"));
                    BugFixResult result = codeAssistant.fixBugs(description, targets);
                    jobs.completeJob(jobId, Map.of("fixes", result.fixes()));
                });
    }

    public Job reviewCode(List<String> files, JobPriority priority) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("at least one file is required");
        }
        List<String> targets = List.copyOf(files);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", "review_code");
        params.put("files", targets);
        return submitWorkflow(JobType.OPENCODE_TASK, params,
                withDefaults(JobOptions.withPriority(priority), JobPriority.NORMAL, CODE_TASK_TIMEOUT), jobId -> {
                    jobs.updateProgress(jobId, 10, Map.of("status", "Reviewing code"));
                    CodeReviewResult result = codeAssistant.reviewCode(targets);
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("issues", result.issues());
                    out.put("suggestions", result.suggestions());
                    jobs.completeJob(jobId, out);
                });
    }

    private static JobOptions withDefaults(JobOptions options, JobPriority priority, Duration timeout) {
        JobOptions opts = options != null ? options : JobOptions.defaults();
        if (opts.priority() == null) {
            opts = opts.priority(priority);
        }
        if (opts.timeout() == null) {
            opts = opts.timeout(timeout);
        }
        if (opts.notifyOnComplete() == null) {
            opts = opts.notifyOnComplete(true);
        }
        return opts;
    }

    /**
     * Create the job with dispatch held so the body is registered before the
     * job can be promoted.
     */
    private Job submitWorkflow(JobType type, Map<String, Object> params, JobOptions options, WorkflowBody body) {
        Job job;
        try (JobScheduler.Hold hold = jobs.holdDispatch()) {
            job = jobs.createJob(type, params, options);
            workflows.put(job.id(), jobId -> runWorkflow(jobId, body));
        }
        return jobs.getJob(job.id()).orElse(job);
    }

    private void onJobUpdate(Job job) {
        if (job.isTerminal()) {
            if (workflows.remove(job.id()) != null) {
                startedAttempts.removeIf(key -> key.startsWith(job.id() + ":"));
            }
            return;
        }
        if (job.status() != JobStatus.RUNNING) {
            return;
        }
        Consumer<String> workflow = workflows.get(job.id());
        if (workflow == null || !startedAttempts.add(job.id() + ":" + job.retries())) {
            return;
        }
        try {
            workflowExecutor.execute(() -> workflow.accept(job.id()));
        } catch (RejectedExecutionException e) {
            log.warn("Workflow for job {} not started: orchestrator is closing", job.id());
        }
    }

    private void runWorkflow(String jobId, WorkflowBody body) {
        try {
            body.run(jobId);
        } catch (CodeAssistantException | RuntimeException e) {
            log.warn("Workflow for job {} failed: {}", jobId, e.getMessage());
            jobs.failJob(jobId, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    @FunctionalInterface
    private interface WorkflowBody {
        void run(String jobId) throws CodeAssistantException;
    }

    @Override
    public void close() {
        workflowTrigger.close();
        scheduler.close();
        workflowExecutor.shutdownNow();
        nodes.close();
        log.info("Orchestrator closed");
    }
}
