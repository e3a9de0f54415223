package homelab.orchestrator.service;

import homelab.orchestrator.assistant.CodeGenerationResult;
import homelab.orchestrator.assistant.CodeTask;
import homelab.orchestrator.assistant.FeatureDevelopmentResult;
import homelab.orchestrator.config.Dependencies;
import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.model.Job;
import homelab.orchestrator.model.JobOptions;
import homelab.orchestrator.model.JobPriority;
import homelab.orchestrator.model.JobStatus;
import homelab.orchestrator.model.JobType;
import homelab.orchestrator.model.NodeAction;
import homelab.orchestrator.model.OrchestratorStats;
import homelab.orchestrator.model.ResourceStatus;
import homelab.orchestrator.model.Subagent;
import homelab.orchestrator.model.SubagentType;
import homelab.orchestrator.testsupport.FakeCodeAssistant;
import homelab.orchestrator.testsupport.FakeReachabilityProbe;
import homelab.orchestrator.testsupport.FakeRuntimeHealthProbe;
import homelab.orchestrator.testsupport.Nodes;
import homelab.orchestrator.testsupport.RecordingAgentTransport;
import homelab.orchestrator.testsupport.RecordingShellTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorTest {

    private final FakeCodeAssistant assistant = new FakeCodeAssistant();
    private Dependencies deps;
    private Orchestrator orchestrator;

    private void start(OrchestratorConfig config) {
        deps = Dependencies.create(config, new Dependencies.Externals()
                .directory(() -> List.of(Nodes.linode(), Nodes.home(), Nodes.windows()))
                .probe(new FakeReachabilityProbe().up(Nodes.LINODE_HOST).up(Nodes.HOME_HOST))
                .shell(new RecordingShellTransport())
                .keys(() -> Optional.of("key".getBytes()))
                .agent(new RecordingAgentTransport())
                .runtimeProbe(new FakeRuntimeHealthProbe())
                .codeAssistant(assistant)
                .credentials(name -> Optional.empty()));
        orchestrator = deps.orchestrator();
    }

    private void start() {
        start(OrchestratorConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private Job awaitTerminal(Job job) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            Job current = orchestrator.getJob(job.id()).orElseThrow();
            if (current.isTerminal()) {
                return current;
            }
            Thread.sleep(20);
        }
        fail("job " + job.id() + " did not finish: " + orchestrator.getJob(job.id()).orElseThrow());
        return null;
    }

    @Test
    @DisplayName("Feature development runs as a job and stores the generated files")
    void developFeature() throws InterruptedException {
        start();

        Job job = orchestrator.developFeature("dark mode toggle", null);

        assertEquals(JobType.OPENCODE_TASK, job.type());
        assertEquals(JobPriority.NORMAL, job.priority());
        assertEquals(Duration.ofMinutes(10), job.timeout());
        assertTrue(job.notifyOnComplete());
        assertEquals("develop_feature", job.params().get("action"));

        Job done = awaitTerminal(job);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(100, done.progress());
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) done.result();
        assertEquals(2, ((List<?>) result.get("files")).size());
        assertEquals(List.of("src/FeatureTest.java"), result.get("tests"));
        assertTrue(((List<?>) result.get("files")).get(0) instanceof FeatureDevelopmentResult.GeneratedFile);
    }

    @Test
    @DisplayName("A failed attempt is retried and the workflow body runs again")
    void retryRerunsWorkflow() throws InterruptedException {
        start();
        assistant.failFirst(1);

        Job job = orchestrator.fixCodeBugs("login crashes on empty password", List.of("src/auth.ts"));
        assertEquals(JobPriority.HIGH, job.priority());

        Job done = awaitTerminal(job);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(1, done.retries());
        assertEquals(2, assistant.calls.get());
    }

    @Test
    @DisplayName("Workflow failing on every attempt ends FAILED with the last error")
    void exhaustedRetries() throws InterruptedException {
        start();
        assistant.failFirst(10);

        Job done = awaitTerminal(orchestrator.reviewCode(List.of("src/app.ts"), JobPriority.LOW));

        assertEquals(JobStatus.FAILED, done.status());
        assertEquals(2, done.retries());
        assertTrue(done.error().contains("attempt 2"), done.error());
        assertEquals(2, assistant.calls.get());
    }

    @Test
    @DisplayName("Code task results carry output and changed files")
    void codeTask() throws InterruptedException {
        start();

        Job done = awaitTerminal(orchestrator.executeOpenCodeTask(
                CodeTask.of(CodeTask.Type.REFACTOR, "extract a service"), null));

        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(Duration.ofMinutes(5), done.timeout());
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) done.result();
        assertEquals("done", result.get("output"));
        assertEquals(List.of("src/App.java"), result.get("changes"));
    }

    @Test
    @DisplayName("Unsuccessful code task fails the job")
    void codeTaskFailure() throws InterruptedException {
        start();
        assistant.executeResult(CodeGenerationResult.failed("model not loaded"));

        Job done = awaitTerminal(orchestrator.executeOpenCodeTask(CodeTask.of(CodeTask.Type.EXPLAIN, "why"),
                JobOptions.defaults().maxRetries(1).priority(JobPriority.CRITICAL)));

        assertEquals(JobStatus.FAILED, done.status());
        assertEquals(JobPriority.CRITICAL, done.priority());
        assertEquals("model not loaded", done.error());
    }

    @Test
    @DisplayName("Workflow does not run before its job is dispatched, nor after it is cancelled")
    void workflowWaitsForDispatch() throws InterruptedException {
        start(OrchestratorConfig.defaults().withMaxConcurrent(1));
        Job blocker = orchestrator.createJob(JobType.COMMAND_EXECUTION, Map.of("command", "sleep 60"), null);
        assertEquals(JobStatus.RUNNING, blocker.status());

        Job queued = orchestrator.developFeature("search page", JobPriority.HIGH);
        Job cancelled = orchestrator.reviewCode(List.of("a.ts"), JobPriority.LOW);
        assertEquals(JobStatus.QUEUED, queued.status());

        Thread.sleep(100);
        assertEquals(0, assistant.calls.get());
        assertTrue(orchestrator.cancelJob(cancelled.id()));

        orchestrator.completeJob(blocker.id(), null);

        assertEquals(JobStatus.COMPLETED, awaitTerminal(queued).status());
        assertEquals(1, assistant.calls.get());
        assertEquals(JobStatus.CANCELLED, orchestrator.getJob(cancelled.id()).orElseThrow().status());
    }

    @Test
    void workflowArgumentsAreValidated() {
        start();

        assertThrows(IllegalArgumentException.class, () -> orchestrator.developFeature(" ", JobPriority.LOW));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.fixCodeBugs(null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.reviewCode(List.of(), null));
        assertEquals(0, orchestrator.getAllJobs().size());
    }

    @Test
    @DisplayName("Stats aggregate jobs, subagents and AI availability")
    void stats() {
        start(OrchestratorConfig.defaults().withMaxConcurrent(1));
        Subagent agent = orchestrator.createSubagent("ops", SubagentType.AUTOMATION, Set.of("docker"), false);
        Job done = orchestrator.createJob(JobType.COMMAND_EXECUTION, Map.of(), null);
        orchestrator.completeJob(done.id(), "ok");
        orchestrator.createJob(JobType.COMMAND_EXECUTION, Map.of(), JobOptions.defaults().subagentId(agent.id()));
        orchestrator.createJob(JobType.FILE_OPERATION, Map.of(), null);

        OrchestratorStats stats = orchestrator.getStats();

        assertEquals(3, stats.totalJobs());
        assertEquals(1, stats.completedJobs());
        assertEquals(0, stats.failedJobs());
        assertEquals(1, stats.runningJobs());
        assertEquals(1, stats.queuedJobs());
        assertEquals(1, stats.activeSubagents());
        assertFalse(stats.localAIAvailable());
        assertTrue(stats.cloudAIAvailable(), "cloud starts available until the first refresh");
    }

    @Test
    @DisplayName("Resource monitoring refreshes AI resources in the background")
    void resourceMonitoring() throws InterruptedException {
        start();
        assistant.installed(true);

        orchestrator.startResourceMonitoring(Duration.ofMillis(50));
        long deadline = System.currentTimeMillis() + 3000;
        while ((orchestrator.selectBestResource("code-review", true).isEmpty()
                || orchestrator.getStats().cloudAIAvailable())
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        orchestrator.stopResourceMonitoring();

        assertEquals(ResourceStatus.AVAILABLE,
                orchestrator.selectBestResource("code-review", true).orElseThrow().status());
        assertFalse(orchestrator.getStats().cloudAIAvailable(), "no credentials configured");
    }

    @Test
    @DisplayName("Cluster operations go through the registry and router")
    void clusterFacade() {
        start();

        assertEquals(3, orchestrator.registerNodes().size());
        assertEquals(2, orchestrator.getOnlineNodes().size());
        assertEquals("linode", orchestrator.routeJobToNode("docker").orElseThrow().id());
        assertEquals("windows", orchestrator.routeJobToNode("ai-text").orElseThrow().id());
        assertTrue(orchestrator.executeOnNode("home", NodeAction.GIT_PULL, Map.of())
                .success());
    }
}
