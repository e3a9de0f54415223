package homelab.orchestrator.scheduler;

import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.core.JobEventBus;
import homelab.orchestrator.store.InMemoryJobRepository;
import homelab.orchestrator.store.InMemorySubagentRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private final AtomicInteger refreshes = new AtomicInteger();
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = OrchestratorConfig.defaults();
        JobScheduler jobs = new JobScheduler(new InMemoryJobRepository(),
                new SubagentRegistry(new InMemorySubagentRepository()), new JobEventBus(), config);
        scheduler = new Scheduler(jobs, refreshes::incrementAndGet, config);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("Resource monitoring refreshes immediately and then periodically")
    void resourceMonitoringRuns() throws InterruptedException {
        scheduler.startResourceMonitoring(Duration.ofMillis(50));
        assertTrue(scheduler.isResourceMonitoring());

        Thread.sleep(300);
        assertTrue(refreshes.get() >= 3, "expected several refreshes, got " + refreshes.get());

        scheduler.stopResourceMonitoring();
        assertFalse(scheduler.isResourceMonitoring());
        Thread.sleep(100);
        int afterStop = refreshes.get();
        Thread.sleep(200);
        assertEquals(afterStop, refreshes.get(), "no refresh after stop");
    }

    @Test
    @DisplayName("A failing refresh does not cancel the schedule")
    void failingRefreshKeepsRunning() throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.defaults();
        AtomicInteger attempts = new AtomicInteger();
        Scheduler failing = new Scheduler(
                new JobScheduler(new InMemoryJobRepository(), new SubagentRegistry(new InMemorySubagentRepository()),
                        new JobEventBus(), config),
                () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("probe down");
                },
                config);
        try {
            failing.startResourceMonitoring(Duration.ofMillis(30));
            Thread.sleep(200);
            assertTrue(attempts.get() >= 2);
        } finally {
            failing.close();
        }
    }

    @Test
    @DisplayName("Start is idempotent and stop shuts the executor down")
    void startAndStop() {
        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());

        scheduler.startResourceMonitoring(Duration.ofMillis(10));
        assertFalse(scheduler.isResourceMonitoring(), "closed scheduler ignores new monitoring");
    }
}
