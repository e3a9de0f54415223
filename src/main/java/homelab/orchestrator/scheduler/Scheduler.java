package homelab.orchestrator.scheduler;

import homelab.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - JobRetentionReaper: removes finished jobs after the retention window
 * - resource monitor: refreshes AI resource status, started and stopped on demand
 *
 * Uses a single-threaded executor so periodic tasks never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobRetentionReaper retentionReaper;
    private final Runnable resourceRefresh;
    private final OrchestratorConfig config;

    private volatile boolean running = false;
    private ScheduledFuture<?> resourceMonitor;

    /**
     * @param jobScheduler    scheduler whose finished jobs are swept
     * @param resourceRefresh runnable that refreshes AI resource status
     *                        (typically AIResourceSelector::refreshResourceStatus)
     * @param config          configuration
     */
    public Scheduler(JobScheduler jobScheduler, Runnable resourceRefresh, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "orchestrator-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.retentionReaper = new JobRetentionReaper(jobScheduler, config);
        this.resourceRefresh = resourceRefresh;
        this.config = config;
    }

    /**
     * Start the retention sweep.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long sweepMs = config.retentionSweepInterval().toMillis();
        executor.scheduleAtFixedRate(retentionReaper, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        log.info("Job retention reaper scheduled every {}ms", sweepMs);

        log.info("Scheduler started");
    }

    /**
     * Refresh AI resources now and then every {@code interval}.
     * Calling it again replaces the previous schedule.
     */
    public synchronized void startResourceMonitoring(Duration interval) {
        if (executor.isShutdown()) {
            log.warn("Scheduler closed, resource monitoring not started");
            return;
        }
        stopResourceMonitoring();
        long intervalMs = interval.toMillis();
        resourceMonitor = executor.scheduleAtFixedRate(
                wrapRunnable("resource-monitor", resourceRefresh),
                0,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Resource monitoring scheduled every {}ms", intervalMs);
    }

    public synchronized void stopResourceMonitoring() {
        if (resourceMonitor != null) {
            resourceMonitor.cancel(false);
            resourceMonitor = null;
            log.info("Resource monitoring stopped");
        }
    }

    public synchronized boolean isResourceMonitoring() {
        return resourceMonitor != null;
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        synchronized (this) {
            stopResourceMonitoring();
            running = false;
            if (executor.isShutdown()) {
                return;
            }
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the retention reaper for direct access (e.g., manual trigger).
     */
    public JobRetentionReaper retentionReaper() {
        return retentionReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
