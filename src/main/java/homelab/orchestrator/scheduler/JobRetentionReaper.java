package homelab.orchestrator.scheduler;

import homelab.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that garbage-collects finished jobs.
 *
 * Jobs that reached COMPLETED, FAILED or CANCELLED more than the configured
 * retention ago are removed together with their update listeners. Queued and
 * running jobs are never touched.
 */
public class JobRetentionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobRetentionReaper.class);

    private final JobScheduler jobScheduler;
    private final OrchestratorConfig config;

    public JobRetentionReaper(JobScheduler jobScheduler, OrchestratorConfig config) {
        this.jobScheduler = jobScheduler;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapExpiredJobs();
        } catch (Exception e) {
            log.error("Job retention reaper error", e);
        }
    }

    /**
     * @return number of jobs removed
     */
    public int reapExpiredJobs() {
        int removed = jobScheduler.clearCompletedJobs(config.jobRetention());
        if (removed == 0) {
            log.debug("No expired jobs found");
        } else {
            log.info("Job retention reaper removed {} jobs", removed);
        }
        return removed;
    }
}
