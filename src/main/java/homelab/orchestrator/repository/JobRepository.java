package homelab.orchestrator.repository;

import homelab.orchestrator.model.Job;
import homelab.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for job snapshots.
 */
public interface JobRepository {

    /**
     * Insert or replace a job snapshot.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get all jobs in creation order.
     *
     * @return list of jobs
     */
    List<Job> findAll();

    /**
     * Get all jobs with the given status, in creation order.
     *
     * @param status the status filter
     * @return list of jobs
     */
    List<Job> findByStatus(JobStatus status);

    /**
     * Get all jobs bound to a subagent.
     *
     * @param subagentId the subagent ID
     * @return list of jobs
     */
    List<Job> findBySubagent(String subagentId);

    /**
     * Find terminal jobs completed before the cutoff.
     *
     * @param completedBefore jobs with completedAt before this instant qualify
     * @return list of jobs
     */
    List<Job> findTerminalCompletedBefore(Instant completedBefore);

    /**
     * Delete a job.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Count jobs with the given status.
     *
     * @param status the status
     * @return count
     */
    int countByStatus(JobStatus status);

    /**
     * Get total count of jobs.
     *
     * @return count
     */
    int count();

    /**
     * Generate a new unique job ID.
     *
     * @return unique ID
     */
    String generateId();
}
