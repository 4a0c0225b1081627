package io.cronrunner;

import io.cronrunner.core.JobNotFoundException;
import io.cronrunner.core.JobRun;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of execution records.
 */
public interface RunLedger {

    /**
     * Insert a new run.
     *
     * @return the run with its generated id
     */
    JobRun create(JobRun run);

    /**
     * Terminal update. Applies only while the stored run is still {@code RUNNING}, so a terminal
     * status never reverts.
     *
     * @return true if the update was applied
     */
    boolean update(JobRun run);

    Optional<JobRun> findById(String runId);

    /**
     * Runs of a job ordered by start time, newest first.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    List<JobRun> listForJob(String jobId, int limit);

    /**
     * All runs in {@code RUNNING}, optionally restricted to one job.
     *
     * @param jobId null for all jobs
     */
    List<JobRun> findRunning(String jobId);

    long countRunning();
}
