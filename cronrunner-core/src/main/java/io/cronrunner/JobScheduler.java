package io.cronrunner;

import io.cronrunner.core.Job;
import io.cronrunner.core.SchedulerEntry;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API. Owns the in-memory trigger registrations.
 *
 * <p>Supports two kinds of entries:
 * <ul>
 *   <li>Recurring entries, one per enabled job, driven by a 5-field UTC cron expression</li>
 *   <li>One-shot entries created by manual run requests, several per job allowed</li>
 * </ul>
 *
 * <p>All methods are safe to call concurrently with trigger firings.
 */
public interface JobScheduler {
    void start();

    void stop();

    boolean isRunning();

    /**
     * Install or replace the recurring entry of a job.
     *
     * <p>Any existing entry is removed first. A disabled job ends up with no entry and a cleared
     * {@code nextRunAt}. An invalid cron expression is logged and leaves the job unscheduled;
     * nothing is thrown.
     */
    void schedule(Job job);

    /**
     * Remove the recurring entry of a job. No-op when it is not scheduled.
     *
     * @return true if an entry was removed
     */
    boolean unschedule(String jobId);

    /**
     * Schedule a single immediate run of a job.
     *
     * @return false if the entry could not be installed; never throws
     */
    boolean scheduleOnce(String jobId, String jobName);

    /**
     * Startup barrier: clear {@code nextRunAt} on disabled jobs, then schedule every enabled job.
     * A failure on one job does not prevent the others from loading.
     */
    void loadAll();

    List<SchedulerEntry> listEntries();

    Optional<SchedulerEntry> findEntry(String entryId);

    /**
     * Remove one entry by id.
     *
     * @return true if the entry existed
     */
    boolean removeEntry(String entryId);
}
