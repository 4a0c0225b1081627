package io.cronrunner.internal;

import io.cronrunner.JobScheduler;
import io.cronrunner.JobStore;
import io.cronrunner.RunLedger;
import io.cronrunner.core.EntryKind;
import io.cronrunner.core.Job;
import io.cronrunner.core.SchedulerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator views over the scheduler and the job store.
 */
public class SchedulerDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(SchedulerDiagnostics.class);

    private final JobScheduler scheduler;
    private final JobStore jobStore;
    private final RunLedger ledger;

    /**
     * Persisted schedule of a job next to its live scheduler entry.
     *
     * @param persistedNextRunAt next_run_at as stored in the job store
     * @param entryNextFireTime  next fire time of the recurring entry, null when not scheduled
     */
    public record JobScheduleStatus(
            String jobId,
            String name,
            boolean enabled,
            String cronExpression,
            Instant persistedNextRunAt,
            boolean inScheduler,
            Instant entryNextFireTime
    ) {
        /**
         * An enabled job must have an entry and a disabled one must not.
         */
        public boolean consistent() {
            return enabled == inScheduler;
        }
    }

    public record SystemStatus(long totalJobs, long enabledJobs, long runningRuns, boolean schedulerRunning) {
    }

    public SchedulerDiagnostics(JobScheduler scheduler, JobStore jobStore, RunLedger ledger) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    }

    /**
     * Re-run {@link JobScheduler#schedule(Job)} for every job, enabled or not.
     *
     * @return number of jobs processed
     */
    public int refreshAll() {
        List<Job> jobs = jobStore.findAll();
        int refreshed = 0;
        for (Job job : jobs) {
            try {
                scheduler.schedule(job);
                refreshed++;
            } catch (Exception e) {
                log.error("Failed to refresh schedule of job {} msg={}", job.id(), e.getMessage(), e);
            }
        }
        log.info("Refreshed schedules of {}/{} jobs", refreshed, jobs.size());
        return refreshed;
    }

    public List<JobScheduleStatus> compare() {
        List<Job> jobs = jobStore.findAll();
        List<JobScheduleStatus> out = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            Optional<SchedulerEntry> entry = scheduler.findEntry(EntryKind.recurringId(job.id()));
            out.add(new JobScheduleStatus(
                    job.id(),
                    job.name(),
                    job.enabled(),
                    job.cronExpression(),
                    job.nextRunAt(),
                    entry.isPresent(),
                    entry.map(SchedulerEntry::nextFireTime).orElse(null)
            ));
        }
        return out;
    }

    public SystemStatus status() {
        return new SystemStatus(jobStore.count(), jobStore.countEnabled(), ledger.countRunning(), scheduler.isRunning());
    }
}
