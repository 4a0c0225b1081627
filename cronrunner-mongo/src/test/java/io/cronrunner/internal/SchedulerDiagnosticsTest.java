package io.cronrunner.internal;

import io.cronrunner.config.CronRunnerProperties;
import io.cronrunner.core.EntryKind;
import io.cronrunner.core.Job;
import io.cronrunner.core.JobRun;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerDiagnosticsTest {

    private InMemoryJobStore jobStore;
    private InMemoryRunLedger ledger;
    private InProcessJobScheduler scheduler;
    private SchedulerDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        ledger = new InMemoryRunLedger(jobStore);
        scheduler = new InProcessJobScheduler(new CronRunnerProperties(), jobStore, () -> jobId -> Optional.empty());
        diagnostics = new SchedulerDiagnostics(scheduler, jobStore, ledger);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void refreshAllShouldRescheduleEveryJob() {
        Job on = jobStore.save(Job.of(null, "on", "/jobs/on.py", "0 * * * *", true));
        Job off = jobStore.save(Job.of(null, "off", "/jobs/off.py", "0 * * * *", false).withNextRunAt(Instant.now()));

        assertThat(diagnostics.refreshAll()).isEqualTo(2);

        assertThat(scheduler.findEntry(EntryKind.recurringId(on.id()))).isPresent();
        assertThat(scheduler.findEntry(EntryKind.recurringId(off.id()))).isEmpty();
        assertThat(jobStore.findById(off.id()).orElseThrow().nextRunAt()).isNull();
    }

    @Test
    void compareShouldExposeDriftBetweenStoreAndScheduler() {
        Job scheduled = jobStore.save(Job.of(null, "scheduled", "/jobs/a.py", "0 * * * *", true));
        Job drifted = jobStore.save(Job.of(null, "drifted", "/jobs/b.py", "0 * * * *", true));
        scheduler.schedule(scheduled);

        List<SchedulerDiagnostics.JobScheduleStatus> report = diagnostics.compare();

        SchedulerDiagnostics.JobScheduleStatus ok = report.stream()
                .filter(s -> s.jobId().equals(scheduled.id())).findFirst().orElseThrow();
        SchedulerDiagnostics.JobScheduleStatus missing = report.stream()
                .filter(s -> s.jobId().equals(drifted.id())).findFirst().orElseThrow();

        assertThat(ok.inScheduler()).isTrue();
        assertThat(ok.consistent()).isTrue();
        assertThat(ok.entryNextFireTime()).isEqualTo(ok.persistedNextRunAt());
        assertThat(missing.inScheduler()).isFalse();
        assertThat(missing.entryNextFireTime()).isNull();
        assertThat(missing.consistent()).isFalse();
    }

    @Test
    void statusShouldSummarizeJobsRunsAndScheduler() {
        jobStore.save(Job.of(null, "a", "/jobs/a.py", "0 * * * *", true));
        jobStore.save(Job.of(null, "b", "/jobs/b.py", "0 * * * *", false));
        ledger.create(JobRun.started("1", Instant.now()));
        scheduler.start();

        SchedulerDiagnostics.SystemStatus status = diagnostics.status();

        assertThat(status.totalJobs()).isEqualTo(2);
        assertThat(status.enabledJobs()).isEqualTo(1);
        assertThat(status.runningRuns()).isEqualTo(1);
        assertThat(status.schedulerRunning()).isTrue();
    }
}
