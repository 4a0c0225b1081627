package io.cronrunner.internal;

import io.cronrunner.JobScheduler;
import io.cronrunner.ProcessTable;
import io.cronrunner.RunLedger;
import io.cronrunner.TerminationCoordinator;
import io.cronrunner.config.CronRunnerProperties;
import io.cronrunner.core.EntryKind;
import io.cronrunner.core.JobEnvironment;
import io.cronrunner.core.JobRun;
import io.cronrunner.core.ProcessInfo;
import io.cronrunner.core.RunStatus;
import io.cronrunner.core.SchedulerEntry;
import io.cronrunner.core.TerminationResult;
import io.cronrunner.core.TerminationView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Cancels in-flight work by reconciling three views, none of them authoritative alone:
 * <ol>
 *   <li>scheduler: pending one-shot entries are removed so they never fire</li>
 *   <li>ledger: running rows are force-failed, whether or not their process is still alive</li>
 *   <li>processes: registered handles first, then an OS process table scan as recovery path</li>
 * </ol>
 *
 * <p>Every item is attempted independently; failures are collected into the
 * {@link TerminationResult} and never thrown.
 */
public class DefaultTerminationCoordinator implements TerminationCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DefaultTerminationCoordinator.class);

    static final String TERMINATED_MESSAGE = "Job terminated by user request";

    private final CronRunnerProperties props;
    private final JobScheduler scheduler;
    private final RunLedger ledger;
    private final ProcessRegistry registry;
    private final ProcessTable processTable;

    public DefaultTerminationCoordinator(CronRunnerProperties props,
                                         JobScheduler scheduler,
                                         RunLedger ledger,
                                         ProcessRegistry registry,
                                         ProcessTable processTable) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.processTable = Objects.requireNonNull(processTable, "processTable must not be null");
    }

    @Override
    public TerminationResult terminateAll() {
        log.info("Terminating all running jobs");
        return terminate(null);
    }

    @Override
    public TerminationResult terminateOne(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        log.info("Terminating running instances of job {}", jobId);
        return terminate(jobId);
    }

    private TerminationResult terminate(String jobId) {
        TerminationResult.Builder result = TerminationResult.builder();

        removeManualEntries(jobId, result);
        failRunningRuns(jobId, result);
        Set<Long> handled = killRegisteredProcesses(jobId, result);
        if (props.isProcessScanEnabled()) {
            killUntrackedProcesses(jobId, handled, result);
        }

        TerminationResult r = result.build();
        log.info("Termination finished job={} entriesRemoved={} runsFailed={} processesKilled={} failures={}",
                jobId == null ? "*" : jobId, r.entriesRemoved(), r.runsFailed(), r.processesKilled(), r.failures().size());
        return r;
    }

    private void removeManualEntries(String jobId, TerminationResult.Builder result) {
        List<SchedulerEntry> entries;
        try {
            entries = scheduler.listEntries();
        } catch (Exception e) {
            log.error("Failed to list scheduler entries msg={}", e.getMessage(), e);
            result.failure(TerminationView.SCHEDULER, "*", e.getMessage());
            return;
        }

        for (SchedulerEntry entry : entries) {
            if (entry.kind() != EntryKind.ONE_SHOT || (jobId != null && !jobId.equals(entry.jobId()))) {
                continue;
            }
            try {
                if (scheduler.removeEntry(entry.id())) {
                    result.entryRemoved();
                    log.info("Removed pending manual entry {}", entry.id());
                }
            } catch (Exception e) {
                log.warn("Failed to remove scheduler entry {} msg={}", entry.id(), e.getMessage());
                result.failure(TerminationView.SCHEDULER, entry.id(), e.getMessage());
            }
        }
    }

    private void failRunningRuns(String jobId, TerminationResult.Builder result) {
        List<JobRun> running;
        try {
            running = ledger.findRunning(jobId);
        } catch (Exception e) {
            log.error("Failed to query running job runs msg={}", e.getMessage(), e);
            result.failure(TerminationView.LEDGER, "*", e.getMessage());
            return;
        }

        for (JobRun run : running) {
            try {
                JobRun failed = run.complete(RunStatus.FAILED, Instant.now(), run.output(), TERMINATED_MESSAGE);
                if (ledger.update(failed)) {
                    result.runFailed();
                    log.info("Marked job run {} of job {} as failed", run.id(), run.jobId());
                } else {
                    log.debug("Job run {} completed before it could be terminated", run.id());
                }
            } catch (Exception e) {
                log.warn("Failed to mark job run {} as failed msg={}", run.id(), e.getMessage());
                result.failure(TerminationView.LEDGER, run.id(), e.getMessage());
            }
        }
    }

    private Set<Long> killRegisteredProcesses(String jobId, TerminationResult.Builder result) {
        Set<Long> handled = new HashSet<>();
        for (ProcessRegistry.RunningProcess running : registry.snapshot(jobId)) {
            long pid = running.pid();
            handled.add(pid);
            running.cancel();
            try {
                if (ProcessSignals.terminate(running.process().toHandle(), props.getTerminationGracePeriod())) {
                    result.processKilled();
                    log.info("Terminated pid={} of job {} run={}", pid, running.jobId(), running.runId());
                } else {
                    result.failure(TerminationView.PROCESS, Long.toString(pid), "process still alive after forceful kill");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.failure(TerminationView.PROCESS, Long.toString(pid), "interrupted while terminating");
                return handled;
            } catch (Exception e) {
                log.warn("Failed to terminate pid={} msg={}", pid, e.getMessage());
                result.failure(TerminationView.PROCESS, Long.toString(pid), e.getMessage());
            }
        }
        return handled;
    }

    private void killUntrackedProcesses(String jobId, Set<Long> handled, TerminationResult.Builder result) {
        if (Thread.currentThread().isInterrupted()) {
            return;
        }

        List<ProcessInfo> processes;
        try {
            processes = processTable.list();
        } catch (Exception e) {
            log.error("Failed to scan process table msg={}", e.getMessage(), e);
            result.failure(TerminationView.PROCESS, "process-table", e.getMessage());
            return;
        }

        long self = ProcessHandle.current().pid();
        for (ProcessInfo process : processes) {
            if (process.pid() == self || handled.contains(process.pid()) || !isJobProcess(process, jobId)) {
                continue;
            }
            try {
                if (processTable.terminate(process.pid(), props.getTerminationGracePeriod())) {
                    result.processKilled();
                    log.info("Terminated untracked pid={} job={} command={}",
                            process.pid(), process.environment().get(JobEnvironment.JOB_ID), process.commandLine());
                } else {
                    result.failure(TerminationView.PROCESS, Long.toString(process.pid()), "process still alive after forceful kill");
                }
            } catch (Exception e) {
                log.warn("Failed to terminate pid={} msg={}", process.pid(), e.getMessage());
                result.failure(TerminationView.PROCESS, Long.toString(process.pid()), e.getMessage());
            }
        }
    }

    /**
     * A process belongs to a job when it runs the script interpreter and its environment carries
     * {@code JOB_ID}, or the script path marker plus {@code JOB_NAME}/{@code JOB_CONFIG}.
     *
     * @param jobId null matches any job; otherwise {@code JOB_ID} must equal it
     */
    boolean isJobProcess(ProcessInfo process, String jobId) {
        if (!runsInterpreter(process)) {
            return false;
        }

        Map<String, String> env = process.environment();
        String envJobId = env.get(JobEnvironment.JOB_ID);
        if (jobId != null) {
            return jobId.equals(envJobId);
        }
        if (envJobId != null) {
            return true;
        }

        String marker = props.getScriptPathMarker();
        boolean hasMarker = marker != null && !marker.isBlank() && process.commandLine().contains(marker);
        return hasMarker && (env.containsKey(JobEnvironment.JOB_NAME) || env.containsKey(JobEnvironment.JOB_CONFIG));
    }

    private boolean runsInterpreter(ProcessInfo process) {
        String interpreter = props.getInterpreter();
        if (interpreter == null || interpreter.isBlank()) {
            return true;
        }
        if (process.command() == null) {
            return false;
        }
        String expected = baseName(interpreter.trim().split("\\s+")[0]).replaceAll("[0-9.]+$", "");
        String actual = baseName(process.command());
        return !expected.isEmpty() && actual.startsWith(expected);
    }

    private static String baseName(String command) {
        Path fileName = Path.of(command).getFileName();
        return fileName == null ? command : fileName.toString();
    }
}
