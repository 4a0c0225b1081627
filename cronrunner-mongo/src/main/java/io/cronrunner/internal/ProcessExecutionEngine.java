package io.cronrunner.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronrunner.ExecutionEngine;
import io.cronrunner.JobScheduler;
import io.cronrunner.JobStore;
import io.cronrunner.RunLedger;
import io.cronrunner.config.CronRunnerProperties;
import io.cronrunner.core.EntryKind;
import io.cronrunner.core.ExecutionTimeoutException;
import io.cronrunner.core.Job;
import io.cronrunner.core.JobEnvironment;
import io.cronrunner.core.JobRun;
import io.cronrunner.core.NonZeroExitException;
import io.cronrunner.core.RunStatus;
import io.cronrunner.core.SchedulerEntry;
import io.cronrunner.core.ScriptNotFoundException;
import io.cronrunner.core.SpawnFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs a job's script as an external process and records the outcome in the {@link RunLedger}.
 *
 * <p>Every execution gets its own ledger row, created in {@code RUNNING} before the process is
 * spawned and completed exactly once afterwards, whatever happened in between. No per-job mutual
 * exclusion: overlapping executions of the same job run side by side.
 *
 * <p>The process inherits this JVM's environment plus {@code JOB_CONFIG}, {@code JOB_ID} and
 * {@code JOB_NAME}. Stdout and stderr are captured separately through temporary files.
 */
public class ProcessExecutionEngine implements ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionEngine.class);

    private final CronRunnerProperties props;
    private final JobStore jobStore;
    private final RunLedger ledger;
    private final JobScheduler scheduler;
    private final ProcessRegistry registry;
    private final ObjectMapper objectMapper;

    private record ScriptResult(int exitCode, String stdout, String stderr, boolean cancelled) {
    }

    public ProcessExecutionEngine(CronRunnerProperties props,
                                  JobStore jobStore,
                                  RunLedger ledger,
                                  JobScheduler scheduler,
                                  ProcessRegistry registry,
                                  ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Optional<JobRun> execute(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        log.info("Starting execution of job {}", jobId);

        Optional<Job> found = jobStore.findById(jobId);
        if (found.isEmpty()) {
            log.error("Job {} not found", jobId);
            return Optional.empty();
        }
        Job job = found.get();

        Instant startedAt = nowInstant();
        JobRun run = ledger.create(JobRun.started(jobId, startedAt));
        log.info("Created job run record id={} job={}", run.id(), jobId);

        JobRun terminal;
        boolean interrupted = false;
        try {
            ScriptResult result = runScript(job, run);
            if (result.exitCode() == 0) {
                terminal = run.complete(RunStatus.SUCCESS, nowInstant(), result.stdout(), null);
                log.info("Job {} completed successfully run={}", jobId, run.id());
            } else {
                NonZeroExitException failure = new NonZeroExitException(result.exitCode(), result.stderr());
                String message = result.cancelled() ? "Terminated by request: " + failure.getMessage() : failure.getMessage();
                terminal = run.complete(RunStatus.FAILED, nowInstant(), result.stdout(), message);
                log.error("Job {} failed run={} exitCode={}: {}", jobId, run.id(), result.exitCode(), failure.getMessage());
            }
        } catch (InterruptedException e) {
            interrupted = true;
            terminal = run.complete(RunStatus.FAILED, nowInstant(), null, "Execution interrupted");
            log.warn("Job {} interrupted run={}", jobId, run.id());
        } catch (Exception e) {
            terminal = run.complete(RunStatus.FAILED, nowInstant(), null, messageOf(e));
            log.error("Job {} failed with exception run={} msg={}", jobId, run.id(), e.getMessage(), e);
        }

        // Stores may refuse I/O on an interrupted thread; restore the flag after the row is terminal.
        complete(terminal);
        refreshJob(job, startedAt);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return Optional.of(terminal);
    }

    /**
     * Utility: current engine time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private ScriptResult runScript(Job job, JobRun run) throws InterruptedException {
        String scriptPath = job.scriptPath();
        if (scriptPath == null || scriptPath.isBlank() || !Files.exists(Path.of(scriptPath))) {
            throw new ScriptNotFoundException(scriptPath);
        }

        ProcessBuilder pb = new ProcessBuilder(buildCommand(scriptPath));
        pb.environment().putAll(buildEnvironment(job));

        Path stdoutFile;
        Path stderrFile;
        try {
            stdoutFile = Files.createTempFile("cronrunner-" + run.id() + "-", ".out");
            stderrFile = Files.createTempFile("cronrunner-" + run.id() + "-", ".err");
        } catch (IOException e) {
            throw new SpawnFailureException("Failed to create output capture files: " + e.getMessage(), e);
        }
        pb.redirectOutput(stdoutFile.toFile());
        pb.redirectError(stderrFile.toFile());

        try {
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new SpawnFailureException("Failed to start " + scriptPath + ": " + e.getMessage(), e);
            }

            ProcessRegistry.RunningProcess running = registry.register(run.id(), job.id(), process);
            log.debug("Spawned pid={} job={} run={} command={}", process.pid(), job.id(), run.id(), pb.command());
            try {
                Duration timeout = props.getExecutionTimeout();
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Job {} exceeded timeout {}; terminating pid={}", job.id(), timeout, process.pid());
                    try {
                        ProcessSignals.terminate(process.toHandle(), props.getTerminationGracePeriod());
                    } catch (IllegalStateException e) {
                        log.warn("Could not terminate timed out pid={} msg={}", process.pid(), e.getMessage());
                    }
                    throw new ExecutionTimeoutException(timeout);
                }
                return new ScriptResult(process.exitValue(), read(stdoutFile), read(stderrFile), running.isCancelled());
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting on pid={} job={}; killing process tree", process.pid(), job.id());
                ProcessSignals.kill(process.toHandle());
                throw e;
            } finally {
                registry.unregister(run.id());
            }
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private List<String> buildCommand(String scriptPath) {
        List<String> command = new ArrayList<>();
        String interpreter = props.getInterpreter();
        if (interpreter != null && !interpreter.isBlank()) {
            command.addAll(Arrays.asList(interpreter.trim().split("\\s+")));
        }
        command.add(scriptPath);
        return command;
    }

    Map<String, String> buildEnvironment(Job job) {
        String config;
        try {
            config = objectMapper.writeValueAsString(job.config());
        } catch (JsonProcessingException e) {
            throw new SpawnFailureException("Failed to serialize config of job " + job.id() + ": " + e.getOriginalMessage(), e);
        }

        Map<String, String> env = new LinkedHashMap<>();
        env.put(JobEnvironment.JOB_CONFIG, config);
        env.put(JobEnvironment.JOB_ID, job.id());
        env.put(JobEnvironment.JOB_NAME, job.name() == null ? "" : job.name());
        return env;
    }

    private void complete(JobRun terminal) {
        try {
            if (ledger.update(terminal)) {
                log.info("Final update completed for job run {} with status: {}", terminal.id(), terminal.status());
            } else {
                log.warn("Job run {} was already completed (terminated?); keeping stored status over {}",
                        terminal.id(), terminal.status());
            }
        } catch (Exception e) {
            log.error("Failed to persist completion of job run {} msg={}", terminal.id(), e.getMessage(), e);
        }
    }

    private void refreshJob(Job job, Instant startedAt) {
        try {
            jobStore.updateLastRunAt(job.id(), startedAt);

            Optional<Job> current = jobStore.findById(job.id());
            if (current.isEmpty() || !current.get().enabled()) {
                return;
            }

            Optional<Instant> next = scheduler.findEntry(EntryKind.recurringId(job.id()))
                    .map(SchedulerEntry::nextFireTime);
            if (next.isPresent()) {
                jobStore.updateNextRunAt(job.id(), next.get());
            } else {
                log.warn("No scheduler entry for job {}; next_run_at left unchanged", job.id());
            }
        } catch (Exception e) {
            log.warn("Failed to update run timestamps of job {} msg={}", job.id(), e.getMessage(), e);
        }
    }

    private static String read(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpawnFailureException("Failed to read captured output: " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete capture file {} msg={}", file, e.getMessage());
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
