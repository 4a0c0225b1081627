package io.cronrunner.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One execution instance of a job, as recorded in the run ledger.
 *
 * <p>Created once in {@link RunStatus#RUNNING} and completed once with a terminal status.
 */
public record JobRun(
        String id,
        String jobId,
        RunStatus status,
        Instant startedAt,
        Instant completedAt,
        Long durationSeconds,
        String output,
        String errorMessage
) {

    public static JobRun started(String jobId, Instant startedAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        return new JobRun(null, jobId, RunStatus.RUNNING, startedAt, null, null, null, null);
    }

    public JobRun withId(String id) {
        return new JobRun(id, jobId, status, startedAt, completedAt, durationSeconds, output, errorMessage);
    }

    /**
     * Returns a terminal copy of this run. Duration is whole seconds between start and completion.
     */
    public JobRun complete(RunStatus status, Instant completedAt, String output, String errorMessage) {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal: " + status);
        }
        long duration = (startedAt == null) ? 0 : Math.max(0, Duration.between(startedAt, completedAt).toSeconds());
        return new JobRun(id, jobId, status, startedAt, completedAt, duration, output, errorMessage);
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    public boolean isCompleted() {
        return status != null && status.isTerminal();
    }
}
