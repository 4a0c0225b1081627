package io.cronrunner.internal;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live processes spawned by this instance, keyed by run id.
 *
 * <p>Filled by the execution engine between spawn and exit. The termination coordinator consults
 * it before falling back to scanning the OS process table.
 */
public class ProcessRegistry {

    private final ConcurrentHashMap<String, RunningProcess> byRunId = new ConcurrentHashMap<>();

    public RunningProcess register(String runId, String jobId, Process process) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(process, "process must not be null");
        RunningProcess running = new RunningProcess(runId, jobId, process, Instant.now());
        byRunId.put(runId, running);
        return running;
    }

    public void unregister(String runId) {
        if (runId != null) {
            byRunId.remove(runId);
        }
    }

    public Optional<RunningProcess> find(String runId) {
        return Optional.ofNullable(byRunId.get(runId));
    }

    /**
     * @param jobId null for all jobs
     */
    public List<RunningProcess> snapshot(String jobId) {
        return byRunId.values().stream()
                .filter(p -> jobId == null || jobId.equals(p.jobId()))
                .toList();
    }

    public int size() {
        return byRunId.size();
    }

    public static final class RunningProcess {
        private final String runId;
        private final String jobId;
        private final Process process;
        private final Instant startedAt;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private RunningProcess(String runId, String jobId, Process process, Instant startedAt) {
            this.runId = runId;
            this.jobId = jobId;
            this.process = process;
            this.startedAt = startedAt;
        }

        public String runId() {
            return runId;
        }

        public String jobId() {
            return jobId;
        }

        public Process process() {
            return process;
        }

        public long pid() {
            return process.pid();
        }

        public Instant startedAt() {
            return startedAt;
        }

        /**
         * @return true on the first call only
         */
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
