package io.cronrunner.internal;

import io.cronrunner.ExecutionEngine;
import io.cronrunner.JobScheduler;
import io.cronrunner.JobStore;
import io.cronrunner.config.CronRunnerProperties;
import io.cronrunner.core.EntryKind;
import io.cronrunner.core.ExecutionPolicy;
import io.cronrunner.core.Job;
import io.cronrunner.core.ScheduleParseException;
import io.cronrunner.core.SchedulerEntry;
import io.cronrunner.utils.CronSchedule;
import io.cronrunner.utils.CronSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory cron scheduler that fires jobs into an {@link ExecutionEngine}.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One recurring entry per enabled job ({@code job_<id>}), re-armed from its cron schedule</li>
 *   <li>One-shot entries for manual runs ({@code manual_<id>_<timestamp>}), removed when fired</li>
 *   <li>A dispatcher thread that hands due entries to an unbounded worker pool</li>
 * </ul>
 *
 * <p>Entries live in a concurrent map; a {@link DelayQueue} orders their fire times. A queued fire
 * whose entry has since been removed or replaced is dropped when it comes due.
 *
 * <p>Replacing an entry is remove-then-add and not atomic: two concurrent {@link #schedule(Job)}
 * calls for the same job end up with whichever add ran last.
 */
public class InProcessJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(InProcessJobScheduler.class);

    private final CronRunnerProperties props;
    private final JobStore jobStore;
    private final Supplier<ExecutionEngine> engine;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final DelayQueue<FireToken> queue = new DelayQueue<>();
    private final AtomicInteger workerSeq = new AtomicInteger();

    private volatile ExecutorService workerPool;
    private volatile Thread dispatcherThread;

    private static final class Entry {
        private final String id;
        private final String jobId;
        private final String name;
        private final EntryKind kind;
        private final CronSchedule schedule;
        private final String trigger;
        private final ExecutionPolicy policy;
        private volatile Instant nextFireTime;

        private Entry(String id, String jobId, String name, EntryKind kind, CronSchedule schedule,
                      String trigger, ExecutionPolicy policy, Instant nextFireTime) {
            this.id = id;
            this.jobId = jobId;
            this.name = name;
            this.kind = kind;
            this.schedule = schedule;
            this.trigger = trigger;
            this.policy = policy;
            this.nextFireTime = nextFireTime;
        }

        private SchedulerEntry snapshot() {
            return new SchedulerEntry(id, jobId, name, kind, trigger, nextFireTime, policy);
        }
    }

    // Delay is measured against nowInstant(), so the queue and fire() share one clock.
    private final class FireToken implements Delayed {
        private final Entry entry;
        private final Instant fireAt;

        private FireToken(Entry entry, Instant fireAt) {
            this.entry = entry;
            this.fireAt = fireAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long nanos = Duration.between(nowInstant(), fireAt).toNanos();
            return unit.convert(nanos, TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof FireToken o) {
                return this.fireAt.compareTo(o.fireAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    /**
     * @param engine resolved on every fire; lets the engine itself depend on this scheduler
     */
    public InProcessJobScheduler(CronRunnerProperties props, JobStore jobStore, Supplier<ExecutionEngine> engine) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Start dispatching due entries. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration grace = Objects.requireNonNull(props.getMisfireGraceTime(), "cronrunner.misfireGraceTime must not be null");
        if (grace.isNegative()) {
            throw new IllegalArgumentException("cronrunner.misfireGraceTime must not be negative");
        }

        log.info("Scheduler starting with misfireGraceTime={}, executionTimeout={}, entries={}",
                grace, props.getExecutionTimeout(), entries.size());

        if (workerPool == null) {
            workerPool = newWorkerPool();
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("cronrunner.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("Scheduler started successfully.");
    }

    /**
     * Stop dispatching and wait for running executions up to the shutdown timeout. Entries are kept,
     * so a later {@link #start()} resumes them. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Executions still running after {}; interrupting workers", props.getShutdownTimeout());
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void schedule(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.id(), "job.id must not be null");
        String entryId = EntryKind.recurringId(job.id());

        try {
            if (findEntry(entryId).isPresent() && removeEntry(entryId)) {
                log.info("Removed existing schedule for job {}", job.id());
            }

            if (!job.enabled()) {
                log.info("Job {} is disabled, clearing next_run_at", job.id());
                jobStore.updateNextRunAt(job.id(), null);
                return;
            }

            CronSchedule cron = CronSupport.parse(job.cronExpression());
            Instant next = cron.nextAfter(nowInstant());

            Entry entry = new Entry(entryId, job.id(), job.name(), EntryKind.RECURRING, cron, cron.describe(),
                    ExecutionPolicy.defaults(props.getMisfireGraceTime()), next);
            entries.put(entryId, entry);
            queue.offer(new FireToken(entry, next));

            jobStore.updateNextRunAt(job.id(), next);
            log.info("Scheduled job {}: {} cron={} next run: {}", job.id(), job.name(), job.cronExpression(), next);
        } catch (ScheduleParseException e) {
            log.error("Failed to schedule job {}: {}", job.id(), e.getMessage());
            clearNextRunQuietly(job.id());
        } catch (Exception e) {
            log.error("Failed to schedule job {} enabled={} cron={} msg={}",
                    job.id(), job.enabled(), job.cronExpression(), e.getMessage(), e);
        }
    }

    @Override
    public boolean unschedule(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        String entryId = EntryKind.recurringId(jobId);
        if (findEntry(entryId).isEmpty()) {
            log.debug("Job {} is not scheduled", jobId);
            return false;
        }

        boolean removed = removeEntry(entryId);
        if (removed) {
            clearNextRunQuietly(jobId);
            log.info("Unscheduled job {}", jobId);
        }
        return removed;
    }

    @Override
    public boolean scheduleOnce(String jobId, String jobName) {
        try {
            Objects.requireNonNull(jobId, "jobId must not be null");

            Instant fireAt = nowInstant().truncatedTo(ChronoUnit.MICROS);
            Entry entry;
            // The fire timestamp keeps ids unique; bump it on the rare same-microsecond collision.
            while (true) {
                String entryId = EntryKind.ONE_SHOT.idPrefix() + jobId + "_" + toEpochMicros(fireAt);
                entry = new Entry(entryId, jobId, "Manual run: " + jobName, EntryKind.ONE_SHOT, null,
                        "date[" + fireAt + "]", ExecutionPolicy.defaults(null), fireAt);
                if (entries.putIfAbsent(entryId, entry) == null) {
                    break;
                }
                fireAt = fireAt.plus(1, ChronoUnit.MICROS);
            }

            queue.offer(new FireToken(entry, fireAt));
            log.info("Manually scheduled job {}: {} entry={}", jobId, jobName, entry.id);
            return true;
        } catch (Exception e) {
            log.error("Failed to manually schedule job {} msg={}", jobId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void loadAll() {
        log.info("Loading existing jobs...");

        int cleared = 0;
        for (Job job : jobStore.findByEnabled(false)) {
            try {
                if (findEntry(EntryKind.recurringId(job.id())).isPresent()) {
                    removeEntry(EntryKind.recurringId(job.id()));
                }
                if (job.nextRunAt() != null) {
                    log.info("Clearing next_run_at for disabled job {}: {}", job.id(), job.name());
                    jobStore.updateNextRunAt(job.id(), null);
                    cleared++;
                }
            } catch (Exception e) {
                log.error("Failed to clear next_run_at for disabled job {} msg={}", job.id(), e.getMessage(), e);
            }
        }
        if (cleared > 0) {
            log.info("Cleared next_run_at for {} disabled jobs", cleared);
        }

        List<Job> enabled = jobStore.findByEnabled(true);
        for (Job job : enabled) {
            try {
                log.info("Loading job {}: {}", job.id(), job.name());
                schedule(job);
            } catch (Exception e) {
                log.error("Failed to load job {} msg={}", job.id(), e.getMessage(), e);
            }
        }

        log.info("Loaded {} enabled jobs", enabled.size());
    }

    @Override
    public List<SchedulerEntry> listEntries() {
        return entries.values().stream()
                .map(Entry::snapshot)
                .sorted(Comparator.comparing(SchedulerEntry::nextFireTime,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public Optional<SchedulerEntry> findEntry(String entryId) {
        if (entryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(entryId)).map(Entry::snapshot);
    }

    @Override
    public boolean removeEntry(String entryId) {
        if (entryId == null) {
            return false;
        }
        Entry removed = entries.remove(entryId);
        if (removed == null) {
            return false;
        }
        queue.removeIf(t -> t.entry == removed);
        return true;
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /**
     * Pool that runs fired entries; created on every {@link #start()}.
     */
    protected ExecutorService newWorkerPool() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("cronrunner.worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                FireToken token = queue.take();
                if (!fire(token)) {
                    log.info("Worker pool is shutting down; dispatcher exiting");
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("scheduler dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    /**
     * @return false when the worker pool no longer accepts work; the fire is then kept queued
     */
    private boolean fire(FireToken token) {
        Entry entry = token.entry;
        if (entries.get(entry.id) != entry) {
            // removed or replaced since this fire was queued
            return true;
        }

        ExecutorService pool = workerPool;
        if (pool == null || pool.isShutdown() || !started.get()) {
            queue.offer(token);
            return false;
        }

        Instant now = nowInstant();
        if (entry.kind == EntryKind.ONE_SHOT) {
            if (!entries.remove(entry.id, entry)) {
                return true;
            }
        } else {
            // Re-arm from the tick itself: the queue may hand a token back a little early.
            Instant from = now.isAfter(token.fireAt) ? now : token.fireAt;
            Instant next = entry.schedule.nextAfter(from);
            entry.nextFireTime = next;
            queue.offer(new FireToken(entry, next));

            Duration lateness = Duration.between(token.fireAt, now);
            Duration grace = entry.policy.misfireGraceTime();
            if (grace != null && lateness.compareTo(grace) > 0) {
                log.warn("Run of job {} was missed by {}; skipping, next run: {}", entry.jobId, lateness, next);
                return true;
            }
        }

        log.debug("Firing entry={} job={} scheduledAt={}", entry.id, entry.jobId, token.fireAt);
        try {
            pool.execute(() -> runEntry(entry));
            return true;
        } catch (RejectedExecutionException e) {
            if (entry.kind == EntryKind.ONE_SHOT) {
                entries.putIfAbsent(entry.id, entry);
                queue.offer(token);
                log.warn("Worker pool rejected manual entry {}; kept for the next start", entry.id);
            } else {
                log.warn("Worker pool rejected run of job {} scheduled at {}", entry.jobId, token.fireAt);
            }
            return false;
        }
    }

    private void runEntry(Entry entry) {
        try {
            engine.get().execute(entry.jobId);
        } catch (Exception e) {
            log.error("Execution of job {} from entry {} failed msg={}", entry.jobId, entry.id, e.getMessage(), e);
        }
    }

    private void clearNextRunQuietly(String jobId) {
        try {
            jobStore.updateNextRunAt(jobId, null);
        } catch (Exception e) {
            log.warn("Failed to clear next_run_at for job {} msg={}", jobId, e.getMessage(), e);
        }
    }

    private static long toEpochMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }
}
