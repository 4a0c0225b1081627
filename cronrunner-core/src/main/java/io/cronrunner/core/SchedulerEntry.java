package io.cronrunner.core;

import java.time.Instant;

/**
 * Snapshot of a live scheduler entry, as returned by {@code JobScheduler.listEntries()}.
 */
public record SchedulerEntry(
        String id,
        String jobId,
        String name,
        EntryKind kind,
        String trigger,
        Instant nextFireTime,
        ExecutionPolicy policy
) {
}
