package io.cronrunner.core;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted job definition. Owned by the CRUD boundary; the scheduler only reads it and maintains
 * {@code lastRunAt} / {@code nextRunAt}.
 *
 * <p>{@code nextRunAt} is non-null only while the job is enabled and has a live scheduler entry.
 */
public record Job(
        String id,
        String name,
        String description,
        String scriptPath,
        String cronExpression,
        boolean enabled,
        Map<String, Object> config,

        Instant createdAt,
        Instant updatedAt,
        Instant lastRunAt,
        Instant nextRunAt
) {

    public Job {
        config = (config == null) ? Map.of() : config;
    }

    public static Job of(String id, String name, String scriptPath, String cronExpression, boolean enabled) {
        Instant now = Instant.now();
        return new Job(id, name, null, scriptPath, cronExpression, enabled, Map.of(), now, now, null, null);
    }

    public Job withId(String id) {
        return new Job(id, name, description, scriptPath, cronExpression, enabled, config,
                createdAt, updatedAt, lastRunAt, nextRunAt);
    }

    public Job withEnabled(boolean enabled) {
        return new Job(id, name, description, scriptPath, cronExpression, enabled, config,
                createdAt, Instant.now(), lastRunAt, nextRunAt);
    }

    public Job withConfig(Map<String, Object> config) {
        return new Job(id, name, description, scriptPath, cronExpression, enabled, config,
                createdAt, Instant.now(), lastRunAt, nextRunAt);
    }

    public Job withNextRunAt(Instant nextRunAt) {
        return new Job(id, name, description, scriptPath, cronExpression, enabled, config,
                createdAt, updatedAt, lastRunAt, nextRunAt);
    }
}
