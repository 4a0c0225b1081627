package io.cronrunner.core;

import java.time.Duration;

/**
 * Execution-policy flags attached to every scheduler entry.
 *
 * @param coalesce         a trigger late by several periods fires once, then re-arms from now
 * @param maxInstances     concurrent executions allowed per entry; {@link #UNBOUNDED} means no limit
 * @param misfireGraceTime how late a fire may be picked up before it is skipped; null means never
 *                         skipped (one-shot entries)
 */
public record ExecutionPolicy(
        boolean coalesce,
        int maxInstances,
        Duration misfireGraceTime
) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static ExecutionPolicy defaults(Duration misfireGraceTime) {
        return new ExecutionPolicy(true, UNBOUNDED, misfireGraceTime);
    }
}
