package io.cronrunner.utils;

import io.cronrunner.core.ScheduleParseException;
import org.quartz.CronExpression;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * A parsed cron expression, produced by {@link CronSupport#parse(String)}.
 */
public final class CronSchedule {

    private final String expression;
    private final List<CronExpression> quartzExpressions;

    CronSchedule(String expression, List<CronExpression> quartzExpressions) {
        this.expression = expression;
        this.quartzExpressions = List.copyOf(quartzExpressions);
    }

    public String expression() {
        return expression;
    }

    /**
     * Next fire time strictly after {@code from}, in UTC.
     */
    public synchronized Instant nextAfter(Instant from) {
        Objects.requireNonNull(from, "from must not be null");

        Date next = null;
        for (CronExpression exp : quartzExpressions) {
            Date candidate = exp.getNextValidTimeAfter(Date.from(from));
            if (candidate != null && (next == null || candidate.before(next))) {
                next = candidate;
            }
        }
        if (next == null) {
            throw new ScheduleParseException(expression, "produced no next execution time");
        }
        return next.toInstant();
    }

    /**
     * Human-readable trigger description, e.g. {@code cron[0 3 * * 1-5] UTC}.
     */
    public String describe() {
        return "cron[" + expression + "] UTC";
    }

    @Override
    public String toString() {
        return describe();
    }
}
