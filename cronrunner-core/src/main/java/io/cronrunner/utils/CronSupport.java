package io.cronrunner.utils;

import io.cronrunner.core.ScheduleParseException;
import org.quartz.CronExpression;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Parses 5-field cron expressions ({@code minute hour day-of-month month day-of-week}) into
 * Quartz {@link CronExpression}s evaluated in UTC.
 * <p>
 * Supported syntax per field: {@code *}, numbers, ranges, lists and {@code /} steps. Month names
 * (JAN-DEC) and weekday names (SUN-SAT) are accepted. Weekday 0 and 7 are both Sunday.
 * <p>
 * Note: Quartz needs one of the two day fields to be {@code ?}. When both are restricted, classic
 * cron fires if <em>either</em> matches, so the expression is split into two Quartz expressions and
 * the earlier next fire time wins.
 */
public final class CronSupport {

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6
    );

    private CronSupport() {
    }

    /**
     * Parse a 5-field cron expression.
     *
     * @throws ScheduleParseException if the expression is not a valid 5-field cron
     */
    public static CronSchedule parse(String expression) {
        if (expression == null) {
            throw new ScheduleParseException(null, "expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new ScheduleParseException(expression, "expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 5) {
            throw new ScheduleParseException(expression, "expected 5 fields but found " + parts.length);
        }

        String minute = parts[0];
        String hour = parts[1];
        String dayOfMonth = parts[2];
        String month = parts[3];
        String dayOfWeek = parts[4].toUpperCase(Locale.ROOT);

        requireCharset(expression, "minute", minute, "[0-9*,/\\-]+");
        requireCharset(expression, "hour", hour, "[0-9*,/\\-]+");
        requireCharset(expression, "day-of-month", dayOfMonth, "[0-9*,/\\-]+");
        requireCharset(expression, "month", month, "[0-9A-Za-z*,/\\-]+");

        TreeSet<Integer> weekdays = expandDayOfWeek(expression, dayOfWeek);
        boolean allWeekdays = weekdays.size() == 7;
        boolean allMonthDays = "*".equals(dayOfMonth);

        List<String> quartz = new ArrayList<>(2);
        if (allWeekdays) {
            boolean either = !dayOfMonth.startsWith("*") && !dayOfWeek.startsWith("*");
            quartz.add(toQuartz(minute, hour, either ? "*" : dayOfMonth, month, "?"));
        } else if (allMonthDays) {
            quartz.add(toQuartz(minute, hour, "?", month, toQuartzWeekdays(weekdays)));
        } else if (dayOfMonth.startsWith("*") || dayOfWeek.startsWith("*")) {
            // Stepped '*' in one day field means AND with the other; Quartz cannot express that.
            throw new ScheduleParseException(expression, "stepped day-of-month combined with day-of-week is not supported");
        } else {
            quartz.add(toQuartz(minute, hour, dayOfMonth, month, "?"));
            quartz.add(toQuartz(minute, hour, "?", month, toQuartzWeekdays(weekdays)));
        }

        List<CronExpression> expressions = new ArrayList<>(quartz.size());
        for (String q : quartz) {
            if (!CronExpression.isValidExpression(q)) {
                throw new ScheduleParseException(expression, "rejected by cron parser as '" + q + "'");
            }
            try {
                CronExpression exp = new CronExpression(q);
                exp.setTimeZone(java.util.TimeZone.getTimeZone("UTC"));
                expressions.add(exp);
            } catch (Exception ex) {
                throw new ScheduleParseException(expression, ex.getMessage());
            }
        }
        return new CronSchedule(s, expressions);
    }

    /**
     * Convenience: next UTC fire time strictly after {@code from}.
     */
    public static Instant nextFireTime(String expression, Instant from) {
        return parse(expression).nextAfter(from);
    }

    /**
     * Returns true if the string is a valid 5-field cron expression.
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ScheduleParseException ignored) {
            return false;
        }
    }

    /* ================= helper ================= */

    private static String toQuartz(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
        return String.join(" ", "0", minute, hour, dayOfMonth, month, dayOfWeek);
    }

    private static void requireCharset(String expression, String field, String value, String pattern) {
        if (!value.matches(pattern)) {
            throw new ScheduleParseException(expression, "unsupported characters in " + field + " field: " + value);
        }
    }

    // Quartz numbers weekdays 1 (SUN) .. 7 (SAT).
    private static String toQuartzWeekdays(TreeSet<Integer> weekdays) {
        List<String> values = new ArrayList<>(weekdays.size());
        for (int d : weekdays) {
            values.add(Integer.toString(d + 1));
        }
        return String.join(",", values);
    }

    /**
     * Expand a day-of-week field into the set of days it matches, 0 (SUN) .. 6 (SAT).
     */
    static TreeSet<Integer> expandDayOfWeek(String expression, String field) {
        TreeSet<Integer> days = new TreeSet<>();
        for (String item : field.split(",", -1)) {
            if (item.isEmpty()) {
                throw new ScheduleParseException(expression, "empty item in day-of-week field");
            }

            String base = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = parseNumber(expression, item.substring(slash + 1), "day-of-week step");
                if (step <= 0) {
                    throw new ScheduleParseException(expression, "day-of-week step must be positive");
                }
            }

            int from;
            int to;
            if ("*".equals(base)) {
                from = 0;
                to = 6;
            } else if (base.contains("-")) {
                String[] range = base.split("-", -1);
                if (range.length != 2) {
                    throw new ScheduleParseException(expression, "invalid day-of-week range: " + base);
                }
                from = parseDay(expression, range[0]);
                to = parseDay(expression, range[1]);
                if (from > to) {
                    throw new ScheduleParseException(expression, "day-of-week range is reversed: " + base);
                }
            } else {
                from = parseDay(expression, base);
                to = (slash >= 0) ? 6 : from;
            }

            for (int d = from; d <= to; d += step) {
                days.add(d % 7);
            }
        }
        return days;
    }

    private static int parseDay(String expression, String token) {
        Integer named = DAY_NAMES.get(token);
        if (named != null) {
            return named;
        }
        int d = parseNumber(expression, token, "day-of-week");
        if (d < 0 || d > 7) {
            throw new ScheduleParseException(expression, "day-of-week out of range: " + token);
        }
        return d;
    }

    private static int parseNumber(String expression, String token, String what) {
        if (!token.matches("^\\d{1,2}$")) {
            throw new ScheduleParseException(expression, "invalid " + what + " value: " + token);
        }
        return Integer.parseInt(token);
    }
}
