package io.cronrunner.utils;

import io.cronrunner.core.ScheduleParseException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronSupportTest {

    @Test
    void everyFiveMinutesShouldFireOnNextMultipleOfFive() {
        Instant next = CronSupport.nextFireTime("*/5 * * * *", Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void nextFireTimeShouldBeStrictlyAfterFrom() {
        Instant next = CronSupport.nextFireTime("*/5 * * * *", Instant.parse("2026-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void hourAndMinuteFieldsShouldBeEvaluatedInUtc() {
        Instant next = CronSupport.nextFireTime("30 2 * * *", Instant.parse("2026-01-01T03:00:00Z"));
        assertEquals(Instant.parse("2026-01-02T02:30:00Z"), next);
    }

    @Test
    void weekdayOneShouldBeMonday() {
        // 2026-01-04 is a Sunday
        Instant next = CronSupport.nextFireTime("0 9 * * 1", Instant.parse("2026-01-04T12:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), next);
    }

    @Test
    void weekdayZeroAndSevenShouldBothBeSunday() {
        Instant from = Instant.parse("2026-01-01T00:00:00Z");
        assertEquals(Instant.parse("2026-01-04T00:00:00Z"), CronSupport.nextFireTime("0 0 * * 0", from));
        assertEquals(Instant.parse("2026-01-04T00:00:00Z"), CronSupport.nextFireTime("0 0 * * 7", from));
    }

    @Test
    void weekdayNamesShouldBeAccepted() {
        // Friday 10:00 -> next weekday 09:00 is Monday
        Instant next = CronSupport.nextFireTime("0 9 * * MON-FRI", Instant.parse("2026-01-02T10:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), next);
    }

    @Test
    void restrictedDayOfMonthAndWeekdayShouldFireWhenEitherMatches() {
        // the 13th or any Friday
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"),
                CronSupport.nextFireTime("0 0 13 * 5", Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals(Instant.parse("2026-01-13T00:00:00Z"),
                CronSupport.nextFireTime("0 0 13 * 5", Instant.parse("2026-01-10T00:00:00Z")));
    }

    @Test
    void describeShouldIncludeExpressionAndZone() {
        assertEquals("cron[*/5 * * * *] UTC", CronSupport.parse(" */5 * * * * ").describe());
    }

    @Test
    void invalidExpressionsShouldBeRejected() {
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("* * * *"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("0 * * * * *"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("61 * * * *"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("0 0 L * *"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("0 0 * * 8"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("0 0 * * 5-1"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse("not a cron"));
        assertThrows(ScheduleParseException.class, () -> CronSupport.parse(null));
    }

    @Test
    void isValidShouldRecognizeFiveFieldCron() {
        assertTrue(CronSupport.isValid("0 */2 1-15 JAN,JUL *"));
        assertFalse(CronSupport.isValid("0 */10 * * * *"));
    }
}
