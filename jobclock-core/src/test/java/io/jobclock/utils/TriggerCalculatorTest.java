package io.jobclock.utils;

import io.jobclock.core.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerCalculatorTest {

    @Test
    void intervalShouldAddExactSeconds() {
        Instant reference = Instant.parse("2026-01-01T00:00:00.250Z");

        for (long n : new long[]{1, 5, 59, 3600, 86_400 * 30L}) {
            Optional<Instant> next = TriggerCalculator.computeNext(Schedule.every(n), reference);
            assertEquals(Optional.of(reference.plusSeconds(n)), next);
        }
    }

    @Test
    void cronShouldReturnNextOccurrence() {
        Optional<Instant> next = TriggerCalculator.computeNext(
                Schedule.cron("*/5 * * * *"),
                Instant.parse("2026-01-01T00:01:00Z")
        );

        assertEquals(Optional.of(Instant.parse("2026-01-01T00:05:00Z")), next);
    }

    @Test
    void cronOnBoundaryShouldReturnFollowingBoundary() {
        Instant boundary = Instant.parse("2026-01-01T00:05:00Z");

        Optional<Instant> next = TriggerCalculator.computeNext(Schedule.cron("*/5 * * * *"), boundary);

        assertEquals(Optional.of(Instant.parse("2026-01-01T00:10:00Z")), next);
    }

    @Test
    void cronResultShouldBeStrictlyAfterReference() {
        String[] expressions = {"* * * * *", "0 * * * *", "30 2 * * *", "0 0 1 * *", "15 10 * * MON-FRI"};
        Instant reference = Instant.parse("2026-03-14T10:15:00Z");

        for (String expression : expressions) {
            Instant next = TriggerCalculator.computeNext(Schedule.cron(expression), reference).orElseThrow();
            assertTrue(next.isAfter(reference), expression + " -> " + next);
        }
    }

    @Test
    void cronShouldEvaluateInUtc() {
        Optional<Instant> next = TriggerCalculator.computeNext(
                Schedule.cron("30 2 * * *"),
                Instant.parse("2026-01-01T03:00:00Z")
        );

        assertEquals(Optional.of(Instant.parse("2026-01-02T02:30:00Z")), next);
    }

    @Test
    void cronDayOfWeekShouldUseCrontabNumbering() {
        // 2026-01-01 is a Thursday
        Instant reference = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Optional.of(Instant.parse("2026-01-05T09:00:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("0 9 * * 1"), reference));
        assertEquals(Optional.of(Instant.parse("2026-01-04T09:00:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("0 9 * * 0"), reference));
        assertEquals(Optional.of(Instant.parse("2026-01-04T09:00:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("0 9 * * 7"), reference));
        assertEquals(Optional.of(Instant.parse("2026-01-03T09:00:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("0 9 * * sat"), reference));
    }

    @Test
    void cronWeekdayRangeShouldSkipWeekend() {
        // Friday after the 02:30 slot -> Monday
        Optional<Instant> next = TriggerCalculator.computeNext(
                Schedule.cron("30 2 * * MON-FRI"),
                Instant.parse("2026-01-02T03:00:00Z")
        );

        assertEquals(Optional.of(Instant.parse("2026-01-05T02:30:00Z")), next);
    }

    @Test
    void cronWithDayOfMonthAndDayOfWeekShouldRequireBoth() {
        // first Friday the 13th after 2026-01-01
        Optional<Instant> next = TriggerCalculator.computeNext(
                Schedule.cron("0 0 13 * 5"),
                Instant.parse("2026-01-01T00:00:00Z")
        );

        assertEquals(Optional.of(Instant.parse("2026-02-13T00:00:00Z")), next);
    }

    @Test
    void invalidCronShouldYieldEmpty() {
        Instant reference = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Optional.empty(), TriggerCalculator.computeNext(Schedule.cron("99 99 * * *"), reference));
        assertEquals(Optional.empty(), TriggerCalculator.computeNext(Schedule.cron("not a cron"), reference));
        assertEquals(Optional.empty(), TriggerCalculator.computeNext(Schedule.cron("* * *"), reference));
        assertEquals(Optional.empty(), TriggerCalculator.computeNext(Schedule.cron("0 */10 * * * *"), reference));
        assertEquals(Optional.empty(), TriggerCalculator.computeNext(Schedule.cron("0 9 * * 8"), reference));
        assertEquals(Optional.empty(), TriggerCalculator.computeNext(Schedule.cron("0 9 * * 5-1"), reference));
    }

    @Test
    void cronShouldAcceptCrontabSyntaxQuartzRejectsAsIs() {
        // day-of-month "1" in crontab becomes "1 * ?" for Quartz; "?" in day-of-month is accepted too
        Instant reference = Instant.parse("2026-01-15T00:00:00Z");

        assertEquals(Optional.of(Instant.parse("2026-02-01T00:00:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("0 0 1 * *"), reference));
        assertEquals(Optional.of(Instant.parse("2026-01-15T00:05:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("*/5 * ? * *"), reference));
        assertEquals(Optional.of(Instant.parse("2026-07-01T00:00:00Z")),
                TriggerCalculator.computeNext(Schedule.cron("0 0 1 JUL *"), reference));
    }

    @Test
    void cronShouldRejectZeroStepsAndQuartzExtensions() {
        assertFalse(TriggerCalculator.isValidCron("*/0 * * * *"));
        assertFalse(TriggerCalculator.isValidCron("0 */0 * * *"));
        assertFalse(TriggerCalculator.isValidCron("0 0 * * */0"));
        assertFalse(TriggerCalculator.isValidCron("0 0 L * *"));
        assertFalse(TriggerCalculator.isValidCron("0 0 15W * *"));
        assertFalse(TriggerCalculator.isValidCron("0 0 LW * *"));
        assertFalse(TriggerCalculator.isValidCron("0 0 * * 5#3"));
        assertFalse(TriggerCalculator.isValidCron("0 0 * * 5L"));
        assertFalse(TriggerCalculator.isValidCron("0 0 1, * *"));
        assertTrue(TriggerCalculator.isValidCron("0 0 * JUL *"));
        assertTrue(TriggerCalculator.isValidCron("0,30 8-17 1,15 1-6 *"));
    }

    @Test
    void largestIntervalShouldBeComputable() {
        Instant reference = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Optional.of(reference.plusSeconds(Schedule.MAX_INTERVAL_SECONDS)),
                TriggerCalculator.computeNext(Schedule.every(Schedule.MAX_INTERVAL_SECONDS), reference));
        assertEquals(Optional.empty(),
                TriggerCalculator.computeNext(Schedule.every(Schedule.MAX_INTERVAL_SECONDS), Instant.MAX));
    }

    @Test
    void oversizedIntervalShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Schedule.every(Schedule.MAX_INTERVAL_SECONDS + 1));
        assertThrows(IllegalArgumentException.class, () -> Schedule.every(Long.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> Schedule.every(0));
    }

    @Test
    void isValidCronShouldRecognizeFiveFieldExpressions() {
        assertTrue(TriggerCalculator.isValidCron("0 */2 * * *"));
        assertTrue(TriggerCalculator.isValidCron("15 14 1 * *"));
        assertFalse(TriggerCalculator.isValidCron("99 99 * * *"));
        assertFalse(TriggerCalculator.isValidCron(null));
    }

    @Test
    void laterOfShouldIgnoreNulls() {
        Instant a = Instant.parse("2026-01-01T00:05:00Z");
        Instant b = Instant.parse("2026-01-01T00:06:00Z");

        assertEquals(b, TriggerCalculator.laterOf(a, b));
        assertEquals(b, TriggerCalculator.laterOf(b, a));
        assertEquals(a, TriggerCalculator.laterOf(a, null));
        assertEquals(a, TriggerCalculator.laterOf(null, a));
    }
}
