package io.jobclock.utils;

import io.jobclock.core.Schedule;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Computes the next fire time of a {@link Schedule}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Fixed intervals in whole seconds: next = reference + interval</li>
 *   <li>Five-field crontab expressions ("minute hour day-of-month month day-of-week"), evaluated in UTC</li>
 * </ul>
 * <p>
 * Cron results are strictly after the reference instant. An expression that cannot be parsed yields
 * {@link Optional#empty()} instead of an exception: the caller treats the job as unschedulable.
 */
public final class TriggerCalculator {

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private static final Pattern NUMERIC_ITEM = Pattern.compile("(?:\\*|\\d+(?:-\\d+)?)(?:/(\\d+))?");
    private static final Pattern MONTH_ITEM =
            Pattern.compile("(?:\\*|(?:\\d+|[A-Za-z]{3})(?:-(?:\\d+|[A-Za-z]{3}))?)(?:/(\\d+))?");

    // candidate days inspected when day-of-month and day-of-week are both restricted
    private static final int MAX_DAY_CANDIDATES = 2_000;

    private TriggerCalculator() {
    }

    /**
     * Computes the next fire time after {@code reference}.
     *
     * @param schedule  interval or cron schedule
     * @param reference instant the trigger is measured from (creation, last run, or mutation time)
     * @return next fire time, or empty when the cron expression is invalid or has no future occurrence
     */
    public static Optional<Instant> computeNext(Schedule schedule, Instant reference) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        if (schedule.isInterval()) {
            try {
                return Optional.of(reference.plusSeconds(schedule.intervalSeconds()));
            } catch (DateTimeException | ArithmeticException e) {
                // past the end of the time line
                return Optional.empty();
            }
        }

        try {
            return CronRule.parse(schedule.cronExpression()).nextAfter(reference);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns true if {@code cron} is a five-field cron expression this calculator can evaluate.
     */
    public static boolean isValidCron(String cron) {
        try {
            CronRule.parse(cron);
            return true;
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    public static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    /* ================= helper ================= */

    private static final class CronRule {
        private final CronExpression expression;
        // crontab day numbers (0 = Sunday), or null when no separate weekday filter applies
        private final TreeSet<Integer> dayOfWeekFilter;

        private CronRule(CronExpression expression, TreeSet<Integer> dayOfWeekFilter) {
            this.expression = expression;
            this.dayOfWeekFilter = dayOfWeekFilter;
        }

        static CronRule parse(String cron) {
            if (cron == null) {
                throw new IllegalArgumentException("cron must not be null");
            }
            String s = cron.trim();
            if (s.isEmpty()) {
                throw new IllegalArgumentException("cron must not be empty");
            }

            String[] parts = s.split("\\s+");
            if (parts.length != 5) {
                throw new IllegalArgumentException("Expected 5 cron fields but got " + parts.length + ": " + cron);
            }

            String minute = checkField(parts[0], NUMERIC_ITEM, "minute");
            String hour = checkField(parts[1], NUMERIC_ITEM, "hour");
            String dayOfMonth = "?".equals(parts[2]) ? parts[2] : checkField(parts[2], NUMERIC_ITEM, "day-of-month");
            String month = checkField(parts[3], MONTH_ITEM, "month");

            TreeSet<Integer> days = parseDayOfWeek(parts[4]);
            boolean dayOfWeekRestricted = days.size() < 7;
            boolean dayOfMonthRestricted = !"*".equals(dayOfMonth) && !"?".equals(dayOfMonth);

            String quartz;
            TreeSet<Integer> filter = null;
            if (dayOfWeekRestricted && !dayOfMonthRestricted) {
                quartz = String.join(" ", "0", minute, hour, "?", month, toQuartzDays(days));
            } else {
                quartz = String.join(" ", "0", minute, hour, dayOfMonthRestricted ? dayOfMonth : "*", month, "?");
                if (dayOfWeekRestricted) {
                    filter = days;
                }
            }

            CronExpression exp;
            try {
                exp = new CronExpression(quartz);
            } catch (ParseException | RuntimeException ex) {
                throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
            }
            exp.setTimeZone(UTC);
            return new CronRule(exp, filter);
        }

        Optional<Instant> nextAfter(Instant reference) {
            Date next = expression.getNextValidTimeAfter(Date.from(reference));
            if (dayOfWeekFilter == null) {
                return Optional.ofNullable(next).map(Date::toInstant);
            }

            for (int i = 0; next != null && i < MAX_DAY_CANDIDATES; i++) {
                ZonedDateTime candidate = ZonedDateTime.ofInstant(next.toInstant(), ZoneOffset.UTC);
                if (dayOfWeekFilter.contains(candidate.getDayOfWeek().getValue() % 7)) {
                    return Optional.of(candidate.toInstant());
                }
                // skip the rest of the candidate's day
                ZonedDateTime lastSecondOfDay = candidate.toLocalDate().plusDays(1)
                        .atStartOfDay(ZoneOffset.UTC)
                        .minusSeconds(1);
                next = expression.getNextValidTimeAfter(Date.from(lastSecondOfDay.toInstant()));
            }
            return Optional.empty();
        }

        /**
         * Accepts plain crontab list items only, so Quartz extensions ({@code L}, {@code W}, {@code #}) and
         * zero steps are rejected before Quartz sees them.
         */
        private static String checkField(String field, Pattern item, String label) {
            for (String part : field.split(",", -1)) {
                Matcher m = item.matcher(part);
                if (!m.matches()) {
                    throw new IllegalArgumentException("Invalid " + label + " field: " + field);
                }
                if (m.group(1) != null) {
                    parseStep(m.group(1));
                }
            }
            return field;
        }

        private static String toQuartzDays(TreeSet<Integer> days) {
            return days.stream()
                    .map(d -> String.valueOf(d + 1))
                    .collect(Collectors.joining(","));
        }

        private static TreeSet<Integer> parseDayOfWeek(String field) {
            TreeSet<Integer> days = new TreeSet<>();
            for (String item : field.split(",", -1)) {
                if (item.isEmpty()) {
                    throw new IllegalArgumentException("Empty day-of-week list item: " + field);
                }

                String range = item;
                int step = 1;
                int slash = item.indexOf('/');
                if (slash >= 0) {
                    range = item.substring(0, slash);
                    step = parseStep(item.substring(slash + 1));
                }

                int lo;
                int hi;
                if ("*".equals(range) || "?".equals(range)) {
                    lo = 0;
                    hi = 6;
                } else if (range.contains("-")) {
                    String[] bounds = range.split("-", -1);
                    if (bounds.length != 2) {
                        throw new IllegalArgumentException("Invalid day-of-week range: " + item);
                    }
                    lo = parseDay(bounds[0]);
                    hi = parseDay(bounds[1]);
                    if (lo > hi) {
                        throw new IllegalArgumentException("Inverted day-of-week range: " + item);
                    }
                } else {
                    lo = parseDay(range);
                    hi = slash >= 0 ? 6 : lo;
                }

                for (int d = lo; d <= hi; d += step) {
                    days.add(d % 7);
                }
            }
            return days;
        }

        private static int parseStep(String s) {
            int step;
            try {
                step = Integer.parseInt(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid step: " + s);
            }
            if (step <= 0) {
                throw new IllegalArgumentException("Step must be positive: " + s);
            }
            return step;
        }

        private static int parseDay(String s) {
            String upper = s.toUpperCase(Locale.ROOT);
            for (int i = 0; i < DAY_NAMES.length; i++) {
                if (DAY_NAMES[i].equals(upper)) {
                    return i;
                }
            }
            int day;
            try {
                day = Integer.parseInt(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid day-of-week: " + s);
            }
            if (day < 0 || day > 7) {
                throw new IllegalArgumentException("Day-of-week must be between 0 and 7: " + s);
            }
            return day;
        }
    }
}
