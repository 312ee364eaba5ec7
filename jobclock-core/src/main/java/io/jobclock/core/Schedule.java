package io.jobclock.core;

/**
 * Recurrence rule of a job: either a fixed interval in whole seconds or a five-field cron expression.
 *
 * <p>Exactly one of the two fields is set. The cron text itself is not validated here; an expression that
 * cannot be parsed makes the job unschedulable rather than invalid.
 */
public record Schedule(Long intervalSeconds, String cronExpression) {

    /**
     * Largest accepted interval: 100 years of 365.25 days.
     */
    public static final long MAX_INTERVAL_SECONDS = 3_155_760_000L;

    public Schedule {
        boolean hasInterval = intervalSeconds != null;
        boolean hasCron = cronExpression != null;
        if (hasInterval == hasCron) {
            throw new IllegalArgumentException("Exactly one of intervalSeconds or cronExpression must be set");
        }
        if (hasInterval && (intervalSeconds <= 0 || intervalSeconds > MAX_INTERVAL_SECONDS)) {
            throw new IllegalArgumentException(
                    "intervalSeconds must be between 1 and " + MAX_INTERVAL_SECONDS + ": " + intervalSeconds);
        }
        if (hasCron && cronExpression.isBlank()) {
            throw new IllegalArgumentException("cronExpression must not be blank");
        }
    }

    public static Schedule every(long seconds) {
        return new Schedule(seconds, null);
    }

    public static Schedule cron(String expression) {
        return new Schedule(null, expression);
    }

    public boolean isInterval() {
        return intervalSeconds != null;
    }

    public String describe() {
        return isInterval() ? "interval=" + intervalSeconds + "s" : "cron='" + cronExpression + "'";
    }
}
