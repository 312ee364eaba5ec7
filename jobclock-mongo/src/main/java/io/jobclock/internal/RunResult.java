package io.jobclock.internal;

import io.jobclock.core.Job;
import io.jobclock.core.JobStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@link JobRunner#run(String)} call.
 *
 * @param job the job as last read or written by the runner; null when it was not found
 */
public record RunResult(RunOutcome outcome, Job job) {

    public RunResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static RunResult missing() {
        return new RunResult(RunOutcome.JOB_MISSING, null);
    }

    /**
     * Instant the next timer should be armed at. Only successful or skipped runs of jobs that are still active
     * re-arm.
     */
    public Optional<Instant> rearmAt() {
        boolean rearms = outcome == RunOutcome.SUCCEEDED || outcome == RunOutcome.SKIPPED;
        if (!rearms || job == null || job.status() != JobStatus.ACTIVE) {
            return Optional.empty();
        }
        return Optional.ofNullable(job.nextRunAt());
    }
}
