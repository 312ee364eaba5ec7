package io.jobclock.internal;

public enum RunOutcome {
    SUCCEEDED,
    FAILED,
    // not active, or its nextRunAt is still ahead (already ran for this slot)
    SKIPPED,
    // deleted between firing and loading
    JOB_MISSING,
    HANDLER_MISSING
}
