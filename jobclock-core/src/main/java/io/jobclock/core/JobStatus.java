package io.jobclock.core;

/**
 * Lifecycle state of a job.
 *
 * <p>Only {@link #ACTIVE} jobs own a live timer. {@link #FAILED} is entered automatically when a run fails and
 * is left only by an explicit reactivation.
 */
public enum JobStatus {
    ACTIVE {
        @Override
        public boolean shouldSchedule() {
            return true;
        }
    },
    PAUSED {
        @Override
        public boolean shouldSchedule() {
            return false;
        }
    },
    FAILED {
        @Override
        public boolean shouldSchedule() {
            return false;
        }
    };

    public abstract boolean shouldSchedule();
}
