package io.jobclock;

import io.jobclock.core.Job;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the in-memory timers of active jobs and fires them on a background clock.
 *
 * <p>The timer set is derived state: {@link #start()} rebuilds it from the job store, and it is never persisted.
 * At most one timer exists per job id.
 */
public interface JobScheduler {
    /**
     * Start the clock and install a timer for every active job in the store. Idempotent.
     */
    void start();

    /**
     * Cancel all timers and stop the clock. Idempotent; a stopped scheduler may be started again.
     */
    void stop();

    boolean isRunning();

    /**
     * Arm a timer for {@code job}, replacing any existing one for the same id.
     *
     * @return false if the job was skipped (not running, not active, no valid trigger, or unknown function)
     */
    boolean install(Job job);

    /**
     * Cancel the timer for {@code jobId}. Removing a timer that does not exist is a no-op.
     *
     * @return true if a timer was removed
     */
    boolean remove(String jobId);

    /**
     * Atomically remove the current timer and install a new one from {@code job}. If the install is skipped, the
     * old timer is still removed.
     */
    boolean reinstall(Job job);

    boolean isScheduled(String jobId);

    Set<String> scheduledJobIds();

    Optional<Instant> nextFireTime(String jobId);
}
