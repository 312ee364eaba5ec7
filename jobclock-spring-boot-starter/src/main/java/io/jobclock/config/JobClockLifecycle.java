package io.jobclock.config;

import io.jobclock.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Ties the timer clock to the Spring context. Timers are armed once every other bean is up and are cancelled
 * before the job store or handlers go away.
 *
 * <p>With {@code jobclock.auto-startup=false} the context leaves the clock stopped; call {@link #start()} (or
 * {@link JobScheduler#start()}) when the application is ready to run jobs.
 */
public class JobClockLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobClockLifecycle.class);

    /** Last to start, first to stop. */
    public static final int PHASE = Integer.MAX_VALUE;

    private final JobScheduler scheduler;
    private final boolean autoStartup;

    public JobClockLifecycle(JobScheduler scheduler, boolean autoStartup) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        if (scheduler.isRunning()) {
            return;
        }
        long began = System.nanoTime();
        scheduler.start();
        log.info("Job clock armed {} timers in {} ms",
                scheduler.scheduledJobIds().size(), (System.nanoTime() - began) / 1_000_000);
    }

    @Override
    public void stop() {
        if (!scheduler.isRunning()) {
            return;
        }
        int armed = scheduler.scheduledJobIds().size();
        scheduler.stop();
        log.info("Job clock stopped; {} timers cancelled", armed);
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
