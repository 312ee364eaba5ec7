package io.jobclock.internal;

import io.jobclock.JobScheduler;
import io.jobclock.JobStore;
import io.jobclock.config.JobClockProperties;
import io.jobclock.core.Job;
import io.jobclock.core.JobHandlerRegistry;
import io.jobclock.utils.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process {@link JobScheduler} backed by a single timer thread and a worker pool.
 *
 * <p>Core behavior:
 * <ul>
 *   <li>One timer per job id; install/remove/reinstall are atomic per id</li>
 *   <li>The timer thread only dispatches; handlers run on {@code jobclock.worker} threads</li>
 *   <li>After each run the timer re-arms at the job's new {@code nextRunAt}, so a job never overlaps itself</li>
 *   <li>Failed, deleted or unresolvable jobs lose their timer</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();          // reconciles timers from the store
 * scheduler.reinstall(job);   // after every edit of an active job
 * scheduler.remove(job.id()); // after pause, failure or delete
 * scheduler.stop();
 * }</pre>
 */
public class TimerJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(TimerJobScheduler.class);

    private final JobClockProperties props;
    private final JobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final JobRunner jobRunner;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, ScheduledTimer> timers = new ConcurrentHashMap<>();
    // serializes runs of one job when a replacement timer fires while the previous run is still going
    private final ConcurrentHashMap<String, RunLock> runLocks = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService timerPool;
    private volatile ExecutorService workerPool;

    private static final class ScheduledTimer {
        private final String jobId;
        private final Instant fireAt;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private ScheduledTimer(String jobId, Instant fireAt) {
            this.jobId = jobId;
            this.fireAt = fireAt;
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                // never interrupt a run that already started
                f.cancel(false);
            }
        }
    }

    // entry lives while any worker holds or waits for it
    private static final class RunLock {
        private int holders;
    }

    public TimerJobScheduler(JobClockProperties props,
                             JobStore jobStore,
                             JobHandlerRegistry jobRegistry,
                             JobRunner jobRunner,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.jobRunner = Objects.requireNonNull(jobRunner, "jobRunner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the clock and rebuild timers from the store. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        if (props.getMaxConcurrency() <= 0) {
            started.set(false);
            throw new IllegalArgumentException("jobclock.maxConcurrency must be a positive number");
        }
        Duration shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(), "jobclock.shutdownTimeout must not be null");
        if (shutdownTimeout.isZero() || shutdownTimeout.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("jobclock.shutdownTimeout must be a positive duration");
        }

        log.info("JobClock starting with maxConcurrency={}, shutdownTimeout={}, reconcileOnStart={}",
                props.getMaxConcurrency(),
                props.getShutdownTimeout(),
                props.isReconcileOnStart());
        log.info("Loaded functions {}", jobRegistry.names());

        timerPool = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("jobclock.timer");
            t.setDaemon(true);
            return t;
        });
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("jobclock.worker");
            t.setDaemon(true);
            return t;
        });

        if (props.isReconcileOnStart()) {
            try {
                reconcile();
            } catch (RuntimeException e) {
                stop();
                throw new IllegalStateException("Failed to reconcile timers from job store", e);
            }
        }
        log.info("JobClock started successfully.");
    }

    /**
     * Cancel every timer and stop the clock. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("JobClock stopping...");

        timers.values().forEach(ScheduledTimer::cancel);
        timers.clear();

        if (timerPool != null) {
            timerPool.shutdownNow();
            timerPool = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        log.info("JobClock stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public boolean install(Job job) {
        return arm(job);
    }

    @Override
    public boolean remove(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        ScheduledTimer removed = timers.remove(jobId);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.info("Removed timer for job {}", jobId);
        return true;
    }

    @Override
    public boolean reinstall(Job job) {
        return arm(job);
    }

    @Override
    public boolean isScheduled(String jobId) {
        return jobId != null && timers.containsKey(jobId);
    }

    @Override
    public Set<String> scheduledJobIds() {
        return Set.copyOf(timers.keySet());
    }

    @Override
    public Optional<Instant> nextFireTime(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(timers.get(jobId)).map(t -> t.fireAt);
    }

    private void reconcile() {
        List<Job> active = jobStore.findAllActive();
        int installed = 0;
        for (Job job : active) {
            try {
                if (arm(job)) {
                    installed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to load job {} msg={}", job.id(), e.getMessage(), e);
            }
        }
        log.info("Reconciled {} of {} active jobs from store", installed, active.size());
    }

    /**
     * Replace the timer for {@code job.id()} with one armed from the job's current state. Validation happens
     * first; when it fails the previous timer is still dropped so an edit never leaves a stale schedule behind.
     */
    private boolean arm(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String jobId = job.id();

        if (!started.get()) {
            log.debug("JobClock not running; job {} will be scheduled on start", jobId);
            return false;
        }

        Instant fireAt = resolveFireTime(job);
        if (fireAt == null) {
            remove(jobId);
            return false;
        }

        ScheduledTimer armed = timers.compute(jobId, (id, existing) -> {
            if (existing != null) {
                log.info("Job {} already has a timer. Removing old timer before rescheduling.", id);
                existing.cancel();
            }
            return newTimer(id, fireAt);
        });
        if (armed == null) {
            return false;
        }
        log.info("Scheduled job {} ({}) with function '{}' at {}",
                jobId, job.schedule().isInterval() ? "interval" : "cron", job.functionName(), fireAt);
        return true;
    }

    private Instant resolveFireTime(Job job) {
        if (!job.status().shouldSchedule()) {
            log.debug("Job {} is {}; not scheduling", job.id(), job.status());
            return null;
        }

        Optional<Instant> trigger = TriggerCalculator.computeNext(job.schedule(), job.referenceTime());
        if (trigger.isEmpty()) {
            log.error("Job {} has no valid schedule ({}). Skipping.", job.id(), job.schedule().describe());
            return null;
        }

        if (!jobRegistry.contains(job.functionName())) {
            log.error("Job {} has unknown function '{}'. Skipping.", job.id(), job.functionName());
            return null;
        }

        return job.nextRunAt() != null ? job.nextRunAt() : trigger.get();
    }

    // Must be called inside timers.compute for the timer's id. Returns null once the clock is shut down.
    private ScheduledTimer newTimer(String jobId, Instant fireAt) {
        ScheduledExecutorService pool = timerPool;
        if (pool == null) {
            return null;
        }
        ScheduledTimer timer = new ScheduledTimer(jobId, fireAt);
        long delayMs = delayMillis(clock.instant(), fireAt);
        try {
            timer.future = pool.schedule(() -> fire(timer), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer pool rejected job {}; scheduler is stopping", jobId);
            return null;
        }
        return timer;
    }

    private void fire(ScheduledTimer timer) {
        if (timer.cancelled) {
            return;
        }
        ExecutorService pool = workerPool;
        if (pool == null) {
            return;
        }
        try {
            pool.execute(() -> execute(timer));
        } catch (RejectedExecutionException e) {
            log.debug("Worker pool rejected job {}; scheduler is stopping", timer.jobId);
        }
    }

    private void execute(ScheduledTimer timer) {
        if (timer.cancelled) {
            return;
        }

        RunResult result = new RunResult(RunOutcome.FAILED, null);
        RunLock lock = runLocks.compute(timer.jobId, (id, existing) -> {
            RunLock l = existing != null ? existing : new RunLock();
            l.holders++;
            return l;
        });
        try {
            synchronized (lock) {
                result = jobRunner.run(timer.jobId);
            }
        } catch (RuntimeException e) {
            log.error("Job runner failed unexpectedly for job {} msg={}", timer.jobId, e.getMessage(), e);
        } finally {
            runLocks.computeIfPresent(timer.jobId, (id, l) -> --l.holders == 0 ? null : l);
            settle(timer, result);
        }
    }

    // Re-arms or drops the timer after a run, unless it was replaced or removed in the meantime.
    private void settle(ScheduledTimer timer, RunResult result) {
        Optional<Instant> rearmAt = result.rearmAt();
        RunOutcome outcome = result.outcome();
        timers.computeIfPresent(timer.jobId, (id, current) -> {
            if (current != timer) {
                return current;
            }
            if (!started.get()) {
                return null;
            }
            if (rearmAt.isPresent()) {
                return newTimer(id, rearmAt.get());
            }
            log.info("Dropping timer for job {} after outcome {}", id, outcome);
            return null;
        });
    }

    /**
     * Milliseconds until {@code fireAt}, rounded up so a timer never fires before its instant. Saturates at
     * {@link Long#MAX_VALUE} for instants too far ahead to express.
     */
    static long delayMillis(Instant now, Instant fireAt) {
        if (!fireAt.isAfter(now)) {
            return 0L;
        }
        try {
            Duration delay = Duration.between(now, fireAt);
            long ms = delay.toMillis();
            return delay.getNano() % 1_000_000 == 0 ? ms : Math.addExact(ms, 1L);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
