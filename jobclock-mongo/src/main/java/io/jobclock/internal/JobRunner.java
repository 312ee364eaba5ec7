package io.jobclock.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobclock.JobHandler;
import io.jobclock.JobStore;
import io.jobclock.core.Job;
import io.jobclock.core.JobHandlerRegistry;
import io.jobclock.core.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes one firing of a job and writes the run bookkeeping back to the store.
 *
 * <p>Never throws, apart from {@link VirtualMachineError}: handler errors of any kind mark the job {@code FAILED},
 * and a failure to write that status is logged and dropped so the calling worker thread stays available for
 * other jobs.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JobRunner(JobStore jobStore, JobHandlerRegistry jobRegistry, ObjectMapper objectMapper, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RunResult run(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");

        Job job;
        try {
            Optional<Job> loaded = jobStore.findById(jobId);
            if (loaded.isEmpty()) {
                log.info("Job {} not found in store; it was probably deleted while firing", jobId);
                return RunResult.missing();
            }
            job = loaded.get();
        } catch (RuntimeException e) {
            return fail(jobId, null, e);
        }

        Optional<JobHandler<?>> handler = jobRegistry.lookup(job.functionName());
        if (handler.isEmpty()) {
            log.error("Job {} has unknown function '{}'; skipping run", jobId, job.functionName());
            return new RunResult(RunOutcome.HANDLER_MISSING, job);
        }

        Instant startedAt = clock.instant();
        if (job.status() != JobStatus.ACTIVE || (job.nextRunAt() != null && job.nextRunAt().isAfter(startedAt))) {
            log.debug("Job {} not due (status={}, nextRunAt={}); skipping run", jobId, job.status(), job.nextRunAt());
            return new RunResult(RunOutcome.SKIPPED, job);
        }

        log.debug("Job {} started function={} at={}", jobId, job.functionName(), startedAt);
        try {
            executeHandler(handler.get(), jobId, job.metadata());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(jobId, job, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return fail(jobId, job, e);
        }

        Instant finishedAt = clock.instant();
        Optional<Job> updated;
        try {
            updated = jobStore.update(jobId, current -> current.recordRun(finishedAt));
        } catch (RuntimeException e) {
            return fail(jobId, job, e);
        }

        if (updated.isEmpty()) {
            log.info("Job {} was deleted while running; run at {} not recorded", jobId, finishedAt);
            return RunResult.missing();
        }

        log.debug("Job {} succeeded at={} nextRunAt={}", jobId, finishedAt, updated.get().nextRunAt());
        return new RunResult(RunOutcome.SUCCEEDED, updated.get());
    }

    private RunResult fail(String jobId, Job job, Throwable cause) {
        Instant failedAt = clock.instant();
        log.error("Job {} FAILED at={} msg={}", jobId, failedAt, cause.getMessage(), cause);

        Job failed = job == null ? null : job.markFailed();
        try {
            Optional<Job> marked = jobStore.update(jobId, Job::markFailed);
            if (marked.isPresent()) {
                failed = marked.get();
                log.info("Job {} marked as FAILED", jobId);
            } else {
                log.info("Job {} no longer exists; FAILED status not recorded", jobId);
            }
        } catch (RuntimeException storeEx) {
            log.error("Failed to mark job {} as FAILED msg={}", jobId, storeEx.getMessage(), storeEx);
        }
        return new RunResult(RunOutcome.FAILED, failed);
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(JobHandler<?> handler, String jobId, Map<String, Object> metadata) throws Exception {
        var h = (JobHandler<T>) handler;
        T data = objectMapper.convertValue(metadata, h.dataClass());
        h.execute(jobId, data);
    }
}
