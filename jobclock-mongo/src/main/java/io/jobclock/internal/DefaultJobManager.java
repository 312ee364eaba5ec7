package io.jobclock.internal;

import io.jobclock.JobManager;
import io.jobclock.JobScheduler;
import io.jobclock.JobStore;
import io.jobclock.core.Job;
import io.jobclock.core.JobDefinition;
import io.jobclock.core.JobNotFoundException;
import io.jobclock.core.JobPatch;
import io.jobclock.core.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Default {@link JobManager}: persists each mutation through the {@link JobStore}, then brings the job's timer in
 * line with its status.
 *
 * <p>Calls for the same job id are serialized so a store write and the matching timer change are never
 * interleaved with another edit of that job.
 */
public class DefaultJobManager implements JobManager {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobManager.class);

    private static final int LOCK_STRIPES = 64;

    private final JobStore jobStore;
    private final JobScheduler scheduler;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public DefaultJobManager(JobStore jobStore, JobScheduler scheduler, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    @Override
    public Job create(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");

        Job job = Job.create(definition, clock.instant());
        synchronized (lockFor(job.id())) {
            Job saved = jobStore.save(job);
            log.info("Job {} created: {}", saved.id(), saved);
            applyStatus(saved);
            return saved;
        }
    }

    @Override
    public Optional<Job> find(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.findById(id);
    }

    @Override
    public Job get(String id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public List<Job> list() {
        return jobStore.findAll();
    }

    @Override
    public Job replace(String id, JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        return mutate(id, job -> job.replace(definition, clock.instant()));
    }

    @Override
    public Job patch(String id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        if (patch.isEmpty()) {
            return get(id);
        }
        return mutate(id, job -> job.patch(patch, clock.instant()));
    }

    @Override
    public Job pause(String id) {
        return mutate(id, job -> job.transitionTo(JobStatus.PAUSED, clock.instant()));
    }

    @Override
    public Job resume(String id) {
        return mutate(id, job -> job.transitionTo(JobStatus.ACTIVE, clock.instant()));
    }

    @Override
    public void delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        synchronized (lockFor(id)) {
            scheduler.remove(id);
            if (!jobStore.deleteById(id)) {
                throw new JobNotFoundException(id);
            }
            log.info("Job {} deleted", id);
        }
    }

    @Override
    public long deleteAll() {
        long deleted = 0;
        for (Job job : jobStore.findAll()) {
            synchronized (lockFor(job.id())) {
                scheduler.remove(job.id());
                if (jobStore.deleteById(job.id())) {
                    deleted++;
                }
            }
        }
        // rows created after the listing
        deleted += jobStore.deleteAll();
        log.info("Deleted {} jobs", deleted);
        return deleted;
    }

    private Job mutate(String id, UnaryOperator<Job> mutation) {
        Objects.requireNonNull(id, "id must not be null");
        synchronized (lockFor(id)) {
            Job updated = jobStore.update(id, mutation)
                    .orElseThrow(() -> new JobNotFoundException(id));
            log.info("Job {} updated: {}", id, updated);
            applyStatus(updated);
            return updated;
        }
    }

    private void applyStatus(Job job) {
        if (job.status().shouldSchedule()) {
            scheduler.reinstall(job);
        } else {
            scheduler.remove(job.id());
        }
    }

    private Object lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }
}
