package io.jobclock.internal;

import io.jobclock.JobStore;
import io.jobclock.core.Job;
import io.jobclock.core.JobStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Map-backed {@link JobStore} for engine tests. Reads and writes can be made to fail on demand.
 */
class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    volatile boolean failReads;
    volatile boolean failUpdates;

    @Override
    public Optional<Job> findById(String id) {
        if (failReads) {
            throw new IllegalStateException("simulated read failure");
        }
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<Job> findAll() {
        List<Job> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(Job::createdAt));
        return all;
    }

    @Override
    public List<Job> findAllActive() {
        List<Job> active = new ArrayList<>();
        for (Job job : findAll()) {
            if (job.status() == JobStatus.ACTIVE) {
                active.add(job);
            }
        }
        return active;
    }

    @Override
    public Job save(Job job) {
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public Optional<Job> update(String id, UnaryOperator<Job> mutation) {
        if (failUpdates) {
            throw new IllegalStateException("simulated write failure");
        }
        return Optional.ofNullable(jobs.computeIfPresent(id, (k, current) -> mutation.apply(current)));
    }

    @Override
    public boolean deleteById(String id) {
        return jobs.remove(id) != null;
    }

    @Override
    public long deleteAll() {
        long n = jobs.size();
        jobs.clear();
        return n;
    }
}
