package io.jobclock;

import io.jobclock.core.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable system of record for jobs.
 *
 * <p>Every write touches exactly one record atomically; concurrent writers to the same record serialize.
 */
public interface JobStore {

    Optional<Job> findById(String id);

    List<Job> findAll();

    List<Job> findAllActive();

    /**
     * Insert or fully overwrite a job.
     */
    Job save(Job job);

    /**
     * Atomically read, transform and write back one job.
     *
     * @return the stored result, or empty if no job has this id
     */
    Optional<Job> update(String id, UnaryOperator<Job> mutation);

    boolean deleteById(String id);

    long deleteAll();
}
