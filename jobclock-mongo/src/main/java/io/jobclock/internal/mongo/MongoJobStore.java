package io.jobclock.internal.mongo;

import io.jobclock.JobStore;
import io.jobclock.core.Job;
import io.jobclock.core.JobStatus;
import io.jobclock.core.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Per-record atomicity uses optimistic locking: every write carries the version that was read, and a write
 * that loses the race is retried from a fresh read (at most {@code updateAttempts} times).
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final int updateAttempts;

    public MongoJobStore(MongoTemplate mongoTemplate, int updateAttempts) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        if (updateAttempts <= 0) {
            throw new IllegalArgumentException("updateAttempts must be a positive number");
        }
        this.updateAttempts = updateAttempts;
    }

    @Override
    public Optional<Job> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(MongoJobStore::toJob);
    }

    @Override
    public List<Job> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt")));
        return toJobs(mongoTemplate.find(q, JobDocument.class));
    }

    @Override
    public List<Job> findAllActive() {
        Query q = new Query(Criteria.where("status").is(JobStatus.ACTIVE))
                .with(Sort.by(Sort.Order.asc("nextRunAt")));
        return toJobs(mongoTemplate.find(q, JobDocument.class));
    }

    /**
     * Upsert by id. An existing document is overwritten under its current version.
     */
    @Override
    public Job save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        return writeWithRetry(job.id(), current -> job)
                .orElseGet(() -> toJob(mongoTemplate.insert(toDocument(job, null))));
    }

    @Override
    public Optional<Job> update(String id, UnaryOperator<Job> mutation) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mutation, "mutation must not be null");
        return writeWithRetry(id, mutation);
    }

    /**
     * Hard delete job by id.
     *
     * @return true if a document was removed
     */
    @Override
    public boolean deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, JobDocument.class).getDeletedCount() > 0;
    }

    @Override
    public long deleteAll() {
        return mongoTemplate.remove(new Query(), JobDocument.class).getDeletedCount();
    }

    // Empty when no document with this id exists.
    private Optional<Job> writeWithRetry(String id, UnaryOperator<Job> mutation) {
        OptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= updateAttempts; attempt++) {
            JobDocument current = mongoTemplate.findById(id, JobDocument.class);
            if (current == null) {
                return Optional.empty();
            }

            Job updated = Objects.requireNonNull(mutation.apply(toJob(current)), "mutation must not return null");
            if (!id.equals(updated.id())) {
                throw new IllegalArgumentException("mutation must not change the job id: " + id + " -> " + updated.id());
            }

            try {
                return Optional.of(toJob(mongoTemplate.save(toDocument(updated, current.getVersion()))));
            } catch (OptimisticLockingFailureException e) {
                lastConflict = e;
                log.debug("Concurrent update of job {} (attempt {}/{})", id, attempt, updateAttempts);
            }
        }
        throw lastConflict;
    }

    private static List<Job> toJobs(List<JobDocument> docs) {
        List<Job> jobs = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            jobs.add(toJob(d));
        }
        return jobs;
    }

    static JobDocument toDocument(Job job, Long version) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setIntervalSeconds(job.schedule().intervalSeconds());
        doc.setCronExpression(job.schedule().cronExpression());
        doc.setFunctionName(job.functionName());
        doc.setJobMetadata(new LinkedHashMap<>(job.metadata()));
        doc.setStatus(job.status());
        doc.setCreatedAt(job.createdAt());
        doc.setLastRunAt(job.lastRunAt());
        doc.setNextRunAt(job.nextRunAt());
        doc.setVersion(version);
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job, Long)}.
     */
    static Job toJob(JobDocument doc) {
        return new Job(
                doc.getId(),
                doc.getName(),
                new Schedule(doc.getIntervalSeconds(), doc.getCronExpression()),
                doc.getStatus(),
                doc.getCreatedAt(),
                doc.getLastRunAt(),
                doc.getNextRunAt(),
                doc.getFunctionName(),
                doc.getJobMetadata()
        );
    }
}
