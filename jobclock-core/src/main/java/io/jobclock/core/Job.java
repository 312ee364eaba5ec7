package io.jobclock.core;

import io.jobclock.utils.TriggerCalculator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted unit of recurring work.
 *
 * <p>Instances are immutable; every lifecycle method returns a new copy. {@code nextRunAt} is always the
 * trigger computed from the current schedule: from the creation time when created, from the run time after a
 * run, and from the mutation time when the schedule changes or the job is reactivated.
 */
public record Job(

        // identity
        String id,
        String name,

        // scheduling
        Schedule schedule,
        JobStatus status,
        Instant createdAt,
        Instant lastRunAt,
        Instant nextRunAt,

        // target
        String functionName,
        Map<String, Object> metadata
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(functionName, "functionName must not be null");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * New job with a random id. {@code nextRunAt} is computed immediately, also for jobs created paused.
     */
    public static Job create(JobDefinition definition, Instant now) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(now, "now must not be null");

        return new Job(
                UUID.randomUUID().toString(),
                definition.name(),
                definition.schedule(),
                definition.status() != null ? definition.status() : JobStatus.ACTIVE,
                now,
                null,
                nextRun(definition.schedule(), now),
                definition.functionName(),
                definition.metadata()
        );
    }

    /**
     * Replaces every caller-controlled field. Identity, creation time and run history are kept.
     */
    public Job replace(JobDefinition definition, Instant now) {
        Objects.requireNonNull(definition, "definition must not be null");
        return new Job(
                id,
                definition.name(),
                definition.schedule(),
                definition.status() != null ? definition.status() : JobStatus.ACTIVE,
                createdAt,
                lastRunAt,
                nextRun(definition.schedule(), now),
                definition.functionName(),
                definition.metadata()
        );
    }

    public Job patch(JobPatch patch, Instant now) {
        Objects.requireNonNull(patch, "patch must not be null");

        Schedule newSchedule = patch.schedule() != null ? patch.schedule() : schedule;
        Job patched = new Job(
                id,
                patch.name() != null ? patch.name() : name,
                newSchedule,
                status,
                createdAt,
                lastRunAt,
                patch.schedule() != null ? nextRun(newSchedule, now) : nextRunAt,
                patch.functionName() != null ? patch.functionName() : functionName,
                patch.metadata() != null ? patch.metadata() : metadata
        );
        return patch.status() != null ? patched.transitionTo(patch.status(), now) : patched;
    }

    /**
     * Moves the job to {@code target}. Entering {@link JobStatus#ACTIVE} from another state reschedules from
     * {@code now}; leaving it keeps the precomputed {@code nextRunAt}.
     */
    public Job transitionTo(JobStatus target, Instant now) {
        Objects.requireNonNull(target, "target must not be null");
        if (target == status) {
            return this;
        }
        Instant next = target == JobStatus.ACTIVE ? nextRun(schedule, now) : nextRunAt;
        return new Job(id, name, schedule, target, createdAt, lastRunAt, next, functionName, metadata);
    }

    public Job recordRun(Instant ranAt) {
        Objects.requireNonNull(ranAt, "ranAt must not be null");
        return new Job(id, name, schedule, status, createdAt, ranAt, nextRun(schedule, ranAt), functionName, metadata);
    }

    public Job markFailed() {
        if (status == JobStatus.FAILED) {
            return this;
        }
        return new Job(id, name, schedule, JobStatus.FAILED, createdAt, lastRunAt, nextRunAt, functionName, metadata);
    }

    /**
     * Instant the trigger is measured from: the later of creation and last run.
     */
    public Instant referenceTime() {
        return TriggerCalculator.laterOf(createdAt, lastRunAt);
    }

    private static Instant nextRun(Schedule schedule, Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        return TriggerCalculator.computeNext(schedule, reference).orElse(null);
    }

    @Override
    public String toString() {
        return "Job{id=" + id
                + ", name='" + name + "'"
                + ", " + schedule.describe()
                + ", function='" + functionName + "'"
                + ", lastRunAt=" + lastRunAt
                + ", nextRunAt=" + nextRunAt
                + ", status=" + status
                + "}";
    }
}
