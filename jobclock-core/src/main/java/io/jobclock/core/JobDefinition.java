package io.jobclock.core;

import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied fields used to create or fully replace a job.
 *
 * @param status initial status; null means {@link JobStatus#ACTIVE}
 */
public record JobDefinition(
        String name,
        Schedule schedule,
        String functionName,
        Map<String, Object> metadata,
        JobStatus status
) {

    public JobDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(functionName, "functionName must not be null");
        if (functionName.isBlank()) {
            throw new IllegalArgumentException("functionName must not be blank");
        }
    }

    public JobDefinition(String name, Schedule schedule, String functionName, Map<String, Object> metadata) {
        this(name, schedule, functionName, metadata, null);
    }
}
