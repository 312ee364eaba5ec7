package io.jobclock.core;

import java.util.Map;

/**
 * Partial update of a job. Null fields are left unchanged.
 */
public record JobPatch(
        String name,
        Schedule schedule,
        String functionName,
        Map<String, Object> metadata,
        JobStatus status
) {

    public static JobPatch status(JobStatus status) {
        return new JobPatch(null, null, null, null, status);
    }

    public static JobPatch schedule(Schedule schedule) {
        return new JobPatch(null, schedule, null, null, null);
    }

    public boolean isEmpty() {
        return name == null && schedule == null && functionName == null && metadata == null && status == null;
    }
}
