package io.jobclock.server.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.jobclock.core.JobPatch;
import io.jobclock.core.JobStatus;
import io.jobclock.core.Schedule;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * Body of {@code PATCH /jobs/{id}}. Absent fields are left unchanged.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobPatchRequest(
        String name,
        @Positive @Max(Schedule.MAX_INTERVAL_SECONDS) Long intervalSeconds,
        String cronExpression,
        String functionName,
        Map<String, Object> jobMetadata,
        JobStatus status
) {

    public JobPatch toPatch() {
        if (intervalSeconds != null && cronExpression != null) {
            throw new IllegalArgumentException("Only one of interval_seconds or cron_expression may be provided");
        }
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (functionName != null && functionName.isBlank()) {
            throw new IllegalArgumentException("function_name must not be blank");
        }
        Schedule schedule = intervalSeconds != null || cronExpression != null
                ? new Schedule(intervalSeconds, cronExpression)
                : null;
        return new JobPatch(name, schedule, functionName, jobMetadata, status);
    }
}
