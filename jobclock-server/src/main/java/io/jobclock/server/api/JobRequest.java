package io.jobclock.server.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.jobclock.core.JobDefinition;
import io.jobclock.core.JobStatus;
import io.jobclock.core.Schedule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * Body of {@code POST /jobs} and {@code PUT /jobs/{id}}. Exactly one of {@code interval_seconds} and
 * {@code cron_expression} must be given.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRequest(
        @NotBlank String name,
        @Positive @Max(Schedule.MAX_INTERVAL_SECONDS) Long intervalSeconds,
        String cronExpression,
        @NotBlank String functionName,
        Map<String, Object> jobMetadata,
        JobStatus status
) {

    public JobDefinition toDefinition() {
        if ((intervalSeconds == null) == (cronExpression == null)) {
            throw new IllegalArgumentException("Exactly one of interval_seconds or cron_expression must be provided");
        }
        return new JobDefinition(name, new Schedule(intervalSeconds, cronExpression), functionName, jobMetadata, status);
    }
}
