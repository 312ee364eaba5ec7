package io.jobclock.server.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.jobclock.core.Job;
import io.jobclock.core.JobStatus;

import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
        String id,
        String name,
        Long intervalSeconds,
        String cronExpression,
        String functionName,
        Map<String, Object> jobMetadata,
        JobStatus status,
        Instant createdAt,
        Instant lastRunAt,
        Instant nextRunAt
) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.schedule().intervalSeconds(),
                job.schedule().cronExpression(),
                job.functionName(),
                job.metadata(),
                job.status(),
                job.createdAt(),
                job.lastRunAt(),
                job.nextRunAt()
        );
    }
}
