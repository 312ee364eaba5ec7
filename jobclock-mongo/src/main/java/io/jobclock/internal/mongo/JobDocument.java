package io.jobclock.internal.mongo;

import io.jobclock.core.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = "jobs")
public class JobDocument {

    @Id
    private String id;

    private String name;

    @Field(name = "interval_seconds", write = Field.Write.ALWAYS)
    private Long intervalSeconds;

    @Field(name = "cron_expression", write = Field.Write.ALWAYS)
    private String cronExpression;

    @Field("function_name")
    private String functionName;

    @Field("job_metadata")
    private Map<String, Object> jobMetadata;

    private JobStatus status;

    @Field("created_at")
    private Instant createdAt;

    @Field(name = "last_run_at", write = Field.Write.ALWAYS)
    private Instant lastRunAt;

    @Field(name = "next_run_at", write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    @Version
    private Long version;

    public JobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(Long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public Map<String, Object> getJobMetadata() {
        return jobMetadata;
    }

    public void setJobMetadata(Map<String, Object> jobMetadata) {
        this.jobMetadata = jobMetadata;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
