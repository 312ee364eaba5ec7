package io.jobclock.server.api;

import io.jobclock.JobManager;
import io.jobclock.core.JobDefinition;
import io.jobclock.core.JobHandlerRegistry;
import io.jobclock.core.JobPatch;
import io.jobclock.utils.TriggerCalculator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job CRUD and lifecycle endpoints. Every mutation goes through the {@link JobManager}, which keeps the
 * scheduler in sync with the stored job.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {
    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobManager jobManager;
    private final JobHandlerRegistry registry;

    public JobController(JobManager jobManager, JobHandlerRegistry registry) {
        this.jobManager = jobManager;
        this.registry = registry;
    }

    @GetMapping
    public List<JobResponse> list() {
        List<JobResponse> res = new ArrayList<>();
        jobManager.list().forEach(job -> res.add(JobResponse.from(job)));
        return res;
    }

    @GetMapping("/{jobId}")
    public JobResponse get(@PathVariable String jobId) {
        return JobResponse.from(jobManager.get(parseJobId(jobId)));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JobResponse create(@Valid @RequestBody JobRequest request) {
        JobDefinition definition = checked(request.toDefinition());
        return JobResponse.from(jobManager.create(definition));
    }

    @PutMapping("/{jobId}")
    public JobResponse replace(@PathVariable String jobId, @Valid @RequestBody JobRequest request) {
        String id = parseJobId(jobId);
        JobDefinition definition = checked(request.toDefinition());
        return JobResponse.from(jobManager.replace(id, definition));
    }

    @PatchMapping("/{jobId}")
    public JobResponse patch(@PathVariable String jobId, @Valid @RequestBody JobPatchRequest request) {
        String id = parseJobId(jobId);
        JobPatch patch = request.toPatch();
        if (patch.functionName() != null) {
            requireRegistered(patch.functionName());
        }
        if (patch.schedule() != null) {
            warnOnInvalidCron(patch.schedule().cronExpression());
        }
        return JobResponse.from(jobManager.patch(id, patch));
    }

    @PostMapping("/{jobId}/pause")
    public Map<String, String> pause(@PathVariable String jobId) {
        String id = parseJobId(jobId);
        jobManager.pause(id);
        return Map.of("message", "Job " + id + " paused");
    }

    @PostMapping("/{jobId}/resume")
    public Map<String, String> resume(@PathVariable String jobId) {
        String id = parseJobId(jobId);
        jobManager.resume(id);
        return Map.of("message", "Job " + id + " resumed");
    }

    @DeleteMapping("/{jobId}")
    public Map<String, String> delete(@PathVariable String jobId,
                                      @RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new IllegalArgumentException("Confirmation required. Use ?confirm=true to delete this job.");
        }
        String id = parseJobId(jobId);
        jobManager.delete(id);
        return Map.of("message", "Job " + id + " deleted successfully");
    }

    @DeleteMapping
    public Map<String, String> deleteAll(@RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new IllegalArgumentException("Confirmation required. Use ?confirm=true to delete all jobs.");
        }
        long deleted = jobManager.deleteAll();
        log.info("Deleted all jobs via API count={}", deleted);
        return Map.of("message", "All jobs deleted successfully");
    }

    private JobDefinition checked(JobDefinition definition) {
        requireRegistered(definition.functionName());
        warnOnInvalidCron(definition.schedule().cronExpression());
        return definition;
    }

    private void requireRegistered(String functionName) {
        if (!registry.contains(functionName)) {
            throw new IllegalArgumentException(
                    "Unknown function '" + functionName + "'. Available: " + registry.names());
        }
    }

    // stored anyway; the scheduler skips it and the job stays unscheduled
    private static void warnOnInvalidCron(String cronExpression) {
        if (cronExpression != null && !TriggerCalculator.isValidCron(cronExpression)) {
            log.warn("Accepting job with invalid cron expression '{}'; it will not be scheduled", cronExpression);
        }
    }

    private static String parseJobId(String jobId) {
        try {
            return UUID.fromString(jobId).toString();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid job ID format");
        }
    }
}
