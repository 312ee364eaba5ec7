package io.jobclock;

import io.jobclock.core.Job;
import io.jobclock.core.JobDefinition;
import io.jobclock.core.JobPatch;

import java.util.List;
import java.util.Optional;

/**
 * Job CRUD and lifecycle operations. Every mutation is persisted first and then reflected in the
 * {@link JobScheduler}: active jobs are (re)installed, all others lose their timer.
 *
 * <p>Operations on an unknown id throw {@link io.jobclock.core.JobNotFoundException}.
 */
public interface JobManager {

    Job create(JobDefinition definition);

    Optional<Job> find(String id);

    Job get(String id);

    List<Job> list();

    Job replace(String id, JobDefinition definition);

    Job patch(String id, JobPatch patch);

    Job pause(String id);

    /**
     * Reactivate a paused or failed job, rescheduling it from now.
     */
    Job resume(String id);

    void delete(String id);

    long deleteAll();
}
