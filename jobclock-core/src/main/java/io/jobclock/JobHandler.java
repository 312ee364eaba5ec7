package io.jobclock;

/**
 * Named unit of work a job can target.
 *
 * <p>The job's metadata map is converted to {@link #dataClass()} before {@link #execute} is called; declare
 * {@code Map} to receive it unchanged. Handlers should be safe to retry.
 */
public interface JobHandler<T> {
    String name();

    Class<T> dataClass();

    void execute(String jobId, T data) throws Exception;
}
