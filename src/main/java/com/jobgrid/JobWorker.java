package com.jobgrid;

import java.util.Map;

/**
 * Interface representing the body of a job.
 * Note: The class must be registered as a Spring Bean to be discovered by the
 * job catalog. Metadata is read from the {@link com.jobgrid.annotation.Job} annotation.
 */
public interface JobWorker {

    /**
     * Runs the job.
     * Any exception thrown from this method marks the job result as ERRORED.
     * Calling {@link JobContext#fail(String)} marks it as FAILED instead.
     *
     * @param context the running job: logging helpers, requesting user and positional args
     * @param kwargs  the keyword arguments of the run
     * @return a JSON-serializable result, or {@code null}
     * @throws Exception if the job cannot complete
     */
    Object run(JobContext context, Map<String, Object> kwargs) throws Exception;
}
