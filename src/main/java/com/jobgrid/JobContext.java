package com.jobgrid;

import com.jobgrid.execution.JobResultService;
import com.jobgrid.model.JobLogEntry;
import com.jobgrid.model.JobResult;
import com.jobgrid.model.LogLevel;

import java.util.List;
import java.util.UUID;

/**
 * Handed to a running {@link JobWorker}. Gives access to the job result being produced and
 * writes to its log.
 */
public class JobContext {

    private final JobResult jobResult;
    private final JobResultService jobResultService;
    private final List<Object> args;
    private volatile boolean failed = false;

    public JobContext(JobResult jobResult, JobResultService jobResultService, List<Object> args) {
        this.jobResult = jobResult;
        this.jobResultService = jobResultService;
        this.args = args == null ? List.of() : args;
    }

    public UUID getJobResultId() {
        return jobResult.getId();
    }

    public JobResult getJobResult() {
        return jobResult;
    }

    /**
     * User that requested the run, or {@code null} for system triggered runs.
     */
    public String getUser() {
        return jobResult.getUser();
    }

    public List<Object> getArgs() {
        return args;
    }

    public JobLogEntry log(LogLevel level, String message) {
        return jobResultService.log(jobResult, message, null, level, JobLogEntry.DEFAULT_GROUPING);
    }

    public JobLogEntry log(LogLevel level, String message, Object logObject) {
        return jobResultService.log(jobResult, message, logObject, level, JobLogEntry.DEFAULT_GROUPING);
    }

    public JobLogEntry log(LogLevel level, String message, Object logObject, String grouping) {
        return jobResultService.log(jobResult, message, logObject, level, grouping);
    }

    public JobLogEntry debug(String message) {
        return log(LogLevel.DEBUG, message);
    }

    public JobLogEntry info(String message) {
        return log(LogLevel.INFO, message);
    }

    public JobLogEntry info(String message, Object logObject) {
        return log(LogLevel.INFO, message, logObject);
    }

    public JobLogEntry success(String message) {
        return log(LogLevel.SUCCESS, message);
    }

    public JobLogEntry success(String message, Object logObject) {
        return log(LogLevel.SUCCESS, message, logObject);
    }

    public JobLogEntry warning(String message) {
        return log(LogLevel.WARNING, message);
    }

    public JobLogEntry warning(String message, Object logObject) {
        return log(LogLevel.WARNING, message, logObject);
    }

    public JobLogEntry failure(String message) {
        return log(LogLevel.FAILURE, message);
    }

    public JobLogEntry failure(String message, Object logObject) {
        return log(LogLevel.FAILURE, message, logObject);
    }

    /**
     * Logs a failure and marks the run as FAILED once the job returns.
     */
    public void fail(String message) {
        this.failed = true;
        failure(message);
    }

    public boolean isFailed() {
        return failed;
    }
}
