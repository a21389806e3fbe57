package com.jobgrid.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.JobContext;
import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.catalog.JobHandle;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.JobLogEntry;
import com.jobgrid.model.JobResult;
import com.jobgrid.model.JobResultStatus;
import com.jobgrid.model.LogLevel;
import com.jobgrid.repository.JobResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Worker side of a job run: resolves the job, executes it and records the outcome on its result row.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final String INITIALIZATION_GROUPING = "initialization";

    private final JobResultRepository jobResultRepository;
    private final JobResultService jobResultService;
    private final JobCatalog catalog;
    private final ObjectMapper objectMapper;
    private final String workerName;

    public JobRunner(
            JobResultRepository jobResultRepository,
            JobResultService jobResultService,
            JobCatalog catalog,
            ObjectMapper objectMapper,
            JobGridProperties properties) {
        this.jobResultRepository = jobResultRepository;
        this.jobResultService = jobResultService;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.workerName = properties.getWorker().getWorkerName();
    }

    /**
     * Runs the job a message points to.
     *
     * @throws IllegalStateException if the job result row does not exist
     */
    public ExecutionOutcome execute(TaskMessage message) {
        JobResult result = jobResultRepository.findById(message.jobResultId())
                .orElseThrow(() -> new IllegalStateException(
                        "Unable to find job result " + message.jobResultId() + " for task " + message.taskName()));

        result.setWorker(workerName);
        Optional<JobHandle> handle = catalog.lookup(message.taskName());
        if (handle.isEmpty()) {
            log.error("Job {} for result {} is not installed on worker {}", message.taskName(), result.getId(),
                    workerName);
            jobResultService.log(result, "Unable to load job " + message.taskName(), null, LogLevel.FAILURE,
                    INITIALIZATION_GROUPING);
            result.setTraceback("Job " + message.taskName() + " is not installed on worker " + workerName);
            return finish(result, JobResultStatus.ERRORED);
        }

        jobResultService.setStatus(result, JobResultStatus.RUNNING);
        result = jobResultRepository.save(result);
        log.debug("Running job {} for result {} on queue {}", message.taskName(), result.getId(), message.queue());

        JobContext context = new JobContext(result, jobResultService, message.args());
        JobResultStatus status;
        try {
            Object value = handle.get().execute(context, message.args(), message.kwargs());
            JsonNode resultNode = value == null ? null : objectMapper.valueToTree(value);
            result.setResult(resultNode);
            status = context.isFailed() ? JobResultStatus.FAILED : JobResultStatus.COMPLETED;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Job {} for result {} raised an exception", message.taskName(), result.getId(), e);
            jobResultService.log(result, "An exception occurred: " + e.getClass().getSimpleName() + ": "
                    + e.getMessage(), null, LogLevel.FAILURE, JobLogEntry.DEFAULT_GROUPING);
            result.setTraceback(stackTrace(e));
            status = JobResultStatus.ERRORED;
        }

        return finish(result, status);
    }

    private ExecutionOutcome finish(JobResult result, JobResultStatus status) {
        jobResultService.setStatus(result, status);
        JobResult saved = jobResultRepository.save(result);
        log.debug("Job result {} finished as {}", saved.getId(), saved.getStatus());
        return new ExecutionOutcome(saved.getId(), saved.getStatus(), saved.getResult(), saved.getTraceback(),
                saved.getWorker(), saved.getDateDone());
    }

    private static String stackTrace(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
