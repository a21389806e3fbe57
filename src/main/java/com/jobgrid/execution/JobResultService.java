package com.jobgrid.execution;

import com.jobgrid.internal.JobGridMetrics;
import com.jobgrid.logging.AbsoluteUrlProvider;
import com.jobgrid.logging.JobLogStore;
import com.jobgrid.logging.LogSanitizer;
import com.jobgrid.model.JobLogEntry;
import com.jobgrid.model.JobResult;
import com.jobgrid.model.JobResultStatus;
import com.jobgrid.model.LogLevel;
import com.jobgrid.repository.JobLogEntryRepository;
import com.jobgrid.repository.JobResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Status transitions and log output of job results.
 */
@Service
public class JobResultService {

    private static final Logger log = LoggerFactory.getLogger(JobResultService.class);
    private static final String JOB_LOGGER_PREFIX = "com.jobgrid.jobs.";

    private final JobResultRepository jobResultRepository;
    private final JobLogEntryRepository jobLogEntryRepository;
    private final JobLogStore jobLogStore;
    private final LogSanitizer logSanitizer;
    private final JobGridMetrics metrics;

    public JobResultService(
            JobResultRepository jobResultRepository,
            JobLogEntryRepository jobLogEntryRepository,
            JobLogStore jobLogStore,
            LogSanitizer logSanitizer,
            JobGridMetrics metrics) {
        this.jobResultRepository = jobResultRepository;
        this.jobLogEntryRepository = jobLogEntryRepository;
        this.jobLogStore = jobLogStore;
        this.logSanitizer = logSanitizer;
        this.metrics = metrics;
    }

    /**
     * Moves a result to {@code status} without saving it.
     * <p>
     * Entering a terminal status stamps {@code dateDone} and records the execution duration.
     * Once terminal, a result keeps its first terminal status and {@code dateDone}; later
     * terminal transitions are ignored.
     *
     * @throws IllegalStateException if a terminal result is moved back to a non-terminal status
     */
    public void setStatus(JobResult result, JobResultStatus status) {
        JobResultStatus current = result.getStatus();
        if (current != null && current.isTerminal()) {
            if (status.isTerminal()) {
                log.warn("Job result {} is already {}, ignoring transition to {}", result.getId(), current, status);
                return;
            }
            throw new IllegalStateException(
                    "Job result " + result.getId() + " is already " + current + " and cannot move to " + status);
        }

        result.setStatus(status);
        if (!status.isTerminal()) {
            return;
        }
        result.setDateDone(OffsetDateTime.now());
        if (result.getJobDefinition() != null) {
            metrics.recordExecution(result.getJobDefinition(), status, result.getDuration());
        }
    }

    public JobLogEntry log(JobResult result, String message) {
        return log(result, message, null, LogLevel.INFO, JobLogEntry.DEFAULT_GROUPING);
    }

    public JobLogEntry log(JobResult result, String message, LogLevel level) {
        return log(result, message, null, level, JobLogEntry.DEFAULT_GROUPING);
    }

    /**
     * Same as {@link #log(JobResult, String, Object, LogLevel, String)} with the level given by name.
     *
     * @throws IllegalArgumentException if {@code levelName} is not a known level
     */
    public JobLogEntry log(JobResult result, String message, Object logObject, String levelName, String grouping) {
        return log(result, message, logObject, LogLevel.fromName(levelName), grouping);
    }

    /**
     * Appends a sanitized entry to the job log and mirrors it to the application log.
     * The entry is durable even if the caller's transaction later rolls back.
     */
    public JobLogEntry log(JobResult result, String message, Object logObject, LogLevel level, String grouping) {
        if (level == null) {
            throw new IllegalArgumentException("Unknown logging level: null");
        }
        String sanitized = logSanitizer.sanitize(message == null ? "" : message);
        String resolvedGrouping = truncate(grouping == null || grouping.isBlank()
                ? JobLogEntry.DEFAULT_GROUPING
                : grouping, JobLogEntry.MAX_GROUPING_LENGTH);
        String objectRepr = logObject == null ? null : truncate(String.valueOf(logObject),
                JobLogEntry.MAX_LOG_OBJECT_LENGTH);
        String absoluteUrl = logObject instanceof AbsoluteUrlProvider provider
                ? truncate(provider.getAbsoluteUrl(), JobLogEntry.MAX_ABSOLUTE_URL_LENGTH)
                : null;

        JobLogEntry entry = new JobLogEntry(result.getId(), level, resolvedGrouping, sanitized, objectRepr,
                absoluteUrl);
        jobLogStore.append(entry);
        mirror(result, level, sanitized, objectRepr);
        return entry;
    }

    private void mirror(JobResult result, LogLevel level, String message, String objectRepr) {
        Logger jobLogger = LoggerFactory.getLogger(JOB_LOGGER_PREFIX
                + (result.getTaskName() == null ? "unknown" : result.getTaskName()));
        String line = objectRepr == null ? message : objectRepr + ": " + message;
        switch (level) {
            case FAILURE -> jobLogger.error("[{}] {}", result.getId(), line);
            case WARNING -> jobLogger.warn("[{}] {}", result.getId(), line);
            case DEBUG -> jobLogger.debug("[{}] {}", result.getId(), line);
            default -> jobLogger.info("[{}] {}", result.getId(), line);
        }
    }

    public JobResult save(JobResult result) {
        return jobResultRepository.save(result);
    }

    public Optional<JobResult> findById(UUID id) {
        return jobResultRepository.findById(id);
    }

    public List<JobLogEntry> getLogEntries(UUID jobResultId) {
        return jobLogEntryRepository.findByJobResultIdOrderByCreatedAsc(jobResultId);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
