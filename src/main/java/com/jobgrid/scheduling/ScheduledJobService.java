package com.jobgrid.scheduling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.JobValidationException;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.ScheduleChangeMarker;
import com.jobgrid.model.ScheduleInterval;
import com.jobgrid.model.ScheduledJob;
import com.jobgrid.repository.ScheduleChangeMarkerRepository;
import com.jobgrid.repository.ScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates and persists scheduled jobs. Every change made here bumps the
 * {@link ScheduleChangeMarker} so running schedulers reload their entries.
 */
@Service
public class ScheduledJobService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobService.class);
    private static final Duration MINIMUM_LEAD_TIME = Duration.ofSeconds(15);

    private final ScheduledJobRepository scheduledJobRepository;
    private final ScheduleChangeMarkerRepository changeMarkerRepository;
    private final ObjectMapper objectMapper;
    private final JobGridProperties properties;

    public ScheduledJobService(ScheduledJobRepository scheduledJobRepository,
            ScheduleChangeMarkerRepository changeMarkerRepository, ObjectMapper objectMapper,
            JobGridProperties properties) {
        this.scheduledJobRepository = scheduledJobRepository;
        this.changeMarkerRepository = changeMarkerRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Checks the approval invariants and the serialized arguments of a schedule.
     *
     * @throws JobValidationException if the schedule is invalid
     */
    public void clean(ScheduledJob job) {
        if (job.getName() == null || job.getName().isBlank()) {
            throw new JobValidationException("name", "Name must not be blank");
        }
        if (job.getInterval() == null) {
            throw new JobValidationException("interval", "Interval must be set");
        }
        if (job.getApprovedByUser() != null && Objects.equals(job.getApprovedByUser(), job.getUser())) {
            throw new JobValidationException("approved_by_user",
                    "The requesting user cannot also be the approving user");
        }
        if ((job.getApprovedByUser() == null) != (job.getApprovedAt() == null)) {
            throw new JobValidationException("approved_at",
                    "Approval by user and approval time must either both be set or both be undefined");
        }
        if (job.getJobDefinition() != null && job.getJobDefinition().isHasSensitiveVariables()) {
            throw new JobValidationException("job_definition",
                    "Unable to schedule job: Job may have sensitive input variables");
        }
        requireJson("args", job.getArgs(), true);
        requireJson("kwargs", job.getKwargs(), false);
    }

    private void requireJson(String field, String value, boolean array) {
        if (value == null) {
            return;
        }
        try {
            JsonNode node = objectMapper.readTree(value);
            if (array ? !node.isArray() : !node.isObject()) {
                throw new JobValidationException(field, field + " must be a JSON " + (array ? "array" : "object"));
            }
        } catch (JsonProcessingException e) {
            throw new JobValidationException(field, field + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Validates, normalizes and persists a schedule.
     * <p>
     * A blank queue is stored as no queue and a schedule without a time zone gets
     * {@code jobgrid.scheduler.time-zone}. Disabling clears the last run time. An enabled
     * hourly, daily or weekly schedule that never ran is back-dated by one interval from its
     * start time so that its first fire time is the start time itself.
     */
    @Transactional
    public ScheduledJob save(ScheduledJob job) {
        clean(job);
        if (job.getQueue() != null && job.getQueue().isBlank()) {
            job.setQueue(null);
        }
        if (job.getTimeZone() == null || job.getTimeZone().isBlank()) {
            job.setTimeZone(properties.getScheduler().getTimeZone());
        }
        if (job.getTask() == null && job.getJobDefinition() != null) {
            job.setTask(job.getJobDefinition().getClassPath());
        }
        JobSchedules.compute(job);

        if (!job.isEnabled()) {
            job.setLastRunAt(null);
        } else if (job.getLastRunAt() == null) {
            Duration period = job.getInterval().getPeriod();
            if (period != null) {
                job.setLastRunAt(job.getStartTime().minus(period));
            }
        }

        ScheduledJob saved = scheduledJobRepository.save(job);
        touchChangeMarker();
        log.debug("Saved scheduled job {}", saved.getName());
        return saved;
    }

    @Transactional
    public void delete(ScheduledJob job) {
        scheduledJobRepository.delete(job);
        touchChangeMarker();
        log.debug("Deleted scheduled job {}", job.getName());
    }

    /**
     * Records the approval of a schedule that requires one.
     *
     * @throws JobValidationException if the approver is the requester
     */
    @Transactional
    public ScheduledJob approve(UUID id, String approver) {
        ScheduledJob job = require(id);
        job.setApprovedByUser(approver);
        job.setApprovedAt(OffsetDateTime.now());
        ScheduledJob saved = save(job);
        log.info("Scheduled job {} approved by {}", saved.getName(), approver);
        return saved;
    }

    /**
     * Rejects a schedule awaiting approval by deleting it.
     */
    @Transactional
    public void deny(UUID id) {
        ScheduledJob job = require(id);
        delete(job);
        log.info("Scheduled job {} denied", job.getName());
    }

    /**
     * Earliest start time accepted for a new one-off schedule.
     */
    public OffsetDateTime earliestPossibleTime() {
        return OffsetDateTime.now().plus(MINIMUM_LEAD_TIME);
    }

    /**
     * @throws JobValidationException if a one-off start time is earlier than {@link #earliestPossibleTime()}
     */
    public void requireFutureStart(ScheduledJob job) {
        if (job.getInterval() == ScheduleInterval.FUTURE
                && (job.getStartTime() == null || job.getStartTime().isBefore(earliestPossibleTime()))) {
            throw new JobValidationException("start_time", "Please enter a valid date and time greater than or equal to "
                    + earliestPossibleTime());
        }
    }

    public Optional<OffsetDateTime> lastChange() {
        return changeMarkerRepository.findById(ScheduleChangeMarker.IDENT).map(ScheduleChangeMarker::getLastUpdate);
    }

    private ScheduledJob require(UUID id) {
        return scheduledJobRepository.findById(id)
                .orElseThrow(() -> new JobValidationException("id", "Scheduled job " + id + " does not exist"));
    }

    private void touchChangeMarker() {
        changeMarkerRepository.save(new ScheduleChangeMarker(OffsetDateTime.now()));
    }
}
