package com.jobgrid.scheduling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.model.ScheduledJob;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * In-memory view of a scheduled job held by the {@link JobScheduler} between reloads.
 */
public class ScheduleEntry {

    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> KWARGS_TYPE = new TypeReference<>() {
    };

    private final ScheduledJob scheduledJob;
    private final JobSchedule schedule;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private OffsetDateTime lastRunAt;
    private int totalRunCount;

    ScheduleEntry(ScheduledJob scheduledJob, JobSchedule schedule, List<Object> args, Map<String, Object> kwargs) {
        this.scheduledJob = scheduledJob;
        this.schedule = schedule;
        this.args = args;
        this.kwargs = kwargs;
        this.lastRunAt = scheduledJob.getLastRunAt();
        this.totalRunCount = scheduledJob.getTotalRunCount();
    }

    /**
     * Builds an entry from a stored schedule.
     *
     * @throws JsonProcessingException if the stored args or kwargs cannot be read
     * @throws com.jobgrid.JobValidationException if the schedule itself is invalid
     */
    public static ScheduleEntry from(ScheduledJob scheduledJob, ObjectMapper objectMapper)
            throws JsonProcessingException {
        List<Object> args = read(objectMapper, scheduledJob.getArgs(), ARGS_TYPE);
        Map<String, Object> kwargs = read(objectMapper, scheduledJob.getKwargs(), KWARGS_TYPE);
        JobSchedule schedule = JobSchedules.compute(scheduledJob);
        return new ScheduleEntry(scheduledJob, schedule,
                args == null ? List.of() : args,
                kwargs == null ? Map.of() : kwargs);
    }

    private static <T> T read(ObjectMapper objectMapper, String json, TypeReference<T> type)
            throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return null;
        }
        return objectMapper.readValue(json, type);
    }

    /**
     * Whether the entry should fire at {@code now}. Nothing fires before the start time and a
     * one-off schedule fires at most once.
     */
    public boolean isDue(OffsetDateTime now) {
        if (now.isBefore(scheduledJob.getStartTime())) {
            return false;
        }
        if (scheduledJob.getInterval().isOneOff() && totalRunCount > 0) {
            return false;
        }
        return schedule.isDue(referenceTime(), now);
    }

    public OffsetDateTime nextFireTime() {
        if (scheduledJob.getInterval().isOneOff() && totalRunCount > 0) {
            return null;
        }
        return schedule.nextFireTime(referenceTime());
    }

    private OffsetDateTime referenceTime() {
        return lastRunAt != null ? lastRunAt : scheduledJob.getStartTime().minusSeconds(1);
    }

    void recordRun(OffsetDateTime runAt) {
        this.lastRunAt = runAt;
        this.totalRunCount++;
    }

    void syncTotalRunCount(int storedTotalRunCount) {
        this.totalRunCount = storedTotalRunCount;
        this.scheduledJob.setTotalRunCount(storedTotalRunCount);
    }

    public String getName() {
        return scheduledJob.getName() + "_" + scheduledJob.getId();
    }

    public ScheduledJob getScheduledJob() {
        return scheduledJob;
    }

    public JobSchedule getSchedule() {
        return schedule;
    }

    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public OffsetDateTime getLastRunAt() {
        return lastRunAt;
    }

    public int getTotalRunCount() {
        return totalRunCount;
    }

    @Override
    public String toString() {
        return "<ScheduleEntry: " + getName() + " " + schedule + ">";
    }
}
