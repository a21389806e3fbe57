package com.jobgrid.scheduling;

import com.jobgrid.JobValidationException;
import com.jobgrid.model.ScheduleInterval;
import com.jobgrid.model.ScheduledJob;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Derives the {@link JobSchedule} of a scheduled job from its interval and start time.
 */
public final class JobSchedules {

    private JobSchedules() {
    }

    /**
     * @throws JobValidationException if the crontab or time zone of the job is invalid
     */
    public static JobSchedule compute(ScheduledJob job) {
        if (job.getStartTime() == null) {
            throw new JobValidationException("start_time", "Please enter a valid date and time.");
        }
        ZoneId zone = zoneOf(job);
        ScheduleInterval interval = job.getInterval();
        if (interval == ScheduleInterval.FUTURE) {
            return new ClockedSchedule(job.getStartTime());
        }
        if (interval == ScheduleInterval.CUSTOM) {
            return CrontabSchedule.parse(job.getCrontab(), zone);
        }

        ZonedDateTime start = job.getStartTime().atZoneSameInstant(zone);
        String minute = String.valueOf(start.getMinute());
        String hour = String.valueOf(start.getHour());
        return switch (interval) {
            case HOURLY -> CrontabSchedule.of(minute, "*", "*", "*", "*", zone);
            case DAILY -> CrontabSchedule.of(minute, hour, "*", "*", "*", zone);
            // ISO Monday=1..Sunday=7, crontab Sunday=0
            case WEEKLY -> CrontabSchedule.of(minute, hour, "*", "*",
                    String.valueOf(start.getDayOfWeek().getValue() % 7), zone);
            default -> throw new JobValidationException("interval", "Unsupported interval " + interval);
        };
    }

    static ZoneId zoneOf(ScheduledJob job) {
        String timeZone = job.getTimeZone();
        if (timeZone == null || timeZone.isBlank()) {
            return job.getStartTime().getOffset();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            throw new JobValidationException("time_zone", "Unknown time zone '" + timeZone + "'", e);
        }
    }
}
