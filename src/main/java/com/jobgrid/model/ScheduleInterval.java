package com.jobgrid.model;

import java.time.Duration;

public enum ScheduleInterval {
    /** Run once at the start time. */
    FUTURE(null),
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    /** Recurring on a user supplied crontab. */
    CUSTOM(null);

    private final Duration period;

    ScheduleInterval(Duration period) {
        this.period = period;
    }

    /**
     * Fixed period of the interval, or {@code null} for one-off and crontab schedules.
     */
    public Duration getPeriod() {
        return period;
    }

    public boolean isOneOff() {
        return this == FUTURE;
    }
}
