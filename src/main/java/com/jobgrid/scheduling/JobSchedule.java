package com.jobgrid.scheduling;

import java.time.OffsetDateTime;

/**
 * When a scheduled job fires.
 */
public interface JobSchedule {

    /**
     * First fire time strictly after {@code after}, or {@code null} if the schedule never fires again.
     */
    OffsetDateTime nextFireTime(OffsetDateTime after);

    default boolean isDue(OffsetDateTime lastRunAt, OffsetDateTime now) {
        OffsetDateTime next = nextFireTime(lastRunAt);
        return next != null && !next.isAfter(now);
    }
}
