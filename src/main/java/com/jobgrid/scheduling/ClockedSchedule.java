package com.jobgrid.scheduling;

import java.time.OffsetDateTime;

/**
 * Fires once at a fixed point in time.
 */
public record ClockedSchedule(OffsetDateTime clockedTime) implements JobSchedule {

    @Override
    public OffsetDateTime nextFireTime(OffsetDateTime after) {
        if (after == null || clockedTime.isAfter(after)) {
            return clockedTime;
        }
        return null;
    }
}
