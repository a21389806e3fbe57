package com.jobgrid.logging;

import com.jobgrid.model.JobLogEntry;

/**
 * Sink for job log entries.
 * <p>
 * Implementations must make an appended entry durable independently of any transaction the
 * caller has open, so log lines survive a job whose own work is rolled back.
 */
public interface JobLogStore {

    void append(JobLogEntry entry);
}
