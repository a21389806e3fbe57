package com.jobgrid.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One log line emitted by a running job. Written through
 * {@link com.jobgrid.logging.JobLogStore} and read back through this entity.
 */
@Entity
@Table(name = "jobgrid_job_log_entries")
public class JobLogEntry {

    public static final String DEFAULT_GROUPING = "main";
    public static final int MAX_GROUPING_LENGTH = 100;
    public static final int MAX_LOG_OBJECT_LENGTH = 200;
    public static final int MAX_ABSOLUTE_URL_LENGTH = 255;

    @Id
    private UUID id;

    @Column(name = "job_result_id", nullable = false)
    private UUID jobResultId;

    @Enumerated(EnumType.STRING)
    @Column(name = "log_level", nullable = false)
    private LogLevel logLevel = LogLevel.DEBUG;

    @Column(nullable = false)
    private String grouping = DEFAULT_GROUPING;

    @Column(columnDefinition = "text", nullable = false)
    private String message = "";

    @Column(nullable = false)
    private OffsetDateTime created;

    @Column(name = "log_object")
    private String logObject;

    @Column(name = "absolute_url")
    private String absoluteUrl;

    public JobLogEntry() {
    }

    public JobLogEntry(UUID jobResultId, LogLevel logLevel, String grouping, String message, String logObject,
            String absoluteUrl) {
        this.id = UUID.randomUUID();
        this.jobResultId = jobResultId;
        this.logLevel = logLevel;
        this.grouping = grouping;
        this.message = message;
        this.logObject = logObject;
        this.absoluteUrl = absoluteUrl;
        this.created = OffsetDateTime.now();
    }

    public UUID getId() {
        return id;
    }

    public UUID getJobResultId() {
        return jobResultId;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    public String getGrouping() {
        return grouping;
    }

    public String getMessage() {
        return message;
    }

    public OffsetDateTime getCreated() {
        return created;
    }

    public String getLogObject() {
        return logObject;
    }

    public String getAbsoluteUrl() {
        return absoluteUrl;
    }

    @Override
    public String toString() {
        return message;
    }
}
