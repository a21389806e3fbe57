package com.jobgrid.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A stored request to run a job at a point in time or on a recurring interval.
 */
@Entity
@Table(name = "jobgrid_scheduled_jobs")
public class ScheduledJob {

    @Id
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "text")
    private String description = "";

    @Column(nullable = false)
    private String task;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "job_definition_id")
    private JobDefinition jobDefinition;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_interval", nullable = false)
    private ScheduleInterval interval = ScheduleInterval.FUTURE;

    private String crontab;

    @Column(columnDefinition = "text", nullable = false)
    private String args = "[]";

    @Column(columnDefinition = "text", nullable = false)
    private String kwargs = "{}";

    private String queue;

    private boolean enabled = true;

    @Column(name = "last_run_at")
    private OffsetDateTime lastRunAt;

    @Column(name = "total_run_count")
    private int totalRunCount = 0;

    @Column(name = "date_changed")
    private OffsetDateTime dateChanged;

    @Column(name = "requested_by")
    private String user;

    @Column(name = "approval_required")
    private boolean approvalRequired = false;

    @Column(name = "approved_by")
    private String approvedByUser;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "start_time", nullable = false)
    private OffsetDateTime startTime;

    @Column(name = "time_zone", nullable = false)
    private String timeZone;

    public ScheduledJob() {
    }

    public ScheduledJob(String name, JobDefinition jobDefinition, ScheduleInterval interval, OffsetDateTime startTime) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.jobDefinition = jobDefinition;
        this.task = jobDefinition != null ? jobDefinition.getClassPath() : null;
        this.interval = interval;
        this.startTime = startTime;
        if (jobDefinition != null) {
            this.approvalRequired = jobDefinition.isApprovalRequired();
        }
    }

    @PrePersist
    @PreUpdate
    void onChange() {
        dateChanged = OffsetDateTime.now();
    }

    /**
     * Whether the schedule is approved or does not need approval.
     */
    public boolean isApprovedOrNotRequired() {
        return !approvalRequired || approvedAt != null;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public JobDefinition getJobDefinition() {
        return jobDefinition;
    }

    public void setJobDefinition(JobDefinition jobDefinition) {
        this.jobDefinition = jobDefinition;
    }

    public ScheduleInterval getInterval() {
        return interval;
    }

    public void setInterval(ScheduleInterval interval) {
        this.interval = interval;
    }

    public String getCrontab() {
        return crontab;
    }

    public void setCrontab(String crontab) {
        this.crontab = crontab;
    }

    public String getArgs() {
        return args;
    }

    public void setArgs(String args) {
        this.args = args;
    }

    public String getKwargs() {
        return kwargs;
    }

    public void setKwargs(String kwargs) {
        this.kwargs = kwargs;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public OffsetDateTime getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(OffsetDateTime lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public int getTotalRunCount() {
        return totalRunCount;
    }

    public void setTotalRunCount(int totalRunCount) {
        this.totalRunCount = totalRunCount;
    }

    public OffsetDateTime getDateChanged() {
        return dateChanged;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public boolean isApprovalRequired() {
        return approvalRequired;
    }

    public void setApprovalRequired(boolean approvalRequired) {
        this.approvalRequired = approvalRequired;
    }

    public String getApprovedByUser() {
        return approvedByUser;
    }

    public void setApprovedByUser(String approvedByUser) {
        this.approvedByUser = approvedByUser;
    }

    public OffsetDateTime getApprovedAt() {
        return approvedAt;
    }

    public void setApprovedAt(OffsetDateTime approvedAt) {
        this.approvedAt = approvedAt;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(OffsetDateTime startTime) {
        this.startTime = startTime;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    @Override
    public String toString() {
        return name + ": " + interval;
    }
}
