package com.jobgrid.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * The record of one requested execution of a job.
 * <p>
 * {@code dateDone} is set exactly when the status is terminal. Transitions go through
 * {@link com.jobgrid.execution.JobResultService#setStatus(JobResult, JobResultStatus)}.
 */
@Entity
@Table(name = "jobgrid_job_results")
public class JobResult {

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "job_definition_id")
    private JobDefinition jobDefinition;

    @Column(nullable = false)
    private String name;

    @Column(name = "task_name")
    private String taskName;

    @Column(name = "date_created", nullable = false)
    private OffsetDateTime dateCreated;

    @Column(name = "date_done")
    private OffsetDateTime dateDone;

    @Column(name = "requested_by")
    private String user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobResultStatus status = JobResultStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode result;

    private String worker;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "task_args", columnDefinition = "jsonb")
    private JsonNode taskArgs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "task_kwargs", columnDefinition = "jsonb")
    private JsonNode taskKwargs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "dispatch_kwargs", columnDefinition = "jsonb")
    private JsonNode dispatchKwargs;

    @Column(columnDefinition = "text")
    private String traceback;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode meta;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "scheduled_job_id")
    private ScheduledJob scheduledJob;

    public JobResult() {
    }

    public JobResult(UUID id, JobDefinition jobDefinition, String user) {
        this.id = id;
        this.jobDefinition = jobDefinition;
        this.name = jobDefinition.getName();
        this.taskName = jobDefinition.getClassPath();
        this.user = user;
        this.dateCreated = OffsetDateTime.now();
    }

    /**
     * Wall time between creation and completion, or {@code null} while the job is not done.
     */
    public Duration getDuration() {
        if (dateCreated == null || dateDone == null) {
            return null;
        }
        return Duration.between(dateCreated, dateDone);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public JobDefinition getJobDefinition() {
        return jobDefinition;
    }

    public void setJobDefinition(JobDefinition jobDefinition) {
        this.jobDefinition = jobDefinition;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTaskName() {
        return taskName;
    }

    public void setTaskName(String taskName) {
        this.taskName = taskName;
    }

    public OffsetDateTime getDateCreated() {
        return dateCreated;
    }

    public void setDateCreated(OffsetDateTime dateCreated) {
        this.dateCreated = dateCreated;
    }

    public OffsetDateTime getDateDone() {
        return dateDone;
    }

    public void setDateDone(OffsetDateTime dateDone) {
        this.dateDone = dateDone;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public JobResultStatus getStatus() {
        return status;
    }

    public void setStatus(JobResultStatus status) {
        this.status = status;
    }

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public String getWorker() {
        return worker;
    }

    public void setWorker(String worker) {
        this.worker = worker;
    }

    public JsonNode getTaskArgs() {
        return taskArgs;
    }

    public void setTaskArgs(JsonNode taskArgs) {
        this.taskArgs = taskArgs;
    }

    public JsonNode getTaskKwargs() {
        return taskKwargs;
    }

    public void setTaskKwargs(JsonNode taskKwargs) {
        this.taskKwargs = taskKwargs;
    }

    public JsonNode getDispatchKwargs() {
        return dispatchKwargs;
    }

    public void setDispatchKwargs(JsonNode dispatchKwargs) {
        this.dispatchKwargs = dispatchKwargs;
    }

    public String getTraceback() {
        return traceback;
    }

    public void setTraceback(String traceback) {
        this.traceback = traceback;
    }

    public JsonNode getMeta() {
        return meta;
    }

    public void setMeta(JsonNode meta) {
        this.meta = meta;
    }

    public ScheduledJob getScheduledJob() {
        return scheduledJob;
    }

    public void setScheduledJob(ScheduledJob scheduledJob) {
        this.scheduledJob = scheduledJob;
    }

    @Override
    public String toString() {
        return name + " started at " + dateCreated + " (" + status + ")";
    }
}
