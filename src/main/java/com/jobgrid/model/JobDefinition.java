package com.jobgrid.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persistent record of a job implementation discovered in the job catalog.
 * <p>
 * Identity is the pair (module name, job class name). Rows survive the removal of
 * their implementation and are flagged {@code installed = false} instead.
 */
@Entity
@Table(name = "jobgrid_job_definitions")
public class JobDefinition {

    @Id
    private UUID id;

    @Column(name = "module_name", nullable = false)
    private String moduleName;

    @Column(name = "job_class_name", nullable = false)
    private String jobClassName;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private String grouping = "";

    @Column(columnDefinition = "text")
    private String description = "";

    private boolean installed = true;

    private boolean enabled = false;

    @Column(name = "is_job_hook_receiver")
    private boolean jobHookReceiver = false;

    @Column(name = "is_job_button_receiver")
    private boolean jobButtonReceiver = false;

    @Column(name = "has_sensitive_variables")
    private boolean hasSensitiveVariables = true;

    @Column(name = "approval_required")
    private boolean approvalRequired = false;

    private boolean hidden = false;

    @Column(name = "dryrun_default")
    private boolean dryrunDefault = false;

    @Column(name = "read_only")
    private boolean readOnly = false;

    @Column(name = "supports_dryrun")
    private boolean supportsDryrun = false;

    @Column(name = "soft_time_limit")
    private int softTimeLimit = 0;

    @Column(name = "time_limit")
    private int timeLimit = 0;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "task_queues", columnDefinition = "jsonb")
    private List<String> taskQueues = new ArrayList<>();

    @Column(name = "grouping_override")
    private boolean groupingOverride = false;

    @Column(name = "name_override")
    private boolean nameOverride = false;

    @Column(name = "description_override")
    private boolean descriptionOverride = false;

    @Column(name = "approval_required_override")
    private boolean approvalRequiredOverride = false;

    @Column(name = "dryrun_default_override")
    private boolean dryrunDefaultOverride = false;

    @Column(name = "hidden_override")
    private boolean hiddenOverride = false;

    @Column(name = "soft_time_limit_override")
    private boolean softTimeLimitOverride = false;

    @Column(name = "time_limit_override")
    private boolean timeLimitOverride = false;

    @Column(name = "has_sensitive_variables_override")
    private boolean hasSensitiveVariablesOverride = false;

    @Column(name = "task_queues_override")
    private boolean taskQueuesOverride = false;

    @Column(name = "created")
    private OffsetDateTime created;

    @Column(name = "last_updated")
    private OffsetDateTime lastUpdated;

    public JobDefinition() {
    }

    public JobDefinition(String moduleName, String jobClassName) {
        this.id = UUID.randomUUID();
        this.moduleName = moduleName;
        this.jobClassName = jobClassName;
        this.name = jobClassName;
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (created == null) {
            created = now;
        }
        lastUpdated = now;
    }

    @PreUpdate
    void onUpdate() {
        lastUpdated = OffsetDateTime.now();
    }

    /**
     * Dotted path that identifies the implementation, used as the task name of dispatched work.
     */
    public String getClassPath() {
        return moduleName + "." + jobClassName;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getModuleName() {
        return moduleName;
    }

    public void setModuleName(String moduleName) {
        this.moduleName = moduleName;
    }

    public String getJobClassName() {
        return jobClassName;
    }

    public void setJobClassName(String jobClassName) {
        this.jobClassName = jobClassName;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getGrouping() {
        return grouping;
    }

    public void setGrouping(String grouping) {
        this.grouping = grouping;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isInstalled() {
        return installed;
    }

    public void setInstalled(boolean installed) {
        this.installed = installed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isJobHookReceiver() {
        return jobHookReceiver;
    }

    public void setJobHookReceiver(boolean jobHookReceiver) {
        this.jobHookReceiver = jobHookReceiver;
    }

    public boolean isJobButtonReceiver() {
        return jobButtonReceiver;
    }

    public void setJobButtonReceiver(boolean jobButtonReceiver) {
        this.jobButtonReceiver = jobButtonReceiver;
    }

    public boolean isHasSensitiveVariables() {
        return hasSensitiveVariables;
    }

    public void setHasSensitiveVariables(boolean hasSensitiveVariables) {
        this.hasSensitiveVariables = hasSensitiveVariables;
    }

    public boolean isApprovalRequired() {
        return approvalRequired;
    }

    public void setApprovalRequired(boolean approvalRequired) {
        this.approvalRequired = approvalRequired;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public boolean isDryrunDefault() {
        return dryrunDefault;
    }

    public void setDryrunDefault(boolean dryrunDefault) {
        this.dryrunDefault = dryrunDefault;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public boolean isSupportsDryrun() {
        return supportsDryrun;
    }

    public void setSupportsDryrun(boolean supportsDryrun) {
        this.supportsDryrun = supportsDryrun;
    }

    public int getSoftTimeLimit() {
        return softTimeLimit;
    }

    public void setSoftTimeLimit(int softTimeLimit) {
        this.softTimeLimit = softTimeLimit;
    }

    public int getTimeLimit() {
        return timeLimit;
    }

    public void setTimeLimit(int timeLimit) {
        this.timeLimit = timeLimit;
    }

    public List<String> getTaskQueues() {
        return taskQueues;
    }

    public void setTaskQueues(List<String> taskQueues) {
        this.taskQueues = taskQueues == null ? new ArrayList<>() : new ArrayList<>(taskQueues);
    }

    public boolean isGroupingOverride() {
        return groupingOverride;
    }

    public void setGroupingOverride(boolean groupingOverride) {
        this.groupingOverride = groupingOverride;
    }

    public boolean isNameOverride() {
        return nameOverride;
    }

    public void setNameOverride(boolean nameOverride) {
        this.nameOverride = nameOverride;
    }

    public boolean isDescriptionOverride() {
        return descriptionOverride;
    }

    public void setDescriptionOverride(boolean descriptionOverride) {
        this.descriptionOverride = descriptionOverride;
    }

    public boolean isApprovalRequiredOverride() {
        return approvalRequiredOverride;
    }

    public void setApprovalRequiredOverride(boolean approvalRequiredOverride) {
        this.approvalRequiredOverride = approvalRequiredOverride;
    }

    public boolean isDryrunDefaultOverride() {
        return dryrunDefaultOverride;
    }

    public void setDryrunDefaultOverride(boolean dryrunDefaultOverride) {
        this.dryrunDefaultOverride = dryrunDefaultOverride;
    }

    public boolean isHiddenOverride() {
        return hiddenOverride;
    }

    public void setHiddenOverride(boolean hiddenOverride) {
        this.hiddenOverride = hiddenOverride;
    }

    public boolean isSoftTimeLimitOverride() {
        return softTimeLimitOverride;
    }

    public void setSoftTimeLimitOverride(boolean softTimeLimitOverride) {
        this.softTimeLimitOverride = softTimeLimitOverride;
    }

    public boolean isTimeLimitOverride() {
        return timeLimitOverride;
    }

    public void setTimeLimitOverride(boolean timeLimitOverride) {
        this.timeLimitOverride = timeLimitOverride;
    }

    public boolean isHasSensitiveVariablesOverride() {
        return hasSensitiveVariablesOverride;
    }

    public void setHasSensitiveVariablesOverride(boolean hasSensitiveVariablesOverride) {
        this.hasSensitiveVariablesOverride = hasSensitiveVariablesOverride;
    }

    public boolean isTaskQueuesOverride() {
        return taskQueuesOverride;
    }

    public void setTaskQueuesOverride(boolean taskQueuesOverride) {
        this.taskQueuesOverride = taskQueuesOverride;
    }

    public OffsetDateTime getCreated() {
        return created;
    }

    public OffsetDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "JobDefinition{" + getClassPath() + ", name='" + name + "'}";
    }
}
