package com.jobgrid.catalog;

import com.jobgrid.JobValidationException;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.repository.JobDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the stored job definitions in line with the job catalog.
 */
@Service
public class JobDefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobDefinitionRegistry.class);

    private final JobDefinitionRepository jobDefinitionRepository;
    private final JobCatalog catalog;
    private final JobGridProperties properties;

    public JobDefinitionRegistry(JobDefinitionRepository jobDefinitionRepository, JobCatalog catalog,
            JobGridProperties properties) {
        this.jobDefinitionRepository = jobDefinitionRepository;
        this.catalog = catalog;
        this.properties = properties;
    }

    /**
     * Upserts one definition per handle and marks installed definitions that no longer have a
     * handle as not installed. Only rows that actually change are written, each in its own
     * transaction, so one invalid job does not hold back the others.
     *
     * @return the definitions that were created or changed
     */
    public List<JobDefinition> reconcile(Collection<? extends JobHandle> handles) {
        List<JobDefinition> touched = new ArrayList<>();
        Set<String> discovered = new HashSet<>();

        for (JobHandle handle : handles) {
            discovered.add(handle.classPath());
            try {
                reconcileHandle(handle).ifPresent(touched::add);
            } catch (JobValidationException e) {
                log.error("Job {} is invalid and was not refreshed: {}", handle.classPath(), e.getMessage());
            }
        }

        for (JobDefinition definition : jobDefinitionRepository.findByInstalledTrue()) {
            if (discovered.contains(definition.getClassPath())) {
                continue;
            }
            definition.setInstalled(false);
            touched.add(jobDefinitionRepository.save(definition));
            log.info("Job {} is no longer installed", definition.getClassPath());
        }

        if (!touched.isEmpty()) {
            log.info("Reconciled {} job definition(s) against {} discovered job(s)", touched.size(), handles.size());
        }
        return touched;
    }

    private Optional<JobDefinition> reconcileHandle(JobHandle handle) {
        Optional<JobDefinition> existing = jobDefinitionRepository.findByModuleNameAndJobClassName(
                handle.module(), handle.className());
        JobDefinition definition = existing.orElseGet(() -> new JobDefinition(handle.module(), handle.className()));
        boolean changed = existing.isEmpty();

        changed |= applyMetadata(definition, handle.metadata());
        if (!definition.isInstalled()) {
            definition.setInstalled(true);
            changed = true;
        }
        if (!changed) {
            log.debug("Job {} is up to date", handle.classPath());
            return Optional.empty();
        }

        validateFields(definition);
        ensureUniqueName(definition);
        JobDefinition saved = jobDefinitionRepository.save(definition);
        if (existing.isEmpty()) {
            log.info("Created job definition {} ({})", saved.getClassPath(), saved.getName());
        } else {
            log.debug("Refreshed job definition {}", saved.getClassPath());
        }
        return Optional.of(saved);
    }

    /**
     * Refreshes non-overridden fields from the catalog and checks the definition's invariants.
     *
     * @throws JobValidationException if the definition is invalid
     */
    public void validate(JobDefinition definition) {
        if (definition.isInstalled()) {
            catalog.lookup(definition.getModuleName(), definition.getJobClassName())
                    .ifPresent(handle -> applyMetadata(definition, handle.metadata()));
        }
        validateFields(definition);
    }

    @Transactional
    public JobDefinition save(JobDefinition definition) {
        validate(definition);
        ensureUniqueName(definition);
        return jobDefinitionRepository.save(definition);
    }

    public Optional<JobDefinition> findByClass(String moduleName, String jobClassName) {
        return jobDefinitionRepository.findByModuleNameAndJobClassName(moduleName, jobClassName);
    }

    public Optional<JobDefinition> findByName(String name) {
        return jobDefinitionRepository.findByName(name);
    }

    /**
     * Copies every field that has not been overridden from the declared metadata.
     *
     * @return whether any field changed
     */
    boolean applyMetadata(JobDefinition definition, JobMetadata metadata) {
        boolean changed = false;
        if (!definition.isNameOverride() && !Objects.equals(definition.getName(), metadata.name())) {
            definition.setName(metadata.name());
            changed = true;
        }
        if (!definition.isGroupingOverride() && !Objects.equals(definition.getGrouping(), metadata.grouping())) {
            definition.setGrouping(metadata.grouping());
            changed = true;
        }
        if (!definition.isDescriptionOverride()
                && !Objects.equals(definition.getDescription(), metadata.description())) {
            definition.setDescription(metadata.description());
            changed = true;
        }
        if (!definition.isApprovalRequiredOverride()
                && definition.isApprovalRequired() != metadata.approvalRequired()) {
            definition.setApprovalRequired(metadata.approvalRequired());
            changed = true;
        }
        if (!definition.isDryrunDefaultOverride() && definition.isDryrunDefault() != metadata.dryrunDefault()) {
            definition.setDryrunDefault(metadata.dryrunDefault());
            changed = true;
        }
        if (!definition.isHiddenOverride() && definition.isHidden() != metadata.hidden()) {
            definition.setHidden(metadata.hidden());
            changed = true;
        }
        if (!definition.isSoftTimeLimitOverride() && definition.getSoftTimeLimit() != metadata.softTimeLimit()) {
            definition.setSoftTimeLimit(metadata.softTimeLimit());
            changed = true;
        }
        if (!definition.isTimeLimitOverride() && definition.getTimeLimit() != metadata.timeLimit()) {
            definition.setTimeLimit(metadata.timeLimit());
            changed = true;
        }
        if (!definition.isHasSensitiveVariablesOverride()
                && definition.isHasSensitiveVariables() != metadata.hasSensitiveVariables()) {
            definition.setHasSensitiveVariables(metadata.hasSensitiveVariables());
            changed = true;
        }
        if (!definition.isTaskQueuesOverride() && !Objects.equals(definition.getTaskQueues(), metadata.taskQueues())) {
            definition.setTaskQueues(metadata.taskQueues());
            changed = true;
        }
        // Not overridable.
        if (definition.isReadOnly() != metadata.readOnly()) {
            definition.setReadOnly(metadata.readOnly());
            changed = true;
        }
        if (definition.isSupportsDryrun() != metadata.supportsDryrun()) {
            definition.setSupportsDryrun(metadata.supportsDryrun());
            changed = true;
        }
        if (definition.isJobHookReceiver() != metadata.jobHookReceiver()) {
            definition.setJobHookReceiver(metadata.jobHookReceiver());
            changed = true;
        }
        if (definition.isJobButtonReceiver() != metadata.jobButtonReceiver()) {
            definition.setJobButtonReceiver(metadata.jobButtonReceiver());
            changed = true;
        }
        return changed;
    }

    private void validateFields(JobDefinition definition) {
        int maxNameLength = properties.getJobs().getMaxNameLength();
        int maxGroupingLength = properties.getJobs().getMaxGroupingLength();

        requireMaxLength("module_name", definition.getModuleName(), maxNameLength);
        requireMaxLength("job_class_name", definition.getJobClassName(), maxNameLength);
        requireMaxLength("grouping", definition.getGrouping(), maxGroupingLength);
        requireMaxLength("name", definition.getName(), maxNameLength);
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new JobValidationException("name", "Name must not be blank");
        }
        if (definition.getSoftTimeLimit() < 0) {
            throw new JobValidationException("soft_time_limit", "Soft time limit must be >= 0");
        }
        if (definition.getTimeLimit() < 0) {
            throw new JobValidationException("time_limit", "Time limit must be >= 0");
        }
        if (definition.isHasSensitiveVariables() && definition.isApprovalRequired()) {
            throw new JobValidationException("approval_required",
                    "A job that may have sensitive variables cannot be marked as requiring approval");
        }
    }

    private void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new JobValidationException(field,
                    "Value of " + field + " is " + value.length() + " characters long, maximum is " + maxLength);
        }
    }

    private void ensureUniqueName(JobDefinition definition) {
        jobDefinitionRepository.findByName(definition.getName())
                .filter(other -> !other.getId().equals(definition.getId()))
                .ifPresent(other -> {
                    throw new JobValidationException("name",
                            "Job name '" + definition.getName() + "' is already used by " + other.getClassPath());
                });
    }
}
