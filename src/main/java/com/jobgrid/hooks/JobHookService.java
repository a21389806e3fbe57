package com.jobgrid.hooks;

import com.jobgrid.JobValidationException;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobHook;
import com.jobgrid.model.ObjectChangeAction;
import com.jobgrid.repository.JobHookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Validates and persists job hooks.
 */
@Service
public class JobHookService {

    private static final Logger log = LoggerFactory.getLogger(JobHookService.class);

    private final JobHookRepository jobHookRepository;

    public JobHookService(JobHookRepository jobHookRepository) {
        this.jobHookRepository = jobHookRepository;
    }

    /**
     * Finds existing hooks that already run {@code job} for one of the given content types and actions.
     *
     * @param excluding hook to leave out of the comparison, typically the one being edited; may be {@code null}
     */
    public List<JobHookConflict> checkForConflicts(
            Collection<String> contentTypes,
            JobDefinition job,
            boolean typeCreate,
            boolean typeUpdate,
            boolean typeDelete,
            JobHook excluding) {
        List<JobHookConflict> conflicts = new ArrayList<>();
        if (contentTypes == null || job == null) {
            return conflicts;
        }
        UUID excludedId = excluding == null ? null : excluding.getId();

        for (String contentType : contentTypes) {
            List<JobHook> existing = jobHookRepository.findByContentTypeAndJob(contentType, job).stream()
                    .filter(hook -> !Objects.equals(hook.getId(), excludedId))
                    .toList();
            if (existing.isEmpty()) {
                continue;
            }
            addConflict(conflicts, existing, contentType, job, ObjectChangeAction.CREATE, typeCreate);
            addConflict(conflicts, existing, contentType, job, ObjectChangeAction.UPDATE, typeUpdate);
            addConflict(conflicts, existing, contentType, job, ObjectChangeAction.DELETE, typeDelete);
        }
        return conflicts;
    }

    private void addConflict(List<JobHookConflict> conflicts, List<JobHook> existing, String contentType,
            JobDefinition job, ObjectChangeAction action, boolean requested) {
        if (!requested || existing.stream().noneMatch(hook -> hook.handles(action))) {
            return;
        }
        String verb = action.name().toLowerCase();
        conflicts.add(new JobHookConflict(
                JobHookConflict.fieldFor(action),
                contentType,
                action,
                "A job hook already exists for " + verb + " on " + contentType + " to job " + job.getName()));
    }

    /**
     * @throws JobValidationException if the hook has no action, its job is not a hook receiver,
     *                                or it overlaps an existing hook
     */
    public void validate(JobHook hook) {
        if (hook.getName() == null || hook.getName().isBlank()) {
            throw new JobValidationException("name", "Name must not be blank");
        }
        if (!hook.isTypeCreate() && !hook.isTypeUpdate() && !hook.isTypeDelete()) {
            throw new JobValidationException("type_create", "You must select at least one type to trigger the job");
        }
        if (hook.getJob() == null) {
            throw new JobValidationException("job", "A job must be selected");
        }
        if (!hook.getJob().isJobHookReceiver()) {
            throw new JobValidationException("job", "Job " + hook.getJob().getName() + " is not a job hook receiver");
        }
        if (hook.getContentTypes() == null || hook.getContentTypes().isEmpty()) {
            throw new JobValidationException("content_types", "At least one content type must be selected");
        }

        List<JobHookConflict> conflicts = checkForConflicts(hook.getContentTypes(), hook.getJob(),
                hook.isTypeCreate(), hook.isTypeUpdate(), hook.isTypeDelete(), hook);
        if (!conflicts.isEmpty()) {
            throw new JobValidationException(conflicts.get(0).field(),
                    conflicts.stream().map(JobHookConflict::message).collect(Collectors.joining("; ")));
        }
    }

    @Transactional
    public JobHook save(JobHook hook) {
        validate(hook);
        JobHook saved = jobHookRepository.save(hook);
        log.debug("Saved job hook {}", saved.getName());
        return saved;
    }

    @Transactional
    public void delete(JobHook hook) {
        jobHookRepository.delete(hook);
    }
}
