package com.jobgrid.hooks;

import com.jobgrid.JobClient;
import com.jobgrid.JobHookReceiver;
import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.model.ChangeContext;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobHook;
import com.jobgrid.model.JobResult;
import com.jobgrid.repository.JobHookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Enqueues the jobs of matching job hooks for each object change.
 * Changes made by a job hook itself never trigger hooks.
 */
@Component
public class JobHookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobHookDispatcher.class);

    private final JobHookRepository jobHookRepository;
    private final JobClient jobClient;
    private final JobCatalog catalog;

    public JobHookDispatcher(JobHookRepository jobHookRepository, JobClient jobClient, JobCatalog catalog) {
        this.jobHookRepository = jobHookRepository;
        this.jobClient = jobClient;
        this.catalog = catalog;
    }

    @EventListener
    public void onObjectChange(ObjectChangeEvent event) {
        dispatch(event);
    }

    /**
     * @return the job results that were enqueued, one per matching hook
     */
    public List<JobResult> dispatch(ObjectChangeEvent event) {
        if (event.changeContext() == ChangeContext.JOB_HOOK) {
            log.debug("Ignoring change {} made by a job hook", event.changeId());
            return List.of();
        }

        List<JobResult> enqueued = new ArrayList<>();
        for (JobHook hook : findHooks(event)) {
            JobDefinition job = hook.getJob();
            if (!job.isInstalled() || !job.isEnabled()) {
                log.warn("JobHook {} is enabled, but the underlying Job implementation {} is not installed or enabled",
                        hook.getName(), job.getClassPath());
                continue;
            }
            if (catalog.lookup(job.getClassPath()).isEmpty()) {
                log.error("JobHook {} is enabled, but the Job implementation {} is missing", hook.getName(),
                        job.getClassPath());
                continue;
            }
            enqueued.add(jobClient.enqueue(job, event.user(),
                    Map.of(JobHookReceiver.OBJECT_CHANGE_KWARG, event.changeId().toString())));
            log.debug("JobHook {} enqueued {} for {} of {}", hook.getName(), job.getClassPath(), event.action(),
                    event.contentType());
        }
        return enqueued;
    }

    private List<JobHook> findHooks(ObjectChangeEvent event) {
        return switch (event.action()) {
            case CREATE -> jobHookRepository.findEnabledForCreate(event.contentType());
            case UPDATE -> jobHookRepository.findEnabledForUpdate(event.contentType());
            case DELETE -> jobHookRepository.findEnabledForDelete(event.contentType());
        };
    }
}
