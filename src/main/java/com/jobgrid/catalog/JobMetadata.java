package com.jobgrid.catalog;

import com.jobgrid.JobButtonReceiver;
import com.jobgrid.JobHookReceiver;
import com.jobgrid.annotation.Job;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.List;

/**
 * Metadata a job implementation declares about itself.
 */
public record JobMetadata(
        String name,
        String grouping,
        String description,
        boolean approvalRequired,
        boolean dryrunDefault,
        boolean hidden,
        boolean readOnly,
        boolean supportsDryrun,
        boolean hasSensitiveVariables,
        int softTimeLimit,
        int timeLimit,
        List<String> taskQueues,
        boolean jobHookReceiver,
        boolean jobButtonReceiver) {

    public JobMetadata {
        taskQueues = taskQueues == null ? List.of() : List.copyOf(taskQueues);
    }

    /**
     * Reads the metadata of a worker class from its {@link Job} annotation, falling back to
     * defaults derived from the class itself.
     */
    public static JobMetadata of(Class<?> workerClass) {
        Job annotation = AnnotationUtils.findAnnotation(workerClass, Job.class);
        boolean hookReceiver = JobHookReceiver.class.isAssignableFrom(workerClass);
        boolean buttonReceiver = JobButtonReceiver.class.isAssignableFrom(workerClass);
        if (annotation == null) {
            return new JobMetadata(workerClass.getSimpleName(), workerClass.getPackageName(), "",
                    false, false, false, false, false, true, 0, 0, List.of(), hookReceiver, buttonReceiver);
        }
        String name = annotation.name().isBlank() ? workerClass.getSimpleName() : annotation.name().trim();
        String grouping = annotation.grouping().isBlank() ? workerClass.getPackageName() : annotation.grouping().trim();
        return new JobMetadata(
                name,
                grouping,
                annotation.description(),
                annotation.approvalRequired(),
                annotation.dryrunDefault(),
                annotation.hidden(),
                annotation.readOnly(),
                annotation.supportsDryrun(),
                annotation.hasSensitiveVariables(),
                annotation.softTimeLimit(),
                annotation.timeLimit(),
                List.of(annotation.taskQueues()),
                hookReceiver,
                buttonReceiver);
    }
}
