package com.jobgrid.catalog;

import com.jobgrid.JobContext;
import com.jobgrid.JobWorker;
import org.springframework.util.ClassUtils;

import java.util.List;
import java.util.Map;

/**
 * {@link JobHandle} backed by a {@link JobWorker} bean. Identity comes from the user class,
 * so proxied beans resolve to the class that declares the job.
 */
public class WorkerJobHandle implements JobHandle {

    private final JobWorker worker;
    private final String module;
    private final String className;
    private final JobMetadata metadata;

    public WorkerJobHandle(JobWorker worker) {
        Class<?> targetClass = ClassUtils.getUserClass(worker);
        this.worker = worker;
        this.module = targetClass.getPackageName();
        this.className = targetClass.getSimpleName();
        this.metadata = JobMetadata.of(targetClass);
    }

    @Override
    public String module() {
        return module;
    }

    @Override
    public String className() {
        return className;
    }

    @Override
    public JobMetadata metadata() {
        return metadata;
    }

    @Override
    public Object execute(JobContext context, List<Object> args, Map<String, Object> kwargs) throws Exception {
        return worker.run(context, kwargs);
    }

    @Override
    public String toString() {
        return "JobWorker " + classPath();
    }
}
