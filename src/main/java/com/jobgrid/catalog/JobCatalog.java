package com.jobgrid.catalog;

import com.jobgrid.JobWorker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of job implementations available to this process, keyed by class path.
 * Built once at startup and handed to the components that need to resolve jobs.
 */
public final class JobCatalog {

    private final Map<String, JobHandle> handlesByClassPath;

    public JobCatalog(Collection<? extends JobHandle> handles) {
        Map<String, JobHandle> byClassPath = new LinkedHashMap<>();
        for (JobHandle handle : handles) {
            JobHandle existing = byClassPath.putIfAbsent(handle.classPath(), handle);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate job '" + handle.classPath() + "' detected while registering " + handle
                                + ". Each job class must be unique.");
            }
        }
        this.handlesByClassPath = Collections.unmodifiableMap(byClassPath);
    }

    public static JobCatalog fromWorkers(List<? extends JobWorker> workers) {
        return new JobCatalog(workers.stream().map(WorkerJobHandle::new).toList());
    }

    public static JobCatalog empty() {
        return new JobCatalog(List.of());
    }

    public Optional<JobHandle> lookup(String module, String className) {
        return lookup(module + "." + className);
    }

    public Optional<JobHandle> lookup(String classPath) {
        if (classPath == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlesByClassPath.get(classPath));
    }

    public List<JobHandle> handles() {
        return List.copyOf(handlesByClassPath.values());
    }

    public int size() {
        return handlesByClassPath.size();
    }
}
