package com.jobgrid.catalog;

import com.jobgrid.JobContext;

import java.util.List;
import java.util.Map;

/**
 * An executable job implementation known to the catalog.
 */
public interface JobHandle {

    String module();

    String className();

    default String classPath() {
        return module() + "." + className();
    }

    JobMetadata metadata();

    Object execute(JobContext context, List<Object> args, Map<String, Object> kwargs) throws Exception;
}
