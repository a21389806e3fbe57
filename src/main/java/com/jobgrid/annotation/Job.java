package com.jobgrid.annotation;

import java.lang.annotation.*;

/**
 * Declares the metadata of a {@link com.jobgrid.JobWorker}. Values declared here are copied
 * onto the stored job definition unless an administrator has overridden the field.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * Human readable name. Defaults to the simple class name.
     */
    String name() default "";

    /**
     * Grouping shown in job listings. Defaults to the package of the worker.
     */
    String grouping() default "";

    String description() default "";

    /**
     * Whether a run must be approved by a second user. Cannot be combined with sensitive variables.
     */
    boolean approvalRequired() default false;

    boolean dryrunDefault() default false;

    boolean hidden() default false;

    boolean readOnly() default false;

    boolean supportsDryrun() default false;

    /**
     * Whether the job's inputs may contain secrets. Inputs of such jobs are never persisted.
     */
    boolean hasSensitiveVariables() default true;

    /**
     * Soft time limit in seconds, 0 for the worker default.
     */
    int softTimeLimit() default 0;

    /**
     * Hard time limit in seconds, 0 for the worker default.
     */
    int timeLimit() default 0;

    /**
     * Queues the job may be sent to. The first one is used when no queue is requested.
     */
    String[] taskQueues() default {};
}
