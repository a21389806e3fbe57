package com.jobgrid;

/**
 * Marker for jobs that can be attached to a job hook. Hook receivers are called with a single
 * keyword argument {@code object_change} holding the id of the change that triggered them.
 */
public interface JobHookReceiver extends JobWorker {

    String OBJECT_CHANGE_KWARG = "object_change";
}
