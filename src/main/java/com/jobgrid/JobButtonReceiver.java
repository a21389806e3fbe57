package com.jobgrid;

/**
 * Marker for jobs that can be launched from a job button.
 */
public interface JobButtonReceiver extends JobWorker {

    String OBJECT_PK_KWARG = "object_pk";

    String OBJECT_MODEL_NAME_KWARG = "object_model_name";
}
