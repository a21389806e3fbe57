package com.jobgrid.model;

/**
 * Where an object change originated.
 */
public enum ChangeContext {
    WEB,
    API,
    ORM,
    JOB,
    JOB_HOOK
}
