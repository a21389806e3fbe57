package com.jobgrid.logging;

/**
 * Implemented by objects that can be linked from a job log entry.
 */
public interface AbsoluteUrlProvider {

    String getAbsoluteUrl();
}
