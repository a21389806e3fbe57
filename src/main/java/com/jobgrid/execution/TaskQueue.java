package com.jobgrid.execution;

/**
 * Dispatch layer that delivers task messages to workers. Delivery is at most once; a message
 * that fails to send is not retried.
 */
public interface TaskQueue {

    void send(TaskMessage message);
}
