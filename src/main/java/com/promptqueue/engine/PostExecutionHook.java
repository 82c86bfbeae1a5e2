package com.promptqueue.engine;

import com.promptqueue.core.Job;

/**
 * Side effect run after a job has been committed as COMPLETED.
 * Failures are logged by the scheduler and never change the job's status.
 */
@FunctionalInterface
public interface PostExecutionHook {

    void afterSuccess(Job job) throws Exception;

    static PostExecutionHook none() {
        return job -> { };
    }
}
