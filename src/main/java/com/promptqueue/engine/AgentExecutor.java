package com.promptqueue.engine;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.Job;

import java.io.IOException;

/**
 * Runs one job through the external agent.
 *
 * <p>Implementations never throw to the scheduler for a failed run: every outcome,
 * including timeouts and launch errors, is reported as an {@link ExecutionResult}.
 * Throttling classification is left to the caller.</p>
 */
public interface AgentExecutor {

    /**
     * Run the job to completion or until its timeout elapses.
     *
     * @param job the job in EXECUTING state
     * @return the outcome of the run
     */
    ExecutionResult execute(Job job);

    /**
     * Stop the run in progress, if any. The pending {@link #execute(Job)} call returns an
     * {@link ExecutionResult#interrupted interrupted} result. Later calls return one
     * immediately.
     */
    default void abort() {
    }

    /**
     * Check that the agent can be launched.
     *
     * @return a short description of what was found
     * @throws IOException if the agent is not reachable
     */
    default String testConnection() throws IOException {
        return "ok";
    }
}
