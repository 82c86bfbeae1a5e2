package com.promptqueue.engine;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.Job;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Agent stand-in that replays queued results and records which jobs it ran.
 * When the script runs out it answers with a plain success.
 */
public class ScriptedAgentExecutor implements AgentExecutor {
    private final Deque<Function<Job, ExecutionResult>> script = new ArrayDeque<>();
    private final List<String> executedIds = new ArrayList<>();

    public ScriptedAgentExecutor thenSucceed(String output) {
        script.add(job -> ExecutionResult.success(output, Duration.ofSeconds(2)));
        return this;
    }

    public ScriptedAgentExecutor thenFail(String error) {
        script.add(job -> ExecutionResult.failure("", error, Duration.ofSeconds(1)));
        return this;
    }

    public ScriptedAgentExecutor thenOutput(boolean succeeded, String output) {
        script.add(job -> succeeded
                ? ExecutionResult.success(output, Duration.ofSeconds(1))
                : ExecutionResult.failure(output, "", Duration.ofSeconds(1)));
        return this;
    }

    public ScriptedAgentExecutor then(Function<Job, ExecutionResult> step) {
        script.add(step);
        return this;
    }

    @Override
    public synchronized ExecutionResult execute(Job job) {
        executedIds.add(job.getId());
        Function<Job, ExecutionResult> step = script.poll();
        if (step == null) {
            return ExecutionResult.success("done", Duration.ofSeconds(1));
        }
        return step.apply(job);
    }

    public synchronized List<String> getExecutedIds() {
        return new ArrayList<>(executedIds);
    }
}
