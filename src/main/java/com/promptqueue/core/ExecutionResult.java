package com.promptqueue.core;

import java.time.Duration;

/**
 * Result of one agent run as reported by the execution collaborator.
 *
 * <p>A run is throttled when a {@link RateLimitInfo} with {@code detected == true}
 * is attached. Throttling is reported independently of the exit status.</p>
 */
public final class ExecutionResult {
    private final boolean succeeded;
    private final String output;
    private final String errorMessage;
    private final Duration elapsed;
    private final boolean timedOut;
    private final boolean interrupted;
    private final RateLimitInfo rateLimitInfo;

    private ExecutionResult(boolean succeeded, String output, String errorMessage, Duration elapsed,
                            boolean timedOut, boolean interrupted, RateLimitInfo rateLimitInfo) {
        this.succeeded = succeeded;
        this.output = output == null ? "" : output;
        this.errorMessage = errorMessage == null ? "" : errorMessage;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
        this.timedOut = timedOut;
        this.interrupted = interrupted;
        this.rateLimitInfo = rateLimitInfo == null ? RateLimitInfo.notLimited() : rateLimitInfo;
    }

    public static ExecutionResult success(String output, Duration elapsed) {
        return new ExecutionResult(true, output, "", elapsed, false, false, null);
    }

    public static ExecutionResult failure(String output, String errorMessage, Duration elapsed) {
        return new ExecutionResult(false, output, errorMessage, elapsed, false, false, null);
    }

    public static ExecutionResult timeout(String output, Duration elapsed) {
        return new ExecutionResult(false, output, "Execution timed out after " + elapsed.getSeconds() + "s",
                elapsed, true, false, null);
    }

    public static ExecutionResult throttled(String output, RateLimitInfo info, Duration elapsed) {
        return new ExecutionResult(false, output, info.getRawMessage(), elapsed, false, false, info);
    }

    /**
     * The run was aborted because the process is shutting down. The job goes back to the
     * queue without consuming an attempt.
     */
    public static ExecutionResult interrupted(String output, Duration elapsed) {
        return new ExecutionResult(false, output, "Execution interrupted during shutdown", elapsed, false, true, null);
    }

    /**
     * Return a copy of this result with the given throttling classification attached.
     * A detected throttle always turns the result into a non-success.
     */
    public ExecutionResult withRateLimit(RateLimitInfo info) {
        if (info == null || !info.isDetected()) {
            return this;
        }
        return new ExecutionResult(false, output, errorMessage.isEmpty() ? info.getRawMessage() : errorMessage,
                elapsed, timedOut, interrupted, info);
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public boolean isRateLimited() {
        return rateLimitInfo.isDetected();
    }

    public RateLimitInfo getRateLimitInfo() {
        return rateLimitInfo;
    }

    public String getOutput() {
        return output;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    @Override
    public String toString() {
        return "ExecutionResult{succeeded=" + succeeded + ", rateLimited=" + isRateLimited()
                + ", timedOut=" + timedOut + ", elapsed=" + elapsed + "}";
    }
}
