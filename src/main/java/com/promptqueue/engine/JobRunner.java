package com.promptqueue.engine;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.RateLimitInfo;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a single job through the agent and decides where it goes next.
 *
 * <p><b>Outcomes:</b></p>
 * <ul>
 *   <li>Success: COMPLETED.</li>
 *   <li>Throttled: back to QUEUED with {@code notBeforeTime} at the estimated reset.
 *       The attempt is not counted.</li>
 *   <li>Failure: the attempt is counted; QUEUED while attempts remain, else FAILED.</li>
 *   <li>Interrupted by shutdown: back to QUEUED, not counted.</li>
 * </ul>
 *
 * <p>Every outcome appends exactly one log entry to the job. The caller commits the
 * returned status and updates the queue counters.</p>
 *
 * @see Scheduler
 */
public class JobRunner {
    private static final Logger logger = Logger.getLogger(JobRunner.class.getName());

    static final int MAX_LOGGED_OUTPUT = 4000;

    private final AgentExecutor executor;
    private final RateLimitDetector detector;

    public JobRunner(AgentExecutor executor, RateLimitDetector detector) {
        this.executor = executor;
        this.detector = detector;
    }

    /**
     * Execute the job and attach the throttling classification of its output.
     *
     * @param job the job, already committed as EXECUTING
     * @return the classified result; never null
     */
    public ExecutionResult run(Job job) {
        String jobId = job.getId();
        logger.info("Runner starting execution of job: " + jobId);

        ExecutionResult result;
        try {
            result = executor.execute(job);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Agent executor threw for job " + jobId, e);
            result = ExecutionResult.failure("", e.getClass().getSimpleName() + ": " + e.getMessage(), Duration.ZERO);
        }
        if (result.isInterrupted() || result.isRateLimited()) {
            return result;
        }

        RateLimitInfo info = result.isSucceeded()
                ? detector.classifyCompletedOutput(result.getOutput())
                : detector.classify(result.getOutput() + "\n" + result.getErrorMessage());
        return result.withRateLimit(info);
    }

    /**
     * Apply a result to the job and pick its next status.
     *
     * @param job the executing job; its counters, not-before time and log are updated
     * @param result the classified result of {@link #run(Job)}
     * @param now the time of the decision
     * @return the status to commit
     */
    public JobStatus decide(Job job, ExecutionResult result, LocalDateTime now) {
        String summary = "Execution completed in " + formatElapsed(result.getElapsed());

        // === INTERRUPTED ===
        if (result.isInterrupted()) {
            logger.warning("Job " + job.getId() + " interrupted during shutdown, returning to queue");
            job.addLog(now, "Execution interrupted during shutdown");
            return JobStatus.QUEUED;
        }

        // === THROTTLED ===
        if (result.isRateLimited()) {
            RateLimitInfo info = result.getRateLimitInfo();
            job.setNotBeforeTime(info.getEstimatedResetAt());
            logger.warning("Job " + job.getId() + " throttled, not before " + info.getEstimatedResetAt());
            job.addLog(now, summary + " - RATE LIMITED (will retry after " + info.getEstimatedResetAt() + ")"
                    + "\nMessage: " + info.getRawMessage());
            return JobStatus.QUEUED;
        }

        // === SUCCESS ===
        if (result.isSucceeded()) {
            logger.info("Job completed successfully: " + job.getId());
            job.addLog(now, summary + " - SUCCESS" + outputSection(result.getOutput()));
            return JobStatus.COMPLETED;
        }

        // === FAILURE ===
        job.setRetryCount(job.getRetryCount() + 1);
        String attempts = job.getRetryCount() + "/" + job.getMaxRetries();
        String details = "\nError: " + result.getErrorMessage() + outputSection(result.getOutput());
        if (job.getRetryCount() < job.getMaxRetries()) {
            logger.info("Job " + job.getId() + " failed, will retry (attempt " + attempts + ")");
            job.addLog(now, summary + " - FAILED (will retry, attempt " + attempts + ")" + details);
            return JobStatus.QUEUED;
        }
        logger.warning("Job " + job.getId() + " exhausted retries (" + attempts + ")");
        job.addLog(now, summary + " - FAILED (max retries exceeded, attempt " + attempts + ")" + details);
        return JobStatus.FAILED;
    }

    private static String outputSection(String output) {
        String trimmed = output.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        if (trimmed.length() > MAX_LOGGED_OUTPUT) {
            trimmed = trimmed.substring(0, MAX_LOGGED_OUTPUT) + "\n... (output truncated)";
        }
        return "\nOutput:\n" + trimmed;
    }

    static String formatElapsed(Duration elapsed) {
        return String.format(Locale.ROOT, "%.1fs", elapsed.toMillis() / 1000.0);
    }
}
