package com.promptqueue.engine;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.LogEntry;
import com.promptqueue.core.RateLimitInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobRunnerTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 14, 30);

    private ScriptedAgentExecutor agent;
    private JobRunner runner;
    private Job job;

    @BeforeEach
    public void setUp() {
        agent = new ScriptedAgentExecutor();
        runner = new JobRunner(agent, new RateLimitDetector(new MutableClock(NOW)));
        job = new Job("Write the changelog");
        job.setId("abcd1234");
        job.setStatus(JobStatus.EXECUTING);
        job.setMaxRetries(2);
    }

    private String lastLog() {
        List<LogEntry> log = job.getExecutionLog();
        return log.get(log.size() - 1).getMessage();
    }

    @Test
    public void testSuccess() {
        agent.thenSucceed("Changelog written");

        ExecutionResult result = runner.run(job);
        assertEquals(JobStatus.COMPLETED, runner.decide(job, result, NOW));
        assertEquals(0, job.getRetryCount());
        assertEquals(1, job.getExecutionLog().size());
        assertEquals("Execution completed in 2.0s - SUCCESS\nOutput:\nChangelog written", lastLog());
    }

    @Test
    public void testThrottledOutputOnSuccessfulExitIsRequeued() {
        agent.thenOutput(true, "Claude AI usage limit reached");

        ExecutionResult result = runner.run(job);
        assertFalse(result.isSucceeded());
        assertTrue(result.isRateLimited());

        assertEquals(JobStatus.QUEUED, runner.decide(job, result, NOW));
        assertEquals(0, job.getRetryCount());
        assertEquals(LocalDateTime.of(2026, 10, 19, 15, 0), job.getNotBeforeTime());
        assertTrue(lastLog().startsWith("Execution completed in 1.0s - RATE LIMITED (will retry after 2026-10-19T15:00)"));
        assertTrue(lastLog().endsWith("\nMessage: Claude AI usage limit reached"));
    }

    @Test
    public void testSuccessfulAnswerMentioningThrottlingIsCompleted() {
        agent.thenOutput(true, "Done. The client now retries when the server answers 429 Too Many Requests.");

        ExecutionResult result = runner.run(job);
        assertTrue(result.isSucceeded());
        assertFalse(result.isRateLimited());

        assertEquals(JobStatus.COMPLETED, runner.decide(job, result, NOW));
        assertNull(job.getNotBeforeTime());
    }

    @Test
    public void testLongSuccessfulAnswerEndingWithPhraseIsCompleted() {
        agent.thenOutput(true, "Added backoff.\nUpdated tests.\nDocumented it.\nRate limit exceeded");

        ExecutionResult result = runner.run(job);
        assertFalse(result.isRateLimited());
        assertEquals(JobStatus.COMPLETED, runner.decide(job, result, NOW));
    }

    @Test
    public void testThrottlingInErrorMessageIsDetected() {
        agent.thenFail("429 Too Many Requests");

        ExecutionResult result = runner.run(job);
        assertTrue(result.isRateLimited());
        assertEquals(JobStatus.QUEUED, runner.decide(job, result, NOW));
        assertEquals(0, job.getRetryCount());
    }

    @Test
    public void testFailureCountsAttemptsUntilExhausted() {
        agent.thenFail("boom").thenFail("boom again");

        assertEquals(JobStatus.QUEUED, runner.decide(job, runner.run(job), NOW));
        assertEquals(1, job.getRetryCount());
        assertEquals("Execution completed in 1.0s - FAILED (will retry, attempt 1/2)\nError: boom", lastLog());

        assertEquals(JobStatus.FAILED, runner.decide(job, runner.run(job), NOW.plusMinutes(1)));
        assertEquals(2, job.getRetryCount());
        assertEquals("Execution completed in 1.0s - FAILED (max retries exceeded, attempt 2/2)\nError: boom again",
                lastLog());
        assertEquals(2, job.getExecutionLog().size());
    }

    @Test
    public void testExecutorExceptionBecomesFailure() {
        agent.then(j -> {
            throw new IllegalStateException("agent crashed");
        });

        ExecutionResult result = runner.run(job);
        assertFalse(result.isSucceeded());
        assertEquals("IllegalStateException: agent crashed", result.getErrorMessage());
        assertEquals(JobStatus.QUEUED, runner.decide(job, result, NOW));
        assertEquals(1, job.getRetryCount());
    }

    @Test
    public void testInterruptedRunIsNotCountedOrClassified() {
        agent.then(j -> ExecutionResult.interrupted("usage limit reached", Duration.ofSeconds(3)));

        ExecutionResult result = runner.run(job);
        assertTrue(result.isInterrupted());
        assertFalse(result.isRateLimited());

        assertEquals(JobStatus.QUEUED, runner.decide(job, result, NOW));
        assertEquals(0, job.getRetryCount());
        assertNull(job.getNotBeforeTime());
        assertEquals("Execution interrupted during shutdown", lastLog());
    }

    @Test
    public void testTimeoutIsAFailure() {
        agent.then(j -> ExecutionResult.timeout("partial", Duration.ofSeconds(60)));

        assertEquals(JobStatus.QUEUED, runner.decide(job, runner.run(job), NOW));
        assertTrue(lastLog().contains("Error: Execution timed out after 60s"));
        assertTrue(lastLog().endsWith("Output:\npartial"));
    }

    @Test
    public void testLongOutputIsTruncatedInLog() {
        agent.thenSucceed("x".repeat(JobRunner.MAX_LOGGED_OUTPUT + 100));

        runner.decide(job, runner.run(job), NOW);
        assertTrue(lastLog().endsWith("... (output truncated)"));
        assertTrue(lastLog().length() < JobRunner.MAX_LOGGED_OUTPUT + 100);
    }

    @Test
    public void testPrecomputedThrottleIsKept() {
        RateLimitInfo info = RateLimitInfo.limited("rate limit exceeded", NOW, NOW.plusHours(2));
        agent.then(j -> ExecutionResult.throttled("", info, Duration.ofSeconds(1)));

        runner.decide(job, runner.run(job), NOW);
        assertEquals(NOW.plusHours(2), job.getNotBeforeTime());
    }

    @Test
    public void testFormatElapsed() {
        assertEquals("0.0s", JobRunner.formatElapsed(Duration.ZERO));
        assertEquals("12.3s", JobRunner.formatElapsed(Duration.ofMillis(12_345)));
    }
}
