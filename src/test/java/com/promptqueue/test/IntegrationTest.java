package com.promptqueue.test;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.QueueState;
import com.promptqueue.engine.RateLimitDetector;
import com.promptqueue.engine.Scheduler;
import com.promptqueue.engine.ScriptedAgentExecutor;
import com.promptqueue.store.JobStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests running the scheduler loop on its own thread against a real
 * storage directory.
 *
 * Tests cover:
 * - Priority-ordered execution of submitted prompts
 * - Crash recovery of prompts left executing
 * - Throttled prompts waiting while others proceed
 * - Cancellation of the prompt in flight
 * - Graceful shutdown with a prompt in flight
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class IntegrationTest {

    @TempDir
    Path baseDir;

    private Clock clock;
    private JobStore store;
    private ScriptedAgentExecutor agent;
    private Scheduler scheduler;
    private Thread schedulerThread;

    @BeforeEach
    public void setUp() {
        clock = Clock.systemDefaultZone();
        store = JobStore.open(baseDir);
        agent = new ScriptedAgentExecutor();
        scheduler = new Scheduler(store, agent, new RateLimitDetector(clock), job -> { }, clock,
                Duration.ofMillis(100), Duration.ofSeconds(60));
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        if (scheduler != null) {
            scheduler.shutdown();
        }
        if (schedulerThread != null && schedulerThread.isAlive()) {
            schedulerThread.join(5000);
        }
    }

    private void startScheduler() {
        schedulerThread = new Thread(scheduler::start, "scheduler");
        schedulerThread.start();
    }

    private Job add(String content, int priority) throws IOException {
        Job job = new Job(content);
        job.setPriority(priority);
        return scheduler.addJob(job);
    }

    private JobStatus statusOf(String id) throws IOException {
        return store.findById(id).map(Job::getStatus).orElse(null);
    }

    private boolean waitForStatus(List<String> ids, JobStatus expected, Duration timeout)
            throws IOException, InterruptedException {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (System.currentTimeMillis() < deadline) {
            boolean all = true;
            for (String id : ids) {
                if (statusOf(id) != expected) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    /**
     * Submitted prompts all complete, in priority order.
     */
    @Test
    @Order(1)
    public void testPromptsRunInPriorityOrder() throws Exception {
        List<String> ids = new ArrayList<>();
        ids.add(add("third", 5).getId());
        ids.add(add("first", 0).getId());
        ids.add(add("second", 1).getId());

        startScheduler();

        assertTrue(waitForStatus(ids, JobStatus.COMPLETED, Duration.ofSeconds(10)),
                "All prompts should complete within 10 seconds");
        assertEquals(List.of(ids.get(1), ids.get(2), ids.get(0)), agent.getExecutedIds());
        assertEquals(3, scheduler.getState().getTotalCompleted());
    }

    /**
     * A prompt left EXECUTING by a dead process is recovered and run.
     */
    @Test
    @Order(2)
    public void testCrashRecovery() throws Exception {
        Job job = add("was running when the process died", 0);
        store.transition(job, JobStatus.EXECUTING);

        startScheduler();

        assertTrue(waitForStatus(List.of(job.getId()), JobStatus.COMPLETED, Duration.ofSeconds(10)));
        assertEquals(List.of(job.getId()), agent.getExecutedIds());
        assertEquals(0, store.findById(job.getId()).orElseThrow().getRetryCount());
    }

    /**
     * A throttled prompt waits for its reset time while lower-priority work proceeds.
     */
    @Test
    @Order(3)
    public void testThrottledPromptWaits() throws Exception {
        Job urgent = add("urgent", 0);
        Job later = add("later", 1);
        agent.thenOutput(false, "Claude AI usage limit reached");

        startScheduler();

        assertTrue(waitForStatus(List.of(later.getId()), JobStatus.COMPLETED, Duration.ofSeconds(10)));
        Job throttled = store.findById(urgent.getId()).orElseThrow();
        assertEquals(JobStatus.QUEUED, throttled.getStatus());
        assertEquals(0, throttled.getRetryCount());
        assertTrue(throttled.getNotBeforeTime().isAfter(LocalDateTime.now(clock)));

        QueueState state = scheduler.getState();
        assertEquals(1, state.getRateLimitedCount());
        assertEquals(1, state.getTotalCompleted());
    }

    /**
     * Cancelling the prompt in flight discards its result.
     */
    @Test
    @Order(4)
    public void testCancelInFlight() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        agent.then(job -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ExecutionResult.success("finished", Duration.ofSeconds(1));
        });
        Job job = add("slow prompt", 0);

        startScheduler();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.EXECUTING, statusOf(job.getId()));

        assertTrue(scheduler.cancelJob(job.getId()));
        release.countDown();

        assertTrue(waitForStatus(List.of(job.getId()), JobStatus.CANCELLED, Duration.ofSeconds(5)));
        assertEquals(1, scheduler.getState().getTotalCancelled());
        assertEquals(0, scheduler.getState().getTotalCompleted());
    }

    /**
     * Shutdown lets the prompt in flight finish and commits it before the loop exits.
     */
    @Test
    @Order(5)
    public void testGracefulShutdown() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        agent.then(job -> {
            started.countDown();
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ExecutionResult.success("finished", Duration.ofMillis(300));
        });
        Job inFlight = add("in flight at shutdown", 0);
        Job waiting = add("never started", 1);

        startScheduler();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        scheduler.shutdown();
        schedulerThread.join(5000);

        assertFalse(schedulerThread.isAlive(), "Scheduler thread should exit after shutdown");
        assertFalse(scheduler.isRunning());
        assertEquals(JobStatus.COMPLETED, statusOf(inFlight.getId()));
        assertEquals(JobStatus.QUEUED, statusOf(waiting.getId()));
        assertEquals(List.of(inFlight.getId()), agent.getExecutedIds());
    }
}
