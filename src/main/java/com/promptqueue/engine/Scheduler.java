package com.promptqueue.engine;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.InvalidTransitionException;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.QueueState;
import com.promptqueue.store.JobStore;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The queue engine: selects the next job, runs it and commits the outcome.
 *
 * <p>The Scheduler polls the pending bucket, picks the best eligible job, hands it to a
 * {@link JobRunner} and commits the resulting transition through the {@link JobStore}.
 * Exactly one job is in flight at a time.</p>
 *
 * <p><b>Selection:</b> among QUEUED jobs whose not-before time is unset or has passed,
 * the lowest priority value wins; ties go to the earliest creation time, then the id.</p>
 *
 * <p><b>Idle sleep:</b></p>
 * <ul>
 *   <li>Throttled: until the estimated reset plus a buffer. When that moment has already
 *       passed, one poll interval.</li>
 *   <li>Otherwise: the poll interval, shortened to the earliest future not-before time.</li>
 * </ul>
 * <p>The throttled flag is cleared when the next execution starts, so a manual
 * {@code next} can try before the estimated reset.</p>
 *
 * <p><b>Error Handling:</b></p>
 * <ul>
 *   <li>IOException in a cycle: logged, 2-second backoff, loop continues</li>
 *   <li>Record removed while executing: result discarded with a warning</li>
 *   <li>Post-execution hook failure: logged as a warning, status unchanged</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> the loop runs on one dedicated thread. {@link #cancelJob},
 * {@link #addJob} and {@link #shutdown} may be called from other threads; store and state
 * mutations are serialized on an internal lock that is not held while the agent runs.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Scheduler scheduler = new Scheduler(store, executor, detector, hook, clock,
 *         Duration.ofSeconds(30), Duration.ofSeconds(60));
 * Thread loop = new Thread(scheduler::start, "scheduler");
 * loop.start();
 * ...
 * scheduler.shutdown();   // the running job finishes and is committed
 * loop.join();
 * }</pre>
 *
 * @see JobRunner
 * @see JobStore
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    static final Duration STORAGE_ERROR_BACKOFF = Duration.ofSeconds(2);
    static final Duration UNEXPECTED_ERROR_BACKOFF = Duration.ofSeconds(1);

    /** Selection order: priority, then creation time, then id. */
    public static final Comparator<Job> SELECTION_ORDER = Comparator
            .comparingInt(Job::getPriority)
            .thenComparing(Job::getCreatedAt)
            .thenComparing(Job::getId);

    private final JobStore store;
    private final AgentExecutor executor;
    private final JobRunner runner;
    private final PostExecutionHook hook;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration rateLimitBuffer;

    private final Object lock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();
    private volatile String inFlightJobId;
    private QueueState state;

    public Scheduler(JobStore store, AgentExecutor executor, RateLimitDetector detector, Clock clock) {
        this(store, executor, detector, PostExecutionHook.none(), clock,
                Duration.ofSeconds(30), Duration.ofSeconds(60));
    }

    /**
     * Create a new Scheduler.
     *
     * @param store the job repository
     * @param executor runs the agent
     * @param detector classifies agent output
     * @param hook side effect after a successful run
     * @param clock source of the current time
     * @param pollInterval sleep between cycles when nothing is eligible
     * @param rateLimitBuffer added to the estimated reset time before waking up
     */
    public Scheduler(JobStore store, AgentExecutor executor, RateLimitDetector detector, PostExecutionHook hook,
                     Clock clock, Duration pollInterval, Duration rateLimitBuffer) {
        this.store = store;
        this.executor = executor;
        this.runner = new JobRunner(executor, detector);
        this.hook = hook;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.rateLimitBuffer = rateLimitBuffer;
        logger.fine("Scheduler created (poll " + pollInterval.getSeconds() + "s, buffer "
                + rateLimitBuffer.getSeconds() + "s)");
    }

    /**
     * Put jobs left EXECUTING by a previous process back in the queue.
     * Only a process that is about to execute jobs may call this.
     *
     * @return number of recovered jobs
     * @throws IOException if the pending bucket cannot be read or rewritten
     */
    public int recoverInterrupted() throws IOException {
        synchronized (lock) {
            int recovered = store.recoverInterrupted();
            if (recovered > 0) {
                logger.info("Recovered " + recovered + " interrupted jobs");
            }
            return recovered;
        }
    }

    /**
     * Run the polling loop until {@link #shutdown()} is called.
     *
     * <p><b>BLOCKING METHOD:</b> call it from a dedicated thread. Crash recovery runs
     * first; a failure there is logged and the loop starts anyway.</p>
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Scheduler is already running");
            return;
        }
        if (shutdownLatch.getCount() == 0) {
            logger.warning("Scheduler was shut down and cannot be restarted");
            running.set(false);
            return;
        }
        logger.info("Scheduler started");

        try {
            recoverInterrupted();
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to recover interrupted jobs", e);
        }

        // MAIN SCHEDULING LOOP
        while (running.get()) {
            try {
                Duration sleep = runCycle();
                if (!sleep.isZero() && running.get()) {
                    logger.fine("Nothing eligible, sleeping " + sleep.getSeconds() + "s");
                    awaitShutdown(sleep);
                }
            } catch (InterruptedException e) {
                logger.info("Scheduler interrupted, shutting down gracefully");
                Thread.currentThread().interrupt();
                break;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Storage error in scheduling loop", e);
                if (!backOff(STORAGE_ERROR_BACKOFF)) {
                    break;
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error in scheduling loop", e);
                if (!backOff(UNEXPECTED_ERROR_BACKOFF)) {
                    break;
                }
            }
        }

        running.set(false);
        logger.info("Scheduler loop exited");
    }

    /**
     * One poll cycle: process the next eligible job, or work out how long to sleep.
     *
     * @return zero after processing a job, else the time to wait before the next cycle
     * @throws IOException if the store fails
     */
    public Duration runCycle() throws IOException {
        if (processNext().isPresent()) {
            return Duration.ZERO;
        }
        synchronized (lock) {
            refreshState();
            return computeSleep(state, store.loadPending(), now());
        }
    }

    /**
     * Select and run at most one eligible job, committing its outcome.
     *
     * @return the job as committed, or empty if nothing was eligible or the result had
     *         to be discarded
     * @throws IOException if the store fails
     */
    public Optional<Job> processNext() throws IOException {
        Job job;
        synchronized (lock) {
            refreshState();
            LocalDateTime now = now();
            Optional<Job> next = selectNext(store.loadPending(), now);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            job = next.get();

            if (state.clearRateLimit()) {
                logger.info("Clearing rate limit, retrying optimistically with job " + job.getId());
            }
            job.setExecutionStartedAt(now);
            job.setLastExecutedAt(now);
            job.addLog(now, "Started execution (attempt " + (job.getRetryCount() + 1) + "/"
                    + job.getMaxRetries() + ")");
            store.transition(job, JobStatus.EXECUTING);
            store.saveState(state);
            inFlightJobId = job.getId();
        }

        ExecutionResult result;
        try {
            result = runner.run(job);
        } catch (RuntimeException e) {
            synchronized (lock) {
                inFlightJobId = null;
                cancelRequests.remove(job.getId());
            }
            throw e;
        }

        synchronized (lock) {
            try {
                return commit(job, result);
            } finally {
                inFlightJobId = null;
                cancelRequests.remove(job.getId());
            }
        }
    }

    private Optional<Job> commit(Job job, ExecutionResult result) throws IOException {
        String jobId = job.getId();
        refreshState();
        LocalDateTime now = now();

        Optional<Path> current = store.pathOf(jobId);
        if (current.isEmpty()) {
            logger.warning("Record for job " + jobId + " disappeared during execution, discarding result");
            return Optional.empty();
        }
        if (store.statusOf(current.get()) != JobStatus.EXECUTING) {
            logger.warning("Job " + jobId + " was changed to " + store.statusOf(current.get())
                    + " during execution, discarding result");
            return Optional.empty();
        }

        JobStatus target;
        if (cancelRequests.contains(jobId)) {
            logger.info("Job " + jobId + " was cancelled while executing, discarding result");
            job.addLog(now, "Cancelled during execution; result discarded");
            target = JobStatus.CANCELLED;
        } else {
            target = runner.decide(job, result, now);
        }

        try {
            store.transition(job, target);
        } catch (NoSuchFileException e) {
            logger.warning("Record for job " + jobId + " disappeared during execution, discarding result");
            return Optional.empty();
        }

        switch (target) {
            case COMPLETED -> state.incrementCompleted();
            case FAILED -> state.incrementFailed();
            case CANCELLED -> state.incrementCancelled();
            case QUEUED -> {
                if (result.isRateLimited()) {
                    state.markRateLimited(result.getRateLimitInfo());
                }
            }
            default -> throw new InvalidTransitionException(jobId, JobStatus.EXECUTING, target);
        }
        if (!result.isInterrupted()) {
            state.setLastProcessedAt(now);
        }
        store.saveState(state);
        logger.info("Job " + jobId + " committed as " + target);

        if (target == JobStatus.COMPLETED) {
            runHook(job);
        }
        return Optional.of(job);
    }

    private void runHook(Job job) {
        try {
            hook.afterSuccess(job);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Post-execution hook failed for job " + job.getId(), e);
        }
    }

    // ==================== SELECTION ====================

    /**
     * Pick the job to run next.
     *
     * @param pending records of the pending bucket
     * @param now the current time
     * @return the eligible job with the lowest (priority, createdAt, id), if any
     */
    public static Optional<Job> selectNext(List<Job> pending, LocalDateTime now) {
        return pending.stream()
                .filter(job -> job.isEligibleAt(now))
                .min(SELECTION_ORDER);
    }

    /**
     * How long to sleep when nothing is eligible.
     *
     * @param state the current queue state
     * @param pending records of the pending bucket
     * @param now the current time
     * @return a positive duration
     */
    public Duration computeSleep(QueueState state, List<Job> pending, LocalDateTime now) {
        if (state.isRateLimited() && state.getEstimatedResetAt() != null) {
            LocalDateTime wake = state.getEstimatedResetAt().plus(rateLimitBuffer);
            if (wake.isAfter(now)) {
                return Duration.between(now, wake);
            }
            return pollInterval;
        }

        Duration sleep = pollInterval;
        for (Job job : pending) {
            LocalDateTime notBefore = job.getNotBeforeTime();
            if (job.getStatus() == JobStatus.QUEUED && notBefore != null && notBefore.isAfter(now)) {
                Duration untilEligible = Duration.between(now, notBefore);
                if (untilEligible.compareTo(sleep) < 0) {
                    sleep = untilEligible;
                }
            }
        }
        return sleep;
    }

    // ==================== QUEUE OPERATIONS ====================

    /**
     * Add a new job to the queue.
     *
     * @param job the job parameters; id, status and creation time are assigned here
     * @return the stored job
     * @throws IOException if the record cannot be written
     */
    public Job addJob(Job job) throws IOException {
        synchronized (lock) {
            refreshState();
            job.setCreatedAt(null);
            Job created = store.create(job, now());
            state.incrementAdded();
            store.saveState(state);
            return created;
        }
    }

    /**
     * Move a prompt file into the queue, keeping the parameters its header names.
     *
     * @param source a Markdown prompt file outside the storage directory
     * @return the stored job
     * @throws IOException if the file is not a usable prompt or cannot be moved
     * @see JobStore#importFile(Path, LocalDateTime)
     */
    public Job importJob(Path source) throws IOException {
        synchronized (lock) {
            refreshState();
            Job created = store.importFile(source, now());
            state.incrementAdded();
            store.saveState(state);
            return created;
        }
    }

    /**
     * Cancel a job. A job executing in this scheduler finishes its run, then its result
     * is discarded and it is committed as CANCELLED.
     *
     * @param jobId the job id
     * @return true if the job was cancelled or a cancellation was requested, false if no
     *         such job exists
     * @throws InvalidTransitionException if the job is already finished
     * @throws IOException if the store fails
     */
    public boolean cancelJob(String jobId) throws IOException {
        synchronized (lock) {
            if (jobId.equals(inFlightJobId)) {
                cancelRequests.add(jobId);
                logger.info("Cancellation requested for executing job " + jobId);
                return true;
            }
            refreshState();
            Optional<Job> found = store.findById(jobId);
            if (found.isEmpty()) {
                return false;
            }
            Job job = found.get();
            if (!job.getStatus().canTransitionTo(JobStatus.CANCELLED)) {
                throw new InvalidTransitionException(jobId, job.getStatus(), JobStatus.CANCELLED);
            }
            job.addLog(now(), "Cancelled by user");
            store.transition(job, JobStatus.CANCELLED);
            state.incrementCancelled();
            store.saveState(state);
            logger.info("Cancelled job " + jobId);
            return true;
        }
    }

    /**
     * Delete a job record permanently. Refused while the job is executing.
     *
     * @param jobId the job id
     * @return true if a record was deleted
     * @throws IllegalStateException if the job is executing
     * @throws IOException if the store fails
     */
    public boolean deleteJob(String jobId) throws IOException {
        synchronized (lock) {
            Optional<Path> path = store.pathOf(jobId);
            if (path.isEmpty()) {
                return false;
            }
            if (jobId.equals(inFlightJobId) || store.statusOf(path.get()) == JobStatus.EXECUTING) {
                throw new IllegalStateException("Job " + jobId + " is executing and cannot be deleted");
            }
            return store.delete(jobId);
        }
    }

    /**
     * Queue a fresh copy of an existing job's parameters.
     *
     * @param jobId the job to copy
     * @param deleteOriginal remove the original record once the copy is stored
     * @return the new job, or empty if {@code jobId} is unknown
     * @throws IllegalStateException if deletion is requested for an executing job
     * @throws IOException if the store fails
     */
    public Optional<Job> retryJob(String jobId, boolean deleteOriginal) throws IOException {
        synchronized (lock) {
            Optional<Job> found = store.findById(jobId);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            Job original = found.get();
            if (deleteOriginal && (original.getStatus() == JobStatus.EXECUTING || jobId.equals(inFlightJobId))) {
                throw new IllegalStateException("Job " + jobId + " is executing and cannot be deleted");
            }
            Job copy = addJob(original.copyParameters());
            logger.info("Job " + jobId + " retried as " + copy.getId());
            if (deleteOriginal) {
                store.delete(jobId);
            }
            return Optional.of(copy);
        }
    }

    /**
     * Current queue state as last read from or written to the store.
     */
    public QueueState getState() throws IOException {
        synchronized (lock) {
            refreshState();
            return state;
        }
    }

    // ==================== LIFECYCLE ====================

    /**
     * Stop selecting new jobs and wake the loop from any sleep. The job in flight, if
     * any, runs to completion and is committed before {@link #start()} returns.
     */
    public void shutdown() {
        logger.info("Shutting down scheduler...");
        running.set(false);
        shutdownLatch.countDown();
    }

    /**
     * Kill the job in flight. Its run is committed as interrupted: back in the queue,
     * attempt not counted.
     */
    public void abortInFlight() {
        String jobId = inFlightJobId;
        if (jobId != null) {
            logger.warning("Aborting in-flight job " + jobId);
        }
        executor.abort();
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getInFlightJobId() {
        return inFlightJobId;
    }

    private void refreshState() throws IOException {
        // other processes (the CLI) update counters between cycles
        state = store.loadState();
    }

    private void awaitShutdown(Duration duration) throws InterruptedException {
        shutdownLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean backOff(Duration duration) {
        try {
            awaitShutdown(duration);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
