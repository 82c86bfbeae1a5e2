package com.promptqueue.core;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A prompt waiting to be handed to the external agent, together with everything
 * needed to run it and the history of its attempts.
 *
 * <p>The execution parameters ({@code workingDirectory}, {@code contextFiles}, {@code model},
 * {@code permissionMode}, {@code allowedTools}, {@code timeoutSeconds}, {@code vcsBookmark})
 * are carried opaquely; only the agent executor and the post-execution hook look at them.</p>
 *
 * <p><b>Thread Safety:</b> Job instances are not shared between threads. The scheduler
 * owns the instance it is executing.</p>
 *
 * @see JobStatus
 */
public class Job {
    public static final int DEFAULT_MAX_RETRIES = 3;

    /** Permission modes accepted by the agent command. */
    public static final Set<String> VALID_PERMISSION_MODES = Collections.unmodifiableSet(new TreeSet<>(List.of(
            "acceptEdits", "bypassPermissions", "default", "delegate", "dontAsk", "plan")));

    private String id;
    private String content = "";
    private int priority = 0;             // lower = served first
    private LocalDateTime createdAt;
    private JobStatus status = JobStatus.QUEUED;
    private int retryCount = 0;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private String workingDirectory = ".";
    private List<String> contextFiles = new ArrayList<>();
    private String model;
    private String permissionMode;
    private List<String> allowedTools;    // null = agent default
    private Integer timeoutSeconds;       // null = global timeout
    private String vcsBookmark;
    private Integer estimatedTokens;
    private LocalDateTime notBeforeTime;
    private LocalDateTime executionStartedAt;
    private LocalDateTime lastExecutedAt;
    private final List<LogEntry> executionLog = new ArrayList<>();

    public Job() {
    }

    public Job(String content) {
        this.content = content;
    }

    /**
     * Generate a fresh short identifier: the first 8 hex characters of a random UUID.
     * Uniqueness across the repository is checked by the store.
     *
     * @return a new candidate id
     */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Append a log entry stamped with the given time.
     *
     * @param now the time of the event
     * @param message the message; may span several lines
     */
    public void addLog(LocalDateTime now, String message) {
        executionLog.add(new LogEntry(now, message));
    }

    /**
     * Check whether the scheduler may select this job at {@code now}.
     *
     * @param now the current time
     * @return true if the job is QUEUED and its not-before time is unset or has passed
     */
    public boolean isEligibleAt(LocalDateTime now) {
        return status == JobStatus.QUEUED && (notBeforeTime == null || !notBeforeTime.isAfter(now));
    }

    /**
     * Create a new job carrying the same content and execution parameters.
     * Identity, status, counters, timestamps and log are not copied.
     *
     * @return a fresh QUEUED job without an id
     */
    public Job copyParameters() {
        Job copy = new Job(content);
        copy.priority = priority;
        copy.maxRetries = maxRetries;
        copy.workingDirectory = workingDirectory;
        copy.contextFiles = new ArrayList<>(contextFiles);
        copy.model = model;
        copy.permissionMode = permissionMode;
        copy.allowedTools = allowedTools == null ? null : new ArrayList<>(allowedTools);
        copy.timeoutSeconds = timeoutSeconds;
        copy.vcsBookmark = vcsBookmark;
        copy.estimatedTokens = estimatedTokens;
        return copy;
    }

    /**
     * First line of the content, shortened for listings.
     *
     * @param maxLength maximum length of the result
     * @return the summary
     */
    public String summary(int maxLength) {
        String firstLine = content.strip();
        int newline = firstLine.indexOf('\n');
        if (newline >= 0) {
            firstLine = firstLine.substring(0, newline).strip();
        }
        if (firstLine.length() <= maxLength) {
            return firstLine;
        }
        return firstLine.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content == null ? "" : content; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = Objects.requireNonNull(status, "status"); }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) {
        // counts attempts, so a job always gets at least one
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory == null ? "." : workingDirectory;
    }

    public List<String> getContextFiles() { return contextFiles; }
    public void setContextFiles(List<String> contextFiles) {
        this.contextFiles = contextFiles == null ? new ArrayList<>() : new ArrayList<>(contextFiles);
    }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getPermissionMode() { return permissionMode; }
    public void setPermissionMode(String permissionMode) {
        if (permissionMode != null && !VALID_PERMISSION_MODES.contains(permissionMode)) {
            throw new IllegalArgumentException("Invalid permission mode: " + permissionMode
                    + ". Must be one of: " + String.join(", ", VALID_PERMISSION_MODES));
        }
        this.permissionMode = permissionMode;
    }

    public List<String> getAllowedTools() { return allowedTools; }
    public void setAllowedTools(List<String> allowedTools) {
        this.allowedTools = allowedTools == null ? null : new ArrayList<>(allowedTools);
    }

    public Integer getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(Integer timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public String getVcsBookmark() { return vcsBookmark; }
    public void setVcsBookmark(String vcsBookmark) { this.vcsBookmark = vcsBookmark; }

    public Integer getEstimatedTokens() { return estimatedTokens; }
    public void setEstimatedTokens(Integer estimatedTokens) { this.estimatedTokens = estimatedTokens; }

    public LocalDateTime getNotBeforeTime() { return notBeforeTime; }
    public void setNotBeforeTime(LocalDateTime notBeforeTime) { this.notBeforeTime = notBeforeTime; }

    public LocalDateTime getExecutionStartedAt() { return executionStartedAt; }
    public void setExecutionStartedAt(LocalDateTime executionStartedAt) { this.executionStartedAt = executionStartedAt; }

    public LocalDateTime getLastExecutedAt() { return lastExecutedAt; }
    public void setLastExecutedAt(LocalDateTime lastExecutedAt) { this.lastExecutedAt = lastExecutedAt; }

    public List<LogEntry> getExecutionLog() { return Collections.unmodifiableList(executionLog); }

    /**
     * Replace the log wholesale. Used when a record is read back from storage.
     */
    public void setExecutionLog(List<LogEntry> entries) {
        executionLog.clear();
        if (entries != null) {
            executionLog.addAll(entries);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job)) {
            return false;
        }
        Job other = (Job) o;
        return priority == other.priority
                && retryCount == other.retryCount
                && maxRetries == other.maxRetries
                && status == other.status
                && Objects.equals(id, other.id)
                && Objects.equals(content, other.content)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(workingDirectory, other.workingDirectory)
                && Objects.equals(contextFiles, other.contextFiles)
                && Objects.equals(model, other.model)
                && Objects.equals(permissionMode, other.permissionMode)
                && Objects.equals(allowedTools, other.allowedTools)
                && Objects.equals(timeoutSeconds, other.timeoutSeconds)
                && Objects.equals(vcsBookmark, other.vcsBookmark)
                && Objects.equals(estimatedTokens, other.estimatedTokens)
                && Objects.equals(notBeforeTime, other.notBeforeTime)
                && Objects.equals(executionStartedAt, other.executionStartedAt)
                && Objects.equals(lastExecutedAt, other.lastExecutedAt)
                && executionLog.equals(other.executionLog);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, priority, createdAt);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", priority=" + priority
                + ", retries=" + retryCount + "/" + maxRetries + "}";
    }
}
