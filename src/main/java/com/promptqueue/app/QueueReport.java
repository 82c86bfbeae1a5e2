package com.promptqueue.app;

import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.LogEntry;
import com.promptqueue.core.QueueState;
import com.promptqueue.engine.Scheduler;

import org.json.JSONArray;
import org.json.JSONObject;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the queue for the {@code status} and {@code list} commands, as text or JSON.
 * Aggregations use the Streams API over the loaded jobs.
 */
public class QueueReport {
    private static final int SUMMARY_LENGTH = 70;

    private final QueueState state;
    private final List<Job> jobs;

    public QueueReport(QueueState state, List<Job> jobs) {
        this.state = state;
        this.jobs = jobs;
    }

    /**
     * Count jobs per status, with every status present.
     */
    public Map<JobStatus, Long> getStatusCounts() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        counts.putAll(jobs.stream().collect(Collectors.groupingBy(Job::getStatus, Collectors.counting())));
        return counts;
    }

    /**
     * Jobs matching a filter, in selection order.
     *
     * @param status only this status, or null for all
     * @param includeCompleted whether completed jobs are listed when no status is given
     */
    public List<Job> filter(JobStatus status, boolean includeCompleted) {
        return jobs.stream()
                .filter(job -> status != null
                        ? job.getStatus() == status
                        : includeCompleted || job.getStatus() != JobStatus.COMPLETED)
                .sorted(Scheduler.SELECTION_ORDER)
                .collect(Collectors.toList());
    }

    // ==================== TEXT ====================

    public String statusText(boolean detailed) {
        StringBuilder sb = new StringBuilder();
        sb.append("Prompt Queue Status\n");
        sb.append("=".repeat(40)).append('\n');
        sb.append("Total prompts: ").append(jobs.size()).append('\n');
        sb.append("Total added: ").append(state.getTotalAdded()).append('\n');
        sb.append("Total completed: ").append(state.getTotalCompleted()).append('\n');
        sb.append("Total failed: ").append(state.getTotalFailed()).append('\n');
        sb.append("Total cancelled: ").append(state.getTotalCancelled()).append('\n');
        sb.append("Rate limited count: ").append(state.getRateLimitedCount()).append('\n');
        if (state.getLastProcessedAt() != null) {
            sb.append("Last processed: ").append(LogEntry.TIMESTAMP_FORMAT.format(state.getLastProcessedAt()))
                    .append('\n');
        }

        sb.append("\nStatus breakdown:\n");
        getStatusCounts().forEach((status, count) -> {
            if (count > 0) {
                sb.append("  ").append(status).append(": ").append(count).append('\n');
            }
        });

        if (state.isRateLimited()) {
            sb.append("\nRate limited");
            if (state.getEstimatedResetAt() != null) {
                sb.append(" until: ").append(LogEntry.TIMESTAMP_FORMAT.format(state.getEstimatedResetAt()));
            }
            sb.append('\n');
            if (state.getLastLimitMessage() != null) {
                sb.append("Message: ").append(state.getLastLimitMessage()).append('\n');
            }
        }

        if (detailed) {
            List<Job> failed = jobs.stream()
                    .filter(job -> job.getStatus() == JobStatus.FAILED)
                    .sorted(Comparator.comparing(Job::getCreatedAt))
                    .collect(Collectors.toList());
            if (failed.isEmpty()) {
                sb.append("\nNo failed prompts\n");
            } else {
                sb.append("\nFailed prompts (by creation date):\n").append("-".repeat(80)).append('\n');
                for (Job job : failed) {
                    appendDetail(sb, job);
                }
            }

            List<Job> others = jobs.stream()
                    .filter(job -> job.getStatus() != JobStatus.FAILED)
                    .sorted(Scheduler.SELECTION_ORDER)
                    .collect(Collectors.toList());
            if (!others.isEmpty()) {
                sb.append("\nOther prompts (by priority):\n").append("-".repeat(80)).append('\n');
                for (Job job : others) {
                    appendDetail(sb, job);
                }
            }
        }
        return sb.toString();
    }

    public String listText(List<Job> selected, LocalDateTime now) {
        if (selected.isEmpty()) {
            return "No prompts found\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(selected.size()).append(" prompt(s):\n\n");
        for (Job job : selected) {
            sb.append(job.getId()).append("  P").append(job.getPriority()).append("  ")
                    .append(job.getStatus()).append("  ").append(job.summary(SUMMARY_LENGTH)).append('\n');
            if (job.getRetryCount() > 0) {
                sb.append("    retries: ").append(job.getRetryCount()).append('/').append(job.getMaxRetries())
                        .append('\n');
            }
            if (job.getNotBeforeTime() != null && job.getNotBeforeTime().isAfter(now)) {
                sb.append("    not before: ").append(LogEntry.TIMESTAMP_FORMAT.format(job.getNotBeforeTime()))
                        .append('\n');
            }
            if (job.getEstimatedTokens() != null) {
                sb.append("    estimated tokens: ").append(job.getEstimatedTokens()).append('\n');
            }
        }
        return sb.toString();
    }

    private static void appendDetail(StringBuilder sb, Job job) {
        sb.append(job.getId()).append(" (P").append(job.getPriority()).append(") - ").append(job.getStatus())
                .append('\n');
        sb.append("   ").append(job.summary(SUMMARY_LENGTH)).append('\n');
        sb.append("   Created: ").append(LogEntry.TIMESTAMP_FORMAT.format(job.getCreatedAt())).append('\n');
        sb.append("   Retries: ").append(job.getRetryCount()).append('/').append(job.getMaxRetries()).append('\n');
        sb.append("   Working directory: ").append(job.getWorkingDirectory()).append('\n');
        List<LogEntry> log = job.getExecutionLog();
        if (!log.isEmpty()) {
            String last = log.get(log.size() - 1).format();
            int newline = last.indexOf('\n');
            sb.append("   Last log: ").append(newline < 0 ? last : last.substring(0, newline)).append('\n');
        }
        sb.append('\n');
    }

    // ==================== JSON ====================

    public JSONObject statusJson() {
        JSONObject json = new JSONObject();
        json.put("total_prompts", jobs.size());
        json.put("total_added", state.getTotalAdded());
        json.put("total_completed", state.getTotalCompleted());
        json.put("total_failed", state.getTotalFailed());
        json.put("total_cancelled", state.getTotalCancelled());
        json.put("rate_limited_count", state.getRateLimitedCount());
        json.put("last_processed", timestamp(state.getLastProcessedAt()));

        JSONObject counts = new JSONObject();
        getStatusCounts().forEach((status, count) -> counts.put(status.getDisplayName(), count));
        json.put("status_counts", counts);

        JSONObject rateLimit = new JSONObject();
        rateLimit.put("is_rate_limited", state.isRateLimited());
        rateLimit.put("reset_time", timestamp(state.getEstimatedResetAt()));
        rateLimit.put("message", state.getLastLimitMessage() == null ? JSONObject.NULL : state.getLastLimitMessage());
        json.put("current_rate_limit", rateLimit);
        return json;
    }

    public JSONArray listJson(List<Job> selected) {
        JSONArray array = new JSONArray();
        for (Job job : selected) {
            JSONObject json = new JSONObject();
            json.put("id", job.getId());
            json.put("content", job.getContent());
            json.put("status", job.getStatus().getDisplayName());
            json.put("priority", job.getPriority());
            json.put("working_directory", job.getWorkingDirectory());
            json.put("context_files", new JSONArray(job.getContextFiles()));
            json.put("created_at", timestamp(job.getCreatedAt()));
            json.put("retry_count", job.getRetryCount());
            json.put("max_retries", job.getMaxRetries());
            json.put("not_before", timestamp(job.getNotBeforeTime()));
            json.put("last_executed", timestamp(job.getLastExecutedAt()));
            json.put("estimated_tokens", job.getEstimatedTokens() == null ? JSONObject.NULL : job.getEstimatedTokens());
            json.put("model", job.getModel() == null ? JSONObject.NULL : job.getModel());
            json.put("bookmark", job.getVcsBookmark() == null ? JSONObject.NULL : job.getVcsBookmark());
            array.put(json);
        }
        return array;
    }

    private static Object timestamp(LocalDateTime value) {
        return value == null ? JSONObject.NULL : value.toString();
    }
}
