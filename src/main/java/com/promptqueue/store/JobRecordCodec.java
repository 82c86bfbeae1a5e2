package com.promptqueue.store;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.LogEntry;

import java.lang.reflect.Type;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the on-disk form of a job record.
 *
 * <p>A record is a key/value header between {@code ---} lines, followed by the prompt
 * content, followed by the execution log:</p>
 * <pre>
 * ---
 * id: 1a2b3c4d
 * status: queued
 * priority: 0
 * created_at: 2026-10-19T14:30:00
 * context_files: ["src/Main.java"]
 * ---
 * Refactor the parser.
 * ## Execution Log
 * [2026-10-19 14:35:12] Execution completed in 12.4s - FAILED (will retry, attempt 1/3)
 *   Error: exit code 1
 * </pre>
 *
 * <p><b>Encoding rules:</b></p>
 * <ul>
 *   <li>Null optional fields are omitted.</li>
 *   <li>Strings are written raw unless they are empty, span lines, carry surrounding
 *       whitespace or start with a quote or bracket; those are JSON-quoted.</li>
 *   <li>Lists are JSON arrays.</li>
 *   <li>Continuation lines of a multi-line log entry are indented by two spaces, so the
 *       log marker can never appear at the start of a line inside the log.</li>
 * </ul>
 *
 * <p>The content is everything between the header and the <i>last</i> marker line, so
 * content may itself contain the marker text.</p>
 */
public class JobRecordCodec {
    static final String HEADER_FENCE = "---";
    static final String LOG_MARKER = "## Execution Log";

    private static final String CONTINUATION_INDENT = "  ";
    private static final Pattern LOG_LINE = Pattern.compile("^\\[(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2})\\] ?(.*)$");
    private static final Type STRING_LIST = new TypeToken<List<String>>() { }.getType();

    private final Gson gson = new Gson();

    /**
     * Render a job as record text.
     *
     * @param job the job to encode; must have an id and a creation time
     * @return the full file content
     */
    public String encode(Job job) {
        if (job.getId() == null || job.getCreatedAt() == null) {
            throw new IllegalArgumentException("Job must have an id and creation time before it is stored");
        }

        StringBuilder sb = new StringBuilder();
        sb.append(HEADER_FENCE).append('\n');
        header(sb, "id", job.getId());
        header(sb, "status", job.getStatus().getDisplayName());
        header(sb, "priority", Integer.toString(job.getPriority()));
        header(sb, "created_at", job.getCreatedAt().toString());
        header(sb, "retry_count", Integer.toString(job.getRetryCount()));
        header(sb, "max_retries", Integer.toString(job.getMaxRetries()));
        header(sb, "working_directory", encodeString(job.getWorkingDirectory()));
        if (!job.getContextFiles().isEmpty()) {
            header(sb, "context_files", gson.toJson(job.getContextFiles()));
        }
        optional(sb, "model", job.getModel());
        optional(sb, "permission_mode", job.getPermissionMode());
        if (job.getAllowedTools() != null) {
            header(sb, "allowed_tools", gson.toJson(job.getAllowedTools()));
        }
        if (job.getTimeoutSeconds() != null) {
            header(sb, "timeout", job.getTimeoutSeconds().toString());
        }
        optional(sb, "bookmark", job.getVcsBookmark());
        if (job.getEstimatedTokens() != null) {
            header(sb, "estimated_tokens", job.getEstimatedTokens().toString());
        }
        timestamp(sb, "not_before", job.getNotBeforeTime());
        timestamp(sb, "execution_started_at", job.getExecutionStartedAt());
        timestamp(sb, "last_executed", job.getLastExecutedAt());
        sb.append(HEADER_FENCE).append('\n');

        sb.append(job.getContent()).append('\n');

        sb.append(LOG_MARKER).append('\n');
        for (LogEntry entry : job.getExecutionLog()) {
            String[] lines = entry.getMessage().split("\n", -1);
            sb.append('[').append(LogEntry.TIMESTAMP_FORMAT.format(entry.getTimestamp())).append("] ")
                    .append(lines[0]).append('\n');
            for (int i = 1; i < lines.length; i++) {
                sb.append(CONTINUATION_INDENT).append(lines[i]).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Parse record text back into a job.
     *
     * @param text the full file content
     * @return the decoded job, with the status taken from the header
     * @throws CorruptRecordException if the text is not a well-formed record
     */
    public Job decode(String text) throws CorruptRecordException {
        if (text.startsWith(HEADER_FENCE + "\r\n")) {
            text = text.replace("\r\n", "\n");
        }
        if (!text.startsWith(HEADER_FENCE + "\n")) {
            throw new CorruptRecordException("Record does not start with a header fence");
        }
        int headerStart = HEADER_FENCE.length() + 1;
        int headerEnd = text.indexOf("\n" + HEADER_FENCE + "\n", headerStart - 1);
        if (headerEnd < 0) {
            throw new CorruptRecordException("Record header is not terminated");
        }

        Map<String, String> fields = parseHeader(headerStart <= headerEnd ? text.substring(headerStart, headerEnd) : "");
        String body = text.substring(headerEnd + HEADER_FENCE.length() + 2);

        String markerLine = LOG_MARKER + "\n";
        int marker = ("\n" + body).lastIndexOf("\n" + markerLine);
        if (marker < 0) {
            throw new CorruptRecordException("Record has no execution log section");
        }
        // marker is an index into "\n" + body, i.e. one past the newline ending the content
        String content = marker == 0 ? "" : body.substring(0, marker - 1);
        String logText = body.substring(marker + markerLine.length());

        try {
            Job job = new Job(content);
            job.setId(required(fields, "id"));
            job.setStatus(JobStatus.fromDisplayName(required(fields, "status")));
            job.setPriority(Integer.parseInt(required(fields, "priority")));
            job.setCreatedAt(LocalDateTime.parse(required(fields, "created_at")));
            applyOptionalFields(job, fields);
            job.setExecutionLog(parseLog(logText));
            return job;
        } catch (NumberFormatException | DateTimeParseException | JsonParseException e) {
            throw new CorruptRecordException("Invalid header value: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CorruptRecordException(e.getMessage(), e);
        }
    }

    /**
     * Whether the text is a hand-written prompt rather than a stored record: it has no
     * header at all, or a header without an {@code id}.
     */
    public boolean isDraft(String text) {
        String normalized = text.replace("\r\n", "\n");
        if (!normalized.startsWith(HEADER_FENCE + "\n")) {
            return true;
        }
        int headerEnd = normalized.indexOf("\n" + HEADER_FENCE + "\n", HEADER_FENCE.length());
        if (headerEnd < 0) {
            return false;
        }
        String header = normalized.substring(HEADER_FENCE.length() + 1, Math.max(headerEnd, HEADER_FENCE.length() + 1));
        for (String line : header.split("\n")) {
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).strip().equals("id")) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parse a hand-written prompt.
     *
     * <p>The whole text is the prompt, unless it opens with a header, in which case the
     * header fields that are present are honoured and everything else takes its default.
     * Status, counters and log are never taken from a draft: the result is a fresh QUEUED
     * job without an id.</p>
     *
     * @param text the file content
     * @param defaultCreatedAt creation time to use when the header has none
     * @return the job
     * @throws CorruptRecordException if the header is present but malformed, or the
     *         prompt is empty
     */
    public Job decodeDraft(String text, LocalDateTime defaultCreatedAt) throws CorruptRecordException {
        String normalized = text.replace("\r\n", "\n");
        Map<String, String> fields = new LinkedHashMap<>();
        String content = normalized;
        if (normalized.startsWith(HEADER_FENCE + "\n")) {
            int headerEnd = normalized.indexOf("\n" + HEADER_FENCE + "\n", HEADER_FENCE.length());
            if (headerEnd < 0) {
                throw new CorruptRecordException("Prompt header is not terminated");
            }
            fields = parseHeader(normalized.substring(HEADER_FENCE.length() + 1, Math.max(headerEnd, HEADER_FENCE.length() + 1)));
            content = normalized.substring(headerEnd + HEADER_FENCE.length() + 2);
        }
        int marker = ("\n" + content).lastIndexOf("\n" + LOG_MARKER + "\n");
        if (marker >= 0) {
            content = marker == 0 ? "" : content.substring(0, marker - 1);
        }
        content = content.strip();
        if (content.isEmpty()) {
            throw new CorruptRecordException("Prompt is empty");
        }

        try {
            Job job = new Job(content);
            job.setStatus(JobStatus.QUEUED);
            job.setPriority(Integer.parseInt(fields.getOrDefault("priority", "0").strip()));
            String created = fields.get("created_at");
            job.setCreatedAt(created == null ? defaultCreatedAt : LocalDateTime.parse(created.strip()));
            applyOptionalFields(job, fields);
            job.setRetryCount(0);
            job.setNotBeforeTime(null);
            job.setExecutionStartedAt(null);
            job.setLastExecutedAt(null);
            return job;
        } catch (NumberFormatException | DateTimeParseException | JsonParseException e) {
            throw new CorruptRecordException("Invalid header value: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CorruptRecordException(e.getMessage(), e);
        }
    }

    private void applyOptionalFields(Job job, Map<String, String> fields) {
        job.setRetryCount(Integer.parseInt(fields.getOrDefault("retry_count", "0")));
        job.setMaxRetries(Integer.parseInt(fields.getOrDefault("max_retries", Integer.toString(Job.DEFAULT_MAX_RETRIES))));
        job.setWorkingDirectory(decodeString(fields.getOrDefault("working_directory", ".")));
        if (fields.containsKey("context_files")) {
            job.setContextFiles(gson.fromJson(fields.get("context_files"), STRING_LIST));
        }
        job.setModel(decodeString(fields.get("model")));
        job.setPermissionMode(decodeString(fields.get("permission_mode")));
        if (fields.containsKey("allowed_tools")) {
            job.setAllowedTools(gson.fromJson(fields.get("allowed_tools"), STRING_LIST));
        }
        job.setTimeoutSeconds(optionalInt(fields.get("timeout")));
        job.setVcsBookmark(decodeString(fields.get("bookmark")));
        job.setEstimatedTokens(optionalInt(fields.get("estimated_tokens")));
        job.setNotBeforeTime(optionalTimestamp(fields.get("not_before")));
        job.setExecutionStartedAt(optionalTimestamp(fields.get("execution_started_at")));
        job.setLastExecutedAt(optionalTimestamp(fields.get("last_executed")));
    }

    private Map<String, String> parseHeader(String headerText) throws CorruptRecordException {
        Map<String, String> fields = new LinkedHashMap<>();
        if (headerText.isEmpty()) {
            return fields;
        }
        for (String line : headerText.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new CorruptRecordException("Malformed header line: " + line);
            }
            String value = line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            fields.put(line.substring(0, colon).strip(), value);
        }
        return fields;
    }

    private List<LogEntry> parseLog(String logText) throws CorruptRecordException {
        List<LogEntry> entries = new ArrayList<>();
        if (logText.isEmpty()) {
            return entries;
        }
        String[] lines = logText.split("\n", -1);
        // the log always ends with a newline, leaving one empty trailing element
        int count = lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;

        LocalDateTime timestamp = null;
        StringBuilder message = null;
        for (int i = 0; i < count; i++) {
            String line = lines[i];
            Matcher m = LOG_LINE.matcher(line);
            if (m.matches()) {
                if (message != null) {
                    entries.add(new LogEntry(timestamp, message.toString()));
                }
                timestamp = LocalDateTime.parse(m.group(1), LogEntry.TIMESTAMP_FORMAT);
                message = new StringBuilder(m.group(2));
            } else if (message != null && line.startsWith(CONTINUATION_INDENT)) {
                message.append('\n').append(line.substring(CONTINUATION_INDENT.length()));
            } else if (message != null && line.isEmpty()) {
                // tolerate hand-edited records that lost the indentation of blank lines
                message.append('\n');
            } else {
                throw new CorruptRecordException("Malformed log line: " + line);
            }
        }
        if (message != null) {
            entries.add(new LogEntry(timestamp, message.toString()));
        }
        return entries;
    }

    private String encodeString(String value) {
        if (value.isEmpty()
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0
                || !value.equals(value.strip())
                || value.startsWith("\"")
                || value.startsWith("[")) {
            return gson.toJson(value);
        }
        return value;
    }

    private String decodeString(String raw) {
        if (raw == null) {
            return null;
        }
        if (raw.startsWith("\"")) {
            return gson.fromJson(raw, String.class);
        }
        return raw;
    }

    private void header(StringBuilder sb, String key, String value) {
        sb.append(key).append(": ").append(value).append('\n');
    }

    private void optional(StringBuilder sb, String key, String value) {
        if (value != null) {
            header(sb, key, encodeString(value));
        }
    }

    private void timestamp(StringBuilder sb, String key, LocalDateTime value) {
        if (value != null) {
            header(sb, key, value.toString());
        }
    }

    private static String required(Map<String, String> fields, String key) throws CorruptRecordException {
        String value = fields.get(key);
        if (value == null || value.isBlank()) {
            throw new CorruptRecordException("Missing required header field: " + key);
        }
        return value.strip();
    }

    private static Integer optionalInt(String raw) {
        return raw == null ? null : Integer.valueOf(raw.strip());
    }

    private static LocalDateTime optionalTimestamp(String raw) {
        return raw == null ? null : LocalDateTime.parse(raw.strip());
    }
}
