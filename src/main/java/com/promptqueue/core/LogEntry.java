package com.promptqueue.core;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One timestamped line (or block) in a job's execution log.
 *
 * <p>Timestamps are kept to whole seconds, matching the precision of the
 * persisted log format.</p>
 */
public final class LogEntry {
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalDateTime timestamp;
    private final String message;

    public LogEntry(LocalDateTime timestamp, String message) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp").truncatedTo(ChronoUnit.SECONDS);
        this.message = message == null ? "" : message;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Render as {@code [yyyy-MM-dd HH:mm:ss] message}.
     */
    public String format() {
        return "[" + TIMESTAMP_FORMAT.format(timestamp) + "] " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogEntry)) {
            return false;
        }
        LogEntry other = (LogEntry) o;
        return timestamp.equals(other.timestamp) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, message);
    }

    @Override
    public String toString() {
        return format();
    }
}
