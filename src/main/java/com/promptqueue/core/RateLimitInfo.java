package com.promptqueue.core;

import java.time.LocalDateTime;

/**
 * Outcome of scanning one agent run's output for throttling signatures.
 */
public final class RateLimitInfo {
    private static final RateLimitInfo NONE = new RateLimitInfo(false, "", null, null);

    private final boolean detected;
    private final String rawMessage;
    private final LocalDateTime detectedAt;
    private final LocalDateTime estimatedResetAt;

    private RateLimitInfo(boolean detected, String rawMessage, LocalDateTime detectedAt, LocalDateTime estimatedResetAt) {
        this.detected = detected;
        this.rawMessage = rawMessage;
        this.detectedAt = detectedAt;
        this.estimatedResetAt = estimatedResetAt;
    }

    public static RateLimitInfo notLimited() {
        return NONE;
    }

    public static RateLimitInfo limited(String rawMessage, LocalDateTime detectedAt, LocalDateTime estimatedResetAt) {
        return new RateLimitInfo(true, rawMessage == null ? "" : rawMessage.strip(), detectedAt, estimatedResetAt);
    }

    public boolean isDetected() {
        return detected;
    }

    public String getRawMessage() {
        return rawMessage;
    }

    public LocalDateTime getDetectedAt() {
        return detectedAt;
    }

    public LocalDateTime getEstimatedResetAt() {
        return estimatedResetAt;
    }

    @Override
    public String toString() {
        return detected ? "RateLimitInfo{resetAt=" + estimatedResetAt + "}" : "RateLimitInfo{none}";
    }
}
