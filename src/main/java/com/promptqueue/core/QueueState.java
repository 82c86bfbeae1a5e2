package com.promptqueue.core;

import java.time.LocalDateTime;

/**
 * Process-wide durable record of queue counters and the current throttling window.
 *
 * <p>One instance exists per storage directory. The scheduler loads it at startup,
 * owns it while running, and persists it after every state-affecting transition.
 * A missing record is equivalent to {@code new QueueState()}.</p>
 *
 * <p>{@code estimatedResetAt} and {@code lastLimitMessage} are only meaningful
 * while {@code rateLimited} is true.</p>
 */
public class QueueState {
    private int totalAdded;
    private int totalCompleted;
    private int totalFailed;
    private int totalCancelled;
    private int rateLimitedCount;
    private boolean rateLimited;
    private LocalDateTime estimatedResetAt;
    private String lastLimitMessage;
    private LocalDateTime lastProcessedAt;

    /**
     * Enter the throttled state with the window described by {@code info}.
     *
     * @param info the detection that triggered the window
     */
    public void markRateLimited(RateLimitInfo info) {
        this.rateLimited = true;
        this.estimatedResetAt = info.getEstimatedResetAt();
        this.lastLimitMessage = info.getRawMessage();
        this.rateLimitedCount++;
    }

    /**
     * Leave the throttled state.
     *
     * @return true if the state was rate limited before the call
     */
    public boolean clearRateLimit() {
        boolean wasLimited = rateLimited;
        this.rateLimited = false;
        this.estimatedResetAt = null;
        this.lastLimitMessage = null;
        return wasLimited;
    }

    public void incrementAdded() { totalAdded++; }
    public void incrementCompleted() { totalCompleted++; }
    public void incrementFailed() { totalFailed++; }
    public void incrementCancelled() { totalCancelled++; }

    public int getTotalAdded() { return totalAdded; }
    public int getTotalCompleted() { return totalCompleted; }
    public int getTotalFailed() { return totalFailed; }
    public int getTotalCancelled() { return totalCancelled; }
    public int getRateLimitedCount() { return rateLimitedCount; }

    public boolean isRateLimited() { return rateLimited; }

    public LocalDateTime getEstimatedResetAt() { return estimatedResetAt; }

    public String getLastLimitMessage() { return lastLimitMessage; }

    public LocalDateTime getLastProcessedAt() { return lastProcessedAt; }
    public void setLastProcessedAt(LocalDateTime lastProcessedAt) { this.lastProcessedAt = lastProcessedAt; }

    @Override
    public String toString() {
        return "QueueState{added=" + totalAdded + ", completed=" + totalCompleted
                + ", failed=" + totalFailed + ", cancelled=" + totalCancelled
                + ", rateLimited=" + rateLimited + ", resetAt=" + estimatedResetAt + "}";
    }
}
