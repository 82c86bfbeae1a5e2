package com.promptqueue.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class QueueStateTest {

    @Test
    public void testRateLimitWindow() {
        QueueState state = new QueueState();
        LocalDateTime reset = LocalDateTime.of(2026, 10, 19, 15, 0);

        state.markRateLimited(RateLimitInfo.limited("usage limit reached", reset.minusHours(1), reset));
        assertTrue(state.isRateLimited());
        assertEquals(reset, state.getEstimatedResetAt());
        assertEquals("usage limit reached", state.getLastLimitMessage());
        assertEquals(1, state.getRateLimitedCount());

        assertTrue(state.clearRateLimit());
        assertFalse(state.isRateLimited());
        assertNull(state.getEstimatedResetAt());
        assertNull(state.getLastLimitMessage());
        assertEquals(1, state.getRateLimitedCount(), "count survives clearing");
        assertFalse(state.clearRateLimit());
    }
}
