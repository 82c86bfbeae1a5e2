package com.promptqueue.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testQueuedTransitions() {
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.EXECUTING));
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.COMPLETED));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.FAILED));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.QUEUED));
    }

    @Test
    public void testExecutingTransitions() {
        Set<JobStatus> allowed = EnumSet.of(JobStatus.COMPLETED, JobStatus.QUEUED, JobStatus.FAILED, JobStatus.CANCELLED);
        for (JobStatus target : JobStatus.values()) {
            assertEquals(allowed.contains(target), JobStatus.EXECUTING.canTransitionTo(target),
                    "EXECUTING -> " + target);
        }
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    public void testFinishedStatesHaveNoOutgoingEdges(JobStatus finished) {
        for (JobStatus target : JobStatus.values()) {
            assertFalse(finished.canTransitionTo(target), finished + " -> " + target);
        }
    }

    @Test
    public void testTerminalAndActive() {
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertTrue(JobStatus.CANCELLED.isTerminal());
        assertFalse(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.QUEUED.isActive());
        assertTrue(JobStatus.EXECUTING.isActive());
        assertFalse(JobStatus.FAILED.isActive());
    }

    @Test
    public void testFromDisplayName() {
        assertEquals(JobStatus.QUEUED, JobStatus.fromDisplayName("queued"));
        assertEquals(JobStatus.CANCELLED, JobStatus.fromDisplayName("CANCELLED"));
        assertEquals("executing", JobStatus.EXECUTING.toString());
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromDisplayName("pending"));
    }
}
