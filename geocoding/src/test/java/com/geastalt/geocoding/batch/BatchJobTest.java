/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchJobTest {

    @Test
    @DisplayName("Should reset the stall counter when progress resumes")
    void shouldResetStallCounterOnProgress() {
        BatchJob job = new BatchJob("job", 10);

        job.record(BatchJobStatus.of(10, 0, "accepted"));
        job.record(BatchJobStatus.of(10, 0, "running"));
        assertEquals(2, job.getStalledRetries());

        job.record(BatchJobStatus.of(10, 4, "running"));
        assertEquals(0, job.getStalledRetries());
        assertEquals(4, job.getProcessedCount());
        assertFalse(job.isFinished());
    }

    @Test
    @DisplayName("Should reject reports after a terminal state")
    void shouldRejectReportsAfterTerminalState() {
        BatchJob job = new BatchJob("job", 10);
        job.record(BatchJobStatus.of(10, 10, "cancelled"));

        assertTrue(job.isFinished());
        assertThrows(IllegalStateException.class, () -> job.record(BatchJobStatus.of(10, 10, "completed")));
    }

    @Test
    @DisplayName("Should treat unknown provider statuses as running")
    void shouldMapProviderStatuses() {
        assertEquals(BatchJobState.COMPLETED, BatchJobState.fromProviderStatus("completed"));
        assertEquals(BatchJobState.CANCELLED, BatchJobState.fromProviderStatus("cancelled"));
        assertEquals(BatchJobState.DELETED, BatchJobState.fromProviderStatus("deleted"));
        assertEquals(BatchJobState.FAILED, BatchJobState.fromProviderStatus("FAILED"));
        assertEquals(BatchJobState.RUNNING, BatchJobState.fromProviderStatus("accepted"));
        assertEquals(BatchJobState.RUNNING, BatchJobState.fromProviderStatus("suspended"));
        assertEquals(BatchJobState.RUNNING, BatchJobState.fromProviderStatus(null));
    }
}
