/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.batch;

import com.geastalt.geocoding.exception.StalledJobException;
import lombok.Getter;

/**
 * Client-side view of one remote job. Owned by a single bulk call and never shared.
 * <p>
 * Every status report either advances {@code processedCount}, which clears the stall
 * counter, or repeats it, which counts as a stall. Once a terminal state has been
 * recorded the job accepts no further reports.
 */
@Getter
public class BatchJob {

    private final String jobId;
    private final int maxStalledRetries;
    private BatchJobState state = BatchJobState.SUBMITTED;
    private int processedCount;
    private int totalCount;
    private int stalledRetries;
    private int polls;

    public BatchJob(String jobId, int maxStalledRetries) {
        this.jobId = jobId;
        this.maxStalledRetries = maxStalledRetries;
    }

    /**
     * Applies a status report.
     *
     * @throws StalledJobException if the report pushes the stall counter past the ceiling,
     *                             regardless of the state it carries
     */
    public void record(BatchJobStatus status) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " already finished as " + state);
        }
        polls++;

        if (status.processedCount() == processedCount) {
            stalledRetries++;
            if (stalledRetries > maxStalledRetries) {
                throw new StalledJobException(jobId, stalledRetries);
            }
        } else {
            stalledRetries = 0;
            processedCount = status.processedCount();
        }

        totalCount = status.totalCount();
        state = status.state();
    }

    public boolean isFinished() {
        return state.isTerminal();
    }
}
