/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.batch;

import com.geastalt.geocoding.common.Sleeper;
import com.geastalt.geocoding.exception.ProviderServiceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Queries a job until it reaches a terminal state, waiting a fixed interval between
 * queries. The only way out other than a terminal state is the stall ceiling.
 */
@Slf4j
public class BatchJobPoller {

    private final int maxStalledRetries;
    private final Duration pollInterval;
    private final Sleeper sleeper;

    public BatchJobPoller(int maxStalledRetries, Duration pollInterval, Sleeper sleeper) {
        this.maxStalledRetries = maxStalledRetries;
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
    }

    public BatchJob awaitTermination(String jobId, JobStatusSource statusSource) {
        BatchJob job = new BatchJob(jobId, maxStalledRetries);

        while (true) {
            job.record(statusSource.fetchStatus(jobId));
            log.debug("Job {} is {}: {}/{} processed, {} stalled polls",
                    jobId, job.getState(), job.getProcessedCount(), job.getTotalCount(), job.getStalledRetries());

            if (job.isFinished()) {
                log.info("Job {} finished as {} after {} polls", jobId, job.getState(), job.getPolls());
                return job;
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderServiceException("Interrupted while polling job " + jobId, e);
            }
        }
    }
}
