/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.batch;

/**
 * One status report for a remote job.
 */
public record BatchJobStatus(int totalCount, int processedCount, BatchJobState state) {

    public static BatchJobStatus of(int totalCount, int processedCount, String providerStatus) {
        return new BatchJobStatus(totalCount, processedCount, BatchJobState.fromProviderStatus(providerStatus));
    }
}
