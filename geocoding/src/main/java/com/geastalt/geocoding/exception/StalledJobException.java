/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.exception;

import lombok.Getter;

@Getter
public class StalledJobException extends ProviderServiceException {

    private final String jobId;
    private final int stalledRetries;

    public StalledJobException(String jobId, int stalledRetries) {
        super("Too many retries for job " + jobId);
        this.jobId = jobId;
        this.stalledRetries = stalledRetries;
    }
}
