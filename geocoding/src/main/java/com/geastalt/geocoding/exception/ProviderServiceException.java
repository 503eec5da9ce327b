/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.exception;

import lombok.Getter;

/**
 * A provider call failed: non-success status, transport failure after retries, or an
 * interrupted wait. Status and body are kept for diagnostics when a response exists.
 */
@Getter
public class ProviderServiceException extends RuntimeException {

    private final Integer statusCode;
    private final String responseBody;

    public ProviderServiceException(String message) {
        this(message, null, null, null);
    }

    public ProviderServiceException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ProviderServiceException(String message, Integer statusCode, String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    public ProviderServiceException(String message, Integer statusCode, String responseBody, Throwable cause) {
        super(statusCode != null ? message + " (status " + statusCode + ")" : message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
}
