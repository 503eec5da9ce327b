/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.config;

import com.geastalt.geocoding.common.RetryPolicy;
import com.geastalt.geocoding.common.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Set;

/**
 * Re-executes idempotent requests that fail at the transport level. Responses, including
 * error statuses, are returned untouched. Must be the last interceptor on the client.
 */
@Slf4j
public class RetryingRequestInterceptor implements ClientHttpRequestInterceptor {

    private static final Set<HttpMethod> IDEMPOTENT = Set.of(HttpMethod.GET, HttpMethod.HEAD);

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RetryingRequestInterceptor(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body,
                                        ClientHttpRequestExecution execution) throws IOException {
        if (!IDEMPOTENT.contains(request.getMethod())) {
            return execution.execute(request, body);
        }

        int retry = 0;
        while (true) {
            try {
                return execution.execute(request, body);
            } catch (IOException e) {
                if (retry >= retryPolicy.maxRetries()) {
                    throw e;
                }
                retry++;
                Duration backoff = retryPolicy.backoff(retry);
                log.warn("{} {} failed ({}), retry {}/{} in {} ms", request.getMethod(), request.getURI().getHost(),
                        e.getMessage(), retry, retryPolicy.maxRetries(), backoff.toMillis());
                pause(backoff);
            }
        }
    }

    private void pause(Duration backoff) throws InterruptedIOException {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }
}
