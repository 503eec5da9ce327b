/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How many times a failed provider call is repeated and how long to wait before each repeat.
 * The backoff doubles per retry up to {@code maxBackoff}; {@code jitter} spreads it by up to
 * that fraction either way.
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff, double jitter) {

    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
    private static final double DEFAULT_JITTER = 0.2;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }

    public static RetryPolicy of(int maxRetries) {
        return new RetryPolicy(maxRetries, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_JITTER);
    }

    /**
     * @param retry 1 for the first retry
     */
    public Duration backoff(int retry) {
        long ceiling = maxBackoff.toMillis();
        long millis = initialBackoff.toMillis();
        for (int i = 1; i < retry && millis < ceiling; i++) {
            millis *= 2;
        }
        millis = Math.min(millis, ceiling);

        if (jitter > 0) {
            millis = Math.round(millis * (1 + ThreadLocalRandom.current().nextDouble(-jitter, jitter)));
        }
        return Duration.ofMillis(millis);
    }
}
