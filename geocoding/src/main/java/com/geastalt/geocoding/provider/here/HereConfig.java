/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "here")
public class HereConfig {

    private String apiKey;
    private String appId;
    private String appCode;
    private String batchUrl;
    private String geocodeUrl;
    private int connectTimeoutMs = 10000;
    private int readTimeoutMs = 60000;
    private int maxRetries = 3;
    private int maxResults = 1;
    private Batch batch = new Batch();

    @Data
    public static class Batch {
        private int minBatchedSearch = 100;
        private int maxBatchSize = 1_000_000;
        private int maxStalledRetries = 100;
        private Duration pollInterval = Duration.ofSeconds(5);
    }

    public boolean hasCredentials() {
        return hasText(apiKey) || (hasText(appId) && hasText(appCode));
    }

    /**
     * An API key takes precedence over an app id / app code pair.
     */
    public HereCredentials credentials() {
        if (hasText(apiKey)) {
            return new HereCredentials.ApiKey(apiKey);
        }
        if (hasText(appId) && hasText(appCode)) {
            return new HereCredentials.AppCode(appId, appCode);
        }
        throw new IllegalStateException("HERE credentials are not configured (here.api-key or here.app-id/app-code)");
    }

    public String resolveBatchUrl() {
        return hasText(batchUrl) ? batchUrl : credentials().defaultBatchUrl();
    }

    public String resolveGeocodeUrl() {
        return hasText(geocodeUrl) ? geocodeUrl : credentials().defaultGeocodeUrl();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
