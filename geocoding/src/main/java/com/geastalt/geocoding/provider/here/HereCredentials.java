/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import java.util.Map;

/**
 * The two HERE credential generations. Each supplies the parameters attached to every
 * outbound call and the endpoints that accept them.
 */
public sealed interface HereCredentials permits HereCredentials.AppCode, HereCredentials.ApiKey {

    Map<String, String> queryParams();

    String defaultBatchUrl();

    String defaultGeocodeUrl();

    record AppCode(String appId, String appCode) implements HereCredentials {

        @Override
        public Map<String, String> queryParams() {
            return Map.of("app_id", appId, "app_code", appCode);
        }

        @Override
        public String defaultBatchUrl() {
            return "https://batch.geocoder.api.here.com/6.2/jobs";
        }

        @Override
        public String defaultGeocodeUrl() {
            return "https://geocoder.api.here.com/6.2/geocode.json";
        }
    }

    record ApiKey(String apiKey) implements HereCredentials {

        @Override
        public Map<String, String> queryParams() {
            return Map.of("apikey", apiKey);
        }

        @Override
        public String defaultBatchUrl() {
            return "https://batch.geocoder.ls.hereapi.com/6.2/jobs";
        }

        @Override
        public String defaultGeocodeUrl() {
            return "https://geocoder.ls.hereapi.com/6.2/geocode.json";
        }

        @Override
        public String toString() {
            return "ApiKey[****]";
        }
    }
}
