/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.mapzen;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "mapzen.routing")
public class MapzenRoutingConfig {

    private String baseUrl = "https://valhalla.mapzen.com/route";
    private String apiKey;
    private int connectTimeoutMs = 10000;
    private int readTimeoutMs = 60000;
    private int maxRetries = 1;
}
