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
import com.geastalt.geocoding.provider.here.HereConfig;
import com.geastalt.geocoding.provider.mapzen.MapzenRoutingConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One {@link RestClient} per provider, each with its own timeouts and retry count.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public RestClient hereRestClient(RestClient.Builder restClientBuilder, HereConfig hereConfig, Sleeper sleeper) {
        return build(restClientBuilder, hereConfig.getConnectTimeoutMs(), hereConfig.getReadTimeoutMs(),
                hereConfig.getMaxRetries(), sleeper);
    }

    @Bean
    public RestClient mapzenRestClient(RestClient.Builder restClientBuilder, MapzenRoutingConfig routingConfig,
                                       Sleeper sleeper) {
        return build(restClientBuilder, routingConfig.getConnectTimeoutMs(), routingConfig.getReadTimeoutMs(),
                routingConfig.getMaxRetries(), sleeper);
    }

    private RestClient build(RestClient.Builder builder, int connectTimeoutMs, int readTimeoutMs,
                             int maxRetries, Sleeper sleeper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        return builder
                .requestFactory(requestFactory)
                .requestInterceptor(new RetryingRequestInterceptor(RetryPolicy.of(maxRetries), sleeper))
                .build();
    }
}
