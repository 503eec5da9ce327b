/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.config;

import com.geastalt.geocoding.common.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RetryingRequestInterceptorTest {

    private List<Duration> sleeps;
    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        RestClient.Builder builder = RestClient.builder()
                .requestInterceptor(new RetryingRequestInterceptor(
                        new RetryPolicy(2, Duration.ofMillis(100), Duration.ofSeconds(1), 0), sleeps::add));
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    void get_shouldRetryTransportFailuresWithBackoff() {
        server.expect(method(HttpMethod.GET)).andRespond(withException(new SocketTimeoutException("Read timed out")));
        server.expect(method(HttpMethod.GET)).andRespond(withException(new ConnectException("Connection refused")));
        server.expect(method(HttpMethod.GET)).andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        String body = restClient.get().uri("https://provider.test/status").retrieve().body(String.class);

        assertEquals("ok", body);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void get_shouldGiveUpAfterMaxRetries() {
        for (int i = 0; i < 3; i++) {
            server.expect(method(HttpMethod.GET)).andRespond(withException(new SocketTimeoutException("Read timed out")));
        }

        assertThrows(ResourceAccessException.class,
                () -> restClient.get().uri("https://provider.test/status").retrieve().body(String.class));
        assertEquals(2, sleeps.size());
    }

    @Test
    void post_shouldNotBeRetried() {
        server.expect(method(HttpMethod.POST)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThrows(ResourceAccessException.class,
                () -> restClient.post().uri("https://provider.test/jobs").body("payload").retrieve().toBodilessEntity());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void get_shouldNotRetryErrorResponses() {
        server.expect(method(HttpMethod.GET)).andRespond(withServerError());

        assertThrows(HttpServerErrorException.class,
                () -> restClient.get().uri("https://provider.test/status").retrieve().body(String.class));
        assertTrue(sleeps.isEmpty());
        server.verify();
    }
}
