/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.geastalt.geocoding.batch.BatchJobState;
import com.geastalt.geocoding.batch.BatchJobStatus;
import com.geastalt.geocoding.exception.MalformedResultException;
import com.geastalt.geocoding.exception.ProviderServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static com.geastalt.geocoding.provider.here.HereFixtures.*;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HereBatchApiClientTest {

    private MockRestServiceServer server;
    private HereBatchApiClient client;

    @BeforeEach
    void setUp() {
        client = clientFor(config());
    }

    private HereBatchApiClient clientFor(HereConfig config) {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        return new HereBatchApiClient(builder.build(), config);
    }

    @Test
    @DisplayName("Should post the payload with job parameters and return the request id")
    void shouldSubmitJob() {
        String payload = "recId|searchText|country\n1|Calle Mayor 1 Madrid|ESP\n";
        server.expect(requestTo(startsWith("https://batch.test/6.2/jobs?")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(queryParam("apikey", "test-key"))
                .andExpect(queryParam("action", "run"))
                .andExpect(queryParam("gen", "8"))
                .andExpect(queryParam("header", "true"))
                .andExpect(queryParam("outputcombined", "true"))
                .andExpect(content().contentType(MediaType.TEXT_PLAIN))
                .andExpect(content().string(payload))
                .andRespond(withSuccess(submitResponse("JOB-1"), MediaType.APPLICATION_XML));

        assertEquals("JOB-1", client.submit(payload));
        server.verify();
    }

    @Test
    @DisplayName("Should report the status and body of a rejected submission")
    void shouldFailOnRejectedSubmission() {
        server.expect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("invalid credentials"));

        ProviderServiceException e = assertThrows(ProviderServiceException.class, () -> client.submit("x"));

        assertEquals(401, e.getStatusCode());
        assertEquals("invalid credentials", e.getResponseBody());
        assertTrue(e.getMessage().startsWith("Error sending HERE batch"));
    }

    @Test
    @DisplayName("Should treat any non-200 success status as a failed submission")
    void shouldFailOnNonOkSubmission() {
        server.expect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.ACCEPTED).body(submitResponse("JOB-2"))
                        .contentType(MediaType.APPLICATION_XML));

        ProviderServiceException e = assertThrows(ProviderServiceException.class, () -> client.submit("x"));

        assertEquals(202, e.getStatusCode());
    }

    @Test
    @DisplayName("Should reject a submission response without a request id")
    void shouldRejectSubmissionWithoutRequestId() {
        server.expect(method(HttpMethod.POST))
                .andRespond(withSuccess("<SearchBatch><Response><Status>accepted</Status></Response></SearchBatch>",
                        MediaType.APPLICATION_XML));

        assertThrows(MalformedResultException.class, () -> client.submit("x"));
    }

    @Test
    @DisplayName("Should read the job status counts")
    void shouldReadStatus() {
        server.expect(requestTo("https://batch.test/6.2/jobs/JOB-1?apikey=test-key&action=status"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(statusResponse("JOB-1", "running", 250, 120), MediaType.APPLICATION_XML));

        BatchJobStatus status = client.status("JOB-1");

        assertEquals(250, status.totalCount());
        assertEquals(120, status.processedCount());
        assertEquals(BatchJobState.RUNNING, status.state());
        server.verify();
    }

    @Test
    @DisplayName("Should reject a status response missing its counts")
    void shouldRejectIncompleteStatus() {
        server.expect(method(HttpMethod.GET))
                .andRespond(withSuccess("<SearchBatch><Response><Status>running</Status></Response></SearchBatch>",
                        MediaType.APPLICATION_XML));

        assertThrows(MalformedResultException.class, () -> client.status("JOB-1"));
    }

    @Test
    @DisplayName("Should download the result archive")
    void shouldDownloadArchive() {
        byte[] archive = zip(entries("r_out.txt", RESULT_HEADER));
        server.expect(requestTo("https://batch.test/6.2/jobs/JOB-1/all?apikey=test-key"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(archive, MediaType.APPLICATION_OCTET_STREAM));

        assertArrayEquals(archive, client.download("JOB-1"));
        server.verify();
    }

    @Test
    @DisplayName("Should surface a download failure with its status")
    void shouldFailOnDownloadError() {
        server.expect(method(HttpMethod.GET)).andRespond(withServerError());

        ProviderServiceException e = assertThrows(ProviderServiceException.class, () -> client.download("JOB-1"));

        assertEquals(500, e.getStatusCode());
    }

    @Test
    @DisplayName("Should authenticate with app id and app code when no api key is set")
    void shouldUseAppCodeCredentials() {
        HereConfig config = config();
        config.setApiKey(null);
        config.setAppId("my-app");
        config.setAppCode("my-code");
        HereBatchApiClient appCodeClient = clientFor(config);

        server.expect(requestTo(startsWith("https://batch.test/6.2/jobs/JOB-9?")))
                .andExpect(queryParam("app_id", "my-app"))
                .andExpect(queryParam("app_code", "my-code"))
                .andExpect(queryParam("action", "status"))
                .andRespond(withSuccess(statusResponse("JOB-9", "completed", 1, 1), MediaType.APPLICATION_XML));

        assertEquals(BatchJobState.COMPLETED, appCodeClient.status("JOB-9").state());
        server.verify();
    }

    @Test
    @DisplayName("Should default to the endpoints of the configured credential generation")
    void shouldResolveDefaultEndpoints() {
        HereConfig config = new HereConfig();
        config.setAppId("a");
        config.setAppCode("b");
        assertEquals("https://batch.geocoder.api.here.com/6.2/jobs", config.resolveBatchUrl());

        config.setApiKey("k");
        assertEquals("https://batch.geocoder.ls.hereapi.com/6.2/jobs", config.resolveBatchUrl());
        assertEquals(Map.of("apikey", "k"), config.credentials().queryParams());
    }
}
