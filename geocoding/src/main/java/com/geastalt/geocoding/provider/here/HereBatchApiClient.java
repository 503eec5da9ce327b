/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.geastalt.geocoding.batch.BatchJobStatus;
import com.geastalt.geocoding.exception.MalformedResultException;
import com.geastalt.geocoding.exception.ProviderServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP side of the HERE batch geocoder: submit a job, read its status, download its results.
 */
@Slf4j
@Component
public class HereBatchApiClient {

    static final String OUTPUT_COLUMNS =
            "displayLatitude,displayLongitude,relevance,matchType,matchCode,matchLevel,matchQualityStreet";

    private final RestClient restClient;
    private final HereConfig hereConfig;
    private final XmlMapper xmlMapper;

    public HereBatchApiClient(@Qualifier("hereRestClient") RestClient restClient, HereConfig hereConfig) {
        this.restClient = restClient;
        this.hereConfig = hereConfig;
        this.xmlMapper = XmlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Starts a job for the encoded payload and returns its id. Never retried here.
     */
    public String submit(String payload) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("gen", "8");
        params.put("action", "run");
        params.put("header", "true");
        params.put("inDelim", String.valueOf(HereBatchPayloadEncoder.DELIMITER));
        params.put("outDelim", String.valueOf(HereBatchPayloadEncoder.DELIMITER));
        params.put("outCols", OUTPUT_COLUMNS);
        params.put("outputcombined", "true");
        URI uri = jobUri(null, params);

        ResponseEntity<String> response;
        try {
            response = restClient.post()
                    .uri(uri)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(payload.getBytes(StandardCharsets.UTF_8))
                    .retrieve()
                    .toEntity(String.class);
        } catch (RestClientResponseException e) {
            log.error("HERE batch submission rejected: {} {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ProviderServiceException("Error sending HERE batch", e.getStatusCode().value(),
                    e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderServiceException("Error sending HERE batch", e);
        }

        if (response.getStatusCode().value() != 200) {
            throw new ProviderServiceException("Error sending HERE batch", response.getStatusCode().value(),
                    response.getBody());
        }

        HereBatchResponse.Response body = parse(response.getBody(), "submission");
        if (body.getMetaInfo() == null || isBlank(body.getMetaInfo().getRequestId())) {
            throw new MalformedResultException("HERE batch submission response has no RequestId");
        }
        String jobId = body.getMetaInfo().getRequestId();
        log.info("Submitted HERE batch job {}", jobId);
        return jobId;
    }

    public BatchJobStatus status(String jobId) {
        String xml = get(jobUri(jobId, Map.of("action", "status")), "status of job " + jobId);
        HereBatchResponse.Response body = parse(xml, "status");
        if (body.getProcessedCount() == null || body.getTotalCount() == null || body.getStatus() == null) {
            throw new MalformedResultException("HERE status response for job " + jobId
                    + " lacks TotalCount, ProcessedCount or Status");
        }
        return BatchJobStatus.of(body.getTotalCount(), body.getProcessedCount(), body.getStatus());
    }

    public byte[] download(String jobId) {
        URI uri = jobUri(jobId + "/all", Map.of());
        try {
            byte[] archive = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(byte[].class);
            return archive != null ? archive : new byte[0];
        } catch (RestClientResponseException e) {
            throw new ProviderServiceException("Error downloading HERE batch results for job " + jobId,
                    e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderServiceException("Error downloading HERE batch results for job " + jobId, e);
        }
    }

    private String get(URI uri, String what) {
        try {
            return restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new ProviderServiceException("Error reading HERE " + what,
                    e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderServiceException("Error reading HERE " + what, e);
        }
    }

    private HereBatchResponse.Response parse(String xml, String what) {
        if (isBlank(xml)) {
            throw new MalformedResultException("Empty HERE batch " + what + " response");
        }
        try {
            HereBatchResponse parsed = xmlMapper.readValue(xml, HereBatchResponse.class);
            if (parsed == null || parsed.getResponse() == null) {
                throw new MalformedResultException("HERE batch " + what + " response has no Response element");
            }
            return parsed.getResponse();
        } catch (JsonProcessingException e) {
            throw new MalformedResultException("Unreadable HERE batch " + what + " response", e);
        }
    }

    private URI jobUri(String path, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(hereConfig.resolveBatchUrl());
        if (path != null) {
            for (String segment : path.split("/")) {
                builder.pathSegment(UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8));
            }
        }
        hereConfig.credentials().queryParams().forEach((name, value) -> builder.queryParam(name, encode(value)));
        params.forEach((name, value) -> builder.queryParam(name, encode(value)));
        return builder.build(true).toUri();
    }

    /**
     * Strict encoding; {@code +} in a value must not reach HERE as a space.
     */
    private static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
