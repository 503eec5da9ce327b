/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geastalt.geocoding.exception.InvalidRequestException;
import com.geastalt.geocoding.exception.MalformedResultException;
import com.geastalt.geocoding.exception.ProviderServiceException;
import com.geastalt.geocoding.model.Coordinate;
import com.geastalt.geocoding.model.GeocodeMetadata;
import com.geastalt.geocoding.model.GeocodeResult;
import com.geastalt.geocoding.model.SearchRequest;
import com.geastalt.geocoding.provider.StreetGeocoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Single address lookup against the HERE geocoder REST API (6.2, JSON).
 */
@Slf4j
@Component
public class HereStreetGeocoder implements StreetGeocoder {

    private static final String GENERATION = "9";

    private final RestClient restClient;
    private final HereConfig hereConfig;
    private final ObjectMapper objectMapper;

    public HereStreetGeocoder(@Qualifier("hereRestClient") RestClient restClient, HereConfig hereConfig,
                              ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.hereConfig = hereConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public GeocodeResult geocode(SearchRequest search) {
        String body = call(buildUri(search));
        return parse(search.id(), body);
    }

    URI buildUri(SearchRequest search) {
        if (isBlank(search.address()) && isBlank(search.city()) && isBlank(search.state())
                && isBlank(search.country())) {
            throw new InvalidRequestException("Search '" + search.id() + "' has no address fields");
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(hereConfig.resolveGeocodeUrl());
        hereConfig.credentials().queryParams().forEach((name, value) -> builder.queryParam(name, encode(value)));
        addIfPresent(builder, "searchtext", search.address());
        addIfPresent(builder, "city", search.city());
        addIfPresent(builder, "state", search.state());
        addIfPresent(builder, "country", search.country());
        builder.queryParam("maxresults", hereConfig.getMaxResults());
        builder.queryParam("gen", GENERATION);
        return builder.build(true).toUri();
    }

    private String call(URI uri) {
        try {
            return restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new ProviderServiceException("Error trying to geocode with HERE", e.getStatusCode().value(),
                    e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderServiceException("Error trying to geocode with HERE", e);
        }
    }

    GeocodeResult parse(String id, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedResultException("Unreadable HERE geocoder response", e);
        }

        JsonNode views = root == null ? null : root.path("Response").get("View");
        if (views == null || !views.isArray()) {
            throw new MalformedResultException("HERE geocoder response has no Response.View");
        }
        if (views.isEmpty() || views.get(0).path("Result").isEmpty()) {
            log.debug("No HERE match for search '{}'", id);
            return GeocodeResult.noMatch(id);
        }

        JsonNode result = views.get(0).path("Result").get(0);
        JsonNode position = result.path("Location").path("DisplayPosition");
        if (!position.hasNonNull("Latitude") || !position.hasNonNull("Longitude")) {
            throw new MalformedResultException("HERE geocoder result has no Location.DisplayPosition");
        }

        Coordinate coordinate = new Coordinate(position.get("Longitude").asDouble(),
                position.get("Latitude").asDouble());
        GeocodeMetadata metadata = GeocodeMetadata.of(
                result.path("Relevance").asDouble(0.0),
                HereMatchQuality.precision(result.path("MatchType").textValue()),
                HereMatchQuality.matchTypes(result.path("MatchLevel").textValue()));
        return new GeocodeResult(id, coordinate, metadata);
    }

    private static void addIfPresent(UriComponentsBuilder builder, String name, String value) {
        if (!isBlank(value)) {
            builder.queryParam(name, encode(value));
        }
    }

    private static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
