/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.mapzen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geastalt.geocoding.exception.InvalidRequestException;
import com.geastalt.geocoding.exception.MalformedResultException;
import com.geastalt.geocoding.exception.ProviderServiceException;
import com.geastalt.geocoding.model.Coordinate;
import com.geastalt.geocoding.polyline.PolylineCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Point to point routes from a Valhalla (Mapzen) endpoint.
 */
@Slf4j
@Component
public class MapzenRoutingClient {

    static final String MODE_TYPE_OPTION = "mode_type";
    static final String SHORTEST = "shortest";

    private final RestClient restClient;
    private final MapzenRoutingConfig routingConfig;
    private final ObjectMapper objectMapper;

    public MapzenRoutingClient(@Qualifier("mapzenRestClient") RestClient restClient,
                               MapzenRoutingConfig routingConfig, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.routingConfig = routingConfig;
        this.objectMapper = objectMapper;
    }

    public RouteResult calculateRoutePointToPoint(List<Coordinate> waypoints, String mode) {
        return calculateRoutePointToPoint(waypoints, mode, List.of(), DistanceUnits.KILOMETERS);
    }

    /**
     * @param waypoints at least two points; the first and last are stops, the rest pass-through
     * @param mode      one of walk, car, public_transport, bicycle
     * @param options   {@code key=value} strings; {@code mode_type=shortest} picks the shortest car route
     * @return the route, or {@link RouteResult#empty()} when the provider rejects the request as unroutable
     */
    public RouteResult calculateRoutePointToPoint(List<Coordinate> waypoints, String mode,
                                                  List<String> options, DistanceUnits units) {
        String costing = resolveCosting(mode, parseOptions(options));
        if (waypoints == null || waypoints.size() < 2) {
            throw new InvalidRequestException("A route needs at least two waypoints");
        }

        String json = buildRequest(waypoints, costing, units).toString();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(routingConfig.getBaseUrl())
                .queryParam("json", UriUtils.encode(json, StandardCharsets.UTF_8));
        if (StringUtils.hasText(routingConfig.getApiKey())) {
            builder.queryParam("api_key", UriUtils.encode(routingConfig.getApiKey(), StandardCharsets.UTF_8));
        }
        URI uri = builder.build(true).toUri();

        try {
            return restClient.get()
                    .uri(uri)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        if (status == HttpStatus.OK.value()) {
                            return parseResponse(body);
                        }
                        if (status == HttpStatus.BAD_REQUEST.value()) {
                            log.debug("No route for {} waypoints in mode {}: {}", waypoints.size(), mode, body);
                            return RouteResult.empty();
                        }
                        log.error("Error trying to calculate route using Mapzen: status {}, mode {}, options {}, body {}",
                                status, mode, options, body);
                        throw new ProviderServiceException("Error trying to calculate route using Mapzen",
                                status, body);
                    });
        } catch (ResourceAccessException e) {
            throw new ProviderServiceException("Error trying to calculate route using Mapzen", e);
        }
    }

    Map<String, String> parseOptions(List<String> options) {
        Map<String, String> parsed = new HashMap<>();
        if (options == null) {
            return parsed;
        }
        for (String option : options) {
            String[] parts = option.split("=", -1);
            if (parts.length != 2 || parts[0].isEmpty()) {
                throw new InvalidRequestException("Invalid routing option '" + option + "', expected key=value");
            }
            parsed.put(parts[0], parts[1]);
        }
        return parsed;
    }

    String resolveCosting(String mode, Map<String, String> options) {
        TravelMode travelMode = TravelMode.fromName(mode);
        if (travelMode == TravelMode.CAR && SHORTEST.equals(options.get(MODE_TYPE_OPTION))) {
            return TravelMode.AUTO_SHORTEST;
        }
        return travelMode.getCosting();
    }

    ObjectNode buildRequest(List<Coordinate> waypoints, String costing, DistanceUnits units) {
        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode locations = request.putArray("locations");
        for (int i = 0; i < waypoints.size(); i++) {
            Coordinate point = waypoints.get(i);
            boolean stop = i == 0 || i == waypoints.size() - 1;
            locations.addObject()
                    .put("lon", String.valueOf(point.longitude()))
                    .put("lat", String.valueOf(point.latitude()))
                    .put("type", stop ? "break" : "through");
        }
        request.put("costing", costing);
        request.putObject("directions_options")
                .put("units", units.getValue())
                .put("narrative", false);
        return request;
    }

    RouteResult parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResultException("Unreadable Mapzen routing response", e);
        }

        JsonNode legs = root.path("trip").get("legs");
        if (legs == null || !legs.isArray()) {
            throw new MalformedResultException("Mapzen routing response has no trip.legs");
        }
        if (legs.isEmpty()) {
            return RouteResult.empty();
        }

        JsonNode leg = legs.get(0);
        JsonNode summary = leg.get("summary");
        if (!leg.hasNonNull("shape") || summary == null
                || !summary.hasNonNull("length") || !summary.hasNonNull("time")) {
            throw new MalformedResultException("Mapzen routing leg lacks shape or summary");
        }

        List<Coordinate> shape = PolylineCodec.decode(leg.get("shape").asText());
        return new RouteResult(shape, summary.get("length").asDouble(), summary.get("time").asDouble());
    }
}
