/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.service;

import com.geastalt.geocoding.exception.InvalidRequestException;
import com.geastalt.geocoding.model.GeocodeResult;
import com.geastalt.geocoding.model.SearchRequest;
import com.geastalt.geocoding.provider.BulkGeocoder;
import com.geastalt.geocoding.provider.GeocoderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BulkGeocodingServiceTest {

    private RecordingGeocoder geocoder;
    private BulkGeocodingService service;

    @BeforeEach
    void setUp() {
        geocoder = new RecordingGeocoder();
        service = new BulkGeocodingService(new GeocoderRegistry(List.of(geocoder), "here"));
    }

    @Test
    void geocode_shouldDelegateToSelectedProvider() {
        List<SearchRequest> searches = List.of(SearchRequest.builder().id("1").address("A").build());

        BulkGeocodingService.Result result = service.geocode(searches, null);

        assertEquals("here", result.providerId());
        assertEquals(1, result.results().size());
        assertEquals(List.of(searches), geocoder.calls);
    }

    @Test
    void geocode_shouldNotCallProviderForEmptyInput() {
        BulkGeocodingService.Result result = service.geocode(List.of(), "here");

        assertTrue(result.results().isEmpty());
        assertTrue(geocoder.calls.isEmpty());
    }

    @Test
    void geocode_shouldRejectUnavailableProvider() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> service.geocode(List.of(), "mapbox"));

        assertTrue(e.getMessage().contains("'mapbox'"));
    }

    static class RecordingGeocoder implements BulkGeocoder {

        final List<List<SearchRequest>> calls = new ArrayList<>();

        @Override
        public String getProviderId() {
            return "here";
        }

        @Override
        public String getDisplayName() {
            return "Recording";
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public List<GeocodeResult> bulkGeocode(List<SearchRequest> searches) {
            calls.add(searches);
            return searches.stream().map(s -> GeocodeResult.noMatch(s.id())).toList();
        }
    }
}
