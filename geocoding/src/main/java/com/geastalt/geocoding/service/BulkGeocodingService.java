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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BulkGeocodingService {

    private final GeocoderRegistry geocoderRegistry;

    public record Result(List<GeocodeResult> results, String providerId) {}

    public Optional<BulkGeocoder> findGeocoder(String providerOverride) {
        return geocoderRegistry.getGeocoder(providerOverride);
    }

    public Result geocode(List<SearchRequest> searches, String providerOverride) {
        BulkGeocoder geocoder = findGeocoder(providerOverride)
                .orElseThrow(() -> new InvalidRequestException("No bulk geocoder available for provider '"
                        + (providerOverride != null ? providerOverride : "default") + "'"));

        if (searches.isEmpty()) {
            return new Result(List.of(), geocoder.getProviderId());
        }

        log.info("Bulk geocoding {} searches with provider '{}'", searches.size(), geocoder.getProviderId());
        return new Result(geocoder.bulkGeocode(searches), geocoder.getProviderId());
    }
}
