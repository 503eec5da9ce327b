/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
public class GeocoderRegistry {

    private final Map<String, BulkGeocoder> geocodersById;
    private final String defaultProviderId;

    public GeocoderRegistry(List<BulkGeocoder> geocoders,
                            @Value("${geocoding.providers.default:here}") String defaultProviderId) {
        this.geocodersById = geocoders.stream()
                .collect(Collectors.toMap(BulkGeocoder::getProviderId, Function.identity()));
        this.defaultProviderId = defaultProviderId;
        log.info("Registered {} bulk geocoders: {}, default '{}'", geocoders.size(),
                geocoders.stream().map(BulkGeocoder::getProviderId).toList(), defaultProviderId);
    }

    public Optional<BulkGeocoder> getGeocoder(String providerOverride) {
        String providerId = providerOverride != null && !providerOverride.isEmpty()
                ? providerOverride
                : defaultProviderId;

        BulkGeocoder geocoder = geocodersById.get(providerId);
        if (geocoder != null && geocoder.isEnabled()) {
            return Optional.of(geocoder);
        }
        return Optional.empty();
    }

    public List<BulkGeocoder> getAllGeocoders() {
        return List.copyOf(geocodersById.values());
    }
}
