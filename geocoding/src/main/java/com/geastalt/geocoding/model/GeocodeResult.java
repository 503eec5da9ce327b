/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.model;

/**
 * Outcome for a single {@link SearchRequest}. Every request produces exactly one of these,
 * including no-match and failure outcomes, where {@code coordinate} is null.
 */
public record GeocodeResult(String id, Coordinate coordinate, GeocodeMetadata metadata) {

    public GeocodeResult {
        if (metadata == null) {
            metadata = GeocodeMetadata.empty();
        }
    }

    public static GeocodeResult noMatch(String id) {
        return new GeocodeResult(id, null, GeocodeMetadata.empty());
    }

    public static GeocodeResult error(String id, String message) {
        return new GeocodeResult(id, null, GeocodeMetadata.error(message));
    }

    public boolean hasCoordinate() {
        return coordinate != null;
    }
}
