/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.mapzen;

import com.geastalt.geocoding.model.Coordinate;

import java.util.List;

/**
 * A computed trip, or the empty result when the provider found no route.
 */
public record RouteResult(List<Coordinate> shape, Double length, Double duration) {

    private static final RouteResult EMPTY = new RouteResult(null, null, null);

    public RouteResult {
        shape = shape != null ? List.copyOf(shape) : null;
    }

    public static RouteResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return shape == null;
    }
}
