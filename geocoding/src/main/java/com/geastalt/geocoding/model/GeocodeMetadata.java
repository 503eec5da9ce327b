/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.model;

import java.util.List;

/**
 * Quality information attached to a geocode. A no-match carries {@link #empty()},
 * a failure carries an error message and nothing else.
 */
public record GeocodeMetadata(Double relevance, Precision precision, List<MatchType> matchTypes, String error) {

    private static final GeocodeMetadata EMPTY = new GeocodeMetadata(null, null, List.of(), null);

    public GeocodeMetadata {
        if (relevance != null) {
            relevance = Math.max(0.0, Math.min(1.0, relevance));
        }
        matchTypes = matchTypes != null ? List.copyOf(matchTypes) : List.of();
    }

    public static GeocodeMetadata of(double relevance, Precision precision, List<MatchType> matchTypes) {
        return new GeocodeMetadata(relevance, precision, matchTypes, null);
    }

    public static GeocodeMetadata empty() {
        return EMPTY;
    }

    public static GeocodeMetadata error(String message) {
        return new GeocodeMetadata(null, null, List.of(), message);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isEmpty() {
        return relevance == null && precision == null && matchTypes.isEmpty() && error == null;
    }
}
