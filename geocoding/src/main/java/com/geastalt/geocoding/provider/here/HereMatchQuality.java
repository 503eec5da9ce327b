/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.geastalt.geocoding.model.MatchType;
import com.geastalt.geocoding.model.Precision;

import java.util.List;
import java.util.Map;

/**
 * HERE match vocabulary mapped onto the canonical precision and match type.
 */
public final class HereMatchQuality {

    private static final Map<String, Precision> PRECISION_BY_MATCH_TYPE = Map.of(
            "pointAddress", Precision.PRECISE,
            "interpolated", Precision.INTERPOLATED
    );

    private static final Map<String, MatchType> MATCH_TYPE_BY_MATCH_LEVEL = Map.of(
            "landmark", MatchType.POINT_OF_INTEREST,
            "country", MatchType.COUNTRY,
            "state", MatchType.STATE,
            "county", MatchType.COUNTY,
            "city", MatchType.LOCALITY,
            "district", MatchType.DISTRICT,
            "street", MatchType.STREET,
            "intersection", MatchType.INTERSECTION,
            "houseNumber", MatchType.STREET_NUMBER,
            "postalCode", MatchType.POSTAL_CODE
    );

    private HereMatchQuality() {
    }

    /**
     * Unknown or missing match types are treated as interpolated.
     */
    public static Precision precision(String matchType) {
        if (matchType == null) {
            return Precision.INTERPOLATED;
        }
        return PRECISION_BY_MATCH_TYPE.getOrDefault(matchType, Precision.INTERPOLATED);
    }

    /**
     * Empty when the level has no canonical counterpart.
     */
    public static List<MatchType> matchTypes(String matchLevel) {
        MatchType matchType = matchLevel != null ? MATCH_TYPE_BY_MATCH_LEVEL.get(matchLevel) : null;
        return matchType != null ? List.of(matchType) : List.of();
    }
}
