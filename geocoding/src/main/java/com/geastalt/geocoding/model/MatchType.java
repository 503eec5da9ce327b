/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.model;

/**
 * Canonical granularity of a geocode match, independent of provider vocabulary.
 */
public enum MatchType {
    COUNTRY("country"),
    STATE("state"),
    COUNTY("county"),
    LOCALITY("locality"),
    DISTRICT("district"),
    STREET("street"),
    INTERSECTION("intersection"),
    STREET_NUMBER("street_number"),
    POSTAL_CODE("postal_code"),
    POINT_OF_INTEREST("point_of_interest");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
