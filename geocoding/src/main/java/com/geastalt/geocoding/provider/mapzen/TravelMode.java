/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.mapzen;

import com.geastalt.geocoding.exception.InvalidRequestException;

import java.util.Arrays;

/**
 * Caller-facing travel modes and the Valhalla costing model each one uses.
 */
public enum TravelMode {
    WALK("walk", "pedestrian"),
    CAR("car", "auto"),
    PUBLIC_TRANSPORT("public_transport", "bus"),
    BICYCLE("bicycle", "bicycle");

    static final String AUTO_SHORTEST = "auto_shortest";

    private final String modeName;
    private final String costing;

    TravelMode(String modeName, String costing) {
        this.modeName = modeName;
        this.costing = costing;
    }

    public String getModeName() {
        return modeName;
    }

    public String getCosting() {
        return costing;
    }

    public static TravelMode fromName(String name) {
        return Arrays.stream(values())
                .filter(mode -> mode.modeName.equals(name))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException(name + " is not an accepted mode type"));
    }
}
