/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.model;

public enum Precision {
    PRECISE("precise"),
    INTERPOLATED("interpolated");

    private final String value;

    Precision(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
