/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.model;

import lombok.Builder;

/**
 * One address to geocode. The id is assigned by the caller and echoed back on the
 * matching {@link GeocodeResult}; it must be unique within a bulk call.
 */
@Builder
public record SearchRequest(String id, String address, String city, String state, String country) {
}
