/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider;

import com.geastalt.geocoding.model.GeocodeResult;
import com.geastalt.geocoding.model.SearchRequest;

/**
 * Geocodes one address per provider call.
 */
public interface StreetGeocoder {

    GeocodeResult geocode(SearchRequest search);
}
