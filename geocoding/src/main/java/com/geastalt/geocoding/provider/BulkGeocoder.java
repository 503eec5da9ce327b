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

import java.util.List;

public interface BulkGeocoder {

    String getProviderId();

    String getDisplayName();

    boolean isEnabled();

    /**
     * Geocodes every search, returning exactly one result per search id. Output order is
     * not guaranteed; correlate by id.
     */
    List<GeocodeResult> bulkGeocode(List<SearchRequest> searches);
}
