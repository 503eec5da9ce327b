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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one provider call per search, in input order. A failing search becomes an error
 * result for its id and the remaining searches still run.
 */
@Slf4j
@RequiredArgsConstructor
public class SerialGeocodeExecutor {

    static final String ERROR_MESSAGE = "Error geocoding";

    private final StreetGeocoder streetGeocoder;

    public List<GeocodeResult> geocode(List<SearchRequest> searches) {
        List<GeocodeResult> results = new ArrayList<>(searches.size());
        for (SearchRequest search : searches) {
            GeocodeResult result;
            try {
                result = streetGeocoder.geocode(search);
            } catch (RuntimeException e) {
                log.error("Error geocoding search '{}'", search.id(), e);
                result = GeocodeResult.error(search.id(), ERROR_MESSAGE);
            }
            results.add(result);
        }
        return results;
    }
}
