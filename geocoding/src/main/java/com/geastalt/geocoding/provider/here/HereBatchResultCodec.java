/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.geastalt.geocoding.model.Coordinate;
import com.geastalt.geocoding.model.GeocodeMetadata;
import com.geastalt.geocoding.model.GeocodeResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Turns one row of a HERE batch result file into a {@link GeocodeResult}.
 * <p>
 * NOMATCH and FAILED rows always produce a result. Otherwise only the top candidate
 * ({@code SeqNumber} 1) does; further candidates for the same record are dropped.
 */
@Slf4j
public class HereBatchResultCodec {

    public static final String REC_ID = "recId";
    public static final String SEQ_NUMBER = "SeqNumber";
    public static final String MATCH_LEVEL = "matchLevel";
    public static final String MATCH_TYPE = "matchType";
    public static final String RELEVANCE = "relevance";
    public static final String DISPLAY_LATITUDE = "displayLatitude";
    public static final String DISPLAY_LONGITUDE = "displayLongitude";

    public static final String NO_MATCH = "NOMATCH";
    public static final String FAILED = "FAILED";
    public static final String FAILED_MESSAGE = "bulk geocoder failed";
    public static final String MALFORMED_MESSAGE = "bulk geocoder returned a malformed row";

    private static final String TOP_CANDIDATE = "1";

    public Optional<GeocodeResult> decode(Map<String, String> row) {
        String recId = row.get(REC_ID);
        if (recId == null || recId.isEmpty()) {
            log.warn("Skipping batch result row without recId: {}", row);
            return Optional.empty();
        }

        String matchLevel = row.get(MATCH_LEVEL);
        if (NO_MATCH.equals(matchLevel)) {
            return Optional.of(GeocodeResult.noMatch(recId));
        }
        if (FAILED.equals(matchLevel)) {
            return Optional.of(GeocodeResult.error(recId, FAILED_MESSAGE));
        }
        if (!TOP_CANDIDATE.equals(row.get(SEQ_NUMBER))) {
            return Optional.empty();
        }

        try {
            Coordinate coordinate = new Coordinate(
                    number(row, DISPLAY_LONGITUDE),
                    number(row, DISPLAY_LATITUDE));
            GeocodeMetadata metadata = GeocodeMetadata.of(
                    number(row, RELEVANCE),
                    HereMatchQuality.precision(row.get(MATCH_TYPE)),
                    HereMatchQuality.matchTypes(matchLevel));
            return Optional.of(new GeocodeResult(recId, coordinate, metadata));
        } catch (NumberFormatException e) {
            log.warn("Malformed batch result row for recId '{}': {}", recId, e.getMessage());
            return Optional.of(GeocodeResult.error(recId, MALFORMED_MESSAGE));
        }
    }

    private static double number(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new NumberFormatException("missing " + column);
        }
        return Double.parseDouble(value.trim());
    }
}
