/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.geastalt.geocoding.exception.InvalidRequestException;
import com.geastalt.geocoding.model.SearchRequest;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes searches as the pipe-delimited input document of a HERE batch job: a
 * {@code recId|searchText|country} header followed by one row per search.
 */
public class HereBatchPayloadEncoder {

    public static final char DELIMITER = '|';

    static final String REC_ID = "recId";
    static final String SEARCH_TEXT = "searchText";
    static final String COUNTRY = "country";

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn(REC_ID)
            .addColumn(SEARCH_TEXT)
            .addColumn(COUNTRY)
            .setColumnSeparator(DELIMITER)
            .setUseHeader(true)
            .build();

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public String encode(List<SearchRequest> searches) {
        requireUniqueIds(searches);

        List<Map<String, String>> rows = new ArrayList<>(searches.size());
        for (SearchRequest search : searches) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(REC_ID, search.id());
            row.put(SEARCH_TEXT, searchText(search));
            row.put(COUNTRY, search.country() != null ? search.country() : "");
            rows.add(row);
        }

        try {
            return csvMapper.writer(SCHEMA).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to write batch payload", e);
        }
    }

    /**
     * Address, city and state joined with ", ", skipping blank parts.
     */
    static String searchText(SearchRequest search) {
        return Stream.of(search.address(), search.city(), search.state())
                .filter(part -> part != null && !part.isEmpty())
                .collect(Collectors.joining(", "));
    }

    /**
     * Results come back keyed by id only, so ids must be present and distinct.
     */
    public static void requireUniqueIds(List<SearchRequest> searches) {
        Set<String> seen = new HashSet<>();
        for (SearchRequest search : searches) {
            if (search.id() == null || search.id().isEmpty()) {
                throw new InvalidRequestException("Every search needs an id");
            }
            if (!seen.add(search.id())) {
                throw new InvalidRequestException("Duplicate search id '" + search.id() + "' in batch");
            }
        }
    }
}
