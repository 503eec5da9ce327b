/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.geastalt.geocoding.model.GeocodeResult;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads the zip archive a finished HERE batch job returns. Only entries named
 * {@code *_out.txt} are result files; anything else in the archive is ignored.
 * <p>
 * Results keep row order within a file. Each row is parsed on its own, so a malformed row
 * costs only that row. A truncated or unreadable archive yields the results read up to the
 * damage, since failed and cancelled jobs may return partial output.
 */
@Slf4j
public class HereResultArchiveReader {

    public static final String RESULTS_SUFFIX = "_out.txt";

    private static final Pattern HEADER_SPLIT = Pattern.compile(Pattern.quote(String.valueOf(HereBatchPayloadEncoder.DELIMITER)));

    private final HereBatchResultCodec codec;
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    public HereResultArchiveReader(HereBatchResultCodec codec) {
        this.codec = codec;
    }

    public List<GeocodeResult> read(byte[] archive) {
        List<GeocodeResult> results = new ArrayList<>();
        if (archive == null || archive.length == 0) {
            log.warn("Batch result archive is empty");
            return results;
        }

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory() || !entry.getName().endsWith(RESULTS_SUFFIX)) {
                    log.debug("Ignoring archive entry {}", entry.getName());
                    continue;
                }
                int before = results.size();
                readResultFile(entry.getName(), zip.readAllBytes(), results);
                log.info("Read {} results from {}", results.size() - before, entry.getName());
            }
        } catch (IOException e) {
            log.warn("Batch result archive is unreadable after {} results: {}", results.size(), e.getMessage());
        }
        return results;
    }

    private void readResultFile(String name, byte[] content, List<GeocodeResult> results) throws IOException {
        try (BufferedReader lines = new BufferedReader(
                new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8))) {
            ObjectReader rowReader = null;
            int lineNumber = 0;
            String line;
            while ((line = lines.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                if (rowReader == null) {
                    rowReader = rowReaderFor(line);
                    continue;
                }
                try {
                    Map<String, String> row = rowReader.readValue(line);
                    codec.decode(row).ifPresent(results::add);
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping malformed row {} of {}: {}", lineNumber, name, e.getMessage());
                }
            }
        }
    }

    private ObjectReader rowReaderFor(String headerLine) {
        CsvSchema.Builder schema = CsvSchema.builder()
                .setColumnSeparator(HereBatchPayloadEncoder.DELIMITER);
        for (String column : HEADER_SPLIT.split(headerLine.trim(), -1)) {
            schema.addColumn(column.trim());
        }
        return csvMapper.readerForMapOf(String.class).with(schema.build());
    }
}
