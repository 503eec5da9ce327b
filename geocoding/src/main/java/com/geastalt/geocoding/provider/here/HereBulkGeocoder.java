/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.geastalt.geocoding.batch.BatchJob;
import com.geastalt.geocoding.batch.BatchJobPoller;
import com.geastalt.geocoding.batch.BatchJobState;
import com.geastalt.geocoding.common.Sleeper;
import com.geastalt.geocoding.exception.InvalidRequestException;
import com.geastalt.geocoding.model.GeocodeResult;
import com.geastalt.geocoding.model.SearchRequest;
import com.geastalt.geocoding.provider.BulkGeocoder;
import com.geastalt.geocoding.provider.GeocodeStrategy;
import com.geastalt.geocoding.provider.SerialGeocodeExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk geocoding through HERE. Large request lists go through an asynchronous batch job;
 * small ones are geocoded one request at a time, where the job round trip would cost more
 * than it saves.
 * <p>
 * Both credential generations share this flow; they differ only in the parameters and
 * endpoints supplied by {@link HereCredentials}.
 */
@Slf4j
@Component
public class HereBulkGeocoder implements BulkGeocoder {

    private final HereConfig hereConfig;
    private final HereBatchApiClient batchApiClient;
    private final SerialGeocodeExecutor serialExecutor;
    private final HereBatchPayloadEncoder payloadEncoder = new HereBatchPayloadEncoder();
    private final HereResultArchiveReader archiveReader = new HereResultArchiveReader(new HereBatchResultCodec());
    private final BatchJobPoller poller;

    public HereBulkGeocoder(HereConfig hereConfig, HereBatchApiClient batchApiClient,
                            HereStreetGeocoder streetGeocoder, Sleeper sleeper) {
        this.hereConfig = hereConfig;
        this.batchApiClient = batchApiClient;
        this.serialExecutor = new SerialGeocodeExecutor(streetGeocoder);
        HereConfig.Batch batch = hereConfig.getBatch();
        this.poller = new BatchJobPoller(batch.getMaxStalledRetries(), batch.getPollInterval(), sleeper);
    }

    @Override
    public String getProviderId() {
        return "here";
    }

    @Override
    public String getDisplayName() {
        return "HERE Batch Geocoder";
    }

    @Override
    public boolean isEnabled() {
        return hereConfig.hasCredentials();
    }

    @Override
    public List<GeocodeResult> bulkGeocode(List<SearchRequest> searches) {
        int maxBatchSize = hereConfig.getBatch().getMaxBatchSize();
        if (searches.size() > maxBatchSize) {
            throw new InvalidRequestException("Batch size can't be larger than " + maxBatchSize);
        }
        HereBatchPayloadEncoder.requireUniqueIds(searches);

        GeocodeStrategy strategy = decide(searches);
        log.info("Geocoding {} searches with HERE using {} strategy", searches.size(), strategy);
        return strategy == GeocodeStrategy.BATCH
                ? batchGeocode(searches)
                : serialExecutor.geocode(searches);
    }

    public GeocodeStrategy decide(List<SearchRequest> searches) {
        return searches.size() >= hereConfig.getBatch().getMinBatchedSearch()
                ? GeocodeStrategy.BATCH
                : GeocodeStrategy.SERIAL;
    }

    List<GeocodeResult> batchGeocode(List<SearchRequest> searches) {
        String jobId = batchApiClient.submit(payloadEncoder.encode(searches));

        BatchJob job = poller.awaitTermination(jobId, batchApiClient::status);
        if (job.getState() != BatchJobState.COMPLETED) {
            log.warn("HERE batch job {} ended as {}, results may be incomplete", jobId, job.getState());
        }

        List<GeocodeResult> results = reconcile(jobId, searches, archiveReader.read(batchApiClient.download(jobId)));
        log.info("HERE batch job {} produced {} results", jobId, results.size());
        return results;
    }

    /**
     * One result per search, in search order. The first decoded result for an id wins, ids
     * that were never requested are dropped, and searches the archive does not cover get a
     * failure result.
     */
    private List<GeocodeResult> reconcile(String jobId, List<SearchRequest> searches, List<GeocodeResult> decoded) {
        Map<String, GeocodeResult> byId = new HashMap<>();
        for (GeocodeResult result : decoded) {
            byId.putIfAbsent(result.id(), result);
        }

        List<GeocodeResult> results = new ArrayList<>(searches.size());
        int missing = 0;
        for (SearchRequest search : searches) {
            GeocodeResult result = byId.remove(search.id());
            if (result == null) {
                missing++;
                result = GeocodeResult.error(search.id(), HereBatchResultCodec.FAILED_MESSAGE);
            }
            results.add(result);
        }

        if (missing > 0) {
            log.warn("HERE batch job {} returned no result for {} of {} searches", jobId, missing, searches.size());
        }
        if (!byId.isEmpty()) {
            log.warn("HERE batch job {} returned {} results for unknown ids", jobId, byId.size());
        }
        return results;
    }
}
