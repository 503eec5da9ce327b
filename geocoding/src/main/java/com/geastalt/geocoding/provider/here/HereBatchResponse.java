/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.provider.here;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * XML envelope HERE returns for both job submission and job status.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HereBatchResponse {

    @JsonProperty("Response")
    private Response response;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Response {
        @JsonProperty("MetaInfo")
        private MetaInfo metaInfo;

        @JsonProperty("Status")
        private String status;

        @JsonProperty("TotalCount")
        private Integer totalCount;

        @JsonProperty("ProcessedCount")
        private Integer processedCount;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetaInfo {
        @JsonProperty("RequestId")
        private String requestId;
    }
}
