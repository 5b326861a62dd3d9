/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON summary of a load: every series with its records, plus counts.
 */
public class SeriesReport {

    private final Instant generatedAt;
    private final List<SeriesBucket> series;
    private final int recordCount;
    private final int failedCount;

    public SeriesReport(Map<String, SeriesBucket> buckets, int failedCount) {
        this(buckets, failedCount, Instant.now());
    }

    public SeriesReport(Map<String, SeriesBucket> buckets, int failedCount, Instant generatedAt) {
        this.generatedAt = generatedAt;
        this.series = new ArrayList<>(buckets.values());
        int count = 0;
        for (SeriesBucket bucket : series) {
            count += bucket.size();
        }
        this.recordCount = count;
        this.failedCount = failedCount;
    }

    @JsonProperty("generated_at")
    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @JsonProperty("series_count")
    public int getSeriesCount() {
        return series.size();
    }

    @JsonProperty("record_count")
    public int getRecordCount() {
        return recordCount;
    }

    @JsonProperty("failed_count")
    public int getFailedCount() {
        return failedCount;
    }

    @JsonProperty("series")
    public List<SeriesBucket> getSeries() {
        return series;
    }

    public String toJson() throws JsonProcessingException {
        return createMapper().writeValueAsString(this);
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
