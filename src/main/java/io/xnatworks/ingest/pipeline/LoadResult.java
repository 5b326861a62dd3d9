/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

import io.xnatworks.ingest.series.SeriesBucket;

import java.util.Map;

/**
 * Payload of a completed load: series buckets in first-seen order, each sorted by instance number.
 */
public class LoadResult {

    private final Map<String, SeriesBucket> series;
    private final int processedCount;
    private final int failedCount;
    private final boolean cancelled;

    public LoadResult(Map<String, SeriesBucket> series, int processedCount, int failedCount, boolean cancelled) {
        this.series = series;
        this.processedCount = processedCount;
        this.failedCount = failedCount;
        this.cancelled = cancelled;
    }

    public Map<String, SeriesBucket> getSeries() {
        return series;
    }

    public int getProcessedCount() {
        return processedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "LoadResult{" + series.size() + " series, " + processedCount + " processed, "
                + failedCount + " failed" + (cancelled ? ", cancelled" : "") + "}";
    }
}
