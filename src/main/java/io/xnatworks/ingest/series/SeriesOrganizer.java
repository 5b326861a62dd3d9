/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Groups records into series buckets keyed by the formatted {@link SeriesKey}, in first-seen
 * order. Two keys with the same formatted text land in one bucket, whose key is the first
 * one seen. A new organizer is used for every load; nothing is merged across runs.
 */
public class SeriesOrganizer {
    private static final Logger log = LoggerFactory.getLogger(SeriesOrganizer.class);

    private final Map<String, SeriesBucket> buckets = new LinkedHashMap<>();

    /**
     * Organize and sort in one pass.
     */
    public static Map<String, SeriesBucket> organize(Iterable<RecordMetadata> records) {
        SeriesOrganizer organizer = new SeriesOrganizer();
        for (RecordMetadata record : records) {
            organizer.add(record);
        }
        organizer.sortAll();
        return organizer.getBuckets();
    }

    /**
     * Add a record to its bucket, creating the bucket on first sight.
     *
     * @return the bucket's display key
     */
    public String add(RecordMetadata record) {
        SeriesKey key = record.seriesKey();
        String display = key.format();
        SeriesBucket bucket = buckets.get(display);
        if (bucket == null) {
            bucket = new SeriesBucket(key);
            buckets.put(display, bucket);
            log.debug("New series {}", display);
        }
        bucket.add(record);
        return display;
    }

    public void sortAll() {
        for (SeriesBucket bucket : buckets.values()) {
            bucket.sort();
        }
    }

    public Map<String, SeriesBucket> getBuckets() {
        return Collections.unmodifiableMap(buckets);
    }

    public int getRecordCount() {
        int count = 0;
        for (SeriesBucket bucket : buckets.values()) {
            count += bucket.size();
        }
        return count;
    }
}
