/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Records of one series, in arrival order until {@link #sort()} orders them by instance number.
 */
public class SeriesBucket {

    private static final Comparator<RecordMetadata> BY_INSTANCE =
            Comparator.comparingInt(RecordMetadata::getInstanceNumber);

    private final SeriesKey key;
    private final List<RecordMetadata> records = new ArrayList<>();

    public SeriesBucket(SeriesKey key) {
        this.key = key;
    }

    @JsonIgnore
    public SeriesKey getKey() {
        return key;
    }

    @JsonProperty("key")
    public String getDisplayKey() {
        return key.format();
    }

    /**
     * Records are matched on the display key, so keys that format alike share a bucket.
     *
     * @throws IllegalArgumentException if the record belongs to another series
     */
    public void add(RecordMetadata record) {
        if (!getDisplayKey().equals(record.seriesKey().format())) {
            throw new IllegalArgumentException(record.getPath() + " belongs to " + record.seriesKey()
                    + ", not " + key);
        }
        records.add(record);
    }

    /**
     * Stable sort by instance number; equal numbers keep arrival order.
     */
    public void sort() {
        records.sort(BY_INSTANCE);
    }

    @JsonProperty("records")
    public List<RecordMetadata> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public RecordMetadata get(int index) {
        return records.get(index);
    }

    @JsonProperty("count")
    public int size() {
        return records.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return key.format() + " (" + records.size() + " files)";
    }
}
