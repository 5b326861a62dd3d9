/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cursor over organized series for a viewer: one current series and one current instance
 * within it. Navigation wraps around at both ends; changing series resets the instance.
 */
public class SeriesBrowser {

    private final List<String> keys;
    private final Map<String, SeriesBucket> buckets;
    private int seriesIndex;
    private int instanceIndex;

    public SeriesBrowser(Map<String, SeriesBucket> buckets) {
        this.buckets = buckets;
        this.keys = new ArrayList<>(buckets.keySet());
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public int getSeriesCount() {
        return keys.size();
    }

    public List<String> getSeriesKeys() {
        return keys;
    }

    public int getSeriesIndex() {
        return seriesIndex;
    }

    public int getInstanceIndex() {
        return instanceIndex;
    }

    public void selectSeries(int index) {
        if (index < 0 || index >= keys.size()) {
            throw new IndexOutOfBoundsException("Series " + index + " of " + keys.size());
        }
        seriesIndex = index;
        instanceIndex = 0;
    }

    public void nextSeries() {
        changeSeries(1);
    }

    public void previousSeries() {
        changeSeries(-1);
    }

    public void nextInstance() {
        changeInstance(1);
    }

    public void previousInstance() {
        changeInstance(-1);
    }

    /**
     * Bucket under the cursor, or null when there are no series.
     */
    public SeriesBucket currentSeries() {
        if (keys.isEmpty()) {
            return null;
        }
        return buckets.get(keys.get(seriesIndex));
    }

    /**
     * Record under the cursor, or null when there are no series.
     */
    public RecordMetadata current() {
        SeriesBucket bucket = currentSeries();
        if (bucket == null || bucket.isEmpty()) {
            return null;
        }
        return bucket.get(instanceIndex);
    }

    /**
     * Information panel text for the record under the cursor.
     */
    public String describeCurrent(RecordInfoFormatter formatter) {
        RecordMetadata record = current();
        if (record == null) {
            return "";
        }
        return formatter.format(record, seriesIndex, keys.size(), instanceIndex, currentSeries().size());
    }

    private void changeSeries(int delta) {
        if (keys.isEmpty()) {
            return;
        }
        seriesIndex = Math.floorMod(seriesIndex + delta, keys.size());
        instanceIndex = 0;
    }

    private void changeInstance(int delta) {
        SeriesBucket bucket = currentSeries();
        if (bucket == null || bucket.isEmpty()) {
            return;
        }
        instanceIndex = Math.floorMod(instanceIndex + delta, bucket.size());
    }
}
