/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

import java.util.Objects;

/**
 * Composite series identity: series number, description, modality and video flag.
 * {@link #format()} gives the display key, e.g. {@code "003 - AX T2 (MR)"} or
 * {@code "001 - Cine (US) [VIDEO]"}.
 */
public final class SeriesKey {

    public static final String VIDEO_SUFFIX = " [VIDEO]";

    private final int seriesNumber;
    private final String seriesDescription;
    private final String modality;
    private final boolean video;

    public SeriesKey(int seriesNumber, String seriesDescription, String modality, boolean video) {
        this.seriesNumber = seriesNumber;
        this.seriesDescription = seriesDescription;
        this.modality = modality;
        this.video = video;
    }

    public int getSeriesNumber() {
        return seriesNumber;
    }

    public String getSeriesDescription() {
        return seriesDescription;
    }

    public String getModality() {
        return modality;
    }

    public boolean isVideo() {
        return video;
    }

    public String format() {
        return String.format("%03d - %s (%s)", seriesNumber, seriesDescription, modality)
                + (video ? VIDEO_SUFFIX : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesKey)) return false;
        SeriesKey that = (SeriesKey) o;
        return seriesNumber == that.seriesNumber
                && video == that.video
                && Objects.equals(seriesDescription, that.seriesDescription)
                && Objects.equals(modality, that.modality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesNumber, seriesDescription, modality, video);
    }

    @Override
    public String toString() {
        return format();
    }
}
