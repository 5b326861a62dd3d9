/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

/**
 * Renders the information panel text for one record.
 */
public class RecordInfoFormatter {

    static final int UID_TAIL = 20;
    static final int PATH_TAIL = 30;

    /**
     * @param seriesIndex zero-based index of the record's series
     * @param seriesCount number of series
     * @param instanceIndex zero-based index of the record within its series
     * @param seriesLength number of records in the series
     */
    public String format(RecordMetadata record, int seriesIndex, int seriesCount,
                         int instanceIndex, int seriesLength) {
        StringBuilder sb = new StringBuilder();
        sb.append("SERIES/IMAGE INFORMATION\n\n");

        sb.append("SERIES: ").append(seriesIndex + 1).append(" / ").append(seriesCount).append('\n');
        sb.append("Description: ").append(record.getSeriesDescription()).append('\n');
        sb.append("Series UID: ").append(tail(record.getSeriesInstanceUid(), UID_TAIL)).append("...\n\n");

        sb.append("IMAGE: ").append(instanceIndex + 1).append(" / ").append(seriesLength).append('\n');
        sb.append("Instance: ").append(record.getInstanceNumber()).append('\n');
        sb.append("Type: ").append(record.isVideo() ? "video" : "image").append('\n');
        sb.append("Modality: ").append(record.getModality()).append('\n');
        sb.append("Frames: ").append(record.getNumberOfFrames()).append('\n');
        if (record.getRows() > 0 && record.getColumns() > 0) {
            sb.append("Size: ").append(record.getColumns()).append('x').append(record.getRows()).append('\n');
        }
        sb.append('\n');

        sb.append("PATIENT:\n");
        sb.append("Name: ").append(record.getPatientName()).append('\n');
        sb.append("ID: ").append(record.getPatientId()).append('\n');
        sb.append("Study: ").append(record.getStudyDescription()).append('\n');
        sb.append("Date: ").append(record.getStudyDate()).append("\n\n");

        sb.append("FILE:\n");
        sb.append("Name: ").append(record.getPath().getFileName()).append('\n');
        sb.append("Size: ").append(record.getFileSize()).append(" bytes\n");
        sb.append("Path: ...").append(tail(record.getPath().toString(), PATH_TAIL)).append('\n');
        return sb.toString();
    }

    static String tail(String value, int length) {
        if (value == null) {
            return "";
        }
        return value.length() <= length ? value : value.substring(value.length() - length);
    }
}
