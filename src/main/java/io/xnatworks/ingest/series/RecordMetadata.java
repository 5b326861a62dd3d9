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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Lightweight attributes of one record, read without decoding pixel data.
 * Instances are immutable; use {@link #builder(Path)}.
 */
public final class RecordMetadata {

    private final Path path;
    private final long fileSize;
    private final String seriesInstanceUid;
    private final String seriesDescription;
    private final int seriesNumber;
    private final String modality;
    private final String patientName;
    private final String patientId;
    private final String studyDescription;
    private final String studyDate;
    private final int instanceNumber;
    private final int numberOfFrames;
    private final boolean video;
    private final String sopClassUid;
    private final String transferSyntaxUid;
    private final int rows;
    private final int columns;

    private RecordMetadata(Builder b) {
        this.path = b.path;
        this.fileSize = b.fileSize;
        this.seriesInstanceUid = b.seriesInstanceUid;
        this.seriesDescription = b.seriesDescription;
        this.seriesNumber = b.seriesNumber;
        this.modality = b.modality;
        this.patientName = b.patientName;
        this.patientId = b.patientId;
        this.studyDescription = b.studyDescription;
        this.studyDate = b.studyDate;
        this.instanceNumber = b.instanceNumber;
        this.numberOfFrames = b.numberOfFrames;
        this.video = b.video;
        this.sopClassUid = b.sopClassUid;
        this.transferSyntaxUid = b.transferSyntaxUid;
        this.rows = b.rows;
        this.columns = b.columns;
    }

    public static Builder builder(Path path) {
        return new Builder(path);
    }

    @JsonIgnore
    public Path getPath() { return path; }

    @JsonProperty("file_path")
    public String getFilePath() { return path.toString(); }

    @JsonProperty("file_size")
    public long getFileSize() { return fileSize; }

    @JsonProperty("series_uid")
    public String getSeriesInstanceUid() { return seriesInstanceUid; }

    @JsonProperty("series_description")
    public String getSeriesDescription() { return seriesDescription; }

    @JsonProperty("series_number")
    public int getSeriesNumber() { return seriesNumber; }

    @JsonProperty("modality")
    public String getModality() { return modality; }

    @JsonProperty("patient_name")
    public String getPatientName() { return patientName; }

    @JsonProperty("patient_id")
    public String getPatientId() { return patientId; }

    @JsonProperty("study_description")
    public String getStudyDescription() { return studyDescription; }

    @JsonProperty("study_date")
    public String getStudyDate() { return studyDate; }

    @JsonProperty("instance_number")
    public int getInstanceNumber() { return instanceNumber; }

    @JsonProperty("number_of_frames")
    public int getNumberOfFrames() { return numberOfFrames; }

    @JsonProperty("is_video")
    public boolean isVideo() { return video; }

    @JsonProperty("sop_class_uid")
    public String getSopClassUid() { return sopClassUid; }

    @JsonProperty("transfer_syntax_uid")
    public String getTransferSyntaxUid() { return transferSyntaxUid; }

    @JsonProperty("rows")
    public int getRows() { return rows; }

    @JsonProperty("columns")
    public int getColumns() { return columns; }

    /**
     * Series this record belongs to.
     */
    public SeriesKey seriesKey() {
        return new SeriesKey(seriesNumber, seriesDescription, modality, video);
    }

    @Override
    public String toString() {
        return "RecordMetadata{" + path.getFileName() + ", series=" + seriesNumber
                + ", instance=" + instanceNumber + ", modality=" + modality + (video ? ", video" : "") + "}";
    }

    public static class Builder {
        private final Path path;
        private long fileSize;
        private String seriesInstanceUid = "UID";
        private String seriesDescription = "Series";
        private int seriesNumber;
        private String modality = "Unknown";
        private String patientName = "Unknown";
        private String patientId = "Unknown";
        private String studyDescription = "Unknown";
        private String studyDate = "Unknown";
        private int instanceNumber;
        private int numberOfFrames = 1;
        private boolean video;
        private String sopClassUid;
        private String transferSyntaxUid;
        private int rows;
        private int columns;

        private Builder(Path path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder seriesInstanceUid(String seriesInstanceUid) {
            this.seriesInstanceUid = seriesInstanceUid;
            return this;
        }

        public Builder seriesDescription(String seriesDescription) {
            this.seriesDescription = seriesDescription;
            return this;
        }

        public Builder seriesNumber(int seriesNumber) {
            this.seriesNumber = seriesNumber;
            return this;
        }

        public Builder modality(String modality) {
            this.modality = modality;
            return this;
        }

        public Builder patientName(String patientName) {
            this.patientName = patientName;
            return this;
        }

        public Builder patientId(String patientId) {
            this.patientId = patientId;
            return this;
        }

        public Builder studyDescription(String studyDescription) {
            this.studyDescription = studyDescription;
            return this;
        }

        public Builder studyDate(String studyDate) {
            this.studyDate = studyDate;
            return this;
        }

        public Builder instanceNumber(int instanceNumber) {
            this.instanceNumber = instanceNumber;
            return this;
        }

        public Builder numberOfFrames(int numberOfFrames) {
            this.numberOfFrames = numberOfFrames;
            return this;
        }

        public Builder video(boolean video) {
            this.video = video;
            return this;
        }

        public Builder sopClassUid(String sopClassUid) {
            this.sopClassUid = sopClassUid;
            return this;
        }

        public Builder transferSyntaxUid(String transferSyntaxUid) {
            this.transferSyntaxUid = transferSyntaxUid;
            return this;
        }

        public Builder rows(int rows) {
            this.rows = rows;
            return this;
        }

        public Builder columns(int columns) {
            this.columns = columns;
            return this;
        }

        public RecordMetadata build() {
            return new RecordMetadata(this);
        }
    }
}
