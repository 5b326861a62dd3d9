/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for scanning, detection and the ingestion pipeline.
 *
 * Every value has a default, so a missing file or a partial file is valid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestConfig {
    private static final Logger log = LoggerFactory.getLogger(IngestConfig.class);

    @JsonProperty("log_level")
    private String logLevel = "INFO";

    private ScanConfig scan = new ScanConfig();
    private DetectorConfig detector = new DetectorConfig();
    private PipelineConfig pipeline = new PipelineConfig();

    /**
     * Path to the config file (set when loaded).
     */
    private transient File configFile;

    public static IngestConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        IngestConfig config = mapper.readValue(configFile, IngestConfig.class);
        if (config == null) {
            config = new IngestConfig();
        }
        config.configFile = configFile;
        return config;
    }

    public static IngestConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Load the file when it exists, otherwise return defaults.
     */
    public static IngestConfig loadOrDefault(File configFile) throws IOException {
        if (configFile == null || !configFile.isFile()) {
            log.debug("No configuration file at {}, using defaults", configFile);
            return new IngestConfig();
        }
        return load(configFile);
    }

    /**
     * Save the configuration back to the YAML file it was loaded from.
     */
    public void save() throws IOException {
        if (configFile == null) {
            throw new IOException("No config file path set");
        }
        save(configFile);
    }

    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
        this.configFile = file;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

    public ScanConfig getScan() {
        return scan;
    }

    public void setScan(ScanConfig scan) {
        this.scan = scan;
    }

    public DetectorConfig getDetector() {
        return detector;
    }

    public void setDetector(DetectorConfig detector) {
        this.detector = detector;
    }

    public PipelineConfig getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineConfig pipeline) {
        this.pipeline = pipeline;
    }

    @JsonIgnore
    public File getConfigFile() {
        return configFile;
    }

    // ========================================================================
    // Directory scanning
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScanConfig {
        /**
         * Directory names never descended into (case-insensitive).
         */
        @JsonProperty("skip_directories")
        private List<String> skipDirectories = new ArrayList<>(Arrays.asList(
                ".git", ".svn", ".hg", "__pycache__", "node_modules", ".cache", ".idea", ".vscode",
                "target", "build", "dist", "out", "tmp", "temp", ".tmp",
                "$RECYCLE.BIN", "System Volume Information"));

        /**
         * Extensions accepted as records without probing.
         */
        @JsonProperty("record_extensions")
        private List<String> recordExtensions = new ArrayList<>(Arrays.asList("dcm", "dicom", "dic", "ima"));

        /**
         * Extensions that are never records: text, archive, office and common media files.
         */
        @JsonProperty("rejected_extensions")
        private List<String> rejectedExtensions = new ArrayList<>(Arrays.asList(
                "txt", "log", "md", "csv", "json", "xml", "yaml", "yml", "ini", "cfg", "html", "htm",
                "zip", "gz", "tgz", "tar", "7z", "rar", "bz2", "xz",
                "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "odt", "rtf",
                "jpg", "jpeg", "png", "gif", "bmp", "tif", "tiff", "svg", "ico",
                "mp3", "wav", "flac", "mp4", "avi", "mov", "mkv", "wmv",
                "exe", "dll", "so", "class", "jar", "py", "java", "js", "css", "sh", "bat"));

        /**
         * Base-name keywords that move a candidate to the front of the probe order.
         */
        @JsonProperty("priority_keywords")
        private List<String> priorityKeywords = new ArrayList<>(Arrays.asList(
                "dicom", "dcm", "img", "ima", "image", "series", "study", "scan", "slice", "ct", "mr", "mri"));

        @JsonProperty("max_candidate_extension_length")
        private int maxCandidateExtensionLength = 4;

        /**
         * Probe batch size is total candidates divided by this value (minimum 1).
         */
        @JsonProperty("batch_divisor")
        private int batchDivisor = 50;

        /**
         * Pause after each probe batch; 0 means a plain thread yield.
         */
        @JsonProperty("yield_millis")
        private long yieldMillis = 1;

        @JsonProperty("skip_protected_paths")
        private boolean skipProtectedPaths = true;

        public List<String> getSkipDirectories() {
            return skipDirectories;
        }

        public void setSkipDirectories(List<String> skipDirectories) {
            this.skipDirectories = skipDirectories;
        }

        public List<String> getRecordExtensions() {
            return recordExtensions;
        }

        public void setRecordExtensions(List<String> recordExtensions) {
            this.recordExtensions = recordExtensions;
        }

        public List<String> getRejectedExtensions() {
            return rejectedExtensions;
        }

        public void setRejectedExtensions(List<String> rejectedExtensions) {
            this.rejectedExtensions = rejectedExtensions;
        }

        public List<String> getPriorityKeywords() {
            return priorityKeywords;
        }

        public void setPriorityKeywords(List<String> priorityKeywords) {
            this.priorityKeywords = priorityKeywords;
        }

        public int getMaxCandidateExtensionLength() {
            return maxCandidateExtensionLength;
        }

        public void setMaxCandidateExtensionLength(int maxCandidateExtensionLength) {
            this.maxCandidateExtensionLength = maxCandidateExtensionLength;
        }

        public int getBatchDivisor() {
            return batchDivisor;
        }

        public void setBatchDivisor(int batchDivisor) {
            this.batchDivisor = batchDivisor;
        }

        public long getYieldMillis() {
            return yieldMillis;
        }

        public void setYieldMillis(long yieldMillis) {
            this.yieldMillis = yieldMillis;
        }

        public boolean isSkipProtectedPaths() {
            return skipProtectedPaths;
        }

        public void setSkipProtectedPaths(boolean skipProtectedPaths) {
            this.skipProtectedPaths = skipProtectedPaths;
        }
    }

    // ========================================================================
    // Format detection
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DetectorConfig {
        @JsonProperty("min_file_size")
        private long minFileSize = 128;

        @JsonProperty("max_file_size")
        private long maxFileSize = 500L * 1024 * 1024;

        @JsonProperty("video_transfer_syntaxes")
        private List<String> videoTransferSyntaxes = new ArrayList<>(Arrays.asList(
                "1.2.840.10008.1.2.4.100",    // MPEG2 Main Profile / Main Level
                "1.2.840.10008.1.2.4.100.1",
                "1.2.840.10008.1.2.4.101",    // MPEG2 Main Profile / High Level
                "1.2.840.10008.1.2.4.101.1",
                "1.2.840.10008.1.2.4.102",    // MPEG-4 AVC/H.264 High Profile / Level 4.1
                "1.2.840.10008.1.2.4.102.1",
                "1.2.840.10008.1.2.4.103",    // MPEG-4 AVC/H.264 BD-compatible
                "1.2.840.10008.1.2.4.103.1",
                "1.2.840.10008.1.2.4.104",    // MPEG-4 AVC/H.264 2D video
                "1.2.840.10008.1.2.4.104.1",
                "1.2.840.10008.1.2.4.105",    // MPEG-4 AVC/H.264 3D video
                "1.2.840.10008.1.2.4.105.1",
                "1.2.840.10008.1.2.4.106",    // MPEG-4 AVC/H.264 Stereo High Profile
                "1.2.840.10008.1.2.4.106.1",
                "1.2.840.10008.1.2.4.107",    // HEVC/H.265 Main Profile
                "1.2.840.10008.1.2.4.108"));  // HEVC/H.265 Main 10 Profile

        @JsonProperty("video_sop_classes")
        private List<String> videoSopClasses = new ArrayList<>(Arrays.asList(
                "1.2.840.10008.5.1.4.1.1.77.1.1.1",  // Video Endoscopic Image
                "1.2.840.10008.5.1.4.1.1.77.1.2.1",  // Video Microscopic Image
                "1.2.840.10008.5.1.4.1.1.77.1.4.1",  // Video Photographic Image
                "1.2.840.10008.5.1.4.1.1.77.1.4",    // VL Photographic Image
                "1.2.840.10008.5.1.4.1.1.3.1"));     // Ultrasound Multi-frame Image

        @JsonProperty("video_modalities")
        private List<String> videoModalities = new ArrayList<>(Arrays.asList("US", "XA", "RF", "ES", "IVUS"));

        /**
         * Frame counts above this are video even without timing attributes.
         */
        @JsonProperty("frame_count_threshold")
        private int frameCountThreshold = 10;

        public long getMinFileSize() {
            return minFileSize;
        }

        public void setMinFileSize(long minFileSize) {
            this.minFileSize = minFileSize;
        }

        public long getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
        }

        public List<String> getVideoTransferSyntaxes() {
            return videoTransferSyntaxes;
        }

        public void setVideoTransferSyntaxes(List<String> videoTransferSyntaxes) {
            this.videoTransferSyntaxes = videoTransferSyntaxes;
        }

        public List<String> getVideoSopClasses() {
            return videoSopClasses;
        }

        public void setVideoSopClasses(List<String> videoSopClasses) {
            this.videoSopClasses = videoSopClasses;
        }

        public List<String> getVideoModalities() {
            return videoModalities;
        }

        public void setVideoModalities(List<String> videoModalities) {
            this.videoModalities = videoModalities;
        }

        public int getFrameCountThreshold() {
            return frameCountThreshold;
        }

        public void setFrameCountThreshold(int frameCountThreshold) {
            this.frameCountThreshold = frameCountThreshold;
        }
    }

    // ========================================================================
    // Ingestion pipeline
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PipelineConfig {
        @JsonProperty("poll_interval_millis")
        private long pollIntervalMillis = 50;

        /**
         * Maximum messages dispatched per polling tick.
         */
        @JsonProperty("drain_limit")
        private int drainLimit = 10;

        /**
         * A load progress message is posted every this many files (and on the last file).
         */
        @JsonProperty("progress_every")
        private int progressEvery = 3;

        public long getPollIntervalMillis() {
            return pollIntervalMillis;
        }

        public void setPollIntervalMillis(long pollIntervalMillis) {
            this.pollIntervalMillis = pollIntervalMillis;
        }

        public int getDrainLimit() {
            return drainLimit;
        }

        public void setDrainLimit(int drainLimit) {
            this.drainLimit = drainLimit;
        }

        public int getProgressEvery() {
            return progressEvery;
        }

        public void setProgressEvery(int progressEvery) {
            this.progressEvery = progressEvery;
        }
    }
}
