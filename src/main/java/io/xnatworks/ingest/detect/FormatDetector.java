/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.detect;

import io.xnatworks.ingest.config.IngestConfig;
import io.xnatworks.ingest.dicom.DicomHeader;
import io.xnatworks.ingest.dicom.DicomHeaderReader;
import io.xnatworks.ingest.dicom.PixelDataDecoder;
import io.xnatworks.ingest.dicom.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic file classification that avoids decoding pixel data.
 *
 * <p>{@link #classifyRecord(Path)} checks, in order and stopping at the first decision:
 * <ol>
 *   <li>record extension (no I/O beyond the name)</li>
 *   <li>file size bounds</li>
 *   <li>each configured {@link RecordProbe}: structural parse, magic at offset 128,
 *       leading tag pairs</li>
 * </ol>
 *
 * <p>{@link #classifyVideo(Path)} checks transfer syntax, SOP class, frame count with timing
 * attributes, and finally modality combined with a full decode. Any exception in one check
 * means that check does not match.
 */
public class FormatDetector {
    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    private static final int[] FRAME_TIMING_TAGS = {
            Tags.FrameTime,
            Tags.FrameTimeVector,
            Tags.CineRate,
            Tags.RecommendedDisplayFrameRate,
            Tags.FrameIncrementPointer
    };

    private final Set<String> recordExtensions;
    private final long minFileSize;
    private final long maxFileSize;
    private final Set<String> videoTransferSyntaxes;
    private final Set<String> videoSopClasses;
    private final Set<String> videoModalities;
    private final int frameCountThreshold;
    private final List<RecordProbe> probes;
    private final DicomHeaderReader reader;
    private final PixelDataDecoder decoder;

    public FormatDetector() {
        this(new IngestConfig());
    }

    public FormatDetector(IngestConfig config) {
        this(config, defaultProbes(new DicomHeaderReader()));
    }

    public FormatDetector(IngestConfig config, List<RecordProbe> probes) {
        this(config, probes, new DicomHeaderReader());
    }

    public FormatDetector(IngestConfig config, List<RecordProbe> probes, DicomHeaderReader reader) {
        IngestConfig.DetectorConfig detector = config.getDetector();
        this.recordExtensions = lowerCaseSet(config.getScan().getRecordExtensions());
        this.minFileSize = detector.getMinFileSize();
        this.maxFileSize = detector.getMaxFileSize();
        this.videoTransferSyntaxes = new HashSet<>(detector.getVideoTransferSyntaxes());
        this.videoSopClasses = new HashSet<>(detector.getVideoSopClasses());
        this.videoModalities = upperCaseSet(detector.getVideoModalities());
        this.frameCountThreshold = detector.getFrameCountThreshold();
        this.probes = Collections.unmodifiableList(new ArrayList<>(probes));
        this.reader = reader;
        this.decoder = new PixelDataDecoder(reader);
    }

    /**
     * Structural parse, then magic marker, then leading tag pairs.
     */
    public static List<RecordProbe> defaultProbes(DicomHeaderReader reader) {
        return Arrays.asList(
                new StructuralRecordProbe(reader),
                new PreambleMagicProbe(),
                new LeadingTagProbe());
    }

    /**
     * Decide whether a file is probably a record.
     */
    public boolean classifyRecord(Path file) {
        if (hasRecordExtension(file)) {
            return true;
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return false;
        }
        if (size < minFileSize || size > maxFileSize) {
            log.trace("Rejecting {} by size ({} bytes)", file, size);
            return false;
        }

        for (RecordProbe probe : probes) {
            try {
                if (probe.probe(file, size)) {
                    log.debug("{} accepted {}", probe.name(), file);
                    return true;
                }
            } catch (Exception e) {
                log.debug("{} failed on {}: {}", probe.name(), file, e.getMessage());
            }
        }
        return false;
    }

    /**
     * Decide whether a record is probably multi-frame video. Reads the header first.
     */
    public boolean classifyVideo(Path file) {
        DicomHeader header;
        try {
            header = reader.read(file);
        } catch (Exception e) {
            log.debug("Cannot read header of {}: {}", file, e.getMessage());
            return false;
        }
        return classifyVideo(file, header);
    }

    /**
     * Decide whether a record is probably multi-frame video, reusing a header already read.
     */
    public boolean classifyVideo(Path file, DicomHeader header) {
        try {
            String tsuid = header.getTransferSyntaxUid();
            if (tsuid != null && videoTransferSyntaxes.contains(tsuid)) {
                return true;
            }
        } catch (Exception e) {
            log.debug("Transfer syntax check failed for {}: {}", file, e.getMessage());
        }

        try {
            String sopClass = header.getString(Tags.SOPClassUID);
            if (sopClass == null) {
                sopClass = header.getString(Tags.MediaStorageSOPClassUID);
            }
            if (sopClass != null && videoSopClasses.contains(sopClass)) {
                return true;
            }
        } catch (Exception e) {
            log.debug("SOP class check failed for {}: {}", file, e.getMessage());
        }

        try {
            int frames = header.getInt(Tags.NumberOfFrames, 1);
            if (frames > 1 && (hasFrameTiming(header) || frames > frameCountThreshold)) {
                return true;
            }
        } catch (Exception e) {
            log.debug("Frame count check failed for {}: {}", file, e.getMessage());
        }

        try {
            String modality = header.getString(Tags.Modality);
            if (modality != null && videoModalities.contains(modality.trim().toUpperCase(Locale.ROOT))
                    && header.hasPixelData()) {
                return decoder.decode(file).getFrames() > 1;
            }
        } catch (Exception e) {
            log.debug("Decode check failed for {}: {}", file, e.getMessage());
        }
        return false;
    }

    public boolean hasRecordExtension(Path file) {
        String ext = extensionOf(file);
        return !ext.isEmpty() && recordExtensions.contains(ext);
    }

    /**
     * Lower-case extension without the dot, or an empty string.
     */
    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        if (dot <= 0 || dot == s.length() - 1) {
            return "";
        }
        return s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean hasFrameTiming(DicomHeader header) {
        for (int tag : FRAME_TIMING_TAGS) {
            if (header.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> lowerCaseSet(List<String> values) {
        Set<String> set = new HashSet<>();
        for (String v : values) {
            set.add(v.toLowerCase(Locale.ROOT));
        }
        return set;
    }

    private static Set<String> upperCaseSet(List<String> values) {
        Set<String> set = new HashSet<>();
        for (String v : values) {
            set.add(v.toUpperCase(Locale.ROOT));
        }
        return set;
    }
}
