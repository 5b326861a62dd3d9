/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.series;

import io.xnatworks.ingest.detect.FormatDetector;
import io.xnatworks.ingest.dicom.DicomHeader;
import io.xnatworks.ingest.dicom.DicomHeaderReader;
import io.xnatworks.ingest.dicom.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link RecordMetadata} from a file's header. Missing attributes take the display
 * defaults ("Series", "UID", "Unknown", instance 0, one frame, series 0).
 */
public class MetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private final DicomHeaderReader reader;
    private final FormatDetector detector;

    public MetadataExtractor(FormatDetector detector) {
        this(new DicomHeaderReader(), detector);
    }

    public MetadataExtractor(DicomHeaderReader reader, FormatDetector detector) {
        this.reader = reader;
        this.detector = detector;
    }

    public RecordMetadata extract(Path file) throws IOException {
        long size = Files.size(file);
        DicomHeader header = reader.read(file);
        boolean video = detector.classifyVideo(file, header);

        RecordMetadata metadata = RecordMetadata.builder(file)
                .fileSize(size)
                .seriesInstanceUid(header.getString(Tags.SeriesInstanceUID, "UID"))
                .seriesDescription(header.getString(Tags.SeriesDescription, "Series"))
                .seriesNumber(header.getInt(Tags.SeriesNumber, 0))
                .modality(header.getString(Tags.Modality, "Unknown"))
                .patientName(header.getString(Tags.PatientName, "Unknown"))
                .patientId(header.getString(Tags.PatientID, "Unknown"))
                .studyDescription(header.getString(Tags.StudyDescription, "Unknown"))
                .studyDate(header.getString(Tags.StudyDate, "Unknown"))
                .instanceNumber(header.getInt(Tags.InstanceNumber, 0))
                .numberOfFrames(Math.max(1, header.getInt(Tags.NumberOfFrames, 1)))
                .video(video)
                .sopClassUid(sopClass(header))
                .transferSyntaxUid(header.getTransferSyntaxUid())
                .rows(header.getInt(Tags.Rows, 0))
                .columns(header.getInt(Tags.Columns, 0))
                .build();
        log.trace("Extracted {}", metadata);
        return metadata;
    }

    private static String sopClass(DicomHeader header) {
        String sopClass = header.getString(Tags.SOPClassUID);
        return sopClass != null ? sopClass : header.getString(Tags.MediaStorageSOPClassUID);
    }
}
