/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.detect;

import io.xnatworks.ingest.dicom.DicomHeaderReader;
import io.xnatworks.ingest.dicom.DicomParseException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Accepts a file whose header and tag directory parse cleanly, without reading pixel data.
 */
public class StructuralRecordProbe implements RecordProbe {

    private final DicomHeaderReader reader;

    public StructuralRecordProbe() {
        this(new DicomHeaderReader());
    }

    public StructuralRecordProbe(DicomHeaderReader reader) {
        this.reader = reader;
    }

    @Override
    public boolean probe(Path file, long size) throws IOException {
        try {
            reader.read(file);
            return true;
        } catch (DicomParseException e) {
            return false;
        }
    }
}
