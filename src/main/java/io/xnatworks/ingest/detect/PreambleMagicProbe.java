/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.detect;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

/**
 * Accepts a file carrying the {@code DICM} marker after the 128-byte preamble.
 */
public class PreambleMagicProbe implements RecordProbe {

    static final int MAGIC_OFFSET = 128;

    @Override
    public boolean probe(Path file, long size) throws IOException {
        if (size < MAGIC_OFFSET + 4) {
            return false;
        }
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            raf.seek(MAGIC_OFFSET);
            byte[] magic = new byte[4];
            raf.readFully(magic);
            return magic[0] == 'D' && magic[1] == 'I' && magic[2] == 'C' && magic[3] == 'M';
        }
    }
}
