/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.detect;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One content check used by {@link FormatDetector} to decide whether a file is a record.
 *
 * Probes are consulted in order after the extension and size checks. An exception from a
 * probe counts as "no match" for that probe only.
 */
public interface RecordProbe {

    /**
     * @param file regular file to inspect
     * @param size file size in bytes, already known to be within the accepted bounds
     * @return true if the content looks like a record
     */
    boolean probe(Path file, long size) throws IOException;

    /**
     * Short name used in log output.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
