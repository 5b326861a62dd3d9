/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.scan;

/**
 * Receives coarse scan progress.
 */
@FunctionalInterface
public interface ScanProgressListener {

    ScanProgressListener NONE = (percent, status) -> { };

    /**
     * @param percent 0 to 100
     * @param status human-readable status line
     */
    void onProgress(double percent, String status);
}
