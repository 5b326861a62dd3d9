/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

/**
 * Host-side receiver of pipeline messages. Called on the scheduler thread, never on a worker.
 */
public interface ProgressListener {

    void onProgress(double percent, String status);

    /**
     * @param payload {@link ScanResult} after a scan, {@link LoadResult} after a load
     */
    void onCompleted(Object payload);

    void onFailure(String message);
}
