/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

/**
 * The host's single-threaded cooperative scheduler, used to run the pipeline's polling step.
 */
public interface HostScheduler {

    /**
     * Run {@code task} every {@code periodMillis} until the returned handle is cancelled.
     */
    Handle scheduleAtFixedRate(Runnable task, long periodMillis);

    interface Handle {
        void cancel();

        boolean isCancelled();
    }
}
