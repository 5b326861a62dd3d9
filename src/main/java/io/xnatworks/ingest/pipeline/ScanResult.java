/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

import io.xnatworks.ingest.scan.FileCandidate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload of a completed scan: the raw candidate list, not organized into series.
 */
public class ScanResult {

    private final Path root;
    private final List<FileCandidate> candidates;
    private final boolean cancelled;

    public ScanResult(Path root, List<FileCandidate> candidates, boolean cancelled) {
        this.root = root;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.cancelled = cancelled;
    }

    public Path getRoot() {
        return root;
    }

    public List<FileCandidate> getCandidates() {
        return candidates;
    }

    public List<Path> getPaths() {
        List<Path> paths = new ArrayList<>(candidates.size());
        for (FileCandidate candidate : candidates) {
            paths.add(candidate.getPath());
        }
        return paths;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "ScanResult{" + root + ", " + candidates.size() + " candidates" + (cancelled ? ", cancelled" : "") + "}";
    }
}
