/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file found by the scanner. The path never changes; the classification starts as
 * {@link Classification#UNKNOWN} and may be set exactly once.
 */
public class FileCandidate {

    public enum Classification {
        UNKNOWN,
        RECORD,
        VIDEO,
        REJECTED
    }

    private final Path path;
    private volatile Classification classification = Classification.UNKNOWN;

    public FileCandidate(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public FileCandidate(Path path, Classification classification) {
        this(path);
        classify(classification);
    }

    public Path getPath() {
        return path;
    }

    public Classification getClassification() {
        return classification;
    }

    public synchronized void classify(Classification value) {
        Objects.requireNonNull(value, "classification");
        if (value == Classification.UNKNOWN) {
            throw new IllegalArgumentException("Cannot classify as UNKNOWN");
        }
        if (classification != Classification.UNKNOWN) {
            throw new IllegalStateException(path + " already classified as " + classification);
        }
        classification = value;
    }

    public boolean isRecord() {
        return classification == Classification.RECORD || classification == Classification.VIDEO;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileCandidate)) return false;
        return path.equals(((FileCandidate) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path + " [" + classification + "]";
    }
}
