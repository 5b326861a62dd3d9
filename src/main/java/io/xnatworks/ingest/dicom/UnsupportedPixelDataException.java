/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

import java.io.IOException;

/**
 * Thrown when a record's pixel data uses an encoding this project cannot decode.
 */
public class UnsupportedPixelDataException extends IOException {

    public UnsupportedPixelDataException(String message) {
        super(message);
    }
}
