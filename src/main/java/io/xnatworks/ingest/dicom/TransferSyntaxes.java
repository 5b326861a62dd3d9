/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

/**
 * Transfer syntax UIDs and the encoding facts derived from them.
 */
public final class TransferSyntaxes {

    private TransferSyntaxes() {
    }

    public static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    public static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";
    public static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";
    public static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";

    public static final String JPEG_BASELINE = "1.2.840.10008.1.2.4.50";
    public static final String JPEG_EXTENDED = "1.2.840.10008.1.2.4.51";

    public static boolean isImplicitVr(String tsuid) {
        return IMPLICIT_VR_LITTLE_ENDIAN.equals(tsuid);
    }

    public static boolean isBigEndian(String tsuid) {
        return EXPLICIT_VR_BIG_ENDIAN.equals(tsuid);
    }

    public static boolean isDeflated(String tsuid) {
        return DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals(tsuid);
    }

    /**
     * Native (uncompressed) encodings keep pixel data as a single contiguous value.
     */
    public static boolean isNative(String tsuid) {
        return tsuid == null
                || IMPLICIT_VR_LITTLE_ENDIAN.equals(tsuid)
                || EXPLICIT_VR_LITTLE_ENDIAN.equals(tsuid)
                || DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals(tsuid)
                || EXPLICIT_VR_BIG_ENDIAN.equals(tsuid);
    }

    /**
     * JPEG process 1 and 2/4 frames can be handed to {@code javax.imageio} directly.
     */
    public static boolean isImageIoJpeg(String tsuid) {
        return JPEG_BASELINE.equals(tsuid) || JPEG_EXTENDED.equals(tsuid);
    }
}
