/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.detect;

import io.xnatworks.ingest.dicom.Tags;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Last-resort check for headerless datasets: reads the first 16 bytes as little endian
 * (group, element) pairs at offsets 0 and 8 and accepts the file if either pair is a
 * standard file meta or identifying header tag.
 */
public class LeadingTagProbe implements RecordProbe {

    private static final Set<Integer> KNOWN_LEADING_TAGS = new HashSet<>(Arrays.asList(
            0x00020000, 0x00020001, 0x00020002, 0x00020010,
            0x00080000, 0x00080005, 0x00080008, 0x00080016, 0x00080018));

    @Override
    public boolean probe(Path file, long size) throws IOException {
        byte[] head = new byte[16];
        int read;
        try (InputStream in = Files.newInputStream(file)) {
            read = in.readNBytes(head, 0, head.length);
        }
        if (read < head.length) {
            return false;
        }
        return isKnownTag(tagAt(head, 0)) || isKnownTag(tagAt(head, 8));
    }

    static boolean isKnownTag(int tag) {
        return KNOWN_LEADING_TAGS.contains(tag);
    }

    private static int tagAt(byte[] b, int off) {
        int group = (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8);
        int element = (b[off + 2] & 0xFF) | ((b[off + 3] & 0xFF) << 8);
        return (group << 16) | element;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LeadingTagProbe");
        for (int tag : KNOWN_LEADING_TAGS) {
            sb.append(' ').append(Tags.toString(tag));
        }
        return sb.toString();
    }
}
