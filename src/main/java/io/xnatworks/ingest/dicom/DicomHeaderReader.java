/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Reads the tag directory of a DICOM record without decoding pixel data.
 *
 * Handles Part-10 files (preamble, {@code DICM}, file meta group) as well as headerless
 * datasets, in implicit or explicit VR little endian, explicit VR big endian and deflated
 * explicit VR little endian. Sequences are walked to keep the stream in step but their
 * contents are not retained.
 *
 * A stream is rejected as not being a record when tags are out of order, a value length
 * runs past the end of the file, an explicit VR is not a known VR, or the dataset holds no
 * attribute from a standard header group.
 */
public class DicomHeaderReader {
    private static final Logger log = LoggerFactory.getLogger(DicomHeaderReader.class);

    /**
     * Values longer than this are skipped rather than retained.
     */
    public static final int MAX_RETAINED_VALUE_LENGTH = 64 * 1024;

    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;
    private static final int PREAMBLE_LENGTH = 128;
    private static final byte[] MAGIC = {'D', 'I', 'C', 'M'};

    /**
     * Deepest sequence nesting accepted before the record is rejected.
     */
    public static final int MAX_SEQUENCE_DEPTH = 64;

    private static final Set<String> VALID_VRS = new HashSet<>(Arrays.asList(
            "AE", "AS", "AT", "CS", "DA", "DS", "DT", "FD", "FL", "IS", "LO", "LT", "OB", "OD",
            "OF", "OL", "OV", "OW", "PN", "SH", "SL", "SQ", "SS", "ST", "SV", "TM", "UC", "UI",
            "UL", "UN", "UR", "US", "UT", "UV"));

    private static final Set<String> LONG_LENGTH_VRS = new HashSet<>(Arrays.asList(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "UC", "UN", "UR", "UT", "SV", "UV"));

    private static final Set<Integer> STANDARD_GROUPS = new HashSet<>(Arrays.asList(
            0x0002, 0x0008, 0x0010, 0x0020, 0x0028));

    // VRs needed to decode binary attributes in implicit VR datasets
    private static final Map<Integer, String> IMPLICIT_VRS = new HashMap<>();
    static {
        IMPLICIT_VRS.put(Tags.FileMetaInformationGroupLength, "UL");
        IMPLICIT_VRS.put(Tags.SamplesPerPixel, "US");
        IMPLICIT_VRS.put(Tags.PlanarConfiguration, "US");
        IMPLICIT_VRS.put(Tags.FrameIncrementPointer, "AT");
        IMPLICIT_VRS.put(Tags.Rows, "US");
        IMPLICIT_VRS.put(Tags.Columns, "US");
        IMPLICIT_VRS.put(Tags.BitsAllocated, "US");
        IMPLICIT_VRS.put(Tags.BitsStored, "US");
        IMPLICIT_VRS.put(Tags.HighBit, "US");
        IMPLICIT_VRS.put(Tags.PixelRepresentation, "US");
        IMPLICIT_VRS.put(Tags.PixelData, "OW");
    }

    /**
     * Read the header only, stopping in front of the pixel data value.
     */
    public DicomHeader read(Path file) throws IOException {
        return read(file, false);
    }

    /**
     * Read the header and the pixel data value (native bytes or encapsulated fragments).
     */
    public DicomHeader readWithPixelData(Path file) throws IOException {
        return read(file, true);
    }

    private DicomHeader read(Path file, boolean includePixelData) throws IOException {
        long fileSize = Files.size(file);
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(file), 64 * 1024)) {
            return read(raw, fileSize, includePixelData);
        } catch (DicomParseException e) {
            throw e;
        } catch (EOFException e) {
            throw new DicomParseException("Truncated record " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a record from a stream.
     *
     * @param stream source positioned at the start of the file
     * @param streamLength total length, or -1 when unknown (disables length checks)
     * @param includePixelData whether to read the pixel data value
     */
    public DicomHeader read(InputStream stream, long streamLength, boolean includePixelData) throws IOException {
        TagInputStream in = new TagInputStream(stream);
        DicomHeader header = new DicomHeader();

        byte[] head = new byte[PREAMBLE_LENGTH + MAGIC.length];
        int available = in.peek(head, head.length);
        if (available == head.length && hasMagic(head)) {
            in.skipFully(head.length);
            header.setPreamble(true);
        }

        readFileMeta(in, header, streamLength);

        String tsuid = header.getTransferSyntaxUid();
        if (tsuid == null) {
            tsuid = guessTransferSyntax(in);
            header.setTransferSyntaxUid(tsuid);
            log.trace("No file meta group, assuming transfer syntax {}", tsuid);
        }

        long limit = streamLength;
        if (TransferSyntaxes.isDeflated(tsuid)) {
            in.replaceSource(new InflaterInputStream(in.source(), new Inflater(true)));
            limit = -1;
        }
        boolean implicit = TransferSyntaxes.isImplicitVr(tsuid);
        in.setBigEndian(TransferSyntaxes.isBigEndian(tsuid));
        header.setBigEndian(in.isBigEndian());

        readDataset(in, header, implicit, limit, includePixelData);

        if (!hasStandardAttribute(header)) {
            throw new DicomParseException("No standard header attributes found");
        }
        return header;
    }

    private static boolean hasMagic(byte[] head) {
        for (int i = 0; i < MAGIC.length; i++) {
            if (head[PREAMBLE_LENGTH + i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * File meta group (0002,xxxx) is always explicit VR little endian.
     */
    private void readFileMeta(TagInputStream in, DicomHeader header, long limit) throws IOException {
        byte[] peek = new byte[2];
        int lastTag = -1;
        while (true) {
            if (in.peek(peek, 2) < 2) {
                return;
            }
            int group = (peek[0] & 0xFF) | ((peek[1] & 0xFF) << 8);
            if (group != 0x0002) {
                return;
            }
            in.setBigEndian(false);
            int tag = in.readTag();
            if (tag <= lastTag) {
                throw new DicomParseException("File meta tags out of order at " + Tags.toString(tag));
            }
            lastTag = tag;
            String vr = readExplicitVr(in, tag);
            long length = readExplicitLength(in, vr);
            if (length == UNDEFINED_LENGTH) {
                throw new DicomParseException("Undefined length in file meta element " + Tags.toString(tag));
            }
            checkLength(in, length, limit, tag);
            byte[] value = new byte[(int) length];
            in.readFully(value);
            header.put(tag, vr, value);
            if (tag == Tags.TransferSyntaxUID) {
                header.setTransferSyntaxUid(trimUid(value));
            }
        }
    }

    /**
     * Headerless dataset: explicit VR when bytes 4-5 spell a known VR, implicit otherwise.
     */
    private String guessTransferSyntax(TagInputStream in) throws IOException {
        byte[] peek = new byte[6];
        if (in.peek(peek, 6) < 6) {
            throw new DicomParseException("Too short to hold a dataset");
        }
        String vr = new String(peek, 4, 2, StandardCharsets.US_ASCII);
        return VALID_VRS.contains(vr)
                ? TransferSyntaxes.EXPLICIT_VR_LITTLE_ENDIAN
                : TransferSyntaxes.IMPLICIT_VR_LITTLE_ENDIAN;
    }

    private void readDataset(TagInputStream in, DicomHeader header, boolean implicit, long limit,
                             boolean includePixelData) throws IOException {
        byte[] probe = new byte[1];
        int lastTag = -1;
        while (in.peek(probe, 1) == 1) {
            int tag = in.readTag();
            if (Tags.group(tag) == 0xFFFE) {
                throw new DicomParseException("Unexpected delimiter " + Tags.toString(tag) + " in dataset");
            }
            if (Integer.compareUnsigned(tag, lastTag) <= 0 && lastTag != -1) {
                throw new DicomParseException("Tags out of order at " + Tags.toString(tag));
            }
            lastTag = tag;

            String vr;
            long length;
            if (implicit) {
                vr = implicitVr(tag);
                length = in.readInt() & 0xFFFFFFFFL;
            } else {
                vr = readExplicitVr(in, tag);
                length = readExplicitLength(in, vr);
            }

            if (tag == Tags.PixelData) {
                readPixelData(in, header, vr, length, limit, includePixelData);
                return;
            }

            if (length == UNDEFINED_LENGTH) {
                skipSequence(in, length, implicit || "UN".equals(vr), limit, 1);
                continue;
            }

            checkLength(in, length, limit, tag);
            if ("SQ".equals(vr)) {
                skipSequence(in, length, implicit, limit, 1);
            } else if (length <= MAX_RETAINED_VALUE_LENGTH) {
                byte[] value = new byte[(int) length];
                in.readFully(value);
                header.put(tag, implicit ? null : vr, value);
            } else {
                in.skipFully(length);
            }
        }
    }

    private void readPixelData(TagInputStream in, DicomHeader header, String vr, long length, long limit,
                               boolean includePixelData) throws IOException {
        boolean encapsulated = length == UNDEFINED_LENGTH;
        header.setPixelDataElement(vr, encapsulated ? -1 : length);
        if (!includePixelData) {
            return;
        }
        if (!encapsulated) {
            checkLength(in, length, limit, Tags.PixelData);
            if (length > Integer.MAX_VALUE - 8) {
                throw new UnsupportedPixelDataException("Pixel data too large: " + length + " bytes");
            }
            byte[] value = new byte[(int) length];
            in.readFully(value);
            header.setPixelData(value);
            return;
        }

        List<byte[]> fragments = new ArrayList<>();
        boolean offsetTable = true;
        while (true) {
            int tag = in.readTag();
            long itemLength = in.readInt() & 0xFFFFFFFFL;
            if (tag == Tags.SequenceDelimitationItem) {
                break;
            }
            if (tag != Tags.Item || itemLength == UNDEFINED_LENGTH) {
                throw new DicomParseException("Malformed pixel data fragment " + Tags.toString(tag));
            }
            checkLength(in, itemLength, limit, tag);
            if (offsetTable) {
                in.skipFully(itemLength);
                offsetTable = false;
                continue;
            }
            byte[] fragment = new byte[(int) itemLength];
            in.readFully(fragment);
            fragments.add(fragment);
        }
        header.setPixelFragments(fragments);
    }

    /**
     * Walk past a sequence value, defined or undefined length.
     */
    private void skipSequence(TagInputStream in, long length, boolean implicit, long limit, int depth)
            throws IOException {
        if (depth > MAX_SEQUENCE_DEPTH) {
            throw new DicomParseException("Sequences nested deeper than " + MAX_SEQUENCE_DEPTH
                    + " at offset " + in.getPosition());
        }
        if (length != UNDEFINED_LENGTH) {
            long end = in.getPosition() + length;
            while (in.getPosition() < end) {
                int tag = in.readTag();
                long itemLength = in.readInt() & 0xFFFFFFFFL;
                if (tag != Tags.Item) {
                    throw new DicomParseException("Expected item in sequence, found " + Tags.toString(tag));
                }
                skipItem(in, itemLength, implicit, limit, depth);
            }
            return;
        }
        while (true) {
            int tag = in.readTag();
            long itemLength = in.readInt() & 0xFFFFFFFFL;
            if (tag == Tags.SequenceDelimitationItem) {
                return;
            }
            if (tag != Tags.Item) {
                throw new DicomParseException("Expected item in sequence, found " + Tags.toString(tag));
            }
            skipItem(in, itemLength, implicit, limit, depth);
        }
    }

    private void skipItem(TagInputStream in, long itemLength, boolean implicit, long limit, int depth)
            throws IOException {
        if (itemLength != UNDEFINED_LENGTH) {
            checkLength(in, itemLength, limit, Tags.Item);
            in.skipFully(itemLength);
            return;
        }
        while (true) {
            int tag = in.readTag();
            if (tag == Tags.ItemDelimitationItem) {
                in.readInt();
                return;
            }
            String vr;
            long length;
            if (implicit) {
                vr = implicitVr(tag);
                length = in.readInt() & 0xFFFFFFFFL;
            } else {
                vr = readExplicitVr(in, tag);
                length = readExplicitLength(in, vr);
            }
            if (length == UNDEFINED_LENGTH) {
                skipSequence(in, length, implicit || "UN".equals(vr), limit, depth + 1);
            } else {
                checkLength(in, length, limit, tag);
                in.skipFully(length);
            }
        }
    }

    private String readExplicitVr(TagInputStream in, int tag) throws IOException {
        byte[] code = new byte[2];
        in.readFully(code);
        String vr = new String(code, StandardCharsets.US_ASCII);
        if (!VALID_VRS.contains(vr)) {
            throw new DicomParseException("Invalid VR '" + printable(vr) + "' for " + Tags.toString(tag));
        }
        return vr;
    }

    private long readExplicitLength(TagInputStream in, String vr) throws IOException {
        if (LONG_LENGTH_VRS.contains(vr)) {
            in.readUShort();
            return in.readInt() & 0xFFFFFFFFL;
        }
        return in.readUShort();
    }

    private static void checkLength(TagInputStream in, long length, long limit, int tag) throws DicomParseException {
        if (limit >= 0 && in.getPosition() + length > limit) {
            throw new DicomParseException("Value length " + length + " of " + Tags.toString(tag)
                    + " exceeds file size " + limit);
        }
    }

    private static boolean hasStandardAttribute(DicomHeader header) {
        for (int tag : header.tags()) {
            if (STANDARD_GROUPS.contains(Tags.group(tag))) {
                return true;
            }
        }
        return header.hasPixelData();
    }

    private static String trimUid(byte[] value) {
        int end = value.length;
        while (end > 0 && (value[end - 1] == 0 || value[end - 1] == ' ')) {
            end--;
        }
        return new String(value, 0, end, StandardCharsets.US_ASCII);
    }

    private static String printable(String s) {
        StringBuilder sb = new StringBuilder();
        for (char c : s.toCharArray()) {
            sb.append(c >= 0x20 && c < 0x7F ? c : '?');
        }
        return sb.toString();
    }

    /**
     * VR used for binary decoding in implicit VR datasets; null means a text value.
     */
    static String implicitVr(int tag) {
        return IMPLICIT_VRS.get(tag);
    }
}
