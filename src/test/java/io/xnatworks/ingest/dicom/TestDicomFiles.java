/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.ingest.dicom;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes small DICOM files for tests: optional preamble and file meta group, then a dataset
 * in implicit VR LE, explicit VR LE or explicit VR BE.
 */
public final class TestDicomFiles {

    public static final String CT_IMAGE_STORAGE = "1.2.840.10008.5.1.4.1.1.2";
    public static final String MR_IMAGE_STORAGE = "1.2.840.10008.5.1.4.1.1.4";
    public static final String US_MULTIFRAME_STORAGE = "1.2.840.10008.5.1.4.1.1.3.1";
    public static final String VIDEO_ENDOSCOPIC_STORAGE = "1.2.840.10008.5.1.4.1.1.77.1.1.1";
    public static final String MPEG4_AVC = "1.2.840.10008.1.2.4.102";

    private static final Set<String> LONG_LENGTH_VRS = new HashSet<>(Arrays.asList(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "UC", "UN", "UR", "UT", "SV", "UV"));

    private TestDicomFiles() {
    }

    public static Builder record() {
        return new Builder();
    }

    /**
     * CT single-frame record with the attributes the series organizer reads.
     */
    public static Path writeSeriesRecord(Path file, String modality, int seriesNumber, String description,
                                         int instanceNumber) throws IOException {
        return record()
                .sopClass("MR".equals(modality) ? MR_IMAGE_STORAGE : CT_IMAGE_STORAGE)
                .string(Tags.Modality, "CS", modality)
                .string(Tags.SeriesDescription, "LO", description)
                .string(Tags.SeriesInstanceUID, "UI", "1.2.826.0.1.3680043.2.1125." + seriesNumber)
                .string(Tags.SeriesNumber, "IS", String.valueOf(seriesNumber))
                .string(Tags.InstanceNumber, "IS", String.valueOf(instanceNumber))
                .string(Tags.PatientName, "PN", "Doe^Jane")
                .string(Tags.PatientID, "LO", "PAT001")
                .image(4, 4, 16, false, ramp(16))
                .write(file);
    }

    /**
     * Bytes that are neither a Part-10 file nor a plausible headerless dataset.
     */
    public static Path writeGarbage(Path file, int size) throws IOException {
        byte[] data = new byte[size];
        Arrays.fill(data, (byte) 'x');
        return Files.write(file, data);
    }

    public static int[] ramp(int count) {
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = i;
        }
        return values;
    }

    public static class Builder {
        private boolean preamble = true;
        private boolean fileMeta = true;
        private String transferSyntax = TransferSyntaxes.EXPLICIT_VR_LITTLE_ENDIAN;
        private String sopClass = CT_IMAGE_STORAGE;
        private String sopInstance = "1.2.826.0.1.3680043.2.1125.1.1";
        private final Map<Integer, Element> elements = new TreeMap<>();
        private byte[] pixelData;
        private String pixelVr = "OW";
        private byte[][] fragments;
        private int nestedTag;
        private int nestedDepth;

        /**
         * Add an undefined-length sequence with {@code depth} levels of nested sequences.
         */
        public Builder nestedSequence(int tag, int depth) {
            this.nestedTag = tag;
            this.nestedDepth = depth;
            return this;
        }

        public Builder preamble(boolean preamble) {
            this.preamble = preamble;
            return this;
        }

        public Builder fileMeta(boolean fileMeta) {
            this.fileMeta = fileMeta;
            return this;
        }

        public Builder transferSyntax(String transferSyntax) {
            this.transferSyntax = transferSyntax;
            return this;
        }

        public Builder sopClass(String sopClass) {
            this.sopClass = sopClass;
            return string(Tags.SOPClassUID, "UI", sopClass);
        }

        /**
         * SOP class in the file meta group only.
         */
        public Builder mediaStorageSopClass(String sopClass) {
            this.sopClass = sopClass;
            return this;
        }

        public Builder sopInstance(String sopInstance) {
            this.sopInstance = sopInstance;
            return this;
        }

        public Builder string(int tag, String vr, String value) {
            elements.put(tag, new Element(vr, value, null));
            return this;
        }

        public Builder uint16(int tag, int... values) {
            elements.put(tag, new Element("US", null, values));
            return this;
        }

        public Builder raw(int tag, String vr, byte[] value) {
            elements.put(tag, new Element(vr, value));
            return this;
        }

        /**
         * Grayscale image attributes plus native pixel data.
         */
        public Builder image(int rows, int columns, int bitsAllocated, boolean signed, int[] samples) {
            return image(rows, columns, bitsAllocated, bitsAllocated, signed, 1, "MONOCHROME2", 0, samples);
        }

        public Builder image(int rows, int columns, int bitsAllocated, int bitsStored, boolean signed,
                             int samplesPerPixel, String photometric, int planar, int[] samples) {
            uint16(Tags.SamplesPerPixel, samplesPerPixel);
            string(Tags.PhotometricInterpretation, "CS", photometric);
            if (samplesPerPixel > 1) {
                uint16(Tags.PlanarConfiguration, planar);
            }
            uint16(Tags.Rows, rows);
            uint16(Tags.Columns, columns);
            uint16(Tags.BitsAllocated, bitsAllocated);
            uint16(Tags.BitsStored, bitsStored);
            uint16(Tags.HighBit, bitsStored - 1);
            uint16(Tags.PixelRepresentation, signed ? 1 : 0);
            return pixels(bitsAllocated, samples);
        }

        /**
         * Native pixel data only; the image attributes are left to the caller.
         */
        public Builder pixels(int bitsAllocated, int[] samples) {
            int bytes = bitsAllocated / 8;
            boolean bigEndian = TransferSyntaxes.isBigEndian(transferSyntax);
            byte[] data = new byte[samples.length * bytes];
            for (int i = 0; i < samples.length; i++) {
                int v = samples[i];
                for (int b = 0; b < bytes; b++) {
                    int shift = 8 * (bigEndian ? bytes - 1 - b : b);
                    data[i * bytes + b] = (byte) (v >> shift);
                }
            }
            this.pixelData = pad(data, (byte) 0);
            this.pixelVr = bitsAllocated == 8 ? "OB" : "OW";
            return this;
        }

        /**
         * Encapsulated pixel data: an empty offset table followed by one item per fragment.
         */
        public Builder encapsulated(byte[]... fragments) {
            this.fragments = fragments;
            this.pixelVr = "OB";
            return this;
        }

        public byte[] toBytes() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (preamble) {
                out.write(new byte[128], 0, 128);
                out.write(new byte[]{'D', 'I', 'C', 'M'}, 0, 4);
            }
            if (fileMeta) {
                writeFileMeta(out);
            }

            boolean implicit = TransferSyntaxes.isImplicitVr(transferSyntax);
            boolean bigEndian = TransferSyntaxes.isBigEndian(transferSyntax);
            boolean nestedWritten = nestedDepth == 0;
            for (Map.Entry<Integer, Element> e : elements.entrySet()) {
                if (!nestedWritten && Integer.compareUnsigned(nestedTag, e.getKey()) < 0) {
                    writeNested(out, nestedTag, nestedDepth, implicit, bigEndian);
                    nestedWritten = true;
                }
                Element el = e.getValue();
                writeElement(out, e.getKey(), el.vr, el.encode(bigEndian), implicit, bigEndian);
            }
            if (!nestedWritten) {
                writeNested(out, nestedTag, nestedDepth, implicit, bigEndian);
            }
            if (pixelData != null) {
                writeElement(out, Tags.PixelData, pixelVr, pixelData, implicit, bigEndian);
            } else if (fragments != null) {
                writeHeader(out, Tags.PixelData, pixelVr, 0xFFFFFFFFL, implicit, bigEndian);
                writeItem(out, Tags.Item, new byte[0], bigEndian);
                for (byte[] fragment : fragments) {
                    writeItem(out, Tags.Item, pad(fragment, (byte) 0), bigEndian);
                }
                writeItem(out, Tags.SequenceDelimitationItem, new byte[0], bigEndian);
            }
            return out.toByteArray();
        }

        public Path write(Path file) throws IOException {
            return Files.write(file, toBytes());
        }

        private void writeFileMeta(ByteArrayOutputStream out) {
            ByteArrayOutputStream group = new ByteArrayOutputStream();
            writeElement(group, Tags.FileMetaInformationVersion, "OB", new byte[]{0, 1}, false, false);
            writeElement(group, Tags.MediaStorageSOPClassUID, "UI", uid(sopClass), false, false);
            writeElement(group, Tags.MediaStorageSOPInstanceUID, "UI", uid(sopInstance), false, false);
            writeElement(group, Tags.TransferSyntaxUID, "UI", uid(transferSyntax), false, false);
            byte[] body = group.toByteArray();
            byte[] length = new byte[4];
            putInt(length, 0, body.length, false);
            writeElement(out, Tags.FileMetaInformationGroupLength, "UL", length, false, false);
            out.write(body, 0, body.length);
        }
    }

    private static final class Element {
        final String vr;
        final String text;
        final int[] shorts;
        final byte[] raw;

        Element(String vr, String text, int[] shorts) {
            this.vr = vr;
            this.text = text;
            this.shorts = shorts;
            this.raw = null;
        }

        Element(String vr, byte[] raw) {
            this.vr = vr;
            this.text = null;
            this.shorts = null;
            this.raw = raw;
        }

        byte[] encode(boolean bigEndian) {
            if (raw != null) {
                return pad(raw, (byte) 0);
            }
            if (shorts != null) {
                byte[] out = new byte[shorts.length * 2];
                for (int i = 0; i < shorts.length; i++) {
                    putShort(out, i * 2, shorts[i], bigEndian);
                }
                return out;
            }
            return "UI".equals(vr) ? uid(text) : pad(text.getBytes(StandardCharsets.US_ASCII), (byte) ' ');
        }
    }

    private static void writeElement(ByteArrayOutputStream out, int tag, String vr, byte[] value,
                                     boolean implicit, boolean bigEndian) {
        writeHeader(out, tag, vr, value.length, implicit, bigEndian);
        out.write(value, 0, value.length);
    }

    private static void writeHeader(ByteArrayOutputStream out, int tag, String vr, long length,
                                    boolean implicit, boolean bigEndian) {
        byte[] b = new byte[4];
        putShort(b, 0, tag >>> 16, bigEndian);
        putShort(b, 2, tag & 0xFFFF, bigEndian);
        out.write(b, 0, 4);
        if (implicit) {
            putInt(b, 0, (int) length, bigEndian);
            out.write(b, 0, 4);
            return;
        }
        out.write(vr.charAt(0));
        out.write(vr.charAt(1));
        if (LONG_LENGTH_VRS.contains(vr)) {
            out.write(0);
            out.write(0);
            putInt(b, 0, (int) length, bigEndian);
            out.write(b, 0, 4);
        } else {
            putShort(b, 0, (int) length, bigEndian);
            out.write(b, 0, 2);
        }
    }

    private static void writeItem(ByteArrayOutputStream out, int tag, byte[] value, boolean bigEndian) {
        byte[] b = new byte[4];
        putShort(b, 0, tag >>> 16, bigEndian);
        putShort(b, 2, tag & 0xFFFF, bigEndian);
        out.write(b, 0, 4);
        putInt(b, 0, value.length, bigEndian);
        out.write(b, 0, 4);
        out.write(value, 0, value.length);
    }

    private static void writeNested(ByteArrayOutputStream out, int tag, int depth,
                                    boolean implicit, boolean bigEndian) {
        for (int i = 0; i < depth; i++) {
            writeHeader(out, tag, "SQ", 0xFFFFFFFFL, implicit, bigEndian);
            writeDelimiter(out, Tags.Item, 0xFFFFFFFF, bigEndian);
        }
        for (int i = 0; i < depth; i++) {
            writeDelimiter(out, Tags.ItemDelimitationItem, 0, bigEndian);
            writeDelimiter(out, Tags.SequenceDelimitationItem, 0, bigEndian);
        }
    }

    private static void writeDelimiter(ByteArrayOutputStream out, int tag, int length, boolean bigEndian) {
        byte[] b = new byte[4];
        putShort(b, 0, tag >>> 16, bigEndian);
        putShort(b, 2, tag & 0xFFFF, bigEndian);
        out.write(b, 0, 4);
        putInt(b, 0, length, bigEndian);
        out.write(b, 0, 4);
    }

    private static byte[] uid(String uid) {
        return pad(uid.getBytes(StandardCharsets.US_ASCII), (byte) 0);
    }

    private static byte[] pad(byte[] value, byte filler) {
        if (value.length % 2 == 0) {
            return value;
        }
        byte[] padded = Arrays.copyOf(value, value.length + 1);
        padded[value.length] = filler;
        return padded;
    }

    private static void putShort(byte[] b, int off, int v, boolean bigEndian) {
        if (bigEndian) {
            b[off] = (byte) (v >> 8);
            b[off + 1] = (byte) v;
        } else {
            b[off] = (byte) v;
            b[off + 1] = (byte) (v >> 8);
        }
    }

    private static void putInt(byte[] b, int off, int v, boolean bigEndian) {
        if (bigEndian) {
            b[off] = (byte) (v >> 24);
            b[off + 1] = (byte) (v >> 16);
            b[off + 2] = (byte) (v >> 8);
            b[off + 3] = (byte) v;
        } else {
            b[off] = (byte) v;
            b[off + 1] = (byte) (v >> 8);
            b[off + 2] = (byte) (v >> 16);
            b[off + 3] = (byte) (v >> 24);
        }
    }
}
