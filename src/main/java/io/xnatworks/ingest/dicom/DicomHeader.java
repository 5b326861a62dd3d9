/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes read from one record by {@link DicomHeaderReader}.
 *
 * Values are kept as raw bytes in the dataset's byte order; the typed accessors decode
 * them on demand. Only top-level attributes are retained, sequence contents are skipped.
 */
public class DicomHeader {

    private final Map<Integer, byte[]> values = new LinkedHashMap<>();
    private final Map<Integer, String> vrs = new LinkedHashMap<>();

    private boolean preamble;
    private String transferSyntaxUid;
    private boolean bigEndian;

    private boolean pixelDataPresent;
    private String pixelDataVr;
    private long pixelDataLength = -1;
    private byte[] pixelData;
    private List<byte[]> pixelFragments;

    void put(int tag, String vr, byte[] value) {
        values.put(tag, value);
        if (vr != null) {
            vrs.put(tag, vr);
        }
    }

    void setPreamble(boolean preamble) {
        this.preamble = preamble;
    }

    void setTransferSyntaxUid(String transferSyntaxUid) {
        this.transferSyntaxUid = transferSyntaxUid;
    }

    void setBigEndian(boolean bigEndian) {
        this.bigEndian = bigEndian;
    }

    void setPixelDataElement(String vr, long length) {
        this.pixelDataPresent = true;
        this.pixelDataVr = vr;
        this.pixelDataLength = length;
    }

    void setPixelData(byte[] pixelData) {
        this.pixelData = pixelData;
    }

    void setPixelFragments(List<byte[]> pixelFragments) {
        this.pixelFragments = pixelFragments;
    }

    /**
     * Whether the file started with the 128-byte preamble and {@code DICM} marker.
     */
    public boolean hasPreamble() {
        return preamble;
    }

    /**
     * Transfer syntax from the file meta group, or the one inferred for headerless files.
     */
    public String getTransferSyntaxUid() {
        return transferSyntaxUid;
    }

    public boolean isBigEndian() {
        return bigEndian;
    }

    public boolean hasPixelData() {
        return pixelDataPresent;
    }

    public String getPixelDataVr() {
        return pixelDataVr;
    }

    /**
     * Declared pixel data length, -1 for encapsulated (undefined length) pixel data.
     */
    public long getPixelDataLength() {
        return pixelDataLength;
    }

    /**
     * Native pixel data bytes, only populated when read with pixel data.
     */
    public byte[] getPixelData() {
        return pixelData;
    }

    /**
     * Encapsulated fragments without the basic offset table, only populated when read with pixel data.
     */
    public List<byte[]> getPixelFragments() {
        return pixelFragments == null ? Collections.emptyList() : pixelFragments;
    }

    public boolean contains(int tag) {
        return values.containsKey(tag);
    }

    public int size() {
        return values.size();
    }

    public Iterable<Integer> tags() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public String getVr(int tag) {
        String vr = vrs.get(tag);
        return vr != null ? vr : DicomHeaderReader.implicitVr(tag);
    }

    public byte[] getBytes(int tag) {
        return values.get(tag);
    }

    public String getString(int tag) {
        return getString(tag, null);
    }

    /**
     * First value of a text attribute, trimmed, or the default when absent or empty.
     */
    public String getString(int tag, String defaultValue) {
        String[] all = getStrings(tag);
        if (all.length == 0 || all[0].isEmpty()) {
            return defaultValue;
        }
        return all[0];
    }

    /**
     * All backslash-separated values of a text attribute.
     */
    public String[] getStrings(int tag) {
        byte[] raw = values.get(tag);
        if (raw == null || raw.length == 0) {
            return new String[0];
        }
        if (isBinaryNumeric(getVr(tag))) {
            int[] ints = getInts(tag);
            String[] result = new String[ints.length];
            for (int i = 0; i < ints.length; i++) {
                result[i] = String.valueOf(ints[i]);
            }
            return result;
        }
        String text = new String(raw, StandardCharsets.ISO_8859_1);
        String[] parts = text.split("\\\\", -1);
        List<String> cleaned = new ArrayList<>(parts.length);
        for (String part : parts) {
            cleaned.add(trim(part));
        }
        return cleaned.toArray(new String[0]);
    }

    public int getInt(int tag, int defaultValue) {
        int[] ints = getInts(tag);
        return ints.length > 0 ? ints[0] : defaultValue;
    }

    /**
     * Integer values of a binary (US, SS, UL, SL, AT) or numeric string (IS, DS) attribute.
     * Values that cannot be parsed are dropped.
     */
    public int[] getInts(int tag) {
        byte[] raw = values.get(tag);
        if (raw == null || raw.length == 0) {
            return new int[0];
        }
        String vr = getVr(tag);
        if (vr != null) {
            switch (vr) {
                case "US":
                    return readShorts(raw, false);
                case "SS":
                    return readShorts(raw, true);
                case "UL":
                case "SL":
                    return readInts(raw);
                case "AT":
                    return readTags(raw);
                default:
                    break;
            }
        }
        double[] doubles = getDoubles(tag);
        int[] result = new int[doubles.length];
        for (int i = 0; i < doubles.length; i++) {
            result[i] = (int) doubles[i];
        }
        return result;
    }

    public double getDouble(int tag, double defaultValue) {
        double[] doubles = getDoubles(tag);
        return doubles.length > 0 ? doubles[0] : defaultValue;
    }

    /**
     * Numeric values of a decimal/integer string attribute. Values that cannot be parsed are dropped.
     */
    public double[] getDoubles(int tag) {
        byte[] raw = values.get(tag);
        if (raw == null || raw.length == 0) {
            return new double[0];
        }
        if (isBinaryNumeric(getVr(tag))) {
            int[] ints = getInts(tag);
            double[] result = new double[ints.length];
            for (int i = 0; i < ints.length; i++) {
                result[i] = ints[i];
            }
            return result;
        }
        String text = new String(raw, StandardCharsets.ISO_8859_1);
        List<Double> parsed = new ArrayList<>();
        for (String part : text.split("\\\\")) {
            String trimmed = trim(part);
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                parsed.add(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                // non-numeric entry, not a usable value
            }
        }
        double[] result = new double[parsed.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = parsed.get(i);
        }
        return result;
    }

    private static boolean isBinaryNumeric(String vr) {
        return "US".equals(vr) || "SS".equals(vr) || "UL".equals(vr) || "SL".equals(vr) || "AT".equals(vr);
    }

    private int[] readShorts(byte[] raw, boolean signed) {
        int[] result = new int[raw.length / 2];
        for (int i = 0; i < result.length; i++) {
            int b0 = raw[i * 2] & 0xFF;
            int b1 = raw[i * 2 + 1] & 0xFF;
            int v = bigEndian ? (b0 << 8) | b1 : (b1 << 8) | b0;
            result[i] = signed ? (short) v : v;
        }
        return result;
    }

    private int[] readInts(byte[] raw) {
        int[] result = new int[raw.length / 4];
        for (int i = 0; i < result.length; i++) {
            int o = i * 4;
            int b0 = raw[o] & 0xFF;
            int b1 = raw[o + 1] & 0xFF;
            int b2 = raw[o + 2] & 0xFF;
            int b3 = raw[o + 3] & 0xFF;
            result[i] = bigEndian
                    ? (b0 << 24) | (b1 << 16) | (b2 << 8) | b3
                    : (b3 << 24) | (b2 << 16) | (b1 << 8) | b0;
        }
        return result;
    }

    private int[] readTags(byte[] raw) {
        int[] halves = readShorts(raw, false);
        int[] result = new int[halves.length / 2];
        for (int i = 0; i < result.length; i++) {
            result[i] = (halves[i * 2] << 16) | halves[i * 2 + 1];
        }
        return result;
    }

    private static String trim(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) <= ' ')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) <= ' ')) {
            end--;
        }
        return s.substring(start, end);
    }
}
