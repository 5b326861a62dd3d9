/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;

/**
 * Byte-order aware reader that tracks its position and supports a small look-ahead.
 */
class TagInputStream extends FilterInputStream {

    // must cover the largest peek: preamble plus magic
    static final int PUSHBACK_SIZE = 256;

    private long position;
    private boolean bigEndian;

    TagInputStream(InputStream in) {
        super(new PushbackInputStream(in, PUSHBACK_SIZE));
    }

    /**
     * Swap the underlying source, keeping position (used when a deflated dataset starts).
     */
    void replaceSource(InputStream source) {
        this.in = new PushbackInputStream(source, PUSHBACK_SIZE);
    }

    InputStream source() {
        return in;
    }

    long getPosition() {
        return position;
    }

    boolean isBigEndian() {
        return bigEndian;
    }

    void setBigEndian(boolean bigEndian) {
        this.bigEndian = bigEndian;
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b >= 0) {
            position++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = in.read(b, off, len);
        if (n > 0) {
            position += n;
        }
        return n;
    }

    /**
     * Read up to {@code len} bytes without consuming them.
     *
     * @return number of bytes actually available, may be less than requested at end of stream
     */
    int peek(byte[] buf, int len) throws IOException {
        int total = 0;
        while (total < len) {
            int n = in.read(buf, total, len - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        if (total > 0) {
            ((PushbackInputStream) in).unread(buf, 0, total);
        }
        return total;
    }

    void readFully(byte[] buf) throws IOException {
        readFully(buf, 0, buf.length);
    }

    void readFully(byte[] buf, int off, int len) throws IOException {
        int total = 0;
        while (total < len) {
            int n = read(buf, off + total, len - total);
            if (n < 0) {
                throw new EOFException("Unexpected end of stream after " + position + " bytes");
            }
            total += n;
        }
    }

    void skipFully(long count) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            long n = in.skip(remaining);
            if (n <= 0) {
                if (in.read() < 0) {
                    throw new EOFException("Unexpected end of stream while skipping " + count + " bytes");
                }
                n = 1;
            }
            remaining -= n;
            position += n;
        }
    }

    int readUShort() throws IOException {
        int b0 = read();
        int b1 = read();
        if ((b0 | b1) < 0) {
            throw new EOFException("Unexpected end of stream after " + position + " bytes");
        }
        return bigEndian ? (b0 << 8) | b1 : (b1 << 8) | b0;
    }

    int readInt() throws IOException {
        int b0 = read();
        int b1 = read();
        int b2 = read();
        int b3 = read();
        if ((b0 | b1 | b2 | b3) < 0) {
            throw new EOFException("Unexpected end of stream after " + position + " bytes");
        }
        return bigEndian
                ? (b0 << 24) | (b1 << 16) | (b2 << 8) | b3
                : (b3 << 24) | (b2 << 16) | (b1 << 8) | b0;
    }

    /**
     * Read a tag as two consecutive 16-bit values (group, element).
     */
    int readTag() throws IOException {
        int group = readUShort();
        int element = readUShort();
        return (group << 16) | element;
    }
}
