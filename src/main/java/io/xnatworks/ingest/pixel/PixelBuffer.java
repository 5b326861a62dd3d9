/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pixel;

/**
 * Decoded numeric samples of one record: a single frame or a frame stack.
 *
 * Samples are stored frame by frame, row by row, with the channel index varying fastest.
 * The channel count is explicit, so a three-frame grayscale stack and a single RGB frame
 * never share a shape.
 */
public class PixelBuffer {

    private final int frames;
    private final int rows;
    private final int columns;
    private final int channels;
    private final int bitsAllocated;
    private final boolean signed;
    private final int[] samples;

    private WindowHint windowHint;
    private double rescaleSlope = 1.0;
    private double rescaleIntercept = 0.0;
    private String photometricInterpretation = "MONOCHROME2";

    public PixelBuffer(int frames, int rows, int columns, int channels,
                       int bitsAllocated, boolean signed, int[] samples) {
        if (frames < 1 || rows < 1 || columns < 1 || channels < 1) {
            throw new IllegalArgumentException("Invalid shape: " + frames + "x" + rows + "x" + columns + "x" + channels);
        }
        long expected = (long) frames * rows * columns * channels;
        if (samples == null || samples.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " samples, got "
                    + (samples == null ? 0 : samples.length));
        }
        this.frames = frames;
        this.rows = rows;
        this.columns = columns;
        this.channels = channels;
        this.bitsAllocated = bitsAllocated;
        this.signed = signed;
        this.samples = samples;
    }

    /**
     * Single-channel, single-frame buffer.
     */
    public static PixelBuffer grayscale(int rows, int columns, int bitsAllocated, boolean signed, int[] samples) {
        return new PixelBuffer(1, rows, columns, 1, bitsAllocated, signed, samples);
    }

    public int getFrames() {
        return frames;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getChannels() {
        return channels;
    }

    public int getBitsAllocated() {
        return bitsAllocated;
    }

    public boolean isSigned() {
        return signed;
    }

    public int[] getSamples() {
        return samples;
    }

    public boolean isFrameStack() {
        return frames > 1;
    }

    public boolean isEightBitUnsigned() {
        return bitsAllocated == 8 && !signed;
    }

    /**
     * Number of samples in one frame.
     */
    public int getFrameLength() {
        return rows * columns * channels;
    }

    /**
     * Array-style shape: leading frame dimension for stacks, trailing channel dimension for
     * multi-channel data.
     */
    public int[] getShape() {
        int dims = 2 + (frames > 1 ? 1 : 0) + (channels > 1 ? 1 : 0);
        int[] shape = new int[dims];
        int i = 0;
        if (frames > 1) {
            shape[i++] = frames;
        }
        shape[i++] = rows;
        shape[i++] = columns;
        if (channels > 1) {
            shape[i] = channels;
        }
        return shape;
    }

    public WindowHint getWindowHint() {
        return windowHint;
    }

    public void setWindowHint(WindowHint windowHint) {
        this.windowHint = windowHint;
    }

    public double getRescaleSlope() {
        return rescaleSlope;
    }

    public void setRescaleSlope(double rescaleSlope) {
        this.rescaleSlope = rescaleSlope;
    }

    public double getRescaleIntercept() {
        return rescaleIntercept;
    }

    public void setRescaleIntercept(double rescaleIntercept) {
        this.rescaleIntercept = rescaleIntercept;
    }

    public String getPhotometricInterpretation() {
        return photometricInterpretation;
    }

    public void setPhotometricInterpretation(String photometricInterpretation) {
        this.photometricInterpretation = photometricInterpretation;
    }
}
