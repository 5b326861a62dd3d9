/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pixel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps decoded samples to an 8-bit display buffer.
 *
 * <ul>
 *   <li>8-bit unsigned input is passed through unchanged.</li>
 *   <li>With a window hint, samples are clipped to {@code [center - width/2, center + width/2]}
 *       and that range is stretched to {@code [0, 255]}. The window applies to every frame.</li>
 *   <li>Without a usable hint, each frame is stretched from its own minimum and maximum.</li>
 *   <li>A constant frame becomes uniform mid-gray (128).</li>
 *   <li>Three or four channels are kept as RGB / RGBA; any other channel count is averaged
 *       into a single luminance channel.</li>
 * </ul>
 *
 * Window values are in modality units and are mapped back through the rescale slope and
 * intercept before clipping. MONOCHROME1 output is inverted.
 */
public class PixelNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PixelNormalizer.class);

    public static final int MID_GRAY = 128;

    /**
     * Normalize using the window hint carried by the buffer, if any.
     */
    public DisplayBuffer normalize(PixelBuffer buffer) {
        return normalize(buffer, buffer.getWindowHint());
    }

    /**
     * Normalize with explicit window values; either being null means min-max stretching.
     */
    public DisplayBuffer normalize(PixelBuffer buffer, Double windowCenter, Double windowWidth) {
        if (windowCenter == null || windowWidth == null) {
            return normalize(buffer, (WindowHint) null);
        }
        return normalize(buffer, WindowHint.of(windowCenter, windowWidth));
    }

    /**
     * Normalize with loosely typed window values (numbers, numeric strings, lists or arrays).
     * Missing or malformed values fall back to min-max stretching.
     */
    public DisplayBuffer normalize(PixelBuffer buffer, Object windowCenter, Object windowWidth) {
        WindowHint hint = WindowHint.parse(windowCenter, windowWidth);
        if (hint == null && (windowCenter != null || windowWidth != null)) {
            log.debug("Ignoring unusable window center={} width={}", windowCenter, windowWidth);
        }
        return normalize(buffer, hint);
    }

    /**
     * Normalize with an explicit hint; null means min-max stretching.
     */
    public DisplayBuffer normalize(PixelBuffer buffer, WindowHint hint) {
        int inChannels = buffer.getChannels();
        int outChannels = (inChannels == 1 || inChannels == 3 || inChannels == 4) ? inChannels : 1;
        int pixelsPerFrame = buffer.getRows() * buffer.getColumns();
        int outFrameLength = pixelsPerFrame * outChannels;
        int frames = buffer.getFrames();
        byte[] out = new byte[outFrameLength * frames];

        boolean passThrough = buffer.isEightBitUnsigned();
        boolean invert = outChannels == 1 && !passThrough
                && "MONOCHROME1".equalsIgnoreCase(buffer.getPhotometricInterpretation());

        double lower = 0;
        double upper = 0;
        if (hint != null && !passThrough) {
            double slope = buffer.getRescaleSlope() > 0 ? buffer.getRescaleSlope() : 1.0;
            double intercept = buffer.getRescaleIntercept();
            lower = (hint.getLower() - intercept) / slope;
            upper = (hint.getUpper() - intercept) / slope;
        }

        double[] values = new double[outFrameLength];
        for (int frame = 0; frame < frames; frame++) {
            readFrame(buffer, frame, outChannels, values);
            int base = frame * outFrameLength;

            if (passThrough) {
                for (int i = 0; i < outFrameLength; i++) {
                    out[base + i] = (byte) clamp((int) values[i]);
                }
                continue;
            }

            if (hint != null) {
                double range = upper - lower;
                for (int i = 0; i < outFrameLength; i++) {
                    double v = Math.min(upper, Math.max(lower, values[i]));
                    out[base + i] = (byte) mapped((v - lower) / range * 255.0, invert);
                }
                continue;
            }

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                if (v < min) {
                    min = v;
                }
                if (v > max) {
                    max = v;
                }
            }
            if (max == min) {
                for (int i = 0; i < outFrameLength; i++) {
                    out[base + i] = (byte) MID_GRAY;
                }
                continue;
            }
            double range = max - min;
            for (int i = 0; i < outFrameLength; i++) {
                out[base + i] = (byte) mapped((values[i] - min) / range * 255.0, invert);
            }
        }

        return new DisplayBuffer(buffer.getColumns(), buffer.getRows(), frames, outChannels, out);
    }

    /**
     * Copy one frame into {@code values}, averaging channels when they are being collapsed.
     */
    private static void readFrame(PixelBuffer buffer, int frame, int outChannels, double[] values) {
        int[] samples = buffer.getSamples();
        int inChannels = buffer.getChannels();
        int offset = frame * buffer.getFrameLength();
        if (inChannels == outChannels) {
            for (int i = 0; i < values.length; i++) {
                values[i] = samples[offset + i];
            }
            return;
        }
        for (int p = 0; p < values.length; p++) {
            double sum = 0;
            int start = offset + p * inChannels;
            for (int c = 0; c < inChannels; c++) {
                sum += samples[start + c];
            }
            values[p] = sum / inChannels;
        }
    }

    private static int mapped(double scaled, boolean invert) {
        int v = clamp((int) scaled);
        return invert ? 255 - v : v;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }
}
