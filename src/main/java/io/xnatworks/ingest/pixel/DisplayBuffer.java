/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pixel;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * 8-bit samples ready for presentation: 1 (luminance), 3 (RGB) or 4 (RGBA) channels,
 * one or more frames, interleaved the same way as {@link PixelBuffer}.
 */
public class DisplayBuffer {

    private final int width;
    private final int height;
    private final int frames;
    private final int channels;
    private final byte[] data;

    public DisplayBuffer(int width, int height, int frames, int channels, byte[] data) {
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (data.length != (long) width * height * frames * channels) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match "
                    + frames + "x" + height + "x" + width + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.frames = frames;
        this.channels = channels;
        this.data = data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFrames() {
        return frames;
    }

    public int getChannels() {
        return channels;
    }

    public byte[] getData() {
        return data;
    }

    public int getFrameLength() {
        return width * height * channels;
    }

    /**
     * Unsigned sample value at the given position.
     */
    public int getSample(int frame, int row, int column, int channel) {
        int index = frame * getFrameLength() + (row * width + column) * channels + channel;
        return data[index] & 0xFF;
    }

    /**
     * Extract one frame of a multi-frame buffer.
     */
    public DisplayBuffer getFrame(int frame) {
        if (frame < 0 || frame >= frames) {
            throw new IndexOutOfBoundsException("Frame " + frame + " of " + frames);
        }
        if (frames == 1) {
            return this;
        }
        int length = getFrameLength();
        byte[] copy = Arrays.copyOfRange(data, frame * length, (frame + 1) * length);
        return new DisplayBuffer(width, height, 1, channels, copy);
    }

    /**
     * Convert one frame to a {@link BufferedImage} for rendering or export.
     */
    public BufferedImage toBufferedImage(int frame) {
        DisplayBuffer single = getFrame(frame);
        byte[] src = single.data;
        BufferedImage image;
        if (channels == 1) {
            image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            byte[] imgData = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            System.arraycopy(src, 0, imgData, 0, imgData.length);
        } else if (channels == 3) {
            // BufferedImage expects BGR, so swap
            image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
            byte[] imgData = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < width * height; i++) {
                imgData[i * 3] = src[i * 3 + 2];
                imgData[i * 3 + 1] = src[i * 3 + 1];
                imgData[i * 3 + 2] = src[i * 3];
            }
        } else {
            // ABGR
            image = new BufferedImage(width, height, BufferedImage.TYPE_4BYTE_ABGR);
            byte[] imgData = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < width * height; i++) {
                imgData[i * 4] = src[i * 4 + 3];
                imgData[i * 4 + 1] = src[i * 4 + 2];
                imgData[i * 4 + 2] = src[i * 4 + 1];
                imgData[i * 4 + 3] = src[i * 4];
            }
        }
        return image;
    }
}
