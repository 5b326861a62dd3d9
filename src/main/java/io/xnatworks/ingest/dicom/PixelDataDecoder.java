/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

import io.xnatworks.ingest.pixel.PixelBuffer;
import io.xnatworks.ingest.pixel.WindowHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Decodes a record's pixel data into a {@link PixelBuffer}.
 *
 * Native pixel data is supported for 8, 16 and 32 bits allocated, signed or unsigned,
 * grayscale, RGB (interleaved or planar) and YBR_FULL. Encapsulated JPEG baseline and
 * extended frames are decoded through {@code javax.imageio}. Everything else raises
 * {@link UnsupportedPixelDataException}.
 */
public class PixelDataDecoder {
    private static final Logger log = LoggerFactory.getLogger(PixelDataDecoder.class);

    private final DicomHeaderReader reader;

    public PixelDataDecoder() {
        this(new DicomHeaderReader());
    }

    public PixelDataDecoder(DicomHeaderReader reader) {
        this.reader = reader;
    }

    /**
     * Read and decode the pixel data of a file.
     */
    public PixelBuffer decode(Path file) throws IOException {
        log.debug("Decoding pixel data: {}", file);
        return decode(reader.readWithPixelData(file));
    }

    /**
     * Decode a header read with {@link DicomHeaderReader#readWithPixelData(Path)}.
     */
    public PixelBuffer decode(DicomHeader header) throws IOException {
        if (!header.hasPixelData()) {
            throw new DicomParseException("Record has no pixel data");
        }

        String tsuid = header.getTransferSyntaxUid();
        PixelBuffer buffer;
        if (header.getPixelDataLength() >= 0 && TransferSyntaxes.isNative(tsuid)) {
            buffer = decodeNative(header);
        } else if (TransferSyntaxes.isImageIoJpeg(tsuid)) {
            buffer = decodeJpeg(header);
        } else {
            throw new UnsupportedPixelDataException("Cannot decode pixel data with transfer syntax " + tsuid);
        }

        buffer.setWindowHint(WindowHint.of(header.getDoubles(Tags.WindowCenter), header.getDoubles(Tags.WindowWidth)));
        buffer.setRescaleSlope(header.getDouble(Tags.RescaleSlope, 1.0));
        buffer.setRescaleIntercept(header.getDouble(Tags.RescaleIntercept, 0.0));
        String photometric = header.getString(Tags.PhotometricInterpretation, "MONOCHROME2");
        buffer.setPhotometricInterpretation(photometric.startsWith("YBR") ? "RGB" : photometric);
        return buffer;
    }

    private PixelBuffer decodeNative(DicomHeader header) throws IOException {
        int rows = header.getInt(Tags.Rows, 0);
        int columns = header.getInt(Tags.Columns, 0);
        if (rows <= 0 || columns <= 0) {
            throw new DicomParseException("Invalid image dimensions: " + columns + "x" + rows);
        }
        int bitsAllocated = header.getInt(Tags.BitsAllocated, 16);
        int bitsStored = header.getInt(Tags.BitsStored, bitsAllocated);
        boolean signed = header.getInt(Tags.PixelRepresentation, 0) == 1;
        int samplesPerPixel = header.getInt(Tags.SamplesPerPixel, 1);
        int planarConfiguration = header.getInt(Tags.PlanarConfiguration, 0);
        String photometric = header.getString(Tags.PhotometricInterpretation, "MONOCHROME2");

        if (bitsAllocated != 8 && bitsAllocated != 16 && bitsAllocated != 32) {
            throw new UnsupportedPixelDataException("Unsupported bits allocated: " + bitsAllocated);
        }
        if (samplesPerPixel < 1) {
            throw new DicomParseException("Invalid samples per pixel: " + samplesPerPixel);
        }
        if ("PALETTE COLOR".equals(photometric) || photometric.endsWith("_422") || photometric.endsWith("_420")) {
            throw new UnsupportedPixelDataException("Unsupported photometric interpretation: " + photometric);
        }
        if (bitsStored <= 0 || bitsStored > bitsAllocated) {
            bitsStored = bitsAllocated;
        }

        byte[] data = header.getPixelData();
        if (data == null) {
            throw new DicomParseException("Pixel data was not read");
        }

        int bytesPerSample = bitsAllocated / 8;
        long frameBytes = (long) rows * columns * samplesPerPixel * bytesPerSample;
        int available = (int) (data.length / frameBytes);
        int frames = header.getInt(Tags.NumberOfFrames, 0);
        if (frames <= 0 || frames > available) {
            if (frames > available) {
                log.warn("Pixel data holds {} frames, header declares {}", available, frames);
            }
            frames = available;
        }
        if (frames < 1) {
            throw new DicomParseException("Pixel data (" + data.length + " bytes) shorter than one frame ("
                    + frameBytes + " bytes)");
        }

        boolean bigEndian = header.isBigEndian() && bitsAllocated > 8;
        int count = (int) (frameBytes / bytesPerSample) * frames;
        int[] samples = new int[count];
        for (int i = 0; i < count; i++) {
            samples[i] = readSample(data, i * bytesPerSample, bitsAllocated, bitsStored, signed, bigEndian);
        }

        if (samplesPerPixel > 1 && planarConfiguration == 1) {
            samples = interleave(samples, frames, rows * columns, samplesPerPixel);
        }
        if (samplesPerPixel == 3 && "YBR_FULL".equals(photometric)) {
            ybrToRgb(samples);
        }
        return new PixelBuffer(frames, rows, columns, samplesPerPixel, bitsAllocated, signed, samples);
    }

    static int readSample(byte[] data, int offset, int bitsAllocated, int bitsStored, boolean signed,
                          boolean bigEndian) {
        long raw;
        switch (bitsAllocated) {
            case 8:
                raw = data[offset] & 0xFF;
                break;
            case 16:
                raw = bigEndian
                        ? ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF)
                        : ((data[offset + 1] & 0xFF) << 8) | (data[offset] & 0xFF);
                break;
            default:
                raw = bigEndian
                        ? ((long) (data[offset] & 0xFF) << 24) | ((data[offset + 1] & 0xFF) << 16)
                        | ((data[offset + 2] & 0xFF) << 8) | (data[offset + 3] & 0xFF)
                        : ((long) (data[offset + 3] & 0xFF) << 24) | ((data[offset + 2] & 0xFF) << 16)
                        | ((data[offset + 1] & 0xFF) << 8) | (data[offset] & 0xFF);
                break;
        }
        long mask = (1L << bitsStored) - 1;
        long value = raw & mask;
        if (signed && (value & (1L << (bitsStored - 1))) != 0) {
            value -= (1L << bitsStored);
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    /**
     * Planar layout (R1R2...G1G2...B1B2...) to interleaved (R1G1B1R2G2B2...), per frame.
     */
    private static int[] interleave(int[] planar, int frames, int pixels, int channels) {
        int[] result = new int[planar.length];
        int frameLength = pixels * channels;
        for (int f = 0; f < frames; f++) {
            int base = f * frameLength;
            for (int c = 0; c < channels; c++) {
                for (int p = 0; p < pixels; p++) {
                    result[base + p * channels + c] = planar[base + c * pixels + p];
                }
            }
        }
        return result;
    }

    private static void ybrToRgb(int[] samples) {
        for (int i = 0; i + 2 < samples.length; i += 3) {
            double y = samples[i];
            double cb = samples[i + 1] - 128.0;
            double cr = samples[i + 2] - 128.0;
            samples[i] = clamp8(y + 1.402 * cr);
            samples[i + 1] = clamp8(y - 0.344136 * cb - 0.714136 * cr);
            samples[i + 2] = clamp8(y + 1.772 * cb);
        }
    }

    private static int clamp8(double v) {
        return (int) Math.max(0, Math.min(255, Math.round(v)));
    }

    private PixelBuffer decodeJpeg(DicomHeader header) throws IOException {
        List<byte[]> fragments = header.getPixelFragments();
        if (fragments.isEmpty()) {
            throw new DicomParseException("Encapsulated pixel data has no fragments");
        }
        int declaredFrames = header.getInt(Tags.NumberOfFrames, 1);
        byte[][] frameStreams;
        if (declaredFrames <= 1) {
            frameStreams = new byte[][]{concat(fragments)};
        } else if (fragments.size() == declaredFrames) {
            frameStreams = fragments.toArray(new byte[0][]);
        } else {
            throw new UnsupportedPixelDataException("Cannot map " + fragments.size() + " fragments onto "
                    + declaredFrames + " frames");
        }

        int rows = 0;
        int columns = 0;
        int channels = 0;
        int[] samples = null;
        for (int f = 0; f < frameStreams.length; f++) {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(frameStreams[f]));
            if (image == null) {
                throw new UnsupportedPixelDataException("No image reader accepted frame " + f);
            }
            Raster raster = image.getRaster();
            if (samples == null) {
                rows = image.getHeight();
                columns = image.getWidth();
                channels = raster.getNumBands();
                samples = new int[frameStreams.length * rows * columns * channels];
            } else if (image.getHeight() != rows || image.getWidth() != columns || raster.getNumBands() != channels) {
                throw new DicomParseException("Frame " + f + " does not match the first frame's geometry");
            }
            int[] frame = raster.getPixels(0, 0, columns, rows, (int[]) null);
            System.arraycopy(frame, 0, samples, f * frame.length, frame.length);
        }
        log.debug("Decoded {} JPEG frame(s) of {}x{}x{}", frameStreams.length, columns, rows, channels);
        return new PixelBuffer(frameStreams.length, rows, columns, channels, 8, false, samples);
    }

    private static byte[] concat(List<byte[]> fragments) {
        if (fragments.size() == 1) {
            return fragments.get(0);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] fragment : fragments) {
            out.write(fragment, 0, fragment.length);
        }
        return out.toByteArray();
    }
}
