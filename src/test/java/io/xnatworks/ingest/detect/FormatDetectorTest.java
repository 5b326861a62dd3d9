/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.ingest.detect;

import io.xnatworks.ingest.config.IngestConfig;
import io.xnatworks.ingest.dicom.Tags;
import io.xnatworks.ingest.dicom.TestDicomFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormatDetector.
 */
class FormatDetectorTest {

    @TempDir
    Path tempDir;

    private IngestConfig config;

    @BeforeEach
    void setUp() {
        config = new IngestConfig();
    }

    /**
     * Probe with a fixed answer that counts its invocations.
     */
    static class CountingProbe implements RecordProbe {
        private final boolean answer;
        private final boolean explode;
        int calls;

        CountingProbe(boolean answer) {
            this(answer, false);
        }

        CountingProbe(boolean answer, boolean explode) {
            this.answer = answer;
            this.explode = explode;
        }

        @Override
        public boolean probe(Path file, long size) throws IOException {
            calls++;
            if (explode) {
                throw new IOException("probe failure");
            }
            return answer;
        }
    }

    private static byte[] filled(int size) {
        byte[] data = new byte[size];
        Arrays.fill(data, (byte) 'x');
        return data;
    }

    @Nested
    @DisplayName("Record classification")
    class RecordTests {

        @Test
        @DisplayName("Whitelisted extensions are accepted without probing")
        void whitelistSkipsProbes() throws Exception {
            CountingProbe probe = new CountingProbe(false);
            FormatDetector detector = new FormatDetector(config, Arrays.asList(probe));
            Path file = Files.write(tempDir.resolve("SCAN.DCM"), new byte[10]);

            assertTrue(detector.classifyRecord(file));
            assertEquals(0, probe.calls);
        }

        @Test
        @DisplayName("Files below the minimum size are rejected without probing")
        void tooSmallIsRejected() throws Exception {
            CountingProbe probe = new CountingProbe(true);
            FormatDetector detector = new FormatDetector(config, Arrays.asList(probe));
            Path file = Files.write(tempDir.resolve("tiny"), filled(127));

            assertFalse(detector.classifyRecord(file));
            assertEquals(0, probe.calls);
        }

        @Test
        @DisplayName("Files above the maximum size are rejected without probing")
        void tooLargeIsRejected() throws Exception {
            config.getDetector().setMaxFileSize(1000);
            CountingProbe probe = new CountingProbe(true);
            FormatDetector detector = new FormatDetector(config, Arrays.asList(probe));
            Path file = Files.write(tempDir.resolve("huge"), filled(1001));

            assertFalse(detector.classifyRecord(file));
            assertEquals(0, probe.calls);
        }

        @Test
        @DisplayName("Probes run in order and stop at the first match")
        void probesStopAtFirstMatch() throws Exception {
            CountingProbe first = new CountingProbe(false);
            CountingProbe second = new CountingProbe(true);
            CountingProbe third = new CountingProbe(true);
            FormatDetector detector = new FormatDetector(config, Arrays.asList(first, second, third));
            Path file = Files.write(tempDir.resolve("candidate"), filled(200));

            assertTrue(detector.classifyRecord(file));
            assertEquals(1, first.calls);
            assertEquals(1, second.calls);
            assertEquals(0, third.calls);
        }

        @Test
        @DisplayName("A failing probe counts as no match")
        void failingProbeIsNoMatch() throws Exception {
            CountingProbe broken = new CountingProbe(true, true);
            CountingProbe next = new CountingProbe(false);
            FormatDetector detector = new FormatDetector(config, Arrays.asList(broken, next));
            Path file = Files.write(tempDir.resolve("candidate"), filled(200));

            assertFalse(detector.classifyRecord(file));
            assertEquals(1, next.calls);
        }

        @Test
        @DisplayName("Should accept well-formed records without an extension")
        void acceptsStructuralRecord() throws Exception {
            Path file = TestDicomFiles.writeSeriesRecord(tempDir.resolve("IM0001"), "CT", 1, "S", 1);

            assertTrue(new FormatDetector(config).classifyRecord(file));
        }

        @Test
        @DisplayName("Should accept the magic marker even when the body is damaged")
        void acceptsMagicOnly() throws Exception {
            byte[] data = filled(300);
            Arrays.fill(data, 0, 128, (byte) 0);
            data[128] = 'D';
            data[129] = 'I';
            data[130] = 'C';
            data[131] = 'M';
            Path file = Files.write(tempDir.resolve("damaged"), data);

            assertFalse(new StructuralRecordProbe().probe(file, data.length));
            assertTrue(new PreambleMagicProbe().probe(file, data.length));
            assertTrue(new FormatDetector(config).classifyRecord(file));
        }

        @Test
        @DisplayName("Should accept headerless files starting with a known tag")
        void acceptsLeadingTag() throws Exception {
            byte[] data = filled(200);
            // (0008,0005) little endian
            data[0] = 0x08;
            data[1] = 0x00;
            data[2] = 0x05;
            data[3] = 0x00;
            Path file = Files.write(tempDir.resolve("headerless"), data);

            assertTrue(new LeadingTagProbe().probe(file, data.length));
            assertTrue(new FormatDetector(config).classifyRecord(file));
        }

        @Test
        @DisplayName("Should accept a known tag at the second offset")
        void acceptsLeadingTagAtSecondOffset() throws Exception {
            byte[] data = filled(200);
            // (0002,0010) little endian at offset 8
            data[8] = 0x02;
            data[9] = 0x00;
            data[10] = 0x10;
            data[11] = 0x00;
            Path file = Files.write(tempDir.resolve("headerless2"), data);

            assertTrue(new LeadingTagProbe().probe(file, data.length));
        }

        @Test
        @DisplayName("Should reject junk")
        void rejectsJunk() throws Exception {
            Path file = TestDicomFiles.writeGarbage(tempDir.resolve("junk"), 500);

            assertFalse(new FormatDetector(config).classifyRecord(file));
        }

        @Test
        @DisplayName("Extension parsing")
        void extensionOf() {
            assertEquals("dcm", FormatDetector.extensionOf(Paths.get("a/b/IMG.DCM")));
            assertEquals("gz", FormatDetector.extensionOf(Paths.get("x.tar.gz")));
            assertEquals("", FormatDetector.extensionOf(Paths.get("IM0001")));
            assertEquals("", FormatDetector.extensionOf(Paths.get(".hidden")));
            assertEquals("", FormatDetector.extensionOf(Paths.get("trailing.")));
        }
    }

    @Nested
    @DisplayName("Video classification")
    class VideoTests {

        private FormatDetector detector;

        @BeforeEach
        void setUp() {
            detector = new FormatDetector(config);
        }

        @Test
        @DisplayName("Video transfer syntax means video")
        void videoTransferSyntax() throws Exception {
            Path file = TestDicomFiles.record()
                    .transferSyntax(TestDicomFiles.MPEG4_AVC)
                    .string(Tags.Modality, "CS", "ES")
                    .encapsulated(new byte[]{0, 0, 0, 1})
                    .write(tempDir.resolve("h264.dcm"));

            assertTrue(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Video SOP class means video")
        void videoSopClass() throws Exception {
            Path file = TestDicomFiles.record()
                    .sopClass(TestDicomFiles.VIDEO_ENDOSCOPIC_STORAGE)
                    .string(Tags.Modality, "CS", "ES")
                    .write(tempDir.resolve("endo.dcm"));

            assertTrue(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Media storage SOP class is used when the dataset has none")
        void mediaStorageSopClass() throws Exception {
            Path video = TestDicomFiles.record()
                    .mediaStorageSopClass(TestDicomFiles.US_MULTIFRAME_STORAGE)
                    .string(Tags.Modality, "CS", "OT")
                    .write(tempDir.resolve("meta-only.dcm"));
            Path still = TestDicomFiles.record()
                    .string(Tags.Modality, "CS", "OT")
                    .write(tempDir.resolve("plain.dcm"));

            assertTrue(detector.classifyVideo(video));
            assertFalse(detector.classifyVideo(still));
        }

        @Test
        @DisplayName("Many frames without timing means video")
        void manyFramesMeansVideo() throws Exception {
            Path file = TestDicomFiles.record()
                    .string(Tags.Modality, "CS", "CT")
                    .string(Tags.NumberOfFrames, "IS", "11")
                    .write(tempDir.resolve("cine.dcm"));

            assertTrue(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Few frames with timing means video")
        void timedFramesMeansVideo() throws Exception {
            Path file = TestDicomFiles.record()
                    .string(Tags.Modality, "CS", "CT")
                    .string(Tags.FrameTime, "DS", "33.3")
                    .string(Tags.NumberOfFrames, "IS", "3")
                    .write(tempDir.resolve("timed.dcm"));

            assertTrue(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Few frames without timing is not video")
        void fewUntimedFramesIsNotVideo() throws Exception {
            Path file = TestDicomFiles.record()
                    .string(Tags.Modality, "CS", "CT")
                    .string(Tags.NumberOfFrames, "IS", "10")
                    .write(tempDir.resolve("stack.dcm"));

            assertFalse(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Video modality with decodable multi-frame pixels means video")
        void videoModalityWithFrames() throws Exception {
            Path file = TestDicomFiles.record()
                    .string(Tags.Modality, "CS", "US")
                    .image(2, 2, 8, false, TestDicomFiles.ramp(12))
                    .write(tempDir.resolve("us.dcm"));

            assertTrue(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Video modality with a single frame is not video")
        void videoModalitySingleFrame() throws Exception {
            Path file = TestDicomFiles.record()
                    .string(Tags.Modality, "CS", "US")
                    .image(2, 2, 8, false, TestDicomFiles.ramp(4))
                    .write(tempDir.resolve("us-still.dcm"));

            assertFalse(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Ordinary CT is not video")
        void ctIsNotVideo() throws Exception {
            Path file = TestDicomFiles.writeSeriesRecord(tempDir.resolve("ct.dcm"), "CT", 1, "S", 1);

            assertFalse(detector.classifyVideo(file));
        }

        @Test
        @DisplayName("Unreadable files are not video")
        void unreadableIsNotVideo() throws Exception {
            Path file = TestDicomFiles.writeGarbage(tempDir.resolve("junk.dcm"), 300);

            assertFalse(detector.classifyVideo(file));
        }
    }
}
