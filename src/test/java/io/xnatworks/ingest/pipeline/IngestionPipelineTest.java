/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.ingest.pipeline;

import io.xnatworks.ingest.config.IngestConfig;
import io.xnatworks.ingest.detect.FormatDetector;
import io.xnatworks.ingest.dicom.TestDicomFiles;
import io.xnatworks.ingest.scan.DirectoryScanner;
import io.xnatworks.ingest.scan.FileCandidate;
import io.xnatworks.ingest.scan.ProtectedPaths;
import io.xnatworks.ingest.scan.ScanProgressListener;
import io.xnatworks.ingest.series.MetadataExtractor;
import io.xnatworks.ingest.series.RecordMetadata;
import io.xnatworks.ingest.series.SeriesBucket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IngestionPipeline, driven tick by tick through a manual scheduler.
 */
class IngestionPipelineTest {

    @TempDir
    Path tempDir;

    private IngestConfig config;
    private ManualHostScheduler scheduler;
    private RecordingListener listener;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() {
        config = new IngestConfig();
        config.getScan().setYieldMillis(0);
        scheduler = new ManualHostScheduler();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.shutdown();
        }
    }

    /**
     * Host scheduler that only runs its task when the test ticks it.
     */
    static class ManualHostScheduler implements HostScheduler {
        private Runnable task;
        private ManualHandle handle;
        int scheduleCount;

        @Override
        public Handle scheduleAtFixedRate(Runnable task, long periodMillis) {
            this.task = task;
            this.handle = new ManualHandle();
            scheduleCount++;
            return handle;
        }

        /**
         * @return false when nothing is scheduled
         */
        boolean tick() {
            if (task == null || handle.cancelled) {
                return false;
            }
            task.run();
            return true;
        }

        boolean isScheduled() {
            return handle != null && !handle.cancelled;
        }

        private static class ManualHandle implements Handle {
            private boolean cancelled;

            @Override
            public void cancel() {
                cancelled = true;
            }

            @Override
            public boolean isCancelled() {
                return cancelled;
            }
        }
    }

    static class RecordingListener implements ProgressListener {
        final List<String> statuses = new ArrayList<>();
        final List<Double> percents = new ArrayList<>();
        final List<Object> completed = new ArrayList<>();
        final List<String> failures = new ArrayList<>();
        // dispatch order across all callbacks
        final List<String> events = new ArrayList<>();

        @Override
        public void onProgress(double percent, String status) {
            percents.add(percent);
            statuses.add(status);
            events.add("progress");
        }

        @Override
        public void onCompleted(Object payload) {
            completed.add(payload);
            events.add("completed");
        }

        @Override
        public void onFailure(String message) {
            failures.add(message);
            events.add("failure");
        }

        int terminalCount() {
            return completed.size() + failures.size();
        }
    }

    /**
     * Extractor that answers without touching the file system, optionally blocking or failing.
     */
    class ScriptedExtractor extends MetadataExtractor {
        volatile CountDownLatch gate;
        volatile CountDownLatch entered = new CountDownLatch(1);
        volatile String ioFailureName;
        volatile String runtimeFailureName;

        ScriptedExtractor() {
            super(new FormatDetector(config));
        }

        @Override
        public RecordMetadata extract(Path file) throws IOException {
            entered.countDown();
            if (gate != null) {
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            String name = file.getFileName().toString();
            if (name.equals(runtimeFailureName)) {
                throw new IllegalStateException("boom");
            }
            if (name.equals(ioFailureName)) {
                throw new IOException("unreadable");
            }
            if (name.equals("collide-a")) {
                return RecordMetadata.builder(file).seriesNumber(1).seriesDescription("A").modality("B) (C").build();
            }
            if (name.equals("collide-b")) {
                return RecordMetadata.builder(file).seriesNumber(1).seriesDescription("A (B)").modality("C").build();
            }
            return RecordMetadata.builder(file).modality("CT").seriesNumber(1).build();
        }
    }

    /**
     * Detector that blocks once a set number of files has been classified.
     */
    class GatedDetector extends FormatDetector {
        final AtomicInteger classified = new AtomicInteger();
        volatile int blockAfter = Integer.MAX_VALUE;
        final CountDownLatch blocked = new CountDownLatch(1);
        final CountDownLatch gate = new CountDownLatch(1);

        GatedDetector() {
            super(config);
        }

        @Override
        public boolean classifyRecord(Path file) {
            boolean record = super.classifyRecord(file);
            if (classified.incrementAndGet() == blockAfter) {
                blocked.countDown();
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return record;
        }
    }

    private IngestionPipeline newPipeline(MetadataExtractor extractor) {
        return newPipeline(new FormatDetector(config), extractor);
    }

    private IngestionPipeline newPipeline(FormatDetector detector, MetadataExtractor extractor) {
        return newPipeline(new DirectoryScanner(config, detector, new ProtectedPaths(false)), extractor);
    }

    private IngestionPipeline newPipeline(DirectoryScanner scanner, MetadataExtractor extractor) {
        pipeline = new IngestionPipeline(config, scanner, extractor, scheduler);
        pipeline.setListener(listener);
        return pipeline;
    }

    private static Set<Path> pathsOf(ScanResult result) {
        return new HashSet<>(result.getPaths());
    }

    private static List<Path> files(int count) {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            paths.add(Paths.get("file" + i));
        }
        return paths;
    }

    /**
     * Wait for the worker, then tick until polling stops. A listener may start another
     * operation from a tick, so the worker is awaited again after each one.
     */
    private void runToEnd() throws InterruptedException {
        assertTrue(pipeline.awaitCompletion(10, TimeUnit.SECONDS));
        int ticks = 0;
        while (scheduler.tick()) {
            ticks++;
            assertTrue(ticks < 1000, "polling never stopped");
            assertTrue(pipeline.awaitCompletion(10, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlightTests {

        @Test
        @DisplayName("A second request is refused while a worker runs")
        void refusesConcurrentRequests() throws Exception {
            ScriptedExtractor extractor = new ScriptedExtractor();
            extractor.gate = new CountDownLatch(1);
            newPipeline(extractor);

            assertTrue(pipeline.loadAsync(files(2)));
            assertTrue(extractor.entered.await(10, TimeUnit.SECONDS));
            assertTrue(pipeline.isRunning());
            assertFalse(pipeline.scanAsync(tempDir, true));
            assertFalse(pipeline.loadAsync(files(1)));

            extractor.gate.countDown();
            runToEnd();

            assertFalse(pipeline.isRunning());
            assertEquals(1, listener.completed.size());
            assertEquals(2, ((LoadResult) listener.completed.get(0)).getProcessedCount());
        }

        @Test
        @DisplayName("A listener may start the next operation from the terminal callback")
        void listenerCanChainOperations() throws Exception {
            newPipeline(new ScriptedExtractor());
            List<Boolean> accepted = new ArrayList<>();
            pipeline.setListener(new RecordingListener() {
                @Override
                public void onCompleted(Object payload) {
                    super.onCompleted(payload);
                    if (payload instanceof ScanResult) {
                        accepted.add(pipeline.loadAsync(((ScanResult) payload).getPaths()));
                    }
                }
            });

            assertTrue(pipeline.scanAsync(tempDir, true));
            runToEnd();
            runToEnd();

            assertEquals(List.of(true), accepted);
            assertFalse(pipeline.isRunning());
        }
    }

    @Nested
    @DisplayName("Message delivery")
    class DeliveryTests {

        @Test
        @DisplayName("Load progress is posted every third file and on the last")
        void progressCadence() throws Exception {
            newPipeline(new ScriptedExtractor());

            pipeline.loadAsync(files(7));
            runToEnd();

            assertEquals(List.of("Loading metadata 3/7...", "Loading metadata 6/7...", "Loading metadata 7/7..."),
                    listener.statuses);
            assertEquals(100.0, listener.percents.get(2), 1e-9);
            assertEquals(1, listener.terminalCount());
        }

        @Test
        @DisplayName("At most ten messages are dispatched per tick")
        void drainLimitPerTick() throws Exception {
            config.getPipeline().setProgressEvery(1);
            newPipeline(new ScriptedExtractor());

            pipeline.loadAsync(files(30));
            assertTrue(pipeline.awaitCompletion(10, TimeUnit.SECONDS));

            scheduler.tick();
            assertEquals(10, listener.statuses.size());
            scheduler.tick();
            assertEquals(20, listener.statuses.size());
            scheduler.tick();
            assertEquals(30, listener.statuses.size());
            assertEquals(0, listener.terminalCount());
            scheduler.tick();
            assertEquals(1, listener.terminalCount());
            assertFalse(scheduler.isScheduled());
        }

        @Test
        @DisplayName("Polling stops after the terminal message and restarts with the next operation")
        void pollingStopsAfterTerminal() throws Exception {
            newPipeline(new ScriptedExtractor());

            pipeline.loadAsync(files(1));
            runToEnd();
            assertFalse(scheduler.isScheduled());
            assertEquals(1, scheduler.scheduleCount);

            pipeline.loadAsync(files(1));
            assertTrue(scheduler.isScheduled());
            runToEnd();
            assertEquals(2, scheduler.scheduleCount);
            assertEquals(2, listener.completed.size());
        }
    }

    @Nested
    @DisplayName("Failures and cancellation")
    class FailureTests {

        @Test
        @DisplayName("Unreadable files are counted and skipped")
        void unreadableFilesAreSkipped() throws Exception {
            ScriptedExtractor extractor = new ScriptedExtractor();
            extractor.ioFailureName = "file1";
            newPipeline(extractor);

            pipeline.loadAsync(files(4));
            runToEnd();

            LoadResult result = (LoadResult) listener.completed.get(0);
            assertEquals(3, result.getProcessedCount());
            assertEquals(1, result.getFailedCount());
            assertFalse(result.isCancelled());
            assertTrue(listener.failures.isEmpty());
        }

        @Test
        @DisplayName("Unexpected errors from one file are counted and skipped")
        void runtimeErrorsAreSkipped() throws Exception {
            ScriptedExtractor extractor = new ScriptedExtractor();
            extractor.runtimeFailureName = "file2";
            newPipeline(extractor);

            pipeline.loadAsync(files(4));
            runToEnd();

            LoadResult result = (LoadResult) listener.completed.get(0);
            assertEquals(3, result.getProcessedCount());
            assertEquals(1, result.getFailedCount());
            assertTrue(listener.failures.isEmpty());
        }

        @Test
        @DisplayName("Records whose series keys print alike share one series")
        void collidingSeriesKeysShareBucket() throws Exception {
            newPipeline(new ScriptedExtractor());
            List<Path> paths = files(2);
            paths.add(Paths.get("collide-a"));
            paths.add(Paths.get("collide-b"));

            pipeline.loadAsync(paths);
            runToEnd();

            assertTrue(listener.failures.isEmpty());
            LoadResult result = (LoadResult) listener.completed.get(0);
            assertEquals(4, result.getProcessedCount());
            assertEquals(2, result.getSeries().get("001 - A (B) (C)").size());
        }

        @Test
        @DisplayName("An unexpected worker error ends in a failure message")
        void workerErrorBecomesFailure() throws Exception {
            FormatDetector detector = new FormatDetector(config);
            DirectoryScanner failing = new DirectoryScanner(config, detector, new ProtectedPaths(false)) {
                @Override
                public List<FileCandidate> scan(Path root, boolean recursive, ScanProgressListener progress,
                                                BooleanSupplier cancelled) {
                    throw new IllegalStateException("boom");
                }
            };
            newPipeline(failing, new ScriptedExtractor());

            pipeline.scanAsync(tempDir, true);
            runToEnd();

            assertTrue(listener.completed.isEmpty());
            assertEquals(List.of("Scan failed: boom"), listener.failures);
            assertFalse(pipeline.isRunning());
            assertTrue(pipeline.loadAsync(files(1)));
            runToEnd();
            assertEquals(1, listener.completed.size());
        }

        @Test
        @DisplayName("A deeply nested record does not abort the scan")
        void deeplyNestedRecordDoesNotAbortScan() throws Exception {
            for (int i = 1; i <= 3; i++) {
                TestDicomFiles.writeSeriesRecord(tempDir.resolve("ct" + i + ".dcm"), "CT", 1, "Chest", i);
            }
            TestDicomFiles.record().preamble(false).fileMeta(false)
                    .nestedSequence(0x00081140, 100_000)
                    .write(tempDir.resolve("nested"));
            newPipeline(new MetadataExtractor(new FormatDetector(config)));

            pipeline.scanAsync(tempDir, true);
            runToEnd();

            assertTrue(listener.failures.isEmpty());
            ScanResult scan = (ScanResult) listener.completed.get(0);
            assertTrue(scan.getCandidates().size() >= 3);
        }

        @Test
        @DisplayName("Stop during a scan ends it early with a subset of the full result")
        void stopDuringScan() throws Exception {
            for (int i = 1; i <= 6; i++) {
                TestDicomFiles.writeSeriesRecord(tempDir.resolve("IM" + i), "CT", 1, "Chest", i);
            }
            config.getScan().setBatchDivisor(3);
            GatedDetector detector = new GatedDetector();
            newPipeline(detector, new ScriptedExtractor());

            pipeline.scanAsync(tempDir, true);
            runToEnd();
            ScanResult full = (ScanResult) listener.completed.get(0);
            assertEquals(6, full.getCandidates().size());

            listener.events.clear();
            detector.blockAfter = detector.classified.get() + 2;
            assertTrue(pipeline.scanAsync(tempDir, true));
            assertTrue(detector.blocked.await(10, TimeUnit.SECONDS));
            pipeline.stop();
            detector.gate.countDown();
            runToEnd();

            ScanResult partial = (ScanResult) listener.completed.get(1);
            assertTrue(partial.isCancelled());
            assertEquals(2, partial.getCandidates().size());
            assertTrue(pathsOf(full).containsAll(pathsOf(partial)));
            assertEquals("completed", listener.events.get(listener.events.size() - 1));
            assertEquals(1, Collections.frequency(listener.events, "completed"));
        }

        @Test
        @DisplayName("Requests after shutdown are refused")
        void refusesAfterShutdown() {
            newPipeline(new ScriptedExtractor());

            pipeline.shutdown();

            assertFalse(pipeline.loadAsync(files(1)));
            assertFalse(pipeline.scanAsync(tempDir, true));
            assertFalse(pipeline.isRunning());
        }

        @Test
        @DisplayName("Stop ends the load early with partial results")
        void stopEndsEarly() throws Exception {
            ScriptedExtractor extractor = new ScriptedExtractor();
            extractor.gate = new CountDownLatch(1);
            newPipeline(extractor);

            pipeline.loadAsync(files(5));
            assertTrue(extractor.entered.await(10, TimeUnit.SECONDS));
            pipeline.stop();
            assertTrue(pipeline.isCancelRequested());
            extractor.gate.countDown();
            runToEnd();

            LoadResult result = (LoadResult) listener.completed.get(0);
            assertTrue(result.isCancelled());
            assertEquals(1, result.getProcessedCount());
        }

        @Test
        @DisplayName("Stop without a running operation does nothing")
        void stopWhenIdle() {
            newPipeline(new ScriptedExtractor());

            pipeline.stop();

            assertFalse(pipeline.isCancelRequested());
            assertFalse(scheduler.isScheduled());
        }
    }

    @Nested
    @DisplayName("End to end")
    class EndToEndTests {

        @Test
        @DisplayName("Scan then load organizes records into series")
        void scanThenLoad() throws Exception {
            for (int i = 1; i <= 5; i++) {
                TestDicomFiles.writeSeriesRecord(tempDir.resolve("ct" + i + ".dcm"), "CT", 1, "Chest", 6 - i);
                TestDicomFiles.writeSeriesRecord(tempDir.resolve("mr" + i + ".dcm"), "MR", 2, "Brain", i);
            }
            TestDicomFiles.writeGarbage(tempDir.resolve("junk1"), 400);
            TestDicomFiles.writeGarbage(tempDir.resolve("junk2"), 600);
            newPipeline(new MetadataExtractor(new FormatDetector(config)));

            assertTrue(pipeline.scanAsync(tempDir, true));
            runToEnd();
            ScanResult scan = (ScanResult) listener.completed.get(0);
            assertEquals(10, scan.getCandidates().size());
            assertFalse(scan.isCancelled());

            assertTrue(pipeline.loadAsync(scan.getPaths()));
            runToEnd();
            LoadResult load = (LoadResult) listener.completed.get(1);

            assertEquals(2, load.getSeries().size());
            assertEquals(10, load.getProcessedCount());
            assertEquals(0, load.getFailedCount());
            SeriesBucket ct = load.getSeries().get("001 - Chest (CT)");
            SeriesBucket mr = load.getSeries().get("002 - Brain (MR)");
            assertNotNull(ct);
            assertNotNull(mr);
            assertEquals(5, ct.size());
            assertEquals(5, mr.size());
            for (int i = 0; i < 5; i++) {
                assertEquals(i + 1, ct.get(i).getInstanceNumber());
            }
            assertTrue(listener.failures.isEmpty());
        }

        @Test
        @DisplayName("Scanning a missing directory completes with no candidates")
        void scanMissingDirectory() throws Exception {
            newPipeline(new MetadataExtractor(new FormatDetector(config)));

            pipeline.scanAsync(tempDir.resolve("missing"), true);
            runToEnd();

            ScanResult scan = (ScanResult) listener.completed.get(0);
            assertTrue(scan.getCandidates().isEmpty());
            assertTrue(listener.statuses.get(listener.statuses.size() - 1).startsWith("Error"));
        }
    }
}
