/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest;

import ch.qos.logback.classic.Level;
import io.xnatworks.ingest.config.IngestConfig;
import io.xnatworks.ingest.detect.FormatDetector;
import io.xnatworks.ingest.dicom.PixelDataDecoder;
import io.xnatworks.ingest.pipeline.IngestionPipeline;
import io.xnatworks.ingest.pipeline.LoadResult;
import io.xnatworks.ingest.pipeline.ProgressListener;
import io.xnatworks.ingest.pipeline.ScanResult;
import io.xnatworks.ingest.pixel.DisplayBuffer;
import io.xnatworks.ingest.pixel.PixelBuffer;
import io.xnatworks.ingest.pixel.PixelNormalizer;
import io.xnatworks.ingest.scan.FileCandidate;
import io.xnatworks.ingest.series.MetadataExtractor;
import io.xnatworks.ingest.series.RecordInfoFormatter;
import io.xnatworks.ingest.series.RecordMetadata;
import io.xnatworks.ingest.series.SeriesBrowser;
import io.xnatworks.ingest.series.SeriesBucket;
import io.xnatworks.ingest.series.SeriesReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * XNAT DICOM Ingest - command line
 *
 * Scans folders for DICOM records, organizes them into series and renders
 * individual frames to PNG.
 */
@Command(name = "dicom-ingest",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "XNAT DICOM Ingest - find, organize and render DICOM records",
        subcommands = {
                DicomIngest.ScanCommand.class,
                DicomIngest.SeriesCommand.class,
                DicomIngest.InfoCommand.class,
                DicomIngest.RenderCommand.class
        })
public class DicomIngest implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DicomIngest.class);

    @Option(names = {"-c", "--config"}, description = "Config file path", defaultValue = "config.yaml")
    protected File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Debug logging")
    protected boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DicomIngest()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Load the config file if present (defaults otherwise) and apply its log level.
     */
    IngestConfig loadConfig() throws IOException {
        IngestConfig config = IngestConfig.loadOrDefault(configFile);
        applyLogLevel(verbose ? "DEBUG" : config.getLogLevel());
        return config;
    }

    private static void applyLogLevel(String level) {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    // ========================================================================
    // SCAN COMMAND - List record files under a directory
    // ========================================================================

    @Command(name = "scan", description = "Find DICOM records under a directory")
    static class ScanCommand implements Callable<Integer> {

        @ParentCommand
        private DicomIngest parent;

        @Parameters(index = "0", description = "Directory to scan")
        private File directory;

        @Option(names = {"--no-recursive"}, description = "Only scan the top-level directory")
        private boolean noRecursive;

        @Override
        public Integer call() throws Exception {
            IngestConfig config = parent.loadConfig();
            if (!directory.isDirectory()) {
                System.err.println("Not a directory: " + directory.getAbsolutePath());
                return 1;
            }

            try (IngestionPipeline pipeline = new IngestionPipeline(config)) {
                WaitingListener listener = new WaitingListener();
                pipeline.setListener(listener);
                pipeline.scanAsync(directory.toPath(), !noRecursive);
                ScanResult result = listener.await(ScanResult.class);
                if (result == null) {
                    System.err.println(listener.getFailure());
                    return 1;
                }

                System.out.println();
                for (FileCandidate candidate : result.getCandidates()) {
                    System.out.println("  " + candidate.getPath());
                }
                System.out.println();
                System.out.println("Found " + result.getCandidates().size() + " DICOM records");
                return 0;
            }
        }
    }

    // ========================================================================
    // SERIES COMMAND - Organize records into series
    // ========================================================================

    @Command(name = "series", description = "Organize DICOM records into series")
    static class SeriesCommand implements Callable<Integer> {

        @ParentCommand
        private DicomIngest parent;

        @Parameters(arity = "1..*", description = "Directories and/or files")
        private List<File> inputs;

        @Option(names = {"--no-recursive"}, description = "Only scan the top level of each directory")
        private boolean noRecursive;

        @Option(names = {"--json"}, description = "Print a JSON report")
        private boolean json;

        @Option(names = {"--details"}, description = "Print the information panel of every record")
        private boolean details;

        @Override
        public Integer call() throws Exception {
            IngestConfig config = parent.loadConfig();

            try (IngestionPipeline pipeline = new IngestionPipeline(config)) {
                List<Path> files = new ArrayList<>();
                for (File input : inputs) {
                    if (input.isDirectory()) {
                        WaitingListener listener = new WaitingListener();
                        pipeline.setListener(listener);
                        pipeline.scanAsync(input.toPath(), !noRecursive);
                        ScanResult scan = listener.await(ScanResult.class);
                        if (scan == null) {
                            System.err.println(listener.getFailure());
                            return 1;
                        }
                        files.addAll(scan.getPaths());
                    } else if (input.isFile()) {
                        files.add(input.toPath());
                    } else {
                        System.err.println("No such file or directory: " + input.getAbsolutePath());
                        return 1;
                    }
                }

                WaitingListener listener = new WaitingListener();
                pipeline.setListener(listener);
                pipeline.loadAsync(files);
                LoadResult result = listener.await(LoadResult.class);
                if (result == null) {
                    System.err.println(listener.getFailure());
                    return 1;
                }

                if (json) {
                    System.out.println(new SeriesReport(result.getSeries(), result.getFailedCount()).toJson());
                    return 0;
                }

                if (details) {
                    printDetails(new SeriesBrowser(result.getSeries()));
                }

                System.out.println();
                System.out.printf("%-50s %-8s%n", "SERIES", "FILES");
                System.out.println("─".repeat(60));
                for (Map.Entry<String, SeriesBucket> entry : result.getSeries().entrySet()) {
                    System.out.printf("%-50s %-8d%n", entry.getKey(), entry.getValue().size());
                }
                System.out.println();
                System.out.println(result.getSeries().size() + " series, " + result.getProcessedCount()
                        + " files" + (result.getFailedCount() > 0 ? ", " + result.getFailedCount() + " unreadable" : ""));
                return 0;
            }
        }

        private void printDetails(SeriesBrowser browser) {
            RecordInfoFormatter formatter = new RecordInfoFormatter();
            for (int s = 0; s < browser.getSeriesCount(); s++) {
                browser.selectSeries(s);
                for (int i = 0; i < browser.currentSeries().size(); i++) {
                    System.out.println(browser.describeCurrent(formatter));
                    browser.nextInstance();
                }
            }
        }
    }

    // ========================================================================
    // INFO COMMAND - Information panel for one record
    // ========================================================================

    @Command(name = "info", description = "Show the information panel for a record")
    static class InfoCommand implements Callable<Integer> {

        @ParentCommand
        private DicomIngest parent;

        @Parameters(index = "0", description = "DICOM file")
        private File file;

        @Override
        public Integer call() throws Exception {
            IngestConfig config = parent.loadConfig();
            if (!file.isFile()) {
                System.err.println("File not found: " + file.getAbsolutePath());
                return 1;
            }
            try {
                MetadataExtractor extractor = new MetadataExtractor(new FormatDetector(config));
                RecordMetadata metadata = extractor.extract(file.toPath());
                System.out.println(new RecordInfoFormatter().format(metadata, 0, 1, 0, 1));
                return 0;
            } catch (IOException e) {
                System.err.println("Error reading " + file + ": " + e.getMessage());
                return 1;
            }
        }
    }

    // ========================================================================
    // RENDER COMMAND - Write one frame as PNG
    // ========================================================================

    @Command(name = "render", description = "Render a frame of a record to PNG")
    static class RenderCommand implements Callable<Integer> {

        @ParentCommand
        private DicomIngest parent;

        @Parameters(index = "0", description = "DICOM file")
        private File file;

        @Option(names = {"-o", "--output"}, required = true, description = "Output PNG file")
        private File output;

        @Option(names = {"--frame"}, defaultValue = "0", description = "Frame index (default: 0)")
        private int frame;

        @Option(names = {"--center"}, description = "Window center (default: from the file)")
        private Double center;

        @Option(names = {"--width"}, description = "Window width (default: from the file)")
        private Double width;

        @Override
        public Integer call() throws Exception {
            parent.loadConfig();
            if (!file.isFile()) {
                System.err.println("File not found: " + file.getAbsolutePath());
                return 1;
            }
            try {
                PixelBuffer pixels = new PixelDataDecoder().decode(file.toPath());
                PixelNormalizer normalizer = new PixelNormalizer();
                DisplayBuffer display = (center != null && width != null)
                        ? normalizer.normalize(pixels, center, width)
                        : normalizer.normalize(pixels);
                if (frame < 0 || frame >= display.getFrames()) {
                    System.err.println("Frame " + frame + " out of range (0-" + (display.getFrames() - 1) + ")");
                    return 1;
                }
                if (!ImageIO.write(display.toBufferedImage(frame), "png", output)) {
                    System.err.println("No PNG writer available");
                    return 1;
                }
                System.out.printf("Wrote %s (%dx%d, frame %d of %d)%n", output, display.getWidth(),
                        display.getHeight(), frame + 1, display.getFrames());
                return 0;
            } catch (IOException e) {
                log.debug("Render of {} failed", file, e);
                System.err.println("Error rendering " + file + ": " + e.getMessage());
                return 1;
            }
        }
    }

    /**
     * Prints progress and lets the command thread wait for the terminal message.
     */
    static class WaitingListener implements ProgressListener {
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile Object payload;
        private volatile String failure;
        private final boolean interactive = System.console() != null;

        @Override
        public void onProgress(double percent, String status) {
            if (interactive) {
                System.err.printf("\r[%3d%%] %-70s", (int) percent, status);
            } else {
                log.debug("[{}%] {}", (int) percent, status);
            }
        }

        @Override
        public void onCompleted(Object payload) {
            this.payload = payload;
            finishLine();
            done.countDown();
        }

        @Override
        public void onFailure(String message) {
            this.failure = message;
            finishLine();
            done.countDown();
        }

        /**
         * @return the payload, or null if the operation failed
         */
        <T> T await(Class<T> type) throws InterruptedException {
            done.await();
            return payload == null ? null : type.cast(payload);
        }

        String getFailure() {
            return failure;
        }

        private void finishLine() {
            if (interactive) {
                System.err.println();
            }
        }
    }
}
