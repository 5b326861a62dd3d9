/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

import io.xnatworks.ingest.config.IngestConfig;
import io.xnatworks.ingest.detect.FormatDetector;
import io.xnatworks.ingest.scan.DirectoryScanner;
import io.xnatworks.ingest.scan.FileCandidate;
import io.xnatworks.ingest.series.MetadataExtractor;
import io.xnatworks.ingest.series.RecordMetadata;
import io.xnatworks.ingest.series.SeriesOrganizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a scan or a metadata load on a background worker and reports through a
 * {@link MessagePump} drained by the host scheduler.
 *
 * <p>Single-flight: while a worker is running, or after {@link #shutdown()}, {@link #scanAsync}
 * and {@link #loadAsync} return false and do nothing. {@link #stop()} asks the worker to finish early; it is checked
 * before every scan batch and every file of a load, and the worker still posts its terminal
 * message with whatever it has so far.
 *
 * <p>The worker only posts messages. The polling step ({@link #poll()}) runs on the host
 * scheduler, dispatches at most {@code drain_limit} messages per tick to the listener and
 * unschedules itself once the terminal message has been dispatched.
 */
public class IngestionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final DirectoryScanner scanner;
    private final MetadataExtractor extractor;
    private final MessagePump pump;
    private final HostScheduler scheduler;
    private final boolean ownsScheduler;
    private final long pollIntervalMillis;
    private final int progressEvery;

    private final ExecutorService worker;
    private final AtomicBoolean running = new AtomicBoolean(false);
    // terminal messages posted or expected but not yet dispatched
    private final AtomicInteger undispatchedTerminals = new AtomicInteger();
    private volatile boolean cancelRequested = false;
    private volatile ProgressListener listener;
    private volatile Future<?> currentJob;

    private final Object pollLock = new Object();
    private HostScheduler.Handle pollHandle;

    public IngestionPipeline(IngestConfig config) {
        this(config, new FormatDetector(config));
    }

    private IngestionPipeline(IngestConfig config, FormatDetector detector) {
        this(config, new DirectoryScanner(config, detector), new MetadataExtractor(detector),
                new ExecutorHostScheduler(), true);
    }

    public IngestionPipeline(IngestConfig config, DirectoryScanner scanner, MetadataExtractor extractor,
                             HostScheduler scheduler) {
        this(config, scanner, extractor, scheduler, false);
    }

    private IngestionPipeline(IngestConfig config, DirectoryScanner scanner, MetadataExtractor extractor,
                              HostScheduler scheduler, boolean ownsScheduler) {
        IngestConfig.PipelineConfig pipeline = config.getPipeline();
        this.scanner = scanner;
        this.extractor = extractor;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.pump = new MessagePump(pipeline.getDrainLimit());
        this.pollIntervalMillis = Math.max(1, pipeline.getPollIntervalMillis());
        this.progressEvery = Math.max(1, pipeline.getProgressEvery());
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ingest-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public void setListener(ProgressListener listener) {
        this.listener = listener;
    }

    /**
     * Scan a directory in the background. Completes with a {@link ScanResult}.
     *
     * @return false if another operation is still running
     */
    public boolean scanAsync(Path root, boolean recursive) {
        if (!begin("scan")) {
            return false;
        }
        log.info("Starting scan of {} (recursive={})", root, recursive);
        return submit("scan", () -> runScan(root, recursive));
    }

    /**
     * Extract metadata from each path and organize it into series in the background.
     * Completes with a {@link LoadResult}. A file that cannot be read or extracted is counted
     * as failed and skipped.
     *
     * @return false if another operation is still running
     */
    public boolean loadAsync(List<Path> paths) {
        if (!begin("load")) {
            return false;
        }
        List<Path> copy = new ArrayList<>(paths);
        log.info("Starting metadata load of {} files", copy.size());
        return submit("load", () -> runLoad(copy));
    }

    /**
     * Request cooperative cancellation of the running operation.
     */
    public void stop() {
        if (running.get()) {
            log.info("Stop requested");
            cancelRequested = true;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * One polling tick: dispatch at most {@code drain_limit} messages.
     *
     * @return false once the operation has finished and every message has been dispatched
     */
    public boolean poll() {
        int terminal = pump.drain(listener);
        synchronized (pollLock) {
            int remaining = undispatchedTerminals.addAndGet(-terminal);
            if (remaining > 0 || !pump.isEmpty()) {
                return true;
            }
            if (pollHandle != null) {
                log.debug("Terminal message dispatched, polling stopped");
                pollHandle.cancel();
                pollHandle = null;
            }
        }
        return false;
    }

    /**
     * Wait for the current worker to finish. Messages may still be waiting to be dispatched.
     *
     * @return true if no worker is running when this returns
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> job = currentJob;
        if (job == null) {
            return true;
        }
        try {
            job.get(timeout, unit);
        } catch (ExecutionException e) {
            log.debug("Worker ended with {}", e.getCause().toString());
        } catch (TimeoutException e) {
            return false;
        }
        return true;
    }

    /**
     * Stop the worker thread and polling. The pipeline cannot be used afterwards.
     */
    public void shutdown() {
        stop();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        synchronized (pollLock) {
            if (pollHandle != null) {
                pollHandle.cancel();
                pollHandle = null;
            }
        }
        if (ownsScheduler && scheduler instanceof AutoCloseable) {
            try {
                ((AutoCloseable) scheduler).close();
            } catch (Exception e) {
                log.warn("Error closing scheduler: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    MessagePump getPump() {
        return pump;
    }

    private boolean begin(String operation) {
        if (worker.isShutdown()) {
            log.warn("Ignoring {} request, the pipeline has been shut down", operation);
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Ignoring {} request, an operation is already running", operation);
            return false;
        }
        cancelRequested = false;
        synchronized (pollLock) {
            undispatchedTerminals.incrementAndGet();
            if (pollHandle == null) {
                pollHandle = scheduler.scheduleAtFixedRate(this::poll, pollIntervalMillis);
            }
        }
        return true;
    }

    /**
     * Hand the job to the worker, undoing {@link #begin} if the worker refuses it.
     */
    private boolean submit(String operation, Runnable job) {
        try {
            currentJob = worker.submit(job);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Ignoring {} request, the pipeline has been shut down", operation);
            synchronized (pollLock) {
                undispatchedTerminals.decrementAndGet();
            }
            running.set(false);
            return false;
        }
    }

    private void runScan(Path root, boolean recursive) {
        ProgressMessage terminal = null;
        try {
            List<FileCandidate> found = scanner.scan(root, recursive,
                    (percent, status) -> pump.post(ProgressMessage.progress(percent, status)),
                    () -> cancelRequested);
            boolean cancelled = cancelRequested;
            log.info("Scan of {} finished: {} candidates{}", root, found.size(), cancelled ? " (cancelled)" : "");
            terminal = ProgressMessage.completed(new ScanResult(root, found, cancelled));
        } catch (Exception e) {
            log.error("Scan of {} failed: {}", root, e.getMessage(), e);
            terminal = ProgressMessage.failure("Scan failed: " + e.getMessage());
        } finally {
            finish(terminal, "Scan failed: worker terminated");
        }
    }

    private void runLoad(List<Path> paths) {
        ProgressMessage terminal = null;
        try {
            SeriesOrganizer organizer = new SeriesOrganizer();
            int total = paths.size();
            int processed = 0;
            int failed = 0;
            for (int i = 0; i < total; i++) {
                if (cancelRequested) {
                    log.info("Load cancelled after {}/{} files", i, total);
                    break;
                }
                Path file = paths.get(i);
                try {
                    RecordMetadata metadata = extractor.extract(file);
                    organizer.add(metadata);
                    processed++;
                } catch (IOException e) {
                    failed++;
                    log.warn("Skipping {}: {}", file, e.getMessage());
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("Skipping {}: unexpected error {}", file, e.toString(), e);
                }
                if ((i + 1) % progressEvery == 0 || i == total - 1) {
                    pump.post(ProgressMessage.progress((i + 1) * 100.0 / total,
                            "Loading metadata " + (i + 1) + "/" + total + "..."));
                }
            }
            organizer.sortAll();
            LoadResult result = new LoadResult(organizer.getBuckets(), processed, failed, cancelRequested);
            log.info("Load finished: {}", result);
            terminal = ProgressMessage.completed(result);
        } catch (Exception e) {
            log.error("Load failed: {}", e.getMessage(), e);
            terminal = ProgressMessage.failure("Load failed: " + e.getMessage());
        } finally {
            finish(terminal, "Load failed: worker terminated");
        }
    }

    /**
     * Clear the running flag, then post the terminal message, so a listener reacting to it
     * can start the next operation. Exactly one terminal message is posted per operation.
     */
    private void finish(ProgressMessage terminal, String fallback) {
        running.set(false);
        pump.post(terminal != null ? terminal : ProgressMessage.failure(fallback));
    }
}
