/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.scan;

import io.xnatworks.ingest.config.IngestConfig;
import io.xnatworks.ingest.detect.FormatDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Walks a directory tree and returns the files that are records.
 *
 * <p>Directories on the skip list are pruned before the walk descends into them. Each file is
 * sorted by extension into rejected, certain (record extension) or candidate (no extension,
 * a short unknown extension, or an all-digit extension). Certain files are returned without
 * being opened; candidates are probed with {@link FormatDetector#classifyRecord(Path)} in
 * batches of {@code total / batch_divisor} (at least 1), with a progress report and a short
 * pause after every batch.
 *
 * <p>Progress runs 0% at start, 5% once the walk is done, then
 * {@code processed / total * 95 + 5} after each batch.
 */
public class DirectoryScanner {
    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    private final FormatDetector detector;
    private final ProtectedPaths protectedPaths;
    private final Set<String> skipDirectories;
    private final Set<String> recordExtensions;
    private final Set<String> rejectedExtensions;
    private final List<String> priorityKeywords;
    private final int maxCandidateExtensionLength;
    private final int batchDivisor;
    private final long yieldMillis;
    private final boolean skipProtectedPaths;

    public DirectoryScanner(IngestConfig config, FormatDetector detector) {
        this(config, detector, new ProtectedPaths());
    }

    public DirectoryScanner(IngestConfig config, FormatDetector detector, ProtectedPaths protectedPaths) {
        IngestConfig.ScanConfig scan = config.getScan();
        this.detector = detector;
        this.protectedPaths = protectedPaths;
        this.skipDirectories = lowerCaseSet(scan.getSkipDirectories());
        this.recordExtensions = lowerCaseSet(scan.getRecordExtensions());
        this.rejectedExtensions = lowerCaseSet(scan.getRejectedExtensions());
        this.priorityKeywords = new ArrayList<>(lowerCaseSet(scan.getPriorityKeywords()));
        this.maxCandidateExtensionLength = scan.getMaxCandidateExtensionLength();
        this.batchDivisor = Math.max(1, scan.getBatchDivisor());
        this.yieldMillis = Math.max(0, scan.getYieldMillis());
        this.skipProtectedPaths = scan.isSkipProtectedPaths();
    }

    public List<FileCandidate> scan(Path root, boolean recursive, ScanProgressListener listener) {
        return scan(root, recursive, listener, () -> false);
    }

    /**
     * Scan {@code root}, checking {@code cancelled} before every probe batch. A cancelled scan
     * returns the certain records plus the candidates confirmed so far.
     */
    public List<FileCandidate> scan(Path root, boolean recursive, ScanProgressListener listener,
                                    BooleanSupplier cancelled) {
        ScanProgressListener progress = listener != null ? listener : ScanProgressListener.NONE;
        progress.onProgress(0, "Scanning " + root + "...");

        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            log.warn("Cannot access directory: {}", root);
            progress.onProgress(0, "Error: cannot access directory " + root);
            return new ArrayList<>();
        }

        List<FileCandidate> certain = new ArrayList<>();
        List<Path> priority = new ArrayList<>();
        List<Path> ordinary = new ArrayList<>();
        try {
            walk(root, recursive, certain, priority, ordinary);
        } catch (IOException e) {
            log.warn("Error scanning {}: {}", root, e.getMessage());
            progress.onProgress(0, "Error scanning " + root + ": " + e.getMessage());
            return new ArrayList<>();
        }

        List<Path> candidates = new ArrayList<>(priority.size() + ordinary.size());
        candidates.addAll(priority);
        candidates.addAll(ordinary);
        int total = candidates.size();
        log.info("Scan of {}: {} record files, {} candidates to probe", root, certain.size(), total);
        progress.onProgress(5, "Found " + certain.size() + " record files, probing " + total + " candidates...");

        List<FileCandidate> results = new ArrayList<>(certain);
        int batchSize = Math.max(1, total / batchDivisor);
        int processed = 0;
        while (processed < total) {
            if (cancelled.getAsBoolean()) {
                log.info("Scan of {} cancelled after probing {}/{} candidates", root, processed, total);
                break;
            }
            int end = Math.min(total, processed + batchSize);
            for (Path file : candidates.subList(processed, end)) {
                FileCandidate candidate = new FileCandidate(file);
                if (detector.classifyRecord(file)) {
                    candidate.classify(FileCandidate.Classification.RECORD);
                    results.add(candidate);
                } else {
                    candidate.classify(FileCandidate.Classification.REJECTED);
                }
            }
            processed = end;
            progress.onProgress((double) processed / total * 95 + 5,
                    "Probing files " + processed + "/" + total + "...");
            if (!pause()) {
                break;
            }
        }

        log.debug("Scan of {} returned {} records", root, results.size());
        return results;
    }

    private void walk(Path root, boolean recursive, List<FileCandidate> certain,
                      List<Path> priority, List<Path> ordinary) throws IOException {
        int depth = recursive ? Integer.MAX_VALUE : 1;
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), depth, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (isSkippedDirectory(dir)) {
                    log.debug("Pruning {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                // with maxDepth 1, subdirectories arrive here too; links to files count as files
                if (!attrs.isRegularFile() && !(attrs.isSymbolicLink() && Files.isRegularFile(file))) {
                    return FileVisitResult.CONTINUE;
                }
                if (skipProtectedPaths && protectedPaths.isProtected(file)) {
                    return FileVisitResult.CONTINUE;
                }
                switch (sort(file)) {
                    case CERTAIN:
                        certain.add(new FileCandidate(file, FileCandidate.Classification.RECORD));
                        break;
                    case CANDIDATE:
                        if (hasPriorityKeyword(file)) {
                            priority.add(file);
                        } else {
                            ordinary.add(file);
                        }
                        break;
                    default:
                        break;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                if (file.equals(root)) {
                    log.warn("Cannot read {}: {}", file, exc.getMessage());
                } else {
                    log.debug("Skipping unreadable {}: {}", file, exc.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    enum Sort {
        REJECTED,
        CERTAIN,
        CANDIDATE
    }

    Sort sort(Path file) {
        String ext = FormatDetector.extensionOf(file);
        if (ext.isEmpty()) {
            return Sort.CANDIDATE;
        }
        if (recordExtensions.contains(ext)) {
            return Sort.CERTAIN;
        }
        if (rejectedExtensions.contains(ext)) {
            return Sort.REJECTED;
        }
        if (ext.length() <= maxCandidateExtensionLength || isAllDigits(ext)) {
            return Sort.CANDIDATE;
        }
        return Sort.REJECTED;
    }

    boolean isSkippedDirectory(Path dir) {
        Path name = dir.getFileName();
        if (name != null && skipDirectories.contains(name.toString().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return skipProtectedPaths && protectedPaths.isProtected(dir);
    }

    private boolean hasPriorityKeyword(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String keyword : priorityKeywords) {
            if (name.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return false if the thread was interrupted
     */
    private boolean pause() {
        if (yieldMillis == 0) {
            Thread.yield();
            return true;
        }
        try {
            Thread.sleep(yieldMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Scan interrupted");
            return false;
        }
    }

    private static boolean isAllDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return !s.isEmpty();
    }

    private static Set<String> lowerCaseSet(List<String> values) {
        Set<String> set = new HashSet<>();
        for (String v : values) {
            set.add(v.toLowerCase(Locale.ROOT));
        }
        return set;
    }
}
