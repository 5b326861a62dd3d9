/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.DosFileAttributes;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Windows system locations and hidden/system entries that a scan must not touch.
 * Inert on other platforms.
 */
public class ProtectedPaths {
    private static final Logger log = LoggerFactory.getLogger(ProtectedPaths.class);

    private static final List<String> PROTECTED_ROOTS = Arrays.asList(
            "c:\\windows",
            "c:\\$recycle.bin",
            "c:\\system volume information",
            "c:\\swapfile.sys",
            "c:\\pagefile.sys");

    private final boolean windows;

    public ProtectedPaths() {
        this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    public ProtectedPaths(boolean windows) {
        this.windows = windows;
    }

    public boolean isWindows() {
        return windows;
    }

    public boolean isProtected(Path path) {
        if (!windows) {
            return false;
        }
        String abs = path.toAbsolutePath().toString().toLowerCase(Locale.ROOT);
        if (isUnderProtectedRoot(abs)) {
            return true;
        }
        try {
            DosFileAttributes attrs = Files.readAttributes(path, DosFileAttributes.class);
            return attrs.isSystem() || attrs.isHidden();
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Cannot read attributes of {}, treating as protected: {}", path, e.getMessage());
            return true;
        }
    }

    static boolean isUnderProtectedRoot(String absoluteLowerCase) {
        for (String root : PROTECTED_ROOTS) {
            if (absoluteLowerCase.equals(root) || absoluteLowerCase.startsWith(root + "\\")) {
                return true;
            }
        }
        return false;
    }
}
