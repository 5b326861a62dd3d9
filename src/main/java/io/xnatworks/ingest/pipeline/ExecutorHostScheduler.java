/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link HostScheduler} backed by one daemon scheduler thread.
 */
public class ExecutorHostScheduler implements HostScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutorHostScheduler.class);

    private final ScheduledExecutorService scheduler;

    public ExecutorHostScheduler() {
        this("ingest-scheduler");
    }

    public ExecutorHostScheduler(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Handle scheduleAtFixedRate(Runnable task, long periodMillis) {
        // an exception would silently cancel the periodic task
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task failed: {}", e.getMessage(), e);
            }
        }, 0, periodMillis, TimeUnit.MILLISECONDS);

        return new Handle() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
