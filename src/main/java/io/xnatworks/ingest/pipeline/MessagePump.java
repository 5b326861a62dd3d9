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

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe FIFO between a worker (posting) and the scheduler (draining).
 *
 * Each {@link #drain(ProgressListener)} dispatches at most {@code drainLimit} messages and
 * leaves the rest for the next tick.
 */
public class MessagePump {
    private static final Logger log = LoggerFactory.getLogger(MessagePump.class);

    public static final int DEFAULT_DRAIN_LIMIT = 10;

    private final Queue<ProgressMessage> queue = new ConcurrentLinkedQueue<>();
    private final int drainLimit;

    public MessagePump() {
        this(DEFAULT_DRAIN_LIMIT);
    }

    public MessagePump(int drainLimit) {
        if (drainLimit < 1) {
            throw new IllegalArgumentException("drainLimit must be positive: " + drainLimit);
        }
        this.drainLimit = drainLimit;
    }

    public void post(ProgressMessage message) {
        queue.add(message);
    }

    public int getDrainLimit() {
        return drainLimit;
    }

    public int pending() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Dispatch up to {@code drainLimit} messages in posting order. Exceptions thrown by the
     * listener are logged and do not stop the drain.
     *
     * @param listener receiver, or null to discard
     * @return number of terminal messages dispatched
     */
    public int drain(ProgressListener listener) {
        int terminal = 0;
        for (int i = 0; i < drainLimit; i++) {
            ProgressMessage message = queue.poll();
            if (message == null) {
                break;
            }
            if (message.isTerminal()) {
                terminal++;
            }
            if (listener == null) {
                log.debug("No listener, dropping {}", message);
                continue;
            }
            try {
                message.accept(new Dispatcher(listener));
            } catch (RuntimeException e) {
                log.error("Listener failed on {}: {}", message, e.getMessage(), e);
            }
        }
        return terminal;
    }

    private static class Dispatcher implements ProgressMessage.Visitor<Void> {
        private final ProgressListener listener;

        Dispatcher(ProgressListener listener) {
            this.listener = listener;
        }

        @Override
        public Void visitProgress(ProgressMessage.Progress progress) {
            listener.onProgress(progress.getPercent(), progress.getStatus());
            return null;
        }

        @Override
        public Void visitCompleted(ProgressMessage.Completed completed) {
            listener.onCompleted(completed.getPayload());
            return null;
        }

        @Override
        public Void visitFailure(ProgressMessage.Failure failure) {
            listener.onFailure(failure.getMessage());
            return null;
        }
    }
}
