/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pipeline;

import java.util.Objects;

/**
 * Unit of communication from a pipeline worker to the host scheduler.
 *
 * <p>Exactly three kinds exist: {@link Progress}, {@link Completed} and {@link Failure}. The
 * constructor is private to this file so no other subclass can be written; consumers
 * dispatch with a {@link Visitor}, which must handle every kind.
 */
public abstract class ProgressMessage {

    private ProgressMessage() {
    }

    public static Progress progress(double percent, String status) {
        return new Progress(percent, status);
    }

    public static Completed completed(Object payload) {
        return new Completed(payload);
    }

    public static Failure failure(String message) {
        return new Failure(message);
    }

    /**
     * True for {@link Completed} and {@link Failure}; a worker posts nothing after a terminal message.
     */
    public abstract boolean isTerminal();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitProgress(Progress progress);

        R visitCompleted(Completed completed);

        R visitFailure(Failure failure);
    }

    public static final class Progress extends ProgressMessage {
        private final double percent;
        private final String status;

        private Progress(double percent, String status) {
            this.percent = percent;
            this.status = status;
        }

        public double getPercent() {
            return percent;
        }

        public String getStatus() {
            return status;
        }

        @Override
        public boolean isTerminal() {
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgress(this);
        }

        @Override
        public String toString() {
            return String.format("Progress[%.1f%%, %s]", percent, status);
        }
    }

    public static final class Completed extends ProgressMessage {
        private final Object payload;

        private Completed(Object payload) {
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        public Object getPayload() {
            return payload;
        }

        /**
         * @throws ClassCastException if the payload is of another type
         */
        public <T> T getPayload(Class<T> type) {
            return type.cast(payload);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompleted(this);
        }

        @Override
        public String toString() {
            return "Completed[" + payload + "]";
        }
    }

    public static final class Failure extends ProgressMessage {
        private final String message;

        private Failure(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFailure(this);
        }

        @Override
        public String toString() {
            return "Failure[" + message + "]";
        }
    }
}
