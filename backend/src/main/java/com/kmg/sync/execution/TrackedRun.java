package com.kmg.sync.execution;

import com.kmg.sync.model.ExecutionRecord;
import com.kmg.sync.model.ExecutionStatus;

/**
 * An open execution record. Closing it writes the terminal state exactly once: {@code COMPLETED} if
 * {@link #completed()} was called, otherwise {@code FAILED} with the recorded error.
 */
public final class TrackedRun implements AutoCloseable {
    private final ExecutionTracker tracker;
    private ExecutionRecord record;
    private ExecutionStatus outcome;
    private String errorMessage;
    private boolean closed;

    TrackedRun(ExecutionTracker tracker, ExecutionRecord record) {
        this.tracker = tracker;
        this.record = record;
    }

    public void completed() {
        outcome = ExecutionStatus.COMPLETED;
        errorMessage = null;
    }

    public void failed(Throwable error) {
        outcome = ExecutionStatus.FAILED;
        errorMessage = "Script execution failed: " + describe(error);
    }

    public ExecutionRecord record() {
        return record;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (outcome == null) {
            outcome = ExecutionStatus.FAILED;
            errorMessage = "Script execution ended without an outcome";
        }
        record = tracker.endRun(record, outcome, errorMessage);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
