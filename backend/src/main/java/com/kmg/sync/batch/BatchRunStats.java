package com.kmg.sync.batch;

import java.time.Duration;
import java.time.Instant;

public class BatchRunStats {
    private final Instant startedAt;
    private int totalCount;
    private int processedCount;
    private int errorCount;

    public BatchRunStats(Instant startedAt) {
        this.startedAt = startedAt;
    }

    void setTotalCount(int totalCount) {
        this.totalCount = totalCount;
    }

    void recordProcessed() {
        processedCount++;
    }

    void recordError() {
        errorCount++;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public int totalCount() {
        return totalCount;
    }

    public int processedCount() {
        return processedCount;
    }

    public int errorCount() {
        return errorCount;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }

    @Override
    public String toString() {
        return String.format("BatchRunStats{total=%d, processed=%d, errors=%d}", totalCount, processedCount, errorCount);
    }
}
