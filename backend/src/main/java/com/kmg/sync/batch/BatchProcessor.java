package com.kmg.sync.batch;

import com.kmg.sync.error.RunFailedException;
import com.kmg.sync.store.StoreConnectionManager;
import com.kmg.sync.unit.ProcessingUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

/**
 * Skeleton of a processing unit that fetches its candidate records once and handles them in fixed-size chunks.
 *
 * <p>A failure of a single record is counted and logged, and the chunk carries on. A failure that escapes the
 * chunk itself (see {@link #isSystemic}) aborts the whole run.</p>
 *
 * @param <T> candidate record type
 */
public abstract class BatchProcessor<T> implements ProcessingUnit {
    public static final int DEFAULT_BATCH_SIZE = 100;

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final StoreConnectionManager stores;
    private final int batchSize;

    protected BatchProcessor(StoreConnectionManager stores) {
        this(stores, DEFAULT_BATCH_SIZE);
    }

    protected BatchProcessor(StoreConnectionManager stores, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.stores = stores;
        this.batchSize = batchSize;
    }

    protected abstract List<T> fetchCandidates();

    protected abstract void processOne(T record);

    @Override
    public void run() {
        runAll();
    }

    public BatchRunStats runAll() {
        BatchRunStats stats = new BatchRunStats(Instant.now());
        String name = getClass().getSimpleName();
        log.info("Starting {} processing", name);

        List<T> candidates = fetchCandidates();
        if (candidates == null || candidates.isEmpty()) {
            log.warn("No data found to process");
            return stats;
        }
        stats.setTotalCount(candidates.size());

        int totalBatches = (candidates.size() + batchSize - 1) / batchSize;
        log.info("Found {} records to process in {} batches", candidates.size(), totalBatches);

        for (int start = 0; start < candidates.size(); start += batchSize) {
            int currentBatch = start / batchSize + 1;
            List<T> chunk = candidates.subList(start, Math.min(start + batchSize, candidates.size()));
            log.info("Processing batch {}/{}", currentBatch, totalBatches);
            try {
                processChunk(chunk, stats);
            } catch (RuntimeException | Error e) {
                log.error("Error processing batch {}/{} of {}: {}", currentBatch, totalBatches, name, e.getMessage());
                throw new RunFailedException("Batch " + currentBatch + " of " + name + " failed: " + e.getMessage(), e);
            }
        }

        logSummary(stats);
        return stats;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Whether a record failure is really a failure of the run, such as a lost store connection. Such exceptions are
     * not counted against the record; they escape the chunk.
     */
    protected boolean isSystemic(RuntimeException e) {
        return e instanceof DataAccessResourceFailureException;
    }

    protected void logSummary(BatchRunStats stats) {
        log.info("Processing summary for {}: processed={}, errors={}, elapsed={}s",
                getClass().getSimpleName(),
                stats.processedCount(),
                stats.errorCount(),
                String.format("%.2f", stats.elapsed().toMillis() / 1000.0));
    }

    private void processChunk(List<T> chunk, BatchRunStats stats) {
        for (T record : chunk) {
            try {
                processOne(record);
            } catch (RuntimeException e) {
                if (isSystemic(e)) {
                    throw e;
                }
                stats.recordError();
                log.error("Error processing record {}: {}", describe(record), e.getMessage());
                continue;
            }
            stats.recordProcessed();
        }
    }

    protected String describe(T record) {
        return String.valueOf(record);
    }
}
