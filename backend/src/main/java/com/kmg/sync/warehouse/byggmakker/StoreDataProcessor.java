package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.batch.BatchProcessor;
import com.kmg.sync.batch.BatchRunStats;
import com.kmg.sync.store.StoreConnectionManager;

import java.util.List;
import java.util.Map;

public class StoreDataProcessor extends BatchProcessor<Map<String, Object>> {
    private int insertedCount;
    private int updatedCount;
    private int skippedCount;

    public StoreDataProcessor(StoreConnectionManager stores, int batchSize) {
        super(stores, batchSize);
    }

    @Override
    protected List<Map<String, Object>> fetchCandidates() {
        return stores.query(Byggmakker.RAW_DATA,
                "SELECT store_id, store_name FROM byggmakker_store_ids ORDER BY store_id");
    }

    @Override
    protected void processOne(Map<String, Object> raw) {
        String storeId = RawRecords.text(raw, "store_id");
        String storeName = RawRecords.text(raw, "store_name");
        if (storeId.isEmpty() || storeName.isEmpty()) {
            log.warn("Skipping store: Missing required data");
            return;
        }

        stores.withTransaction(Byggmakker.SVENN_PRODUCTS, jdbc -> {
            List<String> existing = jdbc.queryForList(
                    "SELECT store_name FROM stores WHERE store_id = ?", String.class, storeId);
            if (existing.isEmpty()) {
                jdbc.update("INSERT INTO stores (store_id, retailer_id, store_name) VALUES (?, ?, ?)",
                        storeId, Byggmakker.RETAILER_ID, storeName);
                insertedCount++;
                log.info("Inserted new store: {} (ID: {})", storeName, storeId);
            } else if (!storeName.equals(existing.get(0))) {
                jdbc.update("UPDATE stores SET store_name = ? WHERE store_id = ?", storeName, storeId);
                updatedCount++;
                log.info("Updated store: {} (ID: {})", storeName, storeId);
            } else {
                skippedCount++;
                log.debug("Skipped existing store: {} (ID: {})", storeName, storeId);
            }
            return null;
        });
    }

    @Override
    protected String describe(Map<String, Object> raw) {
        return "store " + raw.get("store_id");
    }

    @Override
    protected void logSummary(BatchRunStats stats) {
        super.logSummary(stats);
        log.info("Store processing details: inserted={}, updated={}, skipped (no changes)={}",
                insertedCount, updatedCount, skippedCount);
    }

    public int insertedCount() {
        return insertedCount;
    }

    public int updatedCount() {
        return updatedCount;
    }

    public int skippedCount() {
        return skippedCount;
    }
}
