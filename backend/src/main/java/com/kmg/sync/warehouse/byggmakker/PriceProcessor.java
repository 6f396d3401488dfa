package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.batch.BatchProcessor;
import com.kmg.sync.batch.BatchRunStats;
import com.kmg.sync.error.RecordProcessingException;
import com.kmg.sync.store.StoreConnectionManager;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upserts store prices keyed by (store, product). A record with an unusable price or an unknown EAN counts as an
 * error of that record.
 */
public class PriceProcessor extends BatchProcessor<Map<String, Object>> {
    private int upsertedCount;

    public PriceProcessor(StoreConnectionManager stores, int batchSize) {
        super(stores, batchSize);
    }

    /**
     * Parses a price; empty for missing, unparseable or negative values.
     */
    Optional<BigDecimal> validPrice(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            BigDecimal price = raw instanceof BigDecimal decimal ? decimal : new BigDecimal(raw.toString().trim());
            if (price.signum() < 0) {
                log.warn("Negative price value: {}", raw);
                return Optional.empty();
            }
            return Optional.of(price);
        } catch (NumberFormatException e) {
            log.warn("Invalid price value: {}", raw);
            return Optional.empty();
        }
    }

    @Override
    protected List<Map<String, Object>> fetchCandidates() {
        return stores.query(Byggmakker.RAW_DATA, """
                SELECT ean, store_id, price, comparison_price
                FROM byggmakker_store_prices
                WHERE ean IS NOT NULL AND store_id IS NOT NULL AND price IS NOT NULL
                """);
    }

    @Override
    protected void processOne(Map<String, Object> raw) {
        String ean = RawRecords.text(raw, "ean");
        String storeId = RawRecords.text(raw, "store_id");
        BigDecimal price = validPrice(raw.get("price"))
                .filter(value -> value.signum() > 0)
                .orElseThrow(() -> new RecordProcessingException("Invalid price for EAN " + ean + ": " + raw.get("price")));
        BigDecimal comparisonPrice = validPrice(raw.get("comparison_price")).orElse(null);

        stores.withTransaction(Byggmakker.SVENN_PRODUCTS, jdbc -> {
            long productId = RawRecords.productIdByEan(jdbc, ean)
                    .orElseThrow(() -> new RecordProcessingException("No product_id found for EAN: " + ean));
            int updated = jdbc.update("""
                    UPDATE store_prices
                    SET price = ?, comparison_price = ?, updated = CURRENT_TIMESTAMP
                    WHERE store_id = ? AND product_id = ?
                    """, price, comparisonPrice, storeId, productId);
            if (updated == 0) {
                jdbc.update("""
                        INSERT INTO store_prices (store_id, product_id, price, comparison_price, created, updated)
                        VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                        """, storeId, productId, price, comparisonPrice);
            }
            upsertedCount++;
            log.debug("Processed price for EAN {} in store {}", ean, storeId);
            return null;
        });
    }

    @Override
    protected String describe(Map<String, Object> raw) {
        return "price of EAN " + raw.get("ean") + " in store " + raw.get("store_id");
    }

    @Override
    protected void logSummary(BatchRunStats stats) {
        super.logSummary(stats);
        log.info("Store prices upserted: {}", upsertedCount);
    }

    public int upsertedCount() {
        return upsertedCount;
    }
}
