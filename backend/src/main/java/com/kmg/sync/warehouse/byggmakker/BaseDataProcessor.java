package com.kmg.sync.warehouse.byggmakker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.sync.batch.BatchProcessor;
import com.kmg.sync.batch.BatchRunStats;
import com.kmg.sync.store.StoreConnectionManager;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.*;

/**
 * Copies Byggmakker base product data into the product catalog: products, EAN and NOBB codes, images.
 */
public class BaseDataProcessor extends BatchProcessor<Map<String, Object>> {
    static final String FETCH_SQL = """
            SELECT b.name, b.ean, b.product_id, b.images,
                   COALESCE(s.sales_unit, e.sales_unit) AS sales_unit,
                   COALESCE(s.comparison_price_unit, e.comparison_price_unit) AS comparison_price_unit
            FROM byggmakker_base_data b
            LEFT JOIN byggmakker_retailer_store_unit s ON b.ean = s.ean
            LEFT JOIN byggmakker_retailer_ecom_unit e ON b.ean = e.ean
            WHERE b.ean IS NOT NULL
            """;

    private final ObjectMapper objectMapper;
    private int createdCount;
    private int updatedCount;

    record ProductData(String ean, String name, String unit, String priceUnit, String nobb, List<String> images) {
    }

    public BaseDataProcessor(StoreConnectionManager stores, ObjectMapper objectMapper, int batchSize) {
        super(stores, batchSize);
        this.objectMapper = objectMapper;
    }

    @Override
    protected List<Map<String, Object>> fetchCandidates() {
        return stores.query(Byggmakker.RAW_DATA, FETCH_SQL);
    }

    @Override
    protected void processOne(Map<String, Object> raw) {
        Optional<String> ean = RawRecords.validEan(raw.get("ean"), log);
        if (ean.isEmpty()) {
            return;
        }
        ProductData product = new ProductData(
                ean.get(),
                RawRecords.text(raw, "name"),
                RawRecords.text(raw, "sales_unit"),
                RawRecords.text(raw, "comparison_price_unit"),
                RawRecords.text(raw, "product_id"),
                parseImages(raw.get("images"))
        );
        if (product.name().isEmpty() || product.unit().isEmpty() || product.priceUnit().isEmpty()) {
            log.warn("Skipping product with EAN {}: Missing required data", product.ean());
            return;
        }

        stores.withTransaction(Byggmakker.SVENN_PRODUCTS, jdbc -> {
            Optional<Long> productId = RawRecords.productIdByEan(jdbc, product.ean());
            if (productId.isPresent()) {
                update(jdbc, product, productId.get());
            } else {
                insert(jdbc, product);
            }
            return null;
        });
    }

    @Override
    protected String describe(Map<String, Object> raw) {
        return "EAN " + raw.get("ean");
    }

    @Override
    protected void logSummary(BatchRunStats stats) {
        super.logSummary(stats);
        log.info("Products created: {}, updated: {}", createdCount, updatedCount);
    }

    public int createdCount() {
        return createdCount;
    }

    public int updatedCount() {
        return updatedCount;
    }

    List<String> parseImages(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return List.of();
        }
        try {
            List<String> images = objectMapper.readValue(text, new TypeReference<List<String>>() {
            });
            return images == null ? List.of() : images;
        } catch (Exception e) {
            log.warn("Unreadable image list skipped: {}", e.getMessage());
            return List.of();
        }
    }

    private void update(JdbcTemplate jdbc, ProductData product, long productId) {
        jdbc.update("""
                UPDATE products
                SET base_name = ?, base_unit = ?, base_price_unit = ?, updated = CURRENT_TIMESTAMP
                WHERE product_id = ?
                """, product.name(), product.unit(), product.priceUnit(), productId);
        updatedCount++;
        log.info("Updated product: {}", product.ean());
    }

    private void insert(JdbcTemplate jdbc, ProductData product) {
        long productId = GeneratedKeys.insert(jdbc,
                "INSERT INTO products (base_name, base_unit, base_price_unit) VALUES (?, ?, ?)",
                product.name(), product.unit(), product.priceUnit());
        jdbc.update("INSERT INTO ean_codes (ean_code, product_id) VALUES (?, ?)", product.ean(), productId);
        if (!product.nobb().isEmpty()) {
            jdbc.update("INSERT INTO nobb_codes (nobb_code, product_id) VALUES (?, ?)", product.nobb(), productId);
        }
        for (String imageUrl : product.images()) {
            jdbc.update("INSERT INTO product_images (product_id, image_url) VALUES (?, ?)", productId, imageUrl);
        }
        createdCount++;
        log.info("Inserted new product: {}", product.ean());
    }
}
