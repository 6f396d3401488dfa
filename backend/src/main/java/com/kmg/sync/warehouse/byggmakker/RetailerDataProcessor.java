package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.batch.BatchProcessor;
import com.kmg.sync.batch.BatchRunStats;
import com.kmg.sync.store.StoreConnectionManager;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maintains the Byggmakker listing of each known product: category, brand, retail units and product page URL.
 * Products not yet in the catalog are skipped; base data has to run first.
 */
public class RetailerDataProcessor extends BatchProcessor<Map<String, Object>> {
    static final String BASE_URL = "https://www.byggmakker.no/produkt/";
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]+");

    static final String FETCH_SQL = """
            SELECT b.name, b.ean, b.brand, b.category,
                   COALESCE(s.sales_unit, e.sales_unit) AS sales_unit,
                   COALESCE(s.comparison_price_unit, e.comparison_price_unit) AS comparison_price_unit
            FROM byggmakker_base_data b
            LEFT JOIN byggmakker_retailer_store_unit s ON b.ean = s.ean
            LEFT JOIN byggmakker_retailer_ecom_unit e ON b.ean = e.ean
            WHERE b.ean IS NOT NULL
            """;

    private int createdCount;
    private int updatedCount;

    public RetailerDataProcessor(StoreConnectionManager stores, int batchSize) {
        super(stores, batchSize);
    }

    static String productUrl(String productName, String ean) {
        String slug = NON_ALPHANUMERIC.matcher(productName.strip()).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return BASE_URL + slug.substring(start, end) + "/" + ean;
    }

    @Override
    protected List<Map<String, Object>> fetchCandidates() {
        return stores.query(Byggmakker.RAW_DATA, FETCH_SQL);
    }

    @Override
    protected void processOne(Map<String, Object> raw) {
        Optional<String> validated = RawRecords.validEan(raw.get("ean"), log);
        if (validated.isEmpty()) {
            return;
        }
        String ean = validated.get();
        String name = RawRecords.text(raw, "name");
        String category = RawRecords.text(raw, "category");
        if (name.isEmpty() || category.isEmpty()) {
            log.warn("Skipping product with EAN {}: Missing required data", ean);
            return;
        }
        String brand = RawRecords.text(raw, "brand");
        Object salesUnit = raw.get("sales_unit");
        Object comparisonUnit = raw.get("comparison_price_unit");

        stores.withTransaction(Byggmakker.SVENN_PRODUCTS, jdbc -> {
            Optional<Long> productId = RawRecords.productIdByEan(jdbc, ean);
            if (productId.isEmpty()) {
                log.warn("No product_id found for EAN: {}", ean);
                return null;
            }
            long categoryId = categoryId(jdbc, category);
            String url = productUrl(name, ean);

            Integer existing = jdbc.queryForObject("""
                    SELECT COUNT(*) FROM retailers_products WHERE product_id = ? AND retailer_id = ?
                    """, Integer.class, productId.get(), Byggmakker.RETAILER_ID);
            if (existing != null && existing > 0) {
                jdbc.update("""
                        UPDATE retailers_products
                        SET variant_name = ?, brand = ?, category_id = ?,
                            retail_unit = ?, retail_price_comparison_unit = ?,
                            url_product = ?, updated = CURRENT_TIMESTAMP
                        WHERE product_id = ? AND retailer_id = ?
                        """, name, brand, categoryId, salesUnit, comparisonUnit, url,
                        productId.get(), Byggmakker.RETAILER_ID);
                updatedCount++;
                log.info("Updated retailer product: {}", ean);
            } else {
                jdbc.update("""
                        INSERT INTO retailers_products
                            (product_id, retailer_id, variant_name, brand, category_id,
                             retail_unit, retail_price_comparison_unit, url_product)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """, productId.get(), Byggmakker.RETAILER_ID, name, brand, categoryId,
                        salesUnit, comparisonUnit, url);
                createdCount++;
                log.info("Inserted new retailer product: {}", ean);
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
        log.info("Retailer products created: {}, updated: {}", createdCount, updatedCount);
    }

    private long categoryId(JdbcTemplate jdbc, String categoryName) {
        List<Long> ids = jdbc.queryForList(
                "SELECT category_id FROM categories WHERE category_name = ?", Long.class, categoryName);
        if (!ids.isEmpty()) {
            return ids.get(0);
        }
        return GeneratedKeys.insert(jdbc, "INSERT INTO categories (category_name) VALUES (?)", categoryName);
    }
}
