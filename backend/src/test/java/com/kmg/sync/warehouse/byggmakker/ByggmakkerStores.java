package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.config.SyncProperties;
import com.kmg.sync.store.StoreConnectionManager;

import java.nio.file.Path;
import java.util.Map;

/**
 * SQLite stand-ins for the raw and catalog stores.
 */
final class ByggmakkerStores {
    private ByggmakkerStores() {
    }

    static StoreConnectionManager open(Path dir) {
        StoreConnectionManager stores = new StoreConnectionManager(Map.of(
                Byggmakker.RAW_DATA, new SyncProperties.Store("jdbc:sqlite:" + dir.resolve("raw.db"), null, null),
                Byggmakker.SVENN_PRODUCTS, new SyncProperties.Store("jdbc:sqlite:" + dir.resolve("svenn.db"), null, null)
        ), Byggmakker.STORES);

        stores.withCursor(Byggmakker.RAW_DATA, jdbc -> {
            jdbc.execute("CREATE TABLE byggmakker_store_ids (store_id TEXT, store_name TEXT)");
            jdbc.execute("CREATE TABLE byggmakker_store_prices (ean TEXT, store_id TEXT, price NUMERIC, comparison_price NUMERIC)");
            jdbc.execute("""
                    CREATE TABLE byggmakker_base_data (
                      name TEXT, ean TEXT, product_id TEXT, images TEXT, brand TEXT, category TEXT)
                    """);
            jdbc.execute("CREATE TABLE byggmakker_retailer_store_unit (ean TEXT, sales_unit TEXT, comparison_price_unit TEXT)");
            jdbc.execute("CREATE TABLE byggmakker_retailer_ecom_unit (ean TEXT, sales_unit TEXT, comparison_price_unit TEXT)");
            return null;
        });
        stores.withCursor(Byggmakker.SVENN_PRODUCTS, jdbc -> {
            jdbc.execute("""
                    CREATE TABLE products (
                      product_id INTEGER PRIMARY KEY AUTOINCREMENT,
                      base_name TEXT, base_unit TEXT, base_price_unit TEXT, updated TEXT)
                    """);
            jdbc.execute("CREATE TABLE ean_codes (ean_code TEXT PRIMARY KEY, product_id INTEGER NOT NULL)");
            jdbc.execute("CREATE TABLE nobb_codes (nobb_code TEXT, product_id INTEGER NOT NULL)");
            jdbc.execute("CREATE TABLE product_images (product_id INTEGER NOT NULL, image_url TEXT)");
            jdbc.execute("CREATE TABLE stores (store_id TEXT PRIMARY KEY, retailer_id INTEGER, store_name TEXT)");
            jdbc.execute("""
                    CREATE TABLE store_prices (
                      store_id TEXT, product_id INTEGER, price NUMERIC, comparison_price NUMERIC,
                      created TEXT, updated TEXT, PRIMARY KEY (store_id, product_id))
                    """);
            jdbc.execute("CREATE TABLE categories (category_id INTEGER PRIMARY KEY AUTOINCREMENT, category_name TEXT UNIQUE)");
            jdbc.execute("""
                    CREATE TABLE retailers_products (
                      product_id INTEGER, retailer_id INTEGER, variant_name TEXT, brand TEXT, category_id INTEGER,
                      retail_unit TEXT, retail_price_comparison_unit TEXT, url_product TEXT, updated TEXT)
                    """);
            return null;
        });
        return stores;
    }

    static void raw(StoreConnectionManager stores, String sql, Object... args) {
        stores.withCursor(Byggmakker.RAW_DATA, jdbc -> jdbc.update(sql, args));
    }

    static void catalog(StoreConnectionManager stores, String sql, Object... args) {
        stores.withCursor(Byggmakker.SVENN_PRODUCTS, jdbc -> jdbc.update(sql, args));
    }

    static <T> T catalogValue(StoreConnectionManager stores, String sql, Class<T> type, Object... args) {
        return stores.withCursor(Byggmakker.SVENN_PRODUCTS, jdbc -> jdbc.queryForObject(sql, type, args));
    }
}
