package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.batch.BatchRunStats;
import com.kmg.sync.store.StoreConnectionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;

import static com.kmg.sync.warehouse.byggmakker.ByggmakkerStores.*;
import static org.junit.jupiter.api.Assertions.*;

class PriceProcessorTest {
    @TempDir
    Path tempDir;

    private StoreConnectionManager stores;

    @BeforeEach
    void setUp() {
        stores = ByggmakkerStores.open(tempDir);
        catalog(stores, "INSERT INTO ean_codes (ean_code, product_id) VALUES ('7020000000011', 11)");
    }

    @AfterEach
    void tearDown() {
        stores.close();
    }

    @Test
    void invalidRecordsCountedAsErrors() {
        raw(stores, "INSERT INTO byggmakker_store_prices VALUES ('7020000000011', '100', 129.5, 25.9)");
        raw(stores, "INSERT INTO byggmakker_store_prices VALUES ('7020000000011', '200', 'abc', NULL)");
        raw(stores, "INSERT INTO byggmakker_store_prices VALUES ('7020000000011', '300', 0, NULL)");
        raw(stores, "INSERT INTO byggmakker_store_prices VALUES ('7029999999999', '100', 10, NULL)");

        PriceProcessor processor = new PriceProcessor(stores, 100);
        BatchRunStats stats = processor.runAll();

        assertEquals(4, stats.totalCount());
        assertEquals(1, stats.processedCount());
        assertEquals(3, stats.errorCount());
        assertEquals(1, processor.upsertedCount());
        assertEquals(129.5, catalogValue(stores,
                "SELECT price FROM store_prices WHERE store_id = '100' AND product_id = 11", Double.class));
    }

    @Test
    void secondRunUpdatesInPlace() {
        raw(stores, "INSERT INTO byggmakker_store_prices VALUES ('7020000000011', '100', 129.5, NULL)");
        new PriceProcessor(stores, 100).runAll();

        raw(stores, "UPDATE byggmakker_store_prices SET price = 99.0");
        new PriceProcessor(stores, 100).runAll();

        assertEquals(1, catalogValue(stores, "SELECT COUNT(*) FROM store_prices", Integer.class));
        assertEquals(99.0, catalogValue(stores, "SELECT price FROM store_prices", Double.class));
    }

    @Test
    void validPrice_rules() {
        PriceProcessor processor = new PriceProcessor(stores, 100);

        assertEquals(new BigDecimal("12.50"), processor.validPrice("12.50").orElseThrow());
        assertEquals(new BigDecimal("7"), processor.validPrice(7).orElseThrow());
        assertTrue(processor.validPrice(null).isEmpty());
        assertTrue(processor.validPrice("-1").isEmpty());
        assertTrue(processor.validPrice("twelve").isEmpty());
    }
}
