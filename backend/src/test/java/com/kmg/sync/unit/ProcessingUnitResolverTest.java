package com.kmg.sync.unit;

import com.kmg.sync.config.SyncProperties;
import com.kmg.sync.error.ConfigurationException;
import com.kmg.sync.error.ResolutionException;
import com.kmg.sync.error.UnitNotFoundException;
import com.kmg.sync.store.StoreConnectionManagerFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingUnitResolverTest {
    @TempDir
    Path tempDir;

    private ProcessingUnitResolver resolver(ProcessingUnitDefinition... definitions) {
        SyncProperties properties = new SyncProperties();
        properties.setBaseDir(tempDir.toString());
        properties.getStores().put("raw_data", new SyncProperties.Store("jdbc:sqlite:" + tempDir.resolve("raw.db"), null, null));
        return new ProcessingUnitResolver(List.of(definitions), new StoreConnectionManagerFactory(properties));
    }

    @Test
    void resolve_runsFreshInstanceEachTime() {
        AtomicInteger created = new AtomicInteger();
        AtomicInteger runs = new AtomicInteger();
        ProcessingUnitResolver resolver = resolver(new SimpleUnitDefinition(
                UnitLocator.parse("byggmakker/store_data"), Set.of("raw_data"), "stores", stores -> {
                    created.incrementAndGet();
                    return runs::incrementAndGet;
                }));

        try (ResolvedUnit unit = resolver.resolve("byggmakker", "store_data")) {
            unit.run();
        }
        try (ResolvedUnit unit = resolver.resolve(UnitLocator.parse("byggmakker/store_data"))) {
            unit.run();
        }

        assertEquals(2, created.get());
        assertEquals(2, runs.get());
    }

    @Test
    void unknownLocator_notFound() {
        ProcessingUnitResolver resolver = resolver();
        UnitNotFoundException e = assertThrows(UnitNotFoundException.class,
                () -> resolver.resolve("byggmakker", "nope"));
        assertTrue(e.getMessage().contains("byggmakker/nope"));
        assertFalse(resolver.exists(UnitLocator.parse("byggmakker/nope")));
    }

    @Test
    void missingStoreConfig_isConfigurationError() {
        ProcessingUnitResolver resolver = resolver(new SimpleUnitDefinition(
                UnitLocator.parse("byggmakker/prices"), Set.of("svenn_products"), "prices", stores -> () -> {
                }));

        assertThrows(ConfigurationException.class, () -> resolver.resolve("byggmakker", "prices"));
    }

    @Test
    void constructionFailure_wrapped() {
        ProcessingUnitResolver resolver = resolver(new SimpleUnitDefinition(
                UnitLocator.parse("byggmakker/prices"), Set.of(), "prices", stores -> {
                    throw new IllegalStateException("bad wiring");
                }));

        ResolutionException e = assertThrows(ResolutionException.class, () -> resolver.resolve("byggmakker", "prices"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void duplicateLocator_rejected() {
        AtomicInteger runs = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> resolver(
                RecordingUnits.counting("byggmakker/all", runs),
                RecordingUnits.counting("byggmakker/all", runs)));
    }

    @Test
    void locators_sorted() {
        AtomicInteger runs = new AtomicInteger();
        ProcessingUnitResolver resolver = resolver(
                RecordingUnits.counting("byggmakker/prices", runs),
                RecordingUnits.counting("byggmakker/base_data", runs));

        assertEquals(List.of(UnitLocator.parse("byggmakker/base_data"), UnitLocator.parse("byggmakker/prices")),
                resolver.locators());
    }
}
