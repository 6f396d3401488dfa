package com.kmg.sync.unit;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Store-less unit definitions for engine tests.
 */
public final class RecordingUnits {
    private RecordingUnits() {
    }

    public static SimpleUnitDefinition counting(String locator, AtomicInteger runs) {
        return new SimpleUnitDefinition(UnitLocator.parse(locator), Set.of(), "counting", stores -> runs::incrementAndGet);
    }

    public static SimpleUnitDefinition failing(String locator, RuntimeException error) {
        return new SimpleUnitDefinition(UnitLocator.parse(locator), Set.of(), "failing", stores -> () -> {
            throw error;
        });
    }
}
