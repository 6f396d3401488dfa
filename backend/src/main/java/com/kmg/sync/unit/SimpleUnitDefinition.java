package com.kmg.sync.unit;

import com.kmg.sync.store.StoreConnectionManager;

import java.util.Set;
import java.util.function.Function;

/**
 * Definition backed by a plain factory function, for units that need nothing beyond their stores.
 */
public record SimpleUnitDefinition(
        UnitLocator locator,
        Set<String> requiredStores,
        String description,
        Function<StoreConnectionManager, ProcessingUnit> factory
) implements ProcessingUnitDefinition {
    public SimpleUnitDefinition {
        requiredStores = Set.copyOf(requiredStores);
    }

    @Override
    public ProcessingUnit create(StoreConnectionManager stores) {
        return factory.apply(stores);
    }
}
