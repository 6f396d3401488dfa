package com.kmg.sync.unit;

import com.kmg.sync.store.StoreConnectionManager;

import java.util.Set;

/**
 * Registry entry binding a locator to the constructor of its processing unit. Implementations are Spring beans and
 * are collected by {@link ProcessingUnitResolver} at startup.
 */
public interface ProcessingUnitDefinition {
    UnitLocator locator();

    Set<String> requiredStores();

    ProcessingUnit create(StoreConnectionManager stores);

    default String description() {
        return locator().toString();
    }
}
