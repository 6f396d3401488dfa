package com.kmg.sync.unit;

import com.kmg.sync.store.StoreConnectionManager;

/**
 * A unit ready to run together with the connections it owns. Closing releases every store connection.
 */
public final class ResolvedUnit implements ProcessingUnit, AutoCloseable {
    private final UnitLocator locator;
    private final ProcessingUnit unit;
    private final StoreConnectionManager stores;

    ResolvedUnit(UnitLocator locator, ProcessingUnit unit, StoreConnectionManager stores) {
        this.locator = locator;
        this.unit = unit;
        this.stores = stores;
    }

    public UnitLocator locator() {
        return locator;
    }

    @Override
    public void run() {
        unit.run();
    }

    @Override
    public void close() {
        stores.close();
    }
}
