package com.kmg.sync.model;

public record ScriptRecord(
        long id,
        String name,
        String locator,
        long warehouseId,
        String description
) {
}
