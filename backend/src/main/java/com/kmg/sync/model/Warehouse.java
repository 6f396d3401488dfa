package com.kmg.sync.model;

public record Warehouse(
        long id,
        String name,
        String description
) {
}
