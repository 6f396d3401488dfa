package com.kmg.sync.dto;

import jakarta.validation.constraints.Size;

public record WarehouseUpdateRequest(
        @Size(min = 1, max = 64) String name,
        @Size(max = 256) String description
) {
}
