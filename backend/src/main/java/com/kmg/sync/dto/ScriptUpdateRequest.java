package com.kmg.sync.dto;

import jakarta.validation.constraints.Size;

public record ScriptUpdateRequest(
        @Size(min = 1, max = 64) String name,
        @Size(min = 1, max = 128) String locator,
        @Size(max = 256) String description
) {
}
