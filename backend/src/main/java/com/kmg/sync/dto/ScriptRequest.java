package com.kmg.sync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ScriptRequest(
        @NotBlank @Size(max = 64) String name,
        @NotBlank @Size(max = 128) String locator,
        @Size(max = 256) String description
) {
}
