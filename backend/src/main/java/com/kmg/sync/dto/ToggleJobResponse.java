package com.kmg.sync.dto;

public record ToggleJobResponse(
        String message,
        boolean enabled
) {
}
