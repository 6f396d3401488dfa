package com.kmg.sync.dto;

public record ErrorResponse(
        String error
) {
}
