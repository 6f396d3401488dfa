package com.kmg.sync.dto;

public record EventMessage(
        String type,
        long jobId,
        long executionId,
        String message,
        String timestamp
) {
}
