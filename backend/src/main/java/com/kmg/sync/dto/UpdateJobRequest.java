package com.kmg.sync.dto;

public record UpdateJobRequest(
        String cronExpression
) {
}
