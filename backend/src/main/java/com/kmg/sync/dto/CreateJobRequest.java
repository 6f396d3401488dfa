package com.kmg.sync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateJobRequest(
        @NotNull Long scriptId,
        @NotBlank String cronExpression
) {
}
