package com.kmg.sync.dto;

import com.kmg.sync.model.ExecutionStatus;

public record ExecutionView(
        long id,
        String startTime,
        String endTime,
        ExecutionStatus status,
        String errorMessage
) {
}
