package com.kmg.sync.model;

import java.time.OffsetDateTime;

public record ExecutionRecord(
        long id,
        long jobId,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        ExecutionStatus status,
        String errorMessage
) {
}
