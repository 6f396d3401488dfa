package com.kmg.sync.model;

import java.time.OffsetDateTime;

/**
 * Persisted schedule of one script. {@code triggerId} names the live cron trigger and never changes for the
 * lifetime of the row; {@code unitLocator} is read through the script.
 */
public record JobDefinition(
        long id,
        String triggerId,
        long scriptId,
        String unitLocator,
        String cronExpression,
        boolean enabled,
        OffsetDateTime createdAt
) {
    public JobDefinition withCronExpression(String value) {
        return new JobDefinition(id, triggerId, scriptId, unitLocator, value, enabled, createdAt);
    }
}
