package com.kmg.sync.dto;

public record JobView(
        long id,
        String triggerId,
        long scriptId,
        String unitLocator,
        String cronExpression,
        boolean enabled,
        String createdAt,
        boolean triggerRegistered,
        String nextFireTime
) {
}
