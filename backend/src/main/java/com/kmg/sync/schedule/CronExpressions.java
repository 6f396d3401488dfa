package com.kmg.sync.schedule;

import com.kmg.sync.error.ValidationException;
import org.springframework.scheduling.support.CronExpression;

/**
 * Five-field cron expressions ({@code minute hour day month day_of_week}). They are evaluated by Spring's
 * {@link CronExpression} with the seconds field pinned to zero.
 */
public final class CronExpressions {
    public static final int FIELD_COUNT = 5;

    private CronExpressions() {
    }

    public static CronExpression parse(String expression) {
        return CronExpression.parse(toSpringExpression(expression));
    }

    public static String normalize(String expression) {
        return String.join(" ", fields(expression));
    }

    static String toSpringExpression(String expression) {
        String normalized = normalize(expression);
        String spring = "0 " + normalized;
        try {
            CronExpression.parse(spring);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + normalized + "': " + e.getMessage(), e);
        }
        return spring;
    }

    private static String[] fields(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron expression is required");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw new ValidationException(
                    "Invalid cron expression. Expected format: 'minute hour day month day_of_week'");
        }
        return parts;
    }
}
