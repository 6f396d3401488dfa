package com.kmg.sync.unit;

import com.kmg.sync.error.ValidationException;

public record UnitLocator(String group, String name) {
    public UnitLocator {
        if (group == null || group.isBlank() || name == null || name.isBlank()) {
            throw new ValidationException("Unit locator needs a group and a name");
        }
        if (group.contains("/") || name.contains("/")) {
            throw new ValidationException("Unit locator segments must not contain '/': " + group + "/" + name);
        }
    }

    public static UnitLocator parse(String value) {
        if (value == null) {
            throw new ValidationException("Unit locator is required");
        }
        String[] parts = value.trim().split("/", -1);
        if (parts.length != 2) {
            throw new ValidationException("Invalid unit locator format: " + value + " (expected group/unit-name)");
        }
        return new UnitLocator(parts[0].trim(), parts[1].trim());
    }

    @Override
    public String toString() {
        return group + "/" + name;
    }
}
