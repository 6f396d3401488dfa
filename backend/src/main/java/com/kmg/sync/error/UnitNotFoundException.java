package com.kmg.sync.error;

/**
 * The addressed processing unit is not registered. Never retried; the schedule itself is left untouched.
 */
public class UnitNotFoundException extends ResolutionException {
    public UnitNotFoundException(String locator) {
        super("Processing unit not found: " + locator);
    }
}
