package com.kmg.sync.unit;

/**
 * One warehouse data transfer. Everything it needs is wired at construction, so the entry point takes no arguments.
 */
@FunctionalInterface
public interface ProcessingUnit {
    void run();
}
