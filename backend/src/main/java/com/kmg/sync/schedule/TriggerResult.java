package com.kmg.sync.schedule;

/**
 * Outcome of an operation on a live trigger.
 */
public enum TriggerResult {
    /** The trigger existed and was changed. */
    UPDATED,
    /** The trigger was absent, which already satisfies the request (remove, pause). */
    ABSENT_HARMLESS,
    /** The trigger was absent and the request needs it (resume, reschedule); the caller must recreate it. */
    ABSENT_MUST_RECREATE
}
