package com.kmg.sync.service;

public enum RunEvent {
    STARTED("run-started"),
    COMPLETED("run-completed"),
    FAILED("run-failed");

    private final String eventName;

    RunEvent(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
