package com.kmg.sync.error;

public class RunFailedException extends SyncException {
    public RunFailedException(String message) {
        super(message);
    }

    public RunFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
