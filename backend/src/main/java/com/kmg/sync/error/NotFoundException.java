package com.kmg.sync.error;

public class NotFoundException extends SyncException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
