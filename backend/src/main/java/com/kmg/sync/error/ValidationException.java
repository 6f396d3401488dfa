package com.kmg.sync.error;

public class ValidationException extends SyncException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
