package com.kmg.sync.error;

public class RecordProcessingException extends SyncException {
    public RecordProcessingException(String message) {
        super(message);
    }

    public RecordProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
