package com.kmg.sync.error;

public class ResolutionException extends SyncException {
    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
