package com.kmg.sync.error;

public class ConfigurationException extends SyncException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
