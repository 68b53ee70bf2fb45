package com.delta.adfeed.monitor.persistence;

public class ConfigPersistenceException extends RuntimeException {
    public ConfigPersistenceException(String message) {
        super(message);
    }

    public ConfigPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
