package com.cache.infra.exception;

public enum CacheClusterError {
    READ_REPLICA_UNSUPPORTED("Read replicas are not supported for a standalone cache cluster"),
    MISSING_SETTINGS("Cache settings not found in context"),
    INVALID_SETTINGS("Cache settings could not be read");

    private final String message;

    CacheClusterError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
