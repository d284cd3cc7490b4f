package com.cache.infra.exception;

import jakarta.annotation.Nullable;

// Unchecked: raised while the construct tree is being built, nothing can recover mid-synth
public class CacheClusterException extends RuntimeException {
    private final CacheClusterError error;
    @Nullable
    private final String id;

    public CacheClusterException(CacheClusterError error, @Nullable String id) {
        this(error, id, null);
    }

    public CacheClusterException(CacheClusterError error, @Nullable String id, @Nullable Throwable cause) {
        super(id == null ? error.getMessage() : error.getMessage() + ": " + id, cause);
        this.error = error;
        this.id = id;
    }

    public CacheClusterError getError() {
        return error;
    }

    @Nullable
    public String getId() {
        return id;
    }
}
