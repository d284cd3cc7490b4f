package com.cache.infra.cluster;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CacheEngine {
    REDIS("redis", 6379),
    MEMCACHED("memcached", 11211);

    private final String value;
    private final int defaultPort;

    CacheEngine(String value, int defaultPort) {
        this.value = value;
        this.defaultPort = defaultPort;
    }

    // Engine name as CloudFormation expects it, also the cdk.json value
    @JsonValue
    public String getValue() {
        return value;
    }

    public int getDefaultPort() {
        return defaultPort;
    }
}
