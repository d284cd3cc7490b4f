package com.cache.infra.cluster;

import jakarta.annotation.Nullable;

public record ReadReplicaOptions(
    @Nullable Integer numCacheNodes,
    @Nullable String region
) {
}
