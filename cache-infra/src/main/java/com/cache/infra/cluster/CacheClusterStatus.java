package com.cache.infra.cluster;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle states ElastiCache reports for a cache cluster.
 */
public enum CacheClusterStatus {
    AVAILABLE("available"),
    CREATING("creating"),
    DELETED("deleted"),
    DELETING("deleting"),
    INCOMPATIBLE_NETWORK("incompatible-network"),
    MODIFYING("modifying"),
    REBOOTING_CLUSTER_NODES("rebooting-cluster-nodes"),
    RESTORE_FAILED("restore-failed"),
    SNAPSHOTTING("snapshotting");

    private final String value;

    CacheClusterStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<CacheClusterStatus> fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equals(value))
            .findFirst();
    }

    /**
     * Status of a deployed cluster. Empty while the attribute is still a token.
     */
    public static Optional<CacheClusterStatus> of(ResolvableAttribute attribute) {
        if (attribute instanceof ResolvableAttribute.Resolved resolved) {
            return fromValue(resolved.value());
        }
        return Optional.empty();
    }
}
