package com.cache.infra.cluster;

import java.util.LinkedHashMap;
import java.util.Map;

import software.amazon.awscdk.services.elasticache.CfnCacheCluster;
import software.amazon.awscdk.services.elasticache.CfnCacheClusterProps;
import software.constructs.Construct;

/**
 * Mutable property set of the cache cluster before the L1 resource exists.
 * Each write replaces the previous value of the same property.
 */
final class ClusterDraft {
    private final CfnCacheClusterProps.Builder props;
    // CloudFormation properties CfnCacheCluster has no typed field for
    private final Map<String, Object> overrides = new LinkedHashMap<>();

    ClusterDraft(CfnCacheClusterProps.Builder props) {
        this.props = props;
    }

    CfnCacheClusterProps.Builder props() {
        return props;
    }

    void override(String property, Object value) {
        overrides.put(property, value);
    }

    CfnCacheCluster create(Construct scope, String id) {
        var cluster = new CfnCacheCluster(scope, id, props.build());
        overrides.forEach((property, value) -> cluster.addPropertyOverride(property, value));
        return cluster;
    }
}
