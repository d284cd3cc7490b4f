package com.cache.infra;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import com.cache.infra.cluster.CacheEngine;
import com.cache.infra.config.CacheSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awscdk.App;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.assertions.Match;
import software.amazon.awscdk.assertions.Template;

class CacheStackTest {

    private static final String CACHE_CLUSTER = "AWS::ElastiCache::CacheCluster";

    private App app;
    private VpcStack vpcStack;

    @BeforeEach
    void setUp() {
        app = new App();
        vpcStack = new VpcStack(app, "CacheVpc", StackProps.builder().build(), new VpcStackProps(1));
    }

    private CacheStack cacheStack(CacheSettings settings) {
        return new CacheStack(app, "Cache", StackProps.builder().build(),
            new CacheStackProps(vpcStack.getVpc(), settings));
    }

    @Test
    void vpcHasPrivateWithEgressSubnetsForTheCache() {
        assertThat(vpcStack.getVpc().getPrivateSubnets()).hasSize(2);
        Template.fromStack(vpcStack).resourceCountIs("AWS::EC2::NatGateway", 1);
    }

    @Test
    void redisSettingsBecomeClusterProperties() {
        var stack = cacheStack(new CacheSettings(
            CacheEngine.REDIS,
            "cache.t3.micro",
            1,
            "orders-cache",
            "7.1",
            null,
            1,
            new CacheSettings.Encryption(true, true, null),
            new CacheSettings.Backups(7, "03:00-04:00"),
            Map.of("env", "prod")));

        var template = Template.fromStack(stack);
        template.hasResourceProperties(CACHE_CLUSTER, Map.of(
            "Engine", "redis",
            "ClusterName", "orders-cache",
            "EngineVersion", "7.1",
            "Port", 6379,
            "AtRestEncryptionEnabled", true,
            "TransitEncryptionEnabled", true,
            "SnapshotRetentionLimit", 7,
            "SnapshotWindow", "03:00-04:00",
            "Tags", Match.arrayWith(List.of(Map.of("Key", "env", "Value", "prod")))));
        assertThat(template.findOutputs("*").keySet())
            .containsExactlyInAnyOrder("RedisEndpoint", "RedisPort");
    }

    @Test
    void kmsKeyArnIsImported() {
        var stack = cacheStack(new CacheSettings(
            CacheEngine.REDIS,
            "cache.t3.micro",
            1,
            null,
            null,
            null,
            null,
            new CacheSettings.Encryption(true, true,
                "arn:aws:kms:us-west-2:123456789012:key/1234abcd-12ab-34cd-56ef-1234567890ab"),
            null,
            null));

        Template.fromStack(stack).hasResourceProperties(CACHE_CLUSTER, Map.of(
            "KmsKeyId", "1234abcd-12ab-34cd-56ef-1234567890ab"));
    }

    @Test
    void memcachedStackExportsConfigurationEndpoint() {
        var stack = cacheStack(new CacheSettings(
            CacheEngine.MEMCACHED,
            "cache.t3.micro",
            2,
            null,
            null,
            null,
            null,
            null,
            null,
            null));

        var template = Template.fromStack(stack);
        template.hasResourceProperties(CACHE_CLUSTER, Map.of(
            "Engine", "memcached",
            "NumCacheNodes", 2,
            "Port", 11211,
            "AtRestEncryptionEnabled", Match.absent()));
        assertThat(template.findOutputs("*").keySet()).containsExactly("ConfigurationEndpoint");
        assertThat(stack.getCacheCluster().getSecurityGroup().isOwned()).isTrue();
    }
}
