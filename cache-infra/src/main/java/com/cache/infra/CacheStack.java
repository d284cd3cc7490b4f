package com.cache.infra;

import jakarta.annotation.Nullable;
import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.CfnOutputProps;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.kms.Key;
import software.constructs.Construct;

import com.cache.infra.cluster.BackupSettings;
import com.cache.infra.cluster.CacheCluster;
import com.cache.infra.cluster.CacheClusterProps;
import com.cache.infra.cluster.CacheEngine;
import com.cache.infra.cluster.EncryptionSettings;
import com.cache.infra.config.CacheSettings;

record CacheStackProps(IVpc vpc, CacheSettings settings) {}

public class CacheStack extends Stack {
    private final CacheCluster cacheCluster;

    public CacheStack(
        final Construct scope,
        final String id,
        final StackProps props,
        final CacheStackProps cacheStackProps) {
            super(scope, id, props);
            var settings = cacheStackProps.settings();
            this.cacheCluster = new CacheCluster(this, "Cache", CacheClusterProps.builder()
                .vpc(cacheStackProps.vpc())
                .engine(settings.engine())
                .cacheNodeType(settings.cacheNodeType())
                .numCacheNodes(settings.numCacheNodes())
                .clusterName(settings.clusterName())
                .engineVersion(settings.engineVersion())
                .port(settings.port())
                .encryption(this.encryption(settings.encryption()))
                .backups(this.backups(settings.backups()))
                .tags(settings.tags())
                .build());
            this.createOutputs(settings.engine());
    }

    public CacheCluster getCacheCluster() {
        return cacheCluster;
    }

    @Nullable
    private EncryptionSettings encryption(@Nullable CacheSettings.Encryption encryption) {
        if (encryption == null) {
            return null;
        }
        var kmsKey = encryption.kmsKeyArn() == null
            ? null
            : Key.fromKeyArn(this, "CacheKey", encryption.kmsKeyArn());
        return new EncryptionSettings(encryption.atRest(), encryption.inTransit(), kmsKey);
    }

    @Nullable
    private BackupSettings backups(@Nullable CacheSettings.Backups backups) {
        if (backups == null) {
            return null;
        }
        return new BackupSettings(Duration.days(backups.retentionDays()), backups.preferredWindow());
    }

    // Endpoint attributes differ per engine, GetAtt on the other engine's attribute fails the deploy
    private void createOutputs(CacheEngine engine) {
        if (engine == CacheEngine.REDIS) {
            new CfnOutput(this, "RedisEndpoint", CfnOutputProps.builder()
                .value(this.cacheCluster.getRedisEndpoint().asString())
                .build());
            new CfnOutput(this, "RedisPort", CfnOutputProps.builder()
                .value(this.cacheCluster.getRedisPort().asString())
                .build());
        } else {
            new CfnOutput(this, "ConfigurationEndpoint", CfnOutputProps.builder()
                .value(this.cacheCluster.getConfigurationEndpoint().asString())
                .build());
        }
    }
}
