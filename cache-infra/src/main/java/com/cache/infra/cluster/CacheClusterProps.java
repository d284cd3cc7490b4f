package com.cache.infra.cluster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.annotation.Nullable;
import software.amazon.awscdk.services.ec2.ISecurityGroup;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.elasticache.CfnSubnetGroup;

/**
 * Properties of a {@link CacheCluster}.
 *
 * <p>Only {@code vpc}, {@code engine}, {@code cacheNodeType} and {@code numCacheNodes}
 * are required. Every other property left unset is omitted from the template so
 * ElastiCache applies its own default.
 */
public final class CacheClusterProps {
    private final IVpc vpc;
    private final CacheEngine engine;
    private final String cacheNodeType;
    private final int numCacheNodes;
    @Nullable private final String clusterName;
    @Nullable private final String engineVersion;
    @Nullable private final Integer port;
    @Nullable private final CfnSubnetGroup subnetGroup;
    private final List<ISecurityGroup> securityGroups;
    @Nullable private final String cacheParameterGroupName;
    @Nullable private final Boolean autoMinorVersionUpgrade;
    @Nullable private final String azMode;
    @Nullable private final String preferredAvailabilityZone;
    @Nullable private final List<String> preferredAvailabilityZones;
    @Nullable private final String preferredMaintenanceWindow;
    @Nullable private final String notificationTopicArn;
    @Nullable private final List<String> snapshotArns;
    @Nullable private final String snapshotName;
    @Nullable private final Integer snapshotRetentionLimit;
    @Nullable private final String snapshotWindow;
    private final Map<String, String> tags;
    @Nullable private final EncryptionSettings encryption;
    @Nullable private final BackupSettings backups;

    private CacheClusterProps(Builder builder) {
        this.vpc = Objects.requireNonNull(builder.vpc, "vpc is required");
        this.engine = Objects.requireNonNull(builder.engine, "engine is required");
        this.cacheNodeType = Objects.requireNonNull(builder.cacheNodeType, "cacheNodeType is required");
        this.numCacheNodes = Objects.requireNonNull(builder.numCacheNodes, "numCacheNodes is required");
        this.clusterName = builder.clusterName;
        this.engineVersion = builder.engineVersion;
        this.port = builder.port;
        this.subnetGroup = builder.subnetGroup;
        this.securityGroups = builder.securityGroups == null
            ? Collections.emptyList()
            : List.copyOf(builder.securityGroups);
        this.cacheParameterGroupName = builder.cacheParameterGroupName;
        this.autoMinorVersionUpgrade = builder.autoMinorVersionUpgrade;
        this.azMode = builder.azMode;
        this.preferredAvailabilityZone = builder.preferredAvailabilityZone;
        this.preferredAvailabilityZones = builder.preferredAvailabilityZones == null
            ? null
            : List.copyOf(builder.preferredAvailabilityZones);
        this.preferredMaintenanceWindow = builder.preferredMaintenanceWindow;
        this.notificationTopicArn = builder.notificationTopicArn;
        this.snapshotArns = builder.snapshotArns == null ? null : List.copyOf(builder.snapshotArns);
        this.snapshotName = builder.snapshotName;
        this.snapshotRetentionLimit = builder.snapshotRetentionLimit;
        this.snapshotWindow = builder.snapshotWindow;
        // Insertion order is the order tags get applied in
        this.tags = builder.tags == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
        this.encryption = builder.encryption;
        this.backups = builder.backups;
    }

    public static Builder builder() {
        return new Builder();
    }

    public IVpc getVpc() {
        return vpc;
    }

    public CacheEngine getEngine() {
        return engine;
    }

    public String getCacheNodeType() {
        return cacheNodeType;
    }

    public int getNumCacheNodes() {
        return numCacheNodes;
    }

    @Nullable
    public String getClusterName() {
        return clusterName;
    }

    @Nullable
    public String getEngineVersion() {
        return engineVersion;
    }

    @Nullable
    public Integer getPort() {
        return port;
    }

    @Nullable
    public CfnSubnetGroup getSubnetGroup() {
        return subnetGroup;
    }

    public List<ISecurityGroup> getSecurityGroups() {
        return securityGroups;
    }

    @Nullable
    public String getCacheParameterGroupName() {
        return cacheParameterGroupName;
    }

    @Nullable
    public Boolean getAutoMinorVersionUpgrade() {
        return autoMinorVersionUpgrade;
    }

    @Nullable
    public String getAzMode() {
        return azMode;
    }

    @Nullable
    public String getPreferredAvailabilityZone() {
        return preferredAvailabilityZone;
    }

    @Nullable
    public List<String> getPreferredAvailabilityZones() {
        return preferredAvailabilityZones;
    }

    @Nullable
    public String getPreferredMaintenanceWindow() {
        return preferredMaintenanceWindow;
    }

    @Nullable
    public String getNotificationTopicArn() {
        return notificationTopicArn;
    }

    @Nullable
    public List<String> getSnapshotArns() {
        return snapshotArns;
    }

    @Nullable
    public String getSnapshotName() {
        return snapshotName;
    }

    @Nullable
    public Integer getSnapshotRetentionLimit() {
        return snapshotRetentionLimit;
    }

    @Nullable
    public String getSnapshotWindow() {
        return snapshotWindow;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    @Nullable
    public EncryptionSettings getEncryption() {
        return encryption;
    }

    @Nullable
    public BackupSettings getBackups() {
        return backups;
    }

    public static final class Builder {
        private IVpc vpc;
        private CacheEngine engine;
        private String cacheNodeType;
        private Integer numCacheNodes;
        private String clusterName;
        private String engineVersion;
        private Integer port;
        private CfnSubnetGroup subnetGroup;
        private List<? extends ISecurityGroup> securityGroups;
        private String cacheParameterGroupName;
        private Boolean autoMinorVersionUpgrade;
        private String azMode;
        private String preferredAvailabilityZone;
        private List<String> preferredAvailabilityZones;
        private String preferredMaintenanceWindow;
        private String notificationTopicArn;
        private List<String> snapshotArns;
        private String snapshotName;
        private Integer snapshotRetentionLimit;
        private String snapshotWindow;
        private Map<String, String> tags;
        private EncryptionSettings encryption;
        private BackupSettings backups;

        private Builder() {
        }

        public Builder vpc(IVpc vpc) {
            this.vpc = vpc;
            return this;
        }

        public Builder engine(CacheEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder cacheNodeType(String cacheNodeType) {
            this.cacheNodeType = cacheNodeType;
            return this;
        }

        public Builder numCacheNodes(int numCacheNodes) {
            this.numCacheNodes = numCacheNodes;
            return this;
        }

        public Builder clusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder engineVersion(String engineVersion) {
            this.engineVersion = engineVersion;
            return this;
        }

        // Defaults to the engine port: 6379 for Redis, 11211 for Memcached
        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder subnetGroup(CfnSubnetGroup subnetGroup) {
            this.subnetGroup = subnetGroup;
            return this;
        }

        // Only the first group is attached to the cluster
        public Builder securityGroups(List<? extends ISecurityGroup> securityGroups) {
            this.securityGroups = securityGroups;
            return this;
        }

        public Builder cacheParameterGroupName(String cacheParameterGroupName) {
            this.cacheParameterGroupName = cacheParameterGroupName;
            return this;
        }

        public Builder autoMinorVersionUpgrade(Boolean autoMinorVersionUpgrade) {
            this.autoMinorVersionUpgrade = autoMinorVersionUpgrade;
            return this;
        }

        // "single-az" or "cross-az", Memcached only
        public Builder azMode(String azMode) {
            this.azMode = azMode;
            return this;
        }

        public Builder preferredAvailabilityZone(String preferredAvailabilityZone) {
            this.preferredAvailabilityZone = preferredAvailabilityZone;
            return this;
        }

        public Builder preferredAvailabilityZones(List<String> preferredAvailabilityZones) {
            this.preferredAvailabilityZones = preferredAvailabilityZones;
            return this;
        }

        public Builder preferredMaintenanceWindow(String preferredMaintenanceWindow) {
            this.preferredMaintenanceWindow = preferredMaintenanceWindow;
            return this;
        }

        public Builder notificationTopicArn(String notificationTopicArn) {
            this.notificationTopicArn = notificationTopicArn;
            return this;
        }

        public Builder snapshotArns(List<String> snapshotArns) {
            this.snapshotArns = snapshotArns;
            return this;
        }

        public Builder snapshotName(String snapshotName) {
            this.snapshotName = snapshotName;
            return this;
        }

        // Overwritten by backups().retention() when both are set
        public Builder snapshotRetentionLimit(Integer snapshotRetentionLimit) {
            this.snapshotRetentionLimit = snapshotRetentionLimit;
            return this;
        }

        public Builder snapshotWindow(String snapshotWindow) {
            this.snapshotWindow = snapshotWindow;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder encryption(EncryptionSettings encryption) {
            this.encryption = encryption;
            return this;
        }

        public Builder backups(BackupSettings backups) {
            this.backups = backups;
            return this;
        }

        public CacheClusterProps build() {
            return new CacheClusterProps(this);
        }
    }
}
