package com.cache.infra.cluster;

import java.util.List;

import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awscdk.Resource;
import software.amazon.awscdk.Tags;
import software.amazon.awscdk.Token;
import software.amazon.awscdk.services.ec2.Connections;
import software.amazon.awscdk.services.ec2.ConnectionsProps;
import software.amazon.awscdk.services.ec2.IConnectable;
import software.amazon.awscdk.services.ec2.ISecurityGroup;
import software.amazon.awscdk.services.ec2.Port;
import software.amazon.awscdk.services.ec2.SecurityGroup;
import software.amazon.awscdk.services.ec2.SecurityGroupProps;
import software.amazon.awscdk.services.ec2.SubnetSelection;
import software.amazon.awscdk.services.ec2.SubnetType;
import software.amazon.awscdk.services.elasticache.CfnCacheCluster;
import software.amazon.awscdk.services.elasticache.CfnCacheClusterProps;
import software.amazon.awscdk.services.elasticache.CfnSubnetGroup;
import software.amazon.awscdk.services.elasticache.CfnSubnetGroupProps;
import software.constructs.Construct;

import com.cache.infra.exception.CacheClusterError;
import com.cache.infra.exception.CacheClusterException;

/**
 * An ElastiCache cache cluster placed in a VPC, with its subnet group and
 * security group.
 *
 * <p>The security group and subnet group are created unless the props supply
 * them. Other constructs reach the cluster through {@link #getConnections()},
 * which targets the cluster's security group on the cluster port.
 */
public class CacheCluster extends Resource implements IConnectable {
    private static final Logger LOG = LogManager.getLogger(CacheCluster.class);

    private final int port;
    private final ResourceHandle<ISecurityGroup> securityGroup;
    private final ResourceHandle<CfnSubnetGroup> subnetGroup;
    private final CfnCacheCluster cluster;
    private final Connections connections;

    public CacheCluster(final Construct scope, final String id, final CacheClusterProps props) {
        super(scope, id);

        this.port = props.getPort() != null ? props.getPort() : props.getEngine().getDefaultPort();
        this.securityGroup = this.resolveSecurityGroup(props);
        this.subnetGroup = this.resolveSubnetGroup(props);

        var draft = new ClusterDraft(this.baseProperties(props));
        ClusterOverlay.applyAll(draft, props);
        this.cluster = draft.create(this, "Resource");

        // Tags.of propagates to every taggable resource below this construct
        props.getTags().forEach((key, value) -> Tags.of(this).add(key, value));

        this.connections = new Connections(ConnectionsProps.builder()
            .securityGroups(List.of(this.securityGroup.resource()))
            .defaultPort(Port.tcp(this.port))
            .build());

        LOG.debug("cache cluster - {} - engine {} port {} security group {} subnet group {}",
            this.getNode().getPath(),
            props.getEngine().getValue(),
            this.port,
            this.securityGroup.ownership(),
            this.subnetGroup.ownership());
    }

    private ResourceHandle<ISecurityGroup> resolveSecurityGroup(CacheClusterProps props) {
        var supplied = props.getSecurityGroups();
        if (supplied.size() > 1) {
            LOG.warn("cache cluster - {} - {} security groups supplied, only the first is attached",
                this.getNode().getPath(), supplied.size());
        }
        return ResourceHandle.borrowOrCreate(
            supplied.isEmpty() ? null : supplied.get(0),
            () -> new SecurityGroup(this, "SecurityGroup", SecurityGroupProps.builder()
                .vpc(props.getVpc())
                .description("Security group for ElastiCache cluster")
                .allowAllOutbound(true) // Inbound rules come from allowConnectionsFrom
                .build()));
    }

    private ResourceHandle<CfnSubnetGroup> resolveSubnetGroup(CacheClusterProps props) {
        return ResourceHandle.borrowOrCreate(
            props.getSubnetGroup(),
            () -> {
                var subnets = props.getVpc().selectSubnets(SubnetSelection.builder()
                    .subnetType(SubnetType.PRIVATE_WITH_EGRESS)
                    .build());
                return new CfnSubnetGroup(this, "SubnetGroup", CfnSubnetGroupProps.builder()
                    .description("Subnet group for ElastiCache cluster")
                    .subnetIds(subnets.getSubnetIds())
                    .build());
            });
    }

    private CfnCacheClusterProps.Builder baseProperties(CacheClusterProps props) {
        return CfnCacheClusterProps.builder()
            .clusterName(props.getClusterName())
            .engine(props.getEngine().getValue())
            .engineVersion(props.getEngineVersion())
            .cacheNodeType(props.getCacheNodeType())
            .numCacheNodes(props.getNumCacheNodes())
            .port(this.port)
            .cacheSubnetGroupName(this.subnetGroup.resource().getRef())
            .vpcSecurityGroupIds(List.of(this.securityGroup.resource().getSecurityGroupId()))
            .cacheParameterGroupName(props.getCacheParameterGroupName())
            .autoMinorVersionUpgrade(props.getAutoMinorVersionUpgrade())
            .azMode(props.getAzMode())
            .preferredAvailabilityZone(props.getPreferredAvailabilityZone())
            .preferredAvailabilityZones(props.getPreferredAvailabilityZones())
            .preferredMaintenanceWindow(props.getPreferredMaintenanceWindow())
            .notificationTopicArn(props.getNotificationTopicArn())
            .snapshotArns(props.getSnapshotArns())
            .snapshotName(props.getSnapshotName())
            .snapshotRetentionLimit(props.getSnapshotRetentionLimit())
            .snapshotWindow(props.getSnapshotWindow());
    }

    /**
     * Lets {@code other} reach the cluster on {@code port}, or on the cluster
     * port when {@code port} is null.
     */
    public void allowConnectionsFrom(final IConnectable other, @Nullable final Port port) {
        if (port == null) {
            other.getConnections().allowDefaultPortTo(this);
        } else {
            other.getConnections().allowTo(this, port);
        }
    }

    public void allowConnectionsFrom(final IConnectable other) {
        this.allowConnectionsFrom(other, null);
    }

    /**
     * Not supported: a read replica needs a replication group, which a
     * standalone cache cluster is not part of.
     *
     * @throws CacheClusterException always, before any resource is created
     */
    public void addReadReplica(final String id, final ReadReplicaOptions options) {
        LOG.error("cache cluster - {} - read replica {} requested", this.getNode().getPath(), id);
        throw new CacheClusterException(CacheClusterError.READ_REPLICA_UNSUPPORTED, id);
    }

    @Override
    public Connections getConnections() {
        return connections;
    }

    public CfnCacheCluster getCluster() {
        return cluster;
    }

    public ResourceHandle<ISecurityGroup> getSecurityGroup() {
        return securityGroup;
    }

    public ResourceHandle<CfnSubnetGroup> getSubnetGroup() {
        return subnetGroup;
    }

    public int getPort() {
        return port;
    }

    public ResolvableAttribute getClusterStatus() {
        return ResolvableAttribute.of(Token.asString(cluster.getAtt("CacheClusterStatus")));
    }

    // Memcached only
    public ResolvableAttribute getConfigurationEndpoint() {
        return ResolvableAttribute.of(cluster.getAttrConfigurationEndpointAddress());
    }

    public ResolvableAttribute getRedisEndpoint() {
        return ResolvableAttribute.of(cluster.getAttrRedisEndpointAddress());
    }

    public ResolvableAttribute getRedisPort() {
        return ResolvableAttribute.of(cluster.getAttrRedisEndpointPort());
    }
}
