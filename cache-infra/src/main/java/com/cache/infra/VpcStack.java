package com.cache.infra;

import java.util.List;

import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.services.ec2.SubnetConfiguration;
import software.amazon.awscdk.services.ec2.SubnetType;
import software.amazon.awscdk.services.ec2.Vpc;
import software.amazon.awscdk.services.ec2.VpcProps;
import software.constructs.Construct;

record VpcStackProps(int natGateways) {}

public class VpcStack extends Stack {

    private final Vpc vpc;

    public VpcStack(
        final Construct scope,
        final String id,
        final StackProps props,
        final VpcStackProps vpcStackProps) {
            super(scope, id, props);
            this.vpc = new Vpc(this, "Vpc", VpcProps.builder()
                .vpcName("CacheVPC")
                .maxAzs(2)
                // The cache subnets egress through NAT, at least one gateway is needed
                .natGateways(vpcStackProps.natGateways())
                .subnetConfiguration(List.of(
                    SubnetConfiguration.builder()
                        .name("Public")
                        .subnetType(SubnetType.PUBLIC)
                        .cidrMask(24)
                        .build(),
                    SubnetConfiguration.builder()
                        .name("Cache")
                        .subnetType(SubnetType.PRIVATE_WITH_EGRESS)
                        .cidrMask(24)
                        .build()))
                .build());
    }

    public Vpc getVpc() {
        return vpc;
    }
}
