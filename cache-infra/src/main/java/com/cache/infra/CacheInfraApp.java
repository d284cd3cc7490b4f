package com.cache.infra;

import java.util.HashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awscdk.App;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.StackProps;

import com.cache.infra.config.CacheSettings;

public class CacheInfraApp {
    private static final Logger LOG = LogManager.getLogger(CacheInfraApp.class);

    public static void main(final String[] args) {
        var app = new App();

        // Account and region of the CLI profile, set by cdk synth/deploy
        var env = Environment.builder()
            .account(System.getenv("CDK_DEFAULT_ACCOUNT"))
            .region(System.getenv("CDK_DEFAULT_REGION"))
            .build();
        var infraTags = new HashMap<String, String>() {{
            put("team", "platform");
            put("cost", "CacheInfra");
        }};

        var settings = CacheSettings.fromContext(app.getNode());

        // VPC
        var vpcStack = new VpcStack(app, "CacheVpc", StackProps.builder()
            .env(env)
            .tags(infraTags)
            .build(), new VpcStackProps(settings.natGateways() == null ? 1 : settings.natGateways()));

        // Cache
        var cacheStack = new CacheStack(app, "Cache", StackProps.builder()
            .env(env)
            .tags(infraTags)
            .build(), new CacheStackProps(vpcStack.getVpc(), settings));
        cacheStack.addDependency(vpcStack); // Deployed after VPC Stack

        app.synth();
        LOG.info("app - synthesized {} and {}", vpcStack.getStackName(), cacheStack.getStackName());
    }
}
