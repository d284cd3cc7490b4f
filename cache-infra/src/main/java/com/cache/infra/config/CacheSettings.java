package com.cache.infra.config;

import java.util.Map;
import java.util.Objects;

import com.cache.infra.cluster.CacheEngine;
import com.cache.infra.exception.CacheClusterError;
import com.cache.infra.exception.CacheClusterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.constructs.Node;

/**
 * Settings of the cache stack, read from the {@code cache} block of the CDK
 * context: an object in cdk.json, or a JSON string passed with
 * {@code cdk synth -c cache='{...}'}.
 */
public record CacheSettings(
    CacheEngine engine,
    String cacheNodeType,
    Integer numCacheNodes,
    @Nullable String clusterName,
    @Nullable String engineVersion,
    @Nullable Integer port,
    @Nullable Integer natGateways,
    @Nullable Encryption encryption,
    @Nullable Backups backups,
    @Nullable Map<String, String> tags
) {
    public static final String CONTEXT_KEY = "cache";

    private static final Logger LOG = LogManager.getLogger(CacheSettings.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public CacheSettings {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(cacheNodeType, "cacheNodeType");
        Objects.requireNonNull(numCacheNodes, "numCacheNodes");
    }

    public record Encryption(
        boolean atRest,
        boolean inTransit,
        // AWS owned key when null
        @Nullable String kmsKeyArn
    ) {}

    public record Backups(
        int retentionDays,
        @Nullable String preferredWindow
    ) {}

    public static CacheSettings fromContext(Node node) {
        var raw = node.tryGetContext(CONTEXT_KEY);
        if (raw == null) {
            throw new CacheClusterException(CacheClusterError.MISSING_SETTINGS, CONTEXT_KEY);
        }
        try {
            // -c on the command line hands the block over as a string
            var settings = raw instanceof String json
                ? MAPPER.readValue(json, CacheSettings.class)
                : MAPPER.convertValue(raw, CacheSettings.class);
            LOG.info("settings - {} engine {} x {}",
                settings.engine().getValue(), settings.numCacheNodes(), settings.cacheNodeType());
            return settings;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.error("settings - context key {} could not be mapped", CONTEXT_KEY);
            throw new CacheClusterException(CacheClusterError.INVALID_SETTINGS, CONTEXT_KEY, e);
        }
    }
}
