package com.iksanov.partitionedcache.node.config;

import com.iksanov.partitionedcache.common.exception.ConfigurationException;

/**
 * Settings of one cache node, read from the environment.
 * The cluster layout comes separately from {@link ClusterConfig}.
 */
public record ApplicationConfig(
        String nodeId,
        String host,
        String advertisedHost,
        int port,
        int metricsPort,
        int cacheMaxSize,
        long cacheTtlMillis,
        boolean autoCreateCaches,
        int maxFrameLength
) {
    public ApplicationConfig {
        if (nodeId == null || nodeId.isBlank()) throw new ConfigurationException("nodeId must not be blank");
        if (port < 0 || port > 65535) throw new ConfigurationException("Invalid port: " + port);
        if (cacheMaxSize <= 0) throw new ConfigurationException("cacheMaxSize must be > 0");
        if (cacheTtlMillis < 0) throw new ConfigurationException("cacheTtlMillis must be >= 0");
    }

    public static ApplicationConfig fromEnv() {
        return new ApplicationConfig(
                getEnv("CACHE_NODE_ID", "node-1"),
                getEnv("CACHE_NODE_HOST", "0.0.0.0"),
                getEnv("CACHE_NODE_ADVERTISED_HOST", "localhost"),
                getEnvInt("CACHE_NODE_PORT", 7000),
                getEnvInt("METRICS_PORT", 9081),
                getEnvInt("CACHE_MAX_SIZE", 100_000),
                getEnvLong("CACHE_TTL_MILLIS", 0),
                getEnvBool("CACHE_AUTO_CREATE", true),
                getEnvInt("CACHE_MAX_FRAME_LENGTH", 16 * 1024 * 1024)
        );
    }

    public static ApplicationConfig defaults() {
        return new ApplicationConfig("node-1", "0.0.0.0", "localhost", 7000, 9081, 100_000, 0, true, 16 * 1024 * 1024);
    }

    public NetServerConfig toNetServerConfig() {
        return new NetServerConfig(host, port, 1, 2, 256, maxFrameLength, 0, 5);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    private static int getEnvInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer in " + key + ": " + value, e);
        }
    }

    private static long getEnvLong(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number in " + key + ": " + value, e);
        }
    }

    private static boolean getEnvBool(String key, boolean defaultValue) {
        String value = System.getenv(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }
}
