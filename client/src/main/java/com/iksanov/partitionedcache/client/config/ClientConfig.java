package com.iksanov.partitionedcache.client.config;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.exception.ConfigurationException;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Client settings. {@code nodes} is a comma separated list of {@code nodeId:host:port} seeds;
 * node ids must match the ids the nodes are configured with.
 */
@Getter
@Setter
public class ClientConfig {

    private String nodes;
    private ConnectionConfig connection = new ConnectionConfig();
    private NearCacheConfig nearCache = new NearCacheConfig();

    public List<String> getNodes() {
        if (nodes == null || nodes.isBlank()) return new ArrayList<>();
        return Arrays.stream(nodes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public List<NodeInfo> nodeInfos() {
        List<NodeInfo> result = new ArrayList<>();
        for (String address : getNodes()) {
            try {
                result.add(NodeInfo.fromString(address));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid node address in client config: " + address, e);
            }
        }
        return result;
    }

    public static ClientConfig fromEnv() {
        ClientConfig config = new ClientConfig();
        config.setNodes(System.getenv("CACHE_CLIENT_NODES"));
        config.getConnection().setTimeoutMillis(getEnvInt("CACHE_CLIENT_TIMEOUT_MILLIS", config.getConnection().getTimeoutMillis()));
        config.getConnection().setConnectTimeoutMillis(getEnvInt("CACHE_CLIENT_CONNECT_TIMEOUT_MILLIS", config.getConnection().getConnectTimeoutMillis()));
        config.getConnection().setIoThreads(getEnvInt("CACHE_CLIENT_IO_THREADS", config.getConnection().getIoThreads()));
        config.getNearCache().setEnabled(Boolean.parseBoolean(System.getenv().getOrDefault("CACHE_CLIENT_NEAR_CACHE_ENABLED", "false")));
        config.getNearCache().setMaximumSize(getEnvInt("CACHE_CLIENT_NEAR_CACHE_MAX_SIZE", (int) config.getNearCache().getMaximumSize()));
        return config;
    }

    private static int getEnvInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
        }
    }

    @Getter
    @Setter
    public static class ConnectionConfig {
        private int timeoutMillis = 3000;
        private int connectTimeoutMillis = 3000;
        private int ioThreads = 2;
        private int maxFrameLength = 16 * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class NearCacheConfig {
        private boolean enabled = false;
        private long maximumSize = 10_000;
    }
}
