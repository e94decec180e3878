package com.iksanov.partitionedcache.node.config;

/**
 * Tunables of the node's protocol server. Port 0 binds an ephemeral port.
 */
public record NetServerConfig(String host, int port, int bossThreads, int workerThreads, int backlog,
                              int maxFrameLength, int shutdownQuietPeriodSeconds, int shutdownTimeoutSeconds) {
    public static NetServerConfig defaults() {
        return new NetServerConfig("0.0.0.0", 7000, 1, 2, 256, 16 * 1024 * 1024, 2, 10);
    }

    public NetServerConfig withPort(int newPort) {
        return new NetServerConfig(host, newPort, bossThreads, workerThreads, backlog, maxFrameLength,
                shutdownQuietPeriodSeconds, shutdownTimeoutSeconds);
    }
}
