package com.iksanov.partitionedcache.node.app;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.node.config.ApplicationConfig;
import com.iksanov.partitionedcache.node.config.ClusterConfig;
import com.iksanov.partitionedcache.node.core.CacheRegistry;
import com.iksanov.partitionedcache.node.metrics.CacheMetrics;
import com.iksanov.partitionedcache.node.metrics.NetMetrics;
import com.iksanov.partitionedcache.node.net.NetServer;
import com.iksanov.partitionedcache.node.net.RequestProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One cache node: its caches, its slice of the partition table and the protocol server.
 */
public class CacheNode {

    private static final Logger log = LoggerFactory.getLogger(CacheNode.class);
    private final NodeInfo self;
    private final CacheMetrics cacheMetrics;
    private final NetMetrics netMetrics;
    private final CacheRegistry registry;
    private final RequestProcessor processor;
    private final NetServer server;

    public CacheNode(ApplicationConfig config, ClusterConfig cluster) {
        this(config, cluster, new CacheMetrics(), new NetMetrics());
    }

    public CacheNode(ApplicationConfig config, ClusterConfig cluster, CacheMetrics cacheMetrics, NetMetrics netMetrics) {
        this.self = cluster.self(config.nodeId());
        this.cacheMetrics = cacheMetrics;
        this.netMetrics = netMetrics;
        this.registry = new CacheRegistry(config.autoCreateCaches(), config.cacheMaxSize(), config.cacheTtlMillis(), cacheMetrics);
        cluster.caches().forEach(registry::createCache);
        PartitionTable table = cluster.partitionTable();
        log.info("Node {} owns {} of {} partitions", self.nodeId(),
                table.partitionsByNode().getOrDefault(self, List.of()).size(), table.partitionCount());
        this.processor = new RequestProcessor(self, table, registry, netMetrics);
        this.server = new NetServer(config.toNetServerConfig(), processor, netMetrics);
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    public boolean isRunning() {
        return server.isRunning();
    }

    public int port() {
        return server.boundPort();
    }

    public NodeInfo self() {
        return self;
    }

    public CacheRegistry registry() {
        return registry;
    }

    public RequestProcessor processor() {
        return processor;
    }

    public CacheMetrics cacheMetrics() {
        return cacheMetrics;
    }

    public NetMetrics netMetrics() {
        return netMetrics;
    }
}
