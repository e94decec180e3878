package com.iksanov.partitionedcache.node.app;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.node.config.ApplicationConfig;
import com.iksanov.partitionedcache.node.config.ClusterConfig;
import com.iksanov.partitionedcache.node.metrics.MetricsServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point of a cache node process. Configuration comes from the environment.
 */
public class CacheNodeApplication {

    private static final Logger log = LoggerFactory.getLogger(CacheNodeApplication.class);
    private final ApplicationConfig config;
    private final ClusterConfig cluster;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private CacheNode node;
    private MetricsServer metricsServer;

    public CacheNodeApplication(ApplicationConfig config, ClusterConfig cluster) {
        this.config = config;
        this.cluster = cluster;
    }

    public static void main(String[] args) {
        ApplicationConfig config = ApplicationConfig.fromEnv();
        NodeInfo advertised = new NodeInfo(config.nodeId(), config.advertisedHost(), config.port() == 0 ? 7000 : config.port());
        ClusterConfig cluster = ClusterConfig.fromEnv(advertised);

        log.info("Starting cache node {} on port {} ({} cluster member(s))", config.nodeId(), config.port(), cluster.nodes().size());
        CacheNodeApplication app = new CacheNodeApplication(config, cluster);
        try {
            app.start();
        } catch (Exception e) {
            log.error("Startup failed", e);
            app.shutdown();
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
        app.awaitShutdown();
    }

    public void start() {
        node = new CacheNode(config, cluster);
        metricsServer = new MetricsServer(config.metricsPort(), node.cacheMetrics(), node.netMetrics(),
                () -> "{\"status\":\"UP\",\"nodeId\":\"" + config.nodeId() + "\",\"caches\":" + node.registry().cacheCount() + "}");
        metricsServer.start();
        node.start();
        log.info("Cache node {} ready: cache port {}, metrics port {}", config.nodeId(), node.port(), config.metricsPort());
    }

    public void shutdown() {
        if (shutdownLatch.getCount() == 0) return;
        log.info("Shutting down cache node {}", config.nodeId());
        try {
            if (node != null && node.isRunning()) node.stop();
            if (metricsServer != null) metricsServer.shutdown();
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for shutdown");
        }
    }
}
