package com.iksanov.partitionedcache.client;

import com.iksanov.partitionedcache.client.config.ClientConfig;
import com.iksanov.partitionedcache.client.dispatch.SyncDispatcher;
import com.iksanov.partitionedcache.client.metrics.ClientMetrics;
import com.iksanov.partitionedcache.client.near.NearCache;
import com.iksanov.partitionedcache.client.router.DataRouter;
import com.iksanov.partitionedcache.client.router.DefaultDataRouter;
import com.iksanov.partitionedcache.client.router.SharedRouter;
import com.iksanov.partitionedcache.client.transport.NettyNodeTransport;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.exception.CacheException;
import com.iksanov.partitionedcache.common.exception.ConfigurationException;
import com.iksanov.partitionedcache.common.exception.InvalidCacheRequestException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point: owns the router shared by all cache handles it hands out.
 * The connections stay open until the client and every handle are closed.
 */
public final class ThinClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ThinClient.class);
    private final ClientConfig config;
    private final SharedRouter router;
    private final SyncDispatcher dispatcher;
    private final ClientMetrics metrics;
    private final Map<String, NearCache> nearCaches = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ThinClient(ClientConfig config, DataRouter router, ClientMetrics metrics) {
        this.config = config;
        this.router = new SharedRouter(router);
        this.metrics = metrics;
        this.dispatcher = new SyncDispatcher(router, config.getConnection().getTimeoutMillis(), metrics);
    }

    public static ThinClient start(ClientConfig config) {
        return start(config, new SimpleMeterRegistry());
    }

    public static ThinClient start(ClientConfig config, MeterRegistry registry) {
        List<NodeInfo> nodes = config.nodeInfos();
        if (nodes.isEmpty()) throw new ConfigurationException("No cache nodes configured");
        NettyNodeTransport transport = new NettyNodeTransport(config.getConnection());
        log.info("Starting thin client with {} seed nodes, timeout={} ms", nodes.size(), config.getConnection().getTimeoutMillis());
        return new ThinClient(config, new DefaultDataRouter(nodes, transport), new ClientMetrics(registry));
    }

    /**
     * Opens a handle on the named cache and fetches its partition table. If the fetch fails the
     * handle is still returned; key-routed calls fail until {@code refreshAffinityMapping()} succeeds.
     */
    public <K, V> CacheClient<K, V> cache(String name, Class<V> valueType) {
        if (valueType == null) throw new InvalidCacheRequestException("Value type cannot be null");
        return new CacheClient<>(cacheImpl(name), valueType);
    }

    /**
     * Untyped variant of {@link #cache(String, Class)}: values come back as whatever the codec decoded.
     */
    public <K> CacheClient<K, Object> cache(String name) {
        return cache(name, Object.class);
    }

    CacheClientImpl cacheImpl(String name) {
        if (closed.get()) throw new IllegalStateException("Client is closed");
        if (name == null || name.isBlank()) throw new InvalidCacheRequestException("Cache name cannot be null or blank");
        NearCache nearCache = nearCaches.computeIfAbsent(name, this::createNearCache);
        CacheClientImpl impl = new CacheClientImpl(name, false, router.retain(), dispatcher, nearCache, metrics);
        try {
            impl.refreshAffinityMapping();
        } catch (CacheException e) {
            log.warn("Initial affinity fetch for cache '{}' failed, key-routed operations will fail until it is refreshed: {}", name, e.getMessage());
        }
        return impl;
    }

    private NearCache createNearCache(String name) {
        ClientConfig.NearCacheConfig nearConfig = config.getNearCache();
        return nearConfig.isEnabled() ? new NearCache(name, nearConfig.getMaximumSize()) : NearCache.disabled();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing thin client ({} router references left)", router.refCount() - 1);
            router.release();
        }
    }
}
