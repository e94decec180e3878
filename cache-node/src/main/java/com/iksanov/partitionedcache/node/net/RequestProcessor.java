package com.iksanov.partitionedcache.node.net;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.codec.ResponsePayloads;
import com.iksanov.partitionedcache.common.exception.CacheException;
import com.iksanov.partitionedcache.common.protocol.*;
import com.iksanov.partitionedcache.node.core.CacheRegistry;
import com.iksanov.partitionedcache.node.core.CacheStore;
import com.iksanov.partitionedcache.node.core.StoreFailureException;
import com.iksanov.partitionedcache.node.metrics.NetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Executes decoded requests against the node's caches and builds the responses.
 * <p>
 * Key requests are served only for partitions this node owns in its partition table;
 * anything else is answered with {@link ResponseStatus#NOT_PRIMARY} so the client can
 * refresh its mapping. Partition table requests are answered without looking up a cache.
 * Exceptions never escape: they become error responses.
 */
public class RequestProcessor {

    private static final Logger log = LoggerFactory.getLogger(RequestProcessor.class);
    private static final long SLOW_REQUEST_THRESHOLD_NANOS = 100_000_000L;
    private final NodeInfo self;
    private final CacheRegistry registry;
    private final NetMetrics metrics;
    private volatile PartitionTable partitionTable;

    public RequestProcessor(NodeInfo self, PartitionTable partitionTable, CacheRegistry registry, NetMetrics metrics) {
        this.self = Objects.requireNonNull(self, "self");
        this.partitionTable = Objects.requireNonNull(partitionTable, "partitionTable");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public CacheResponse process(RequestFrame frame) {
        Objects.requireNonNull(frame, "frame");
        CacheRequest request = frame.request();
        long requestId = frame.requestId();
        long start = System.nanoTime();
        metrics.incrementRequests();
        CacheResponse response;
        try {
            response = execute(requestId, request);
        } catch (StoreFailureException e) {
            log.warn("Store failure on requestId={} op={}: {}", requestId, request.operation(), e.getMessage());
            response = CacheResponse.error(requestId, ResponseStatus.STORE_FAILURE, e.getMessage());
        } catch (CacheException e) {
            log.error("CacheException while processing requestId={}: {}", requestId, e.getMessage());
            response = CacheResponse.error(requestId, ResponseStatus.FAILED, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error while processing requestId={}", requestId, e);
            response = CacheResponse.error(requestId, ResponseStatus.FAILED, "Internal server error");
        }
        long duration = System.nanoTime() - start;
        metrics.recordStatus(response.status());
        metrics.recordRequestDuration(request.operation(), duration);
        if (duration > SLOW_REQUEST_THRESHOLD_NANOS) {
            log.warn("Slow request [op={}, requestId={}] took {} ms", request.operation(), requestId, duration / 1_000_000);
        } else {
            log.debug("Request [op={}, requestId={}] processed with status {}", request.operation(), requestId, response.status());
        }
        return response;
    }

    private CacheResponse execute(long requestId, CacheRequest request) {
        if (request.operation() == ClientOperation.CACHE_PARTITIONS) {
            return CacheResponse.ok(requestId, ResponsePayloads.partitions(partitionTable));
        }

        if (request instanceof KeyRoutedRequest keyed && !partitionTable.isOwner(self, keyed.partition())) {
            NodeInfo owner = partitionTable.owner(keyed.partition());
            String message = "Node %s is not primary for partition %d (owner: %s)"
                    .formatted(self.nodeId(), keyed.partition(), owner == null ? "none" : owner.nodeId());
            log.debug(message);
            return CacheResponse.error(requestId, ResponseStatus.NOT_PRIMARY, message);
        }

        CacheStore store = registry.get(request.cacheId());
        if (store == null) {
            return CacheResponse.error(requestId, ResponseStatus.CACHE_DOES_NOT_EXIST,
                    "Cache does not exist [cacheId=" + request.cacheId() + "]");
        }

        byte[] payload = switch (request.operation()) {
            case CACHE_GET -> ResponsePayloads.value(store.get(((KeyRequest) request).key()));
            case CACHE_PUT -> handlePut(store, (PutRequest) request);
            case CACHE_CONTAINS_KEY -> ResponsePayloads.bool(store.containsKey(((KeyRequest) request).key()));
            case CACHE_REMOVE_KEY -> handleRemove(store, (KeyRequest) request);
            case CACHE_CLEAR_KEY -> {
                store.remove(((KeyRequest) request).key());
                yield ResponsePayloads.empty();
            }
            case CACHE_REMOVE_ALL -> handleRemoveAll(store, request.cacheId());
            case CACHE_CLEAR -> {
                store.clear();
                yield ResponsePayloads.empty();
            }
            case CACHE_GET_SIZE -> ResponsePayloads.count(localSize(store, ((SizeRequest) request).peekModes()));
            case CACHE_PARTITIONS -> ResponsePayloads.partitions(partitionTable);
        };
        return CacheResponse.ok(requestId, payload);
    }

    private byte[] handlePut(CacheStore store, PutRequest request) {
        store.put(request.key(), request.value());
        registry.notifyPut(request.cacheId(), request.key(), request.value());
        return ResponsePayloads.empty();
    }

    private byte[] handleRemove(CacheStore store, KeyRequest request) {
        boolean removed = store.remove(request.key());
        if (removed) registry.notifyRemove(request.cacheId(), request.key());
        return ResponsePayloads.bool(removed);
    }

    private byte[] handleRemoveAll(CacheStore store, int cacheId) {
        List<byte[]> removed = store.removeAll();
        for (byte[] key : removed) registry.notifyRemove(cacheId, key);
        return ResponsePayloads.empty();
    }

    // every entry here is a primary on-heap copy; this node keeps no near, backup or off-heap tier
    private static long localSize(CacheStore store, int peekModes) {
        boolean counted = CachePeekMode.includes(peekModes, CachePeekMode.PRIMARY)
                || CachePeekMode.includes(peekModes, CachePeekMode.ONHEAP);
        return counted ? store.size() : 0;
    }

    public PartitionTable getPartitionTable() {
        return partitionTable;
    }

    /**
     * Replaces the ownership map, for example after the member list changed.
     */
    public void updatePartitionTable(PartitionTable table) {
        this.partitionTable = Objects.requireNonNull(table, "table");
        log.info("Partition table updated: {} partitions over {} node(s)", table.partitionCount(), table.nodes().size());
    }
}
