package com.iksanov.partitionedcache.client.dispatch;

import com.iksanov.partitionedcache.client.metrics.ClientMetrics;
import com.iksanov.partitionedcache.client.router.DataRouter;
import com.iksanov.partitionedcache.client.router.Route;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.codec.ResponseReader;
import com.iksanov.partitionedcache.common.exception.*;
import com.iksanov.partitionedcache.common.protocol.CacheRequest;
import com.iksanov.partitionedcache.common.protocol.CacheResponse;
import com.iksanov.partitionedcache.common.protocol.KeyRoutedRequest;
import com.iksanov.partitionedcache.common.protocol.ResponseStatus;
import io.micrometer.core.instrument.Timer;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.*;

/**
 * Blocking request/response over a {@link DataRouter}.
 * <p>
 * Each call waits at most {@code timeoutMillis}. Failures are never retried here and map onto
 * the exception hierarchy as follows:
 * <ul>
 *   <li>no route, or the node answered {@code NOT_PRIMARY}: {@link RoutingUnavailableException}</li>
 *   <li>timeout: {@link CacheTimeoutException}; other transport errors: {@link CacheConnectionException}</li>
 *   <li>any other failure status: {@link ServerApplicationException}</li>
 *   <li>malformed frame or payload: {@link SerializationException}</li>
 * </ul>
 */
public class SyncDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SyncDispatcher.class);
    private final DataRouter router;
    private final long timeoutMillis;
    private final ClientMetrics metrics;

    public SyncDispatcher(DataRouter router, long timeoutMillis, ClientMetrics metrics) {
        if (timeoutMillis <= 0) throw new ConfigurationException("timeoutMillis must be > 0");
        this.router = router;
        this.timeoutMillis = timeoutMillis;
        this.metrics = metrics;
    }

    /**
     * Sends a key-routed request to the owner of the partition {@code affinityKey} maps to.
     */
    public <T> T dispatch(byte[] affinityKey, KeyRoutedRequest request, ResponseReader<T> reader) {
        Route route;
        try {
            route = router.resolveNode(request.cacheId(), affinityKey);
        } catch (RoutingUnavailableException e) {
            metrics.recordRoutingFailure();
            throw e;
        }
        KeyRoutedRequest routed = request.withPartition(route.partition());
        log.debug("Dispatching {} for cache {} to {} (partition {})", routed.operation(), routed.cacheId(), route.node().nodeId(), route.partition());
        return call(route.node(), routed, reader);
    }

    /**
     * Sends a request any node can answer.
     */
    public <T> T dispatchAny(CacheRequest request, ResponseReader<T> reader) {
        NodeInfo node = router.anyNode();
        log.debug("Dispatching {} for cache {} to {}", request.operation(), request.cacheId(), node.nodeId());
        return call(node, request, reader);
    }

    /**
     * Sends the request to every node of the cache and returns one result per node.
     * All requests go out before any is awaited, and all share one deadline. If any node fails,
     * the first failure is thrown once every call has finished.
     */
    public <T> List<T> broadcast(CacheRequest request, ResponseReader<T> reader) {
        Set<NodeInfo> nodes = router.nodes(request.cacheId());
        if (nodes.isEmpty()) {
            metrics.recordRoutingFailure();
            throw new RoutingUnavailableException("No nodes to broadcast " + request.operation() + " to");
        }
        log.debug("Broadcasting {} for cache {} to {} nodes", request.operation(), request.cacheId(), nodes.size());

        Map<NodeInfo, CompletableFuture<CacheResponse>> futures = new LinkedHashMap<>();
        Map<NodeInfo, Timer.Sample> samples = new LinkedHashMap<>();
        for (NodeInfo node : nodes) {
            metrics.recordRequest();
            samples.put(node, metrics.startTimer());
            futures.put(node, send(node, request));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        List<T> results = new ArrayList<>(nodes.size());
        CacheException firstFailure = null;
        for (Map.Entry<NodeInfo, CompletableFuture<CacheResponse>> entry : futures.entrySet()) {
            NodeInfo node = entry.getKey();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                results.add(await(node, request, entry.getValue(), remaining, reader));
            } catch (CacheException e) {
                log.warn("{} on node {} failed: {}", request.operation(), node.nodeId(), e.getMessage());
                if (firstFailure == null) firstFailure = e;
            } finally {
                metrics.stopTimer(samples.get(node), request.operation());
            }
        }
        if (firstFailure != null) throw firstFailure;
        return results;
    }

    private <T> T call(NodeInfo node, CacheRequest request, ResponseReader<T> reader) {
        metrics.recordRequest();
        Timer.Sample sample = metrics.startTimer();
        try {
            return await(node, request, send(node, request), TimeUnit.MILLISECONDS.toNanos(timeoutMillis), reader);
        } finally {
            metrics.stopTimer(sample, request.operation());
        }
    }

    private CompletableFuture<CacheResponse> send(NodeInfo node, CacheRequest request) {
        try {
            return router.send(node, request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T await(NodeInfo node, CacheRequest request, CompletableFuture<CacheResponse> future,
                        long timeoutNanos, ResponseReader<T> reader) {
        CacheResponse response;
        try {
            response = future.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordTimeout();
            metrics.recordFailure();
            throw new CacheTimeoutException(request.operation() + " to " + node.nodeId() + " timed out after " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.recordFailure();
            throw new CacheConnectionException("Interrupted while waiting for " + request.operation() + " on " + node.nodeId(), e);
        } catch (CancellationException e) {
            metrics.recordFailure();
            throw new CacheConnectionException(request.operation() + " to " + node.nodeId() + " was cancelled", e);
        } catch (ExecutionException e) {
            metrics.recordFailure();
            throw translateTransportFailure(node, request, e.getCause());
        }

        if (!response.isSuccess()) {
            metrics.recordFailure();
            if (response.status() == ResponseStatus.NOT_PRIMARY) {
                metrics.recordRoutingFailure();
                throw new RoutingUnavailableException("Node " + node.nodeId() + " does not own the partition: "
                        + response.errorMessage() + "; refresh the affinity mapping and retry");
            }
            throw new ServerApplicationException(response.status(), response.errorMessage());
        }

        T result;
        try {
            result = reader.read(response.payload());
        } catch (SerializationException e) {
            metrics.recordFailure();
            throw e;
        }
        metrics.recordSuccess();
        return result;
    }

    private CacheException translateTransportFailure(NodeInfo node, CacheRequest request, Throwable cause) {
        if (cause instanceof DecoderException || cause instanceof SerializationException) {
            return new SerializationException("Malformed response to " + request.operation() + " from " + node.nodeId() + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof RoutingUnavailableException routing) return routing;
        return new CacheConnectionException(request.operation() + " to " + node.nodeId() + " failed: " + cause.getMessage(), cause);
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
