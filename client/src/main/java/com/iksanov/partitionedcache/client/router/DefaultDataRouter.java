package com.iksanov.partitionedcache.client.router;

import com.iksanov.partitionedcache.client.transport.NodeTransport;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.exception.ConfigurationException;
import com.iksanov.partitionedcache.common.exception.RoutingUnavailableException;
import com.iksanov.partitionedcache.common.protocol.CacheRequest;
import com.iksanov.partitionedcache.common.protocol.CacheResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Router over a {@link NodeTransport}: keeps one immutable partition table per cache id
 * and the set of nodes learned from seeds and installed tables.
 */
public class DefaultDataRouter implements DataRouter {

    private static final Logger log = LoggerFactory.getLogger(DefaultDataRouter.class);
    private final NodeTransport transport;
    private final ConcurrentMap<Integer, PartitionTable> tables = new ConcurrentHashMap<>();
    private final Set<NodeInfo> knownNodes = ConcurrentHashMap.newKeySet();
    private final AtomicInteger nextNode = new AtomicInteger();

    public DefaultDataRouter(List<NodeInfo> seedNodes, NodeTransport transport) {
        if (seedNodes == null || seedNodes.isEmpty()) throw new ConfigurationException("No cache nodes configured");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.knownNodes.addAll(seedNodes);
        log.info("Router initialized with {} seed nodes", seedNodes.size());
    }

    @Override
    public Route resolveNode(int cacheId, byte[] affinityKey) {
        PartitionTable table = partitionTable(cacheId);
        if (table.isEmpty()) {
            throw new RoutingUnavailableException("No partition table for cache " + cacheId + ", call refreshAffinityMapping() first");
        }
        int partition = table.partitionFor(affinityKey);
        NodeInfo owner = table.owner(partition);
        log.trace("Routed cache {} partition {} to {}", cacheId, partition, owner.nodeId());
        return new Route(partition, owner);
    }

    @Override
    public NodeInfo anyNode() {
        List<NodeInfo> nodes = new ArrayList<>(knownNodes);
        if (nodes.isEmpty()) throw new RoutingUnavailableException("No cache nodes known");
        nodes.sort(Comparator.comparing(NodeInfo::nodeId));
        return nodes.get(Math.floorMod(nextNode.getAndIncrement(), nodes.size()));
    }

    @Override
    public Set<NodeInfo> nodes(int cacheId) {
        PartitionTable table = partitionTable(cacheId);
        if (!table.isEmpty()) return table.nodes();
        return Collections.unmodifiableSet(new LinkedHashSet<>(knownNodes));
    }

    @Override
    public CompletableFuture<CacheResponse> send(NodeInfo node, CacheRequest request) {
        return transport.send(node, request);
    }

    @Override
    public void installPartitionTable(int cacheId, PartitionTable table) {
        Objects.requireNonNull(table, "table");
        PartitionTable previous = tables.put(cacheId, table);
        knownNodes.addAll(table.nodes());
        if (!table.equals(previous)) {
            log.info("Installed partition table for cache {}: {} partitions over {} nodes", cacheId, table.partitionCount(), table.nodes().size());
        }
    }

    @Override
    public PartitionTable partitionTable(int cacheId) {
        return tables.getOrDefault(cacheId, PartitionTable.empty());
    }

    @Override
    public void close() {
        log.info("Closing router");
        transport.close();
    }
}
