package com.iksanov.partitionedcache.client.router;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.protocol.CacheRequest;
import com.iksanov.partitionedcache.common.protocol.CacheResponse;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routing and transport seam used by the dispatcher.
 * Implementations must be safe for concurrent use.
 */
public interface DataRouter extends AutoCloseable {

    /**
     * Maps affinity bytes onto a partition and its owner using the cache's current partition table.
     *
     * @throws com.iksanov.partitionedcache.common.exception.RoutingUnavailableException if no table is installed
     */
    Route resolveNode(int cacheId, byte[] affinityKey);

    /**
     * @return some known node, for requests any node can answer
     */
    NodeInfo anyNode();

    /**
     * @return the owners in the cache's table, or every known node when no table is installed
     */
    Set<NodeInfo> nodes(int cacheId);

    /**
     * Sends a request. The returned future completes with the node's response or exceptionally on
     * transport failure; cancelling it drops the pending request.
     */
    CompletableFuture<CacheResponse> send(NodeInfo node, CacheRequest request);

    /**
     * Replaces the cache's partition table as one atomic step.
     */
    void installPartitionTable(int cacheId, PartitionTable table);

    /**
     * @return the installed table, or {@link PartitionTable#empty()}
     */
    PartitionTable partitionTable(int cacheId);

    @Override
    void close();
}
