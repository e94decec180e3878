package com.iksanov.partitionedcache.client.transport;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.protocol.CacheRequest;
import com.iksanov.partitionedcache.common.protocol.CacheResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Connections to cache nodes. Assigns correlation ids and completes each future with the matching response.
 */
public interface NodeTransport {

    CompletableFuture<CacheResponse> send(NodeInfo node, CacheRequest request);

    void close();
}
