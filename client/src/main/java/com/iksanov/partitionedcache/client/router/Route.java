package com.iksanov.partitionedcache.client.router;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;

/**
 * Partition a key maps to and the node currently believed to own it.
 */
public record Route(int partition, NodeInfo node) {
}
