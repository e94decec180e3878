package com.iksanov.partitionedcache.common.cluster;

import com.iksanov.partitionedcache.common.cluster.sharding.ConsistentHashRing;
import com.iksanov.partitionedcache.common.util.HashUtils;

import java.util.*;

/**
 * Immutable mapping from partition number to the node that is its primary owner.
 * <p>
 * Instances are never mutated after construction: a topology refresh builds a new table
 * and swaps it in, so readers always see a complete, consistent snapshot.
 */
public final class PartitionTable {

    private static final PartitionTable EMPTY = new PartitionTable(new NodeInfo[0]);

    private final NodeInfo[] owners;
    private final Set<NodeInfo> nodes;

    private PartitionTable(NodeInfo[] owners) {
        this.owners = owners;
        this.nodes = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(owners)));
    }

    public static PartitionTable empty() {
        return EMPTY;
    }

    /**
     * @param owners owner of each partition, indexed by partition number; no gaps allowed
     */
    public static PartitionTable of(List<NodeInfo> owners) {
        Objects.requireNonNull(owners, "owners");
        NodeInfo[] copy = owners.toArray(new NodeInfo[0]);
        for (int p = 0; p < copy.length; p++) {
            if (copy[p] == null) throw new IllegalArgumentException("Partition " + p + " has no owner");
        }
        return copy.length == 0 ? EMPTY : new PartitionTable(copy);
    }

    /**
     * Assigns each partition to the ring node that owns the token {@code "partition-<n>"}.
     */
    public static PartitionTable fromRing(ConsistentHashRing ring, int partitionCount) {
        Objects.requireNonNull(ring, "ring");
        if (partitionCount <= 0) throw new IllegalArgumentException("partitionCount must be > 0");
        if (ring.ringSize() == 0) throw new IllegalArgumentException("ring has no nodes");
        NodeInfo[] owners = new NodeInfo[partitionCount];
        for (int p = 0; p < partitionCount; p++) {
            owners[p] = ring.getNodeForKey("partition-" + p);
        }
        return new PartitionTable(owners);
    }

    public boolean isEmpty() {
        return owners.length == 0;
    }

    public int partitionCount() {
        return owners.length;
    }

    public int partitionFor(byte[] affinityKey) {
        if (isEmpty()) throw new IllegalStateException("partition table is empty");
        return HashUtils.partition(affinityKey, owners.length);
    }

    public NodeInfo owner(int partition) {
        if (partition < 0 || partition >= owners.length) return null;
        return owners[partition];
    }

    public boolean isOwner(NodeInfo node, int partition) {
        NodeInfo owner = owner(partition);
        return owner != null && owner.equals(node);
    }

    /**
     * @return distinct owners in order of first appearance
     */
    public Set<NodeInfo> nodes() {
        return nodes;
    }

    public Map<NodeInfo, List<Integer>> partitionsByNode() {
        Map<NodeInfo, List<Integer>> result = new LinkedHashMap<>();
        for (int p = 0; p < owners.length; p++) {
            result.computeIfAbsent(owners[p], n -> new ArrayList<>()).add(p);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionTable that)) return false;
        if (owners.length != that.owners.length) return false;
        for (int p = 0; p < owners.length; p++) {
            NodeInfo a = owners[p];
            NodeInfo b = that.owners[p];
            if (!a.equals(b) || !a.host().equals(b.host()) || a.port() != b.port()) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(owners);
    }

    @Override
    public String toString() {
        return "PartitionTable[partitions=%d, nodes=%d]".formatted(owners.length, nodes.size());
    }
}
