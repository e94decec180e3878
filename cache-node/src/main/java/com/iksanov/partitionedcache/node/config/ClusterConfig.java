package com.iksanov.partitionedcache.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.cluster.sharding.ConsistentHashRing;
import com.iksanov.partitionedcache.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cluster layout shared by every node: the member list and the partition settings.
 * Nodes configured with the same layout derive the same {@link PartitionTable}.
 * <p>
 * Expected JSON in {@code CACHE_CLUSTER_CONFIG}:
 * <pre>
 * {
 *   "partitions": 1024,
 *   "virtualNodes": 100,
 *   "nodes": ["node-1:10.0.0.1:7000", "node-2:10.0.0.2:7000"],
 *   "caches": ["users", "sessions"]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterConfig(int partitions, int virtualNodes, List<String> nodes, List<String> caches) {
    private static final Logger log = LoggerFactory.getLogger(ClusterConfig.class);
    public static final int DEFAULT_PARTITIONS = 1024;
    public static final int DEFAULT_VIRTUAL_NODES = 100;

    public ClusterConfig {
        if (partitions <= 0) partitions = DEFAULT_PARTITIONS;
        if (virtualNodes <= 0) virtualNodes = DEFAULT_VIRTUAL_NODES;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        caches = caches == null ? List.of() : List.copyOf(caches);
    }

    public static ClusterConfig fromEnv(NodeInfo self) {
        String json = System.getenv("CACHE_CLUSTER_CONFIG");
        if (json == null || json.isBlank()) {
            log.warn("CACHE_CLUSTER_CONFIG not set, running as a single-node cluster ({})", self.toAddressString());
            return singleNode(self);
        }
        return parse(json);
    }

    public static ClusterConfig parse(String json) {
        try {
            ClusterConfig config = new ObjectMapper().readValue(json, ClusterConfig.class);
            log.info("Loaded cluster config: {} node(s), {} partitions", config.nodes().size(), config.partitions());
            return config;
        } catch (Exception e) {
            log.error("Expected format: {\"partitions\":1024,\"nodes\":[\"node-1:host:7000\"],\"caches\":[\"name\"]}");
            throw new ConfigurationException("Invalid CACHE_CLUSTER_CONFIG: " + e.getMessage(), e);
        }
    }

    public static ClusterConfig singleNode(NodeInfo self) {
        return new ClusterConfig(DEFAULT_PARTITIONS, DEFAULT_VIRTUAL_NODES, List.of(self.toAddressString()), List.of());
    }

    public List<NodeInfo> nodeInfos() {
        List<NodeInfo> result = new ArrayList<>(nodes.size());
        for (String address : nodes) {
            try {
                result.add(NodeInfo.fromString(address));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid node address '" + address + "': " + e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * @return the member whose id is {@code nodeId}
     * @throws ConfigurationException if this node is not listed
     */
    public NodeInfo self(String nodeId) {
        return nodeInfos().stream()
                .filter(n -> n.nodeId().equals(nodeId))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Node " + nodeId + " is not a member of the cluster " + nodes));
    }

    public PartitionTable partitionTable() {
        List<NodeInfo> members = nodeInfos();
        if (members.isEmpty()) throw new ConfigurationException("Cluster has no nodes");
        ConsistentHashRing ring = new ConsistentHashRing(virtualNodes);
        members.forEach(ring::addNode);
        return PartitionTable.fromRing(ring, partitions);
    }
}
