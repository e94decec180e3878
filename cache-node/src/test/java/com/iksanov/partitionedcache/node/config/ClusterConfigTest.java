package com.iksanov.partitionedcache.node.config;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ClusterConfigTest {

    private static final String JSON = """
            {
              "partitions": 64,
              "virtualNodes": 50,
              "nodes": ["node-1:localhost:7000", "node-2:localhost:7001"],
              "caches": ["users"],
              "comment": "ignored"
            }
            """;

    @Test
    @DisplayName("parse() should read members, partitions and declared caches")
    void parses() {
        ClusterConfig config = ClusterConfig.parse(JSON);

        assertThat(config.partitions()).isEqualTo(64);
        assertThat(config.virtualNodes()).isEqualTo(50);
        assertThat(config.caches()).containsExactly("users");
        assertThat(config.nodeInfos()).extracting(NodeInfo::nodeId).containsExactly("node-1", "node-2");
        assertThat(config.self("node-2").port()).isEqualTo(7001);
    }

    @Test
    @DisplayName("Missing partition settings should fall back to defaults")
    void defaults() {
        ClusterConfig config = ClusterConfig.parse("{\"nodes\":[\"node-1:localhost:7000\"]}");

        assertThat(config.partitions()).isEqualTo(ClusterConfig.DEFAULT_PARTITIONS);
        assertThat(config.virtualNodes()).isEqualTo(ClusterConfig.DEFAULT_VIRTUAL_NODES);
        assertThat(config.caches()).isEmpty();
    }

    @Test
    @DisplayName("Every node should derive the same partition table from the same config")
    void deterministicTable() {
        PartitionTable first = ClusterConfig.parse(JSON).partitionTable();
        PartitionTable second = ClusterConfig.parse(JSON).partitionTable();

        assertThat(first).isEqualTo(second);
        assertThat(first.partitionCount()).isEqualTo(64);
        assertThat(first.nodes()).hasSize(2);
    }

    @Test
    @DisplayName("Invalid input should raise ConfigurationException")
    void invalid() {
        assertThatThrownBy(() -> ClusterConfig.parse("not json")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> ClusterConfig.parse("{\"nodes\":[\"bad-address\"]}").nodeInfos())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> ClusterConfig.parse(JSON).self("node-9"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("node-9");
        assertThatThrownBy(() -> ClusterConfig.parse("{}").partitionTable()).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void singleNode() {
        NodeInfo self = new NodeInfo("solo", "localhost", 7100);
        ClusterConfig config = ClusterConfig.singleNode(self);

        assertThat(config.self("solo")).isEqualTo(self);
        assertThat(config.partitionTable().nodes()).containsExactly(self);
    }
}
