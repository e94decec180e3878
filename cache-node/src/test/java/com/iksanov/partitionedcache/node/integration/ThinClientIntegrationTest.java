package com.iksanov.partitionedcache.node.integration;

import com.iksanov.partitionedcache.client.CacheClient;
import com.iksanov.partitionedcache.client.ThinClient;
import com.iksanov.partitionedcache.client.binary.AffinityKey;
import com.iksanov.partitionedcache.client.binary.BinaryObject;
import com.iksanov.partitionedcache.client.binary.BinaryWriter;
import com.iksanov.partitionedcache.client.binary.WritableKeyImpl;
import com.iksanov.partitionedcache.client.config.ClientConfig;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.exception.CacheConnectionException;
import com.iksanov.partitionedcache.common.exception.SerializationException;
import com.iksanov.partitionedcache.common.util.CacheIds;
import com.iksanov.partitionedcache.node.app.CacheNode;
import com.iksanov.partitionedcache.node.config.ApplicationConfig;
import com.iksanov.partitionedcache.node.config.ClusterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Two real nodes on loopback and a {@link ThinClient} talking to them over TCP.
 */
@DisplayName("ThinClient against a two-node cluster")
class ThinClientIntegrationTest {

    private CacheNode node1;
    private CacheNode node2;
    private ThinClient client;
    private CacheClient<String, String> users;

    @BeforeEach
    void setUp() throws IOException {
        int port1 = freePort();
        int port2 = freePort();
        List<String> members = List.of("node-1:127.0.0.1:" + port1, "node-2:127.0.0.1:" + port2);
        ClusterConfig cluster = new ClusterConfig(64, 50, members, List.of("users"));

        node1 = new CacheNode(nodeConfig("node-1", port1), cluster);
        node2 = new CacheNode(nodeConfig("node-2", port2), cluster);
        node1.start();
        node2.start();

        ClientConfig config = new ClientConfig();
        config.setNodes(String.join(",", members));
        config.getConnection().setTimeoutMillis(5000);
        config.getNearCache().setEnabled(true);
        client = ThinClient.start(config);
        users = client.cache("users", String.class);
    }

    @AfterEach
    void tearDown() {
        if (users != null) users.close();
        if (client != null) client.close();
        if (node1 != null && node1.isRunning()) node1.stop();
        if (node2 != null && node2.isRunning()) node2.stop();
    }

    private static ApplicationConfig nodeConfig(String nodeId, int port) {
        return new ApplicationConfig(nodeId, "127.0.0.1", "127.0.0.1", port, 0, 10_000, 0, true, 1024 * 1024);
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    private int storedOn(CacheNode node, String cacheName) {
        return node.registry().get(CacheIds.cacheId(cacheName)).size();
    }

    private NodeInfo ownerOf(String key) {
        PartitionTable table = node1.processor().getPartitionTable();
        return table.owner(table.partitionFor(BinaryWriter.encode(new WritableKeyImpl<>(key))));
    }

    @Test
    @DisplayName("put() then get() should round-trip values")
    void putAndGet() {
        users.put("alice", "admin");
        users.put("bob", "viewer");

        assertThat(users.get("alice")).isEqualTo("admin");
        assertThat(users.get("bob")).isEqualTo("viewer");
        assertThat(users.get("carol")).isNull();
        assertThat(users.containsKey("alice")).isTrue();
        assertThat(users.containsKey("carol")).isFalse();
    }

    @Test
    @DisplayName("Entries should be spread over both nodes and counted once by getSize()")
    void sizeAcrossNodes() {
        for (int i = 0; i < 200; i++) users.put("key-" + i, "value-" + i);

        assertThat(storedOn(node1, "users")).isPositive();
        assertThat(storedOn(node2, "users")).isPositive();
        assertThat(storedOn(node1, "users") + storedOn(node2, "users")).isEqualTo(200);
        assertThat(users.getSize()).isEqualTo(200);
    }

    @Test
    @DisplayName("Each key should be stored on the owner of its partition")
    void storedOnOwner() {
        users.put("routed", "value");

        CacheNode owner = ownerOf("routed").nodeId().equals("node-1") ? node1 : node2;
        CacheNode other = owner == node1 ? node2 : node1;
        assertThat(storedOn(owner, "users")).isEqualTo(1);
        assertThat(storedOn(other, "users")).isZero();
    }

    @Test
    @DisplayName("remove() should return true once and then false")
    void removeSemantics() {
        users.put("k", "v");

        assertThat(users.remove("k")).isTrue();
        assertThat(users.remove("k")).isFalse();
        assertThat(users.get("k")).isNull();
    }

    @Test
    @DisplayName("clear(key), removeAll() and clear() should empty what they target")
    void clearing() {
        for (int i = 0; i < 20; i++) users.put("key-" + i, "v");

        users.clear("key-0");
        assertThat(users.containsKey("key-0")).isFalse();
        assertThat(users.getSize()).isEqualTo(19);

        users.removeAll();
        assertThat(users.getSize()).isZero();

        users.put("again", "v");
        users.clear();
        assertThat(users.getSize()).isZero();
        assertThat(users.localPeek("again")).isNull();
    }

    @Test
    @DisplayName("refreshAffinityMapping() should be idempotent")
    void refreshIsIdempotent() {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 100; i++) keys.add("key-" + i);

        users.refreshAffinityMapping();
        PartitionTable first = users.unwrap().affinityMapping();
        List<NodeInfo> firstRoutes = routes(keys);

        users.refreshAffinityMapping();
        PartitionTable second = users.unwrap().affinityMapping();
        List<NodeInfo> secondRoutes = routes(keys);

        assertThat(second).isEqualTo(first);
        assertThat(first).isEqualTo(node1.processor().getPartitionTable());
        assertThat(secondRoutes).isEqualTo(firstRoutes);
        assertThat(firstRoutes).extracting(NodeInfo::nodeId).contains("node-1", "node-2");
        for (int i = 0; i < keys.size(); i++) {
            assertThat(firstRoutes.get(i)).isEqualTo(ownerOf(keys.get(i)));
        }
    }

    private List<NodeInfo> routes(List<String> keys) {
        List<NodeInfo> routes = new ArrayList<>(keys.size());
        for (String key : keys) routes.add(users.unwrap().primaryNode(new WritableKeyImpl<>(key)));
        return routes;
    }

    @Test
    @DisplayName("get() through a handle of another value type should raise SerializationException")
    void valueTypeMismatch() {
        users.put("k", "v");

        try (CacheClient<String, Integer> numbers = client.cache("users", Integer.class)) {
            assertThatThrownBy(() -> numbers.get("k"))
                    .isInstanceOf(SerializationException.class)
                    .hasMessageContaining("java.lang.Integer");
        }
        assertThat(users.get("k")).isEqualTo("v");
    }

    @Test
    @DisplayName("localPeek() should answer from the near cache without a network call")
    void localPeekIsLocal() {
        users.put("k", "v");
        double before = node1.netMetrics().getRequestCount() + node2.netMetrics().getRequestCount();

        assertThat(users.localPeek("k")).isEqualTo("v");
        assertThat(users.localPeek("unknown")).isNull();

        double after = node1.netMetrics().getRequestCount() + node2.netMetrics().getRequestCount();
        assertThat(after).isEqualTo(before);
    }

    @Test
    @DisplayName("Keys with the same affinity should land on the same node")
    void affinityColocation() {
        try (CacheClient<AffinityKey<String, String>, String> orders = client.cache("orders", String.class)) {
            for (int i = 0; i < 10; i++) {
                orders.put(new AffinityKey<>("order-" + i, "customer-7"), "item-" + i);
            }

            assertThat(orders.get(new AffinityKey<>("order-3", "customer-7"))).isEqualTo("item-3");
            int onFirst = storedOn(node1, "orders");
            int onSecond = storedOn(node2, "orders");
            assertThat(List.of(onFirst, onSecond)).containsExactlyInAnyOrder(10, 0);
        }
    }

    @Test
    @DisplayName("withKeepBinary() should return values in binary form")
    void keepBinary() {
        users.put("k", "v");

        try (CacheClient<String, BinaryObject> binary = users.withKeepBinary()) {
            BinaryObject value = binary.get("k");
            assertThat(value).isNotNull();
            assertThat(value.deserialize()).isEqualTo("v");
        }
    }

    @Test
    @DisplayName("Concurrent callers with disjoint keys should all see their own writes")
    void concurrentDisjointKeys() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        String key = "t" + thread + "-" + i;
                        users.put(key, key.toUpperCase());
                        assertThat(users.get(key)).isEqualTo(key.toUpperCase());
                    }
                }));
            }
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(users.getSize()).isEqualTo(400);
    }

    @Test
    @DisplayName("Requests to a stopped owner should fail with CacheConnectionException")
    void ownerDown() {
        String key = null;
        for (int i = 0; key == null; i++) {
            if (ownerOf("candidate-" + i).nodeId().equals("node-2")) key = "candidate-" + i;
        }
        node2.stop();
        String target = key;

        assertThatThrownBy(() -> users.get(target)).isInstanceOf(CacheConnectionException.class);
    }
}
