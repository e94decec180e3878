package com.iksanov.partitionedcache.client;

import com.iksanov.partitionedcache.client.config.ClientConfig;
import com.iksanov.partitionedcache.client.metrics.ClientMetrics;
import com.iksanov.partitionedcache.client.router.DataRouter;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.codec.ResponsePayloads;
import com.iksanov.partitionedcache.common.exception.CacheConnectionException;
import com.iksanov.partitionedcache.common.exception.ConfigurationException;
import com.iksanov.partitionedcache.common.protocol.CacheResponse;
import com.iksanov.partitionedcache.common.util.CacheIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ThinClient lifecycle")
class ThinClientTest {

    @Mock
    private DataRouter router;

    private NodeInfo node;
    private ThinClient client;

    @BeforeEach
    void setUp() {
        node = new NodeInfo("node-1", "localhost", 7000);
        ClientConfig config = new ClientConfig();
        config.setNodes("node-1:localhost:7000");
        client = new ThinClient(config, router, new ClientMetrics());
    }

    @Test
    @DisplayName("cache() should fetch and install the partition table")
    void cacheFetchesTable() {
        PartitionTable table = PartitionTable.of(List.of(node));
        when(router.anyNode()).thenReturn(node);
        when(router.send(eq(node), any())).thenReturn(CompletableFuture.completedFuture(CacheResponse.ok(1, ResponsePayloads.partitions(table))));

        CacheClient<String, String> cache = client.cache("users", String.class);

        assertThat(cache.getName()).isEqualTo("users");
        verify(router).installPartitionTable(CacheIds.cacheId("users"), table);
    }

    @Test
    @DisplayName("cache() should still return a handle when the initial table fetch fails")
    void cacheSurvivesFetchFailure() {
        when(router.anyNode()).thenReturn(node);
        when(router.send(eq(node), any())).thenReturn(CompletableFuture.failedFuture(new CacheConnectionException("refused")));

        CacheClient<String, String> cache = client.cache("users", String.class);

        assertThat(cache).isNotNull();
        verify(router, never()).installPartitionTable(anyInt(), any());
    }

    @Test
    @DisplayName("Router should be closed only after the client and all handles are closed")
    void routerClosedByLastOwner() {
        when(router.anyNode()).thenReturn(node);
        when(router.send(eq(node), any())).thenReturn(CompletableFuture.failedFuture(new CacheConnectionException("refused")));
        CacheClient<String, String> users = client.cache("users", String.class);
        CacheClient<String, String> orders = client.cache("orders", String.class);

        client.close();
        users.close();
        verify(router, never()).close();

        orders.close();
        verify(router).close();
    }

    @Test
    @DisplayName("cache() on a closed client should fail")
    void cacheAfterClose() {
        client.close();
        assertThatThrownBy(() -> client.cache("users")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("start() should refuse a config without nodes")
    void startWithoutNodes() {
        assertThatThrownBy(() -> ThinClient.start(new ClientConfig())).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Invalid node addresses should raise ConfigurationException")
    void invalidNodeAddress() {
        ClientConfig config = new ClientConfig();
        config.setNodes("node-1:localhost:7000, broken");
        assertThat(config.getNodes()).containsExactly("node-1:localhost:7000", "broken");
        assertThatThrownBy(config::nodeInfos).isInstanceOf(ConfigurationException.class);
    }
}
