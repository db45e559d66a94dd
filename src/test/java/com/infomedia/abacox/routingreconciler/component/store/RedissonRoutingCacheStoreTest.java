package com.infomedia.abacox.routingreconciler.component.store;

import com.infomedia.abacox.routingreconciler.exception.StoreConnectionMissingException;
import com.infomedia.abacox.routingreconciler.exception.StoreOperationFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.BatchOptions;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RKeysAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedissonRoutingCacheStore Tests")
class RedissonRoutingCacheStoreTest {

    @Mock
    private RedissonClient client;
    @Mock
    private RBatch batch;
    @Mock
    private RKeysAsync batchKeys;

    @Test
    @DisplayName("all keys are deleted in one batch and counts keep key order")
    void deleteKeysInOneBatch() {
        when(client.createBatch(any(BatchOptions.class))).thenReturn(batch);
        when(batch.getKeys()).thenReturn(batchKeys);
        doReturn(new BatchResult<>(List.of(1L, 0L, 1L), 0)).when(batch).execute();

        RedissonRoutingCacheStore store = new RedissonRoutingCacheStore("redis://cache:6379", 9, config -> client);
        List<Long> counts = store.deleteKeys(List.of("nprn:routing:1", "nprn:routing:2", "nprn:routing:3"));

        assertThat(counts).containsExactly(1L, 0L, 1L);
        verify(batchKeys).deleteAsync("nprn:routing:1");
        verify(batchKeys).deleteAsync("nprn:routing:2");
        verify(batchKeys).deleteAsync("nprn:routing:3");
        verify(batch).execute();
    }

    @Test
    @DisplayName("the client is created once and reused")
    void clientIsReused() {
        when(client.createBatch(any(BatchOptions.class))).thenReturn(batch);
        when(batch.getKeys()).thenReturn(batchKeys);
        doReturn(new BatchResult<>(List.of(0L), 0)).when(batch).execute();
        AtomicInteger created = new AtomicInteger();

        RedissonRoutingCacheStore store = new RedissonRoutingCacheStore("redis://cache:6379", 9, config -> {
            created.incrementAndGet();
            return client;
        });
        store.deleteKeys(List.of("nprn:routing:1"));
        store.deleteKeys(List.of("nprn:routing:1"));

        assertThat(created).hasValue(1);
    }

    @Test
    @DisplayName("a missing url is reported without creating a client")
    void missingUrl() {
        AtomicInteger created = new AtomicInteger();
        RedissonRoutingCacheStore store = new RedissonRoutingCacheStore("", 9, config -> {
            created.incrementAndGet();
            return client;
        });

        assertThatThrownBy(() -> store.deleteKeys(List.of("nprn:routing:1")))
                .isInstanceOf(StoreConnectionMissingException.class)
                .hasMessage("REDIS_URL missing");
        assertThat(created).hasValue(0);
    }

    @Test
    @DisplayName("a failing batch surfaces as a store failure")
    void batchFailure() {
        when(client.createBatch(any(BatchOptions.class))).thenReturn(batch);
        when(batch.getKeys()).thenReturn(batchKeys);
        doThrow(new RedisException("connection reset")).when(batch).execute();

        RedissonRoutingCacheStore store = new RedissonRoutingCacheStore("redis://cache:6379", 9, config -> client);

        assertThatThrownBy(() -> store.deleteKeys(List.of("nprn:routing:1")))
                .isInstanceOf(StoreOperationFailedException.class)
                .extracting("kind").isEqualTo("StoreOperationFailed");
    }

    @Test
    @DisplayName("the url is mapped to a single server config on the configured database")
    void toConfig() {
        Config config = RedissonRoutingCacheStore.toConfig("redis://:pa%3Ass@cache.local:6380/0", 9);
        SingleServerConfig server = config.useSingleServer();

        assertThat(server.getAddress()).isEqualTo("redis://cache.local:6380");
        assertThat(server.getDatabase()).isEqualTo(9);
        assertThat(server.getPassword()).isEqualTo("pa:ss");
        assertThat(server.getUsername()).isNull();
    }

    @Test
    @DisplayName("a url without port uses the default port")
    void toConfigDefaultPort() {
        Config config = RedissonRoutingCacheStore.toConfig("redis://cache", 3);

        assertThat(config.useSingleServer().getAddress()).isEqualTo("redis://cache:6379");
        assertThat(config.useSingleServer().getDatabase()).isEqualTo(3);
    }
}
