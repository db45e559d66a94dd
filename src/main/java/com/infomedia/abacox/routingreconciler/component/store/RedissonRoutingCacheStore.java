package com.infomedia.abacox.routingreconciler.component.store;

import com.infomedia.abacox.routingreconciler.exception.StoreConnectionMissingException;
import com.infomedia.abacox.routingreconciler.exception.StoreOperationFailedException;
import lombok.extern.log4j.Log4j2;
import org.redisson.Redisson;
import org.redisson.api.BatchOptions;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RKeysAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Redis routing cache reached through Redisson. The client is created on first
 * use and bound to the configured logical database.
 */
@Log4j2
public class RedissonRoutingCacheStore implements RoutingCacheStore {

    private final String url;
    private final int database;
    private final Function<Config, RedissonClient> clientFactory;

    private volatile RedissonClient client;

    public RedissonRoutingCacheStore(String url, int database) {
        this(url, database, Redisson::create);
    }

    RedissonRoutingCacheStore(String url, int database, Function<Config, RedissonClient> clientFactory) {
        this.url = url;
        this.database = database;
        this.clientFactory = clientFactory;
    }

    @Override
    public int getDatabase() {
        return database;
    }

    @Override
    public List<Long> deleteKeys(List<String> keys) {
        RedissonClient redisson = client();
        try {
            RBatch batch = redisson.createBatch(BatchOptions.defaults());
            RKeysAsync batchKeys = batch.getKeys();
            for (String key : keys) {
                batchKeys.deleteAsync(key);
            }
            BatchResult<?> result = batch.execute();

            List<Long> counts = new ArrayList<>(keys.size());
            for (Object response : result.getResponses()) {
                counts.add(response == null ? 0L : ((Number) response).longValue());
            }
            log.info("Deleted {} of {} routing key(s) in db {}",
                    counts.stream().mapToLong(Long::longValue).sum(), keys.size(), database);
            return counts;
        } catch (RedisException e) {
            log.error("Routing cache batch delete failed: {}", e.getMessage(), e);
            throw new StoreOperationFailedException("Routing cache delete failed: " + e.getMessage(), e);
        }
    }

    public void shutdown() {
        RedissonClient current = client;
        if (current != null && !current.isShutdown()) {
            log.info("Shutting down routing cache client");
            current.shutdown();
        }
    }

    private RedissonClient client() {
        RedissonClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (client == null) {
                if (url == null || url.isBlank()) {
                    throw new StoreConnectionMissingException("REDIS_URL missing");
                }
                try {
                    client = clientFactory.apply(toConfig(url, database));
                } catch (RedisException e) {
                    log.error("Could not connect to routing cache: {}", e.getMessage(), e);
                    throw new StoreOperationFailedException("Routing cache connection failed: " + e.getMessage(), e);
                }
            }
            return client;
        }
    }

    /**
     * Builds a single server config from a {@code redis://[user:password@]host:port[/db]} URL.
     * The database in the URL path is ignored in favour of {@code database}.
     */
    static Config toConfig(String redisUrl, int database) {
        URI uri = URI.create(redisUrl.trim());
        String scheme = uri.getScheme() == null ? "redis" : uri.getScheme();
        int port = uri.getPort() < 0 ? 6379 : uri.getPort();

        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(scheme + "://" + uri.getHost() + ":" + port)
                .setDatabase(database);

        if (uri.getRawUserInfo() != null) {
            String[] credentials = uri.getRawUserInfo().split(":", 2);
            if (credentials.length == 2) {
                if (!credentials[0].isEmpty()) {
                    server.setUsername(decode(credentials[0]));
                }
                server.setPassword(decode(credentials[1]));
            } else {
                server.setPassword(decode(credentials[0]));
            }
        }
        return config;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
