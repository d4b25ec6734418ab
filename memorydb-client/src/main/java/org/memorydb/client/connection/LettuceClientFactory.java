package org.memorydb.client.connection;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;
import org.memorydb.client.config.MemoryDbConfig;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.metrics.CommandLatencyCollectorOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;

/**
 * Creates the Lettuce {@link RedisClient} for one {@link LettuceMemoryDbClient} and owns its {@link ClientResources}.
 */
public class LettuceClientFactory {

    private static final Logger logger = Logger.getLogger(LettuceClientFactory.class);

    private final MemoryDbConfig config;
    private RedisClient redisClient;
    private ClientResources clientResources;

    public LettuceClientFactory(MemoryDbConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @return the client, created on first use. Creating a client performs no I/O.
     */
    public synchronized RedisClient create() {
        if (redisClient != null) {
            return redisClient;
        }

        ClientResources resources = DefaultClientResources.builder()
                .commandLatencyCollectorOptions(CommandLatencyCollectorOptions.disabled())
                .build();
        this.clientResources = resources;

        RedisClient client = RedisClient.create(resources, config.toRedisURI());
        client.setOptions(buildClientOptions(config));
        client.setDefaultTimeout(config.getCommandTimeout());
        this.redisClient = client;
        return client;
    }

    static ClientOptions buildClientOptions(MemoryDbConfig config) {
        TimeoutOptions timeoutOptions = TimeoutOptions.enabled(config.getCommandTimeout());
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(config.getConnectTimeout())
                .keepAlive(true)
                .tcpNoDelay(true)
                .build();

        // A lost connection must surface as a failed call, not as a silent reconnect.
        return ClientOptions.builder()
                .autoReconnect(false)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .pingBeforeActivateConnection(true)
                .timeoutOptions(timeoutOptions)
                .socketOptions(socketOptions)
                .build();
    }

    /**
     * Shuts down the client and its resources. A later {@link #create()} builds fresh ones.
     */
    public synchronized void close() {
        RedisClient client = this.redisClient;
        this.redisClient = null;
        if (client != null) {
            try {
                client.shutdown(config.getShutdownQuietPeriod(), config.getShutdownTimeout());
            } catch (RuntimeException ex) {
                logger.debugf(ex, "Graceful client shutdown failed; forcing shutdown");
                client.shutdown();
            }
        }

        ClientResources resources = this.clientResources;
        this.clientResources = null;
        if (resources != null) {
            resources.shutdown(config.getShutdownQuietPeriod().toMillis(), config.getShutdownTimeout().toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }
}
