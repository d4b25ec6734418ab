package org.memorydb.client.connection;

import java.util.Objects;

import org.jboss.logging.Logger;
import org.memorydb.client.ConnectionState;
import org.memorydb.client.MemoryDbClient;
import org.memorydb.client.ResultKind;
import org.memorydb.client.StoreResult;
import org.memorydb.client.config.MemoryDbConfig;
import org.memorydb.client.metrics.MemoryDbMetrics;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;
import io.micrometer.core.instrument.Timer;

/**
 * {@link MemoryDbClient} backed by a single UTF-8 Lettuce connection.
 */
public class LettuceMemoryDbClient implements MemoryDbClient {

    private static final Logger logger = Logger.getLogger(LettuceMemoryDbClient.class);
    private static final String OK = "OK";
    private static final String PONG = "PONG";

    private final MemoryDbConfig config;
    private final LettuceClientFactory clientFactory;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private StatefulRedisConnection<String, String> connection;
    private RedisCommands<String, String> commands;

    public LettuceMemoryDbClient(MemoryDbConfig config) {
        this(config, new LettuceClientFactory(config));
    }

    LettuceMemoryDbClient(MemoryDbConfig config, LettuceClientFactory clientFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    @Override
    public synchronized StoreResult<String> tryConnect() {
        if (state == ConnectionState.CLOSED) {
            return rejected("connect");
        }
        if (state == ConnectionState.CONNECTED) {
            if (isAlive()) {
                return StoreResult.success(PONG);
            }
            dropConnection();
        }

        Timer.Sample sample = MemoryDbMetrics.startTimer();
        StatefulRedisConnection<String, String> created = null;
        try {
            RedisClient client = clientFactory.create();
            created = client.connect(StringCodec.UTF8);
            String reply = created.sync().ping();
            if (!PONG.equalsIgnoreCase(reply)) {
                releaseQuietly(created);
                return failed("connect", sample, ResultKind.OTHER_ERROR, "Unexpected PING reply: " + reply);
            }
            this.connection = created;
            this.commands = created.sync();
            this.state = ConnectionState.CONNECTED;
            logger.infof("Connected to MemoryDB cluster %s:%d", config.getEndpoint(), config.getPort());
            MemoryDbMetrics.record("connect", sample, ResultKind.SUCCESS);
            return StoreResult.success(reply);
        } catch (RuntimeException ex) {
            releaseQuietly(created);
            logger.debugf(ex, "Connection attempt to %s failed", config.getSanitizedEndpoint());
            return failed("connect", sample, StoreFailures.classify(ex),
                    "Failed to connect to " + config.getSanitizedEndpoint() + ": " + StoreFailures.describe(ex));
        }
    }

    @Override
    public synchronized StoreResult<Void> trySet(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (state != ConnectionState.CONNECTED) {
            return rejected("set");
        }
        Timer.Sample sample = MemoryDbMetrics.startTimer();
        try {
            return acknowledged("set", sample, key, commands.set(key, value));
        } catch (RuntimeException ex) {
            return failed("set", sample, key, ex);
        }
    }

    @Override
    public synchronized StoreResult<Void> trySet(String key, String value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
        if (state != ConnectionState.CONNECTED) {
            return rejected("setex");
        }
        Timer.Sample sample = MemoryDbMetrics.startTimer();
        try {
            return acknowledged("setex", sample, key, commands.setex(key, ttlSeconds, value));
        } catch (RuntimeException ex) {
            return failed("setex", sample, key, ex);
        }
    }

    @Override
    public synchronized StoreResult<String> tryGet(String key) {
        Objects.requireNonNull(key, "key");
        if (state != ConnectionState.CONNECTED) {
            return rejected("get");
        }
        Timer.Sample sample = MemoryDbMetrics.startTimer();
        try {
            String value = commands.get(key);
            if (value == null) {
                logger.debugf("Key %s not found", key);
                MemoryDbMetrics.record("get", sample, ResultKind.NOT_FOUND);
                return StoreResult.notFound();
            }
            logger.infof("Read key %s", key);
            MemoryDbMetrics.record("get", sample, ResultKind.SUCCESS);
            return StoreResult.success(value);
        } catch (RuntimeException ex) {
            return failed("get", sample, key, ex);
        }
    }

    @Override
    public synchronized StoreResult<Long> tryDelete(String key) {
        Objects.requireNonNull(key, "key");
        if (state != ConnectionState.CONNECTED) {
            return rejected("del");
        }
        Timer.Sample sample = MemoryDbMetrics.startTimer();
        try {
            Long removed = commands.del(key);
            if (removed == null || removed == 0L) {
                logger.debugf("Key %s did not exist", key);
                MemoryDbMetrics.record("del", sample, ResultKind.NOT_FOUND);
                return StoreResult.notFound();
            }
            logger.infof("Deleted key %s", key);
            MemoryDbMetrics.record("del", sample, ResultKind.SUCCESS);
            return StoreResult.success(removed);
        } catch (RuntimeException ex) {
            return failed("del", sample, key, ex);
        }
    }

    @Override
    public synchronized void close() {
        StatefulRedisConnection<String, String> current = this.connection;
        this.connection = null;
        this.commands = null;
        this.state = ConnectionState.CLOSED;
        if (current == null) {
            return;
        }
        releaseQuietly(current);
        MemoryDbMetrics.count("close", MemoryDbMetrics.Outcome.SUCCESS);
        logger.info("MemoryDB connection closed");
    }

    @Override
    public synchronized ConnectionState getState() {
        return state;
    }

    @Override
    public MemoryDbConfig getConfig() {
        return config;
    }

    private StoreResult<Void> acknowledged(String operation, Timer.Sample sample, String key, String reply) {
        if (!OK.equals(reply)) {
            return failed(operation, sample, ResultKind.OTHER_ERROR,
                    "Unexpected " + operation + " reply for key " + key + ": " + reply);
        }
        logger.infof("Stored key %s", key);
        MemoryDbMetrics.record(operation, sample, ResultKind.SUCCESS);
        return StoreResult.success(null);
    }

    private <T> StoreResult<T> failed(String operation, Timer.Sample sample, String key, RuntimeException ex) {
        logger.debugf(ex, "%s failed for key %s", operation, key);
        ResultKind kind = StoreFailures.classify(ex);
        if (connection != null && !connection.isOpen()) {
            kind = ResultKind.CONNECTION_ERROR;
            dropConnection();
        }
        return failed(operation, sample, kind, operation + " failed for key " + key + ": " + StoreFailures.describe(ex));
    }

    private <T> StoreResult<T> failed(String operation, Timer.Sample sample, ResultKind kind, String message) {
        logger.errorf("%s (%s)", message, kind);
        MemoryDbMetrics.record(operation, sample, kind);
        return StoreResult.failure(kind, message);
    }

    private <T> StoreResult<T> rejected(String operation) {
        String message = "Cannot " + operation + " while client is " + state;
        logger.error(message);
        MemoryDbMetrics.count(operation, MemoryDbMetrics.Outcome.FAILURE);
        return StoreResult.failure(ResultKind.INVALID_STATE, message);
    }

    private boolean isAlive() {
        if (connection == null || !connection.isOpen()) {
            return false;
        }
        try {
            return PONG.equalsIgnoreCase(commands.ping());
        } catch (RuntimeException ex) {
            logger.debugf(ex, "Liveness check against %s failed", config.getSanitizedEndpoint());
            return false;
        }
    }

    /**
     * Releases a connection that is no longer usable. Unlike {@link #close()} the client may connect again.
     */
    private void dropConnection() {
        StatefulRedisConnection<String, String> current = this.connection;
        this.connection = null;
        this.commands = null;
        this.state = ConnectionState.DISCONNECTED;
        releaseQuietly(current);
        logger.warnf("Lost connection to MemoryDB cluster %s", config.getSanitizedEndpoint());
    }

    private void releaseQuietly(StatefulRedisConnection<String, String> target) {
        if (target != null) {
            try {
                target.close();
            } catch (RuntimeException ex) {
                logger.debugf(ex, "Failed to close MemoryDB connection");
            }
        }
        try {
            clientFactory.close();
        } catch (RuntimeException ex) {
            logger.debugf(ex, "Failed to shut down MemoryDB client resources");
        }
    }
}
