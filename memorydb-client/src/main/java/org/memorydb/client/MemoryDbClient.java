package org.memorydb.client;

import java.time.Duration;
import java.util.Optional;

import org.memorydb.client.config.MemoryDbConfig;

/**
 * Blocking facade over a single connection to a RESP compatible key-value store.
 *
 * <p>Every operation comes in two flavours. The {@code try*} methods return a {@link StoreResult} that tells a
 * missing key apart from the different failure causes. The plain methods collapse that into a boolean or an
 * {@link Optional}. Neither flavour throws on store failures; failures are logged instead.</p>
 *
 * <p>Instances hold one connection and are meant for a single caller.</p>
 */
public interface MemoryDbClient extends AutoCloseable {

    /**
     * Opens the connection and verifies it with {@code PING}.
     *
     * @return {@link ResultKind#SUCCESS} with the {@code PONG} reply, or the failure cause.
     */
    StoreResult<String> tryConnect();

    /**
     * Stores {@code value} under {@code key} without expiration ({@code SET}).
     */
    StoreResult<Void> trySet(String key, String value);

    /**
     * Stores {@code value} under {@code key}, expiring after {@code ttlSeconds} ({@code SETEX}).
     *
     * @throws IllegalArgumentException if {@code ttlSeconds} is not positive
     */
    StoreResult<Void> trySet(String key, String value, long ttlSeconds);

    /**
     * Looks up {@code key} ({@code GET}). A missing key yields {@link ResultKind#NOT_FOUND}.
     */
    StoreResult<String> tryGet(String key);

    /**
     * Deletes {@code key} ({@code DEL}). Yields the number of removed keys, or {@link ResultKind#NOT_FOUND}.
     */
    StoreResult<Long> tryDelete(String key);

    /**
     * Releases the connection. Safe to call more than once.
     */
    @Override
    void close();

    ConnectionState getState();

    MemoryDbConfig getConfig();

    default boolean connect() {
        return tryConnect().isSuccess();
    }

    default boolean setValue(String key, String value) {
        return trySet(key, value).isSuccess();
    }

    default boolean setValue(String key, String value, long ttlSeconds) {
        return trySet(key, value, ttlSeconds).isSuccess();
    }

    /**
     * @throws IllegalArgumentException if {@code ttl} is shorter than one second
     */
    default boolean setValue(String key, String value, Duration ttl) {
        long seconds = ttl.getSeconds();
        if (seconds < 1) {
            throw new IllegalArgumentException("ttl must be at least one second");
        }
        return setValue(key, value, seconds);
    }

    default Optional<String> getValue(String key) {
        return tryGet(key).getValue();
    }

    default boolean deleteKey(String key) {
        return tryDelete(key).isSuccess();
    }

    default boolean isConnected() {
        return getState() == ConnectionState.CONNECTED;
    }
}
