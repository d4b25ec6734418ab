package org.memorydb.client.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.net.ConnectException;

import org.junit.jupiter.api.Test;
import org.memorydb.client.ResultKind;

import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisException;

class StoreFailuresTest {

    @Test
    void shouldClassifyTimeouts() {
        assertEquals(ResultKind.TIMEOUT, StoreFailures.classify(new RedisCommandTimeoutException("timed out")));
        assertEquals(ResultKind.TIMEOUT,
                StoreFailures.classify(new RedisException("wrapped", new RedisCommandTimeoutException("timed out"))));
    }

    @Test
    void shouldClassifyAuthenticationFailuresWrappedInConnectionErrors() {
        RedisConnectionException wrongPass = new RedisConnectionException("Unable to connect",
                new RedisCommandExecutionException("WRONGPASS invalid username-password pair or user is disabled."));
        assertEquals(ResultKind.AUTH_ERROR, StoreFailures.classify(wrongPass));
        assertEquals(ResultKind.AUTH_ERROR,
                StoreFailures.classify(new RedisCommandExecutionException("NOAUTH Authentication required.")));
        assertEquals(ResultKind.AUTH_ERROR,
                StoreFailures.classify(new RedisCommandExecutionException("ERR invalid password")));
    }

    @Test
    void shouldClassifyConnectionFailures() {
        assertEquals(ResultKind.CONNECTION_ERROR,
                StoreFailures.classify(new RedisConnectionException("Unable to connect to localhost:6379")));
        assertEquals(ResultKind.CONNECTION_ERROR,
                StoreFailures.classify(new RedisException(new ConnectException("Connection refused"))));
        assertEquals(ResultKind.CONNECTION_ERROR,
                StoreFailures.classify(new RedisException("Currently not connected. Commands are rejected.")));
        assertEquals(ResultKind.CONNECTION_ERROR, StoreFailures.classify(new RedisException("Connection closed")));
    }

    @Test
    void shouldFallBackToOtherError() {
        assertEquals(ResultKind.OTHER_ERROR, StoreFailures.classify(new RedisCommandExecutionException(
                "WRONGTYPE Operation against a key holding the wrong kind of value")));
        assertEquals(ResultKind.OTHER_ERROR, StoreFailures.classify(new IllegalStateException()));
    }

    @Test
    void shouldDescribeInnermostMessage() {
        RedisConnectionException failure = new RedisConnectionException("Unable to connect to localhost:6379",
                new IOException("Connection refused"));
        assertEquals("Connection refused", StoreFailures.describe(failure));
        assertEquals("IllegalStateException", StoreFailures.describe(new IllegalStateException()));
    }
}
