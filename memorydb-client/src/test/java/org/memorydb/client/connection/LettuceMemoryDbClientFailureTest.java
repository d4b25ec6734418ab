package org.memorydb.client.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.memorydb.client.ConnectionState;
import org.memorydb.client.ResultKind;
import org.memorydb.client.StoreResult;
import org.memorydb.client.config.MemoryDbConfig;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;

class LettuceMemoryDbClientFailureTest {

    private LettuceClientFactory factory;
    private RedisClient redisClient;
    private StatefulRedisConnection<String, String> connection;
    private RedisCommands<String, String> commands;
    private LettuceMemoryDbClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        factory = mock(LettuceClientFactory.class);
        redisClient = mock(RedisClient.class);
        connection = mock(StatefulRedisConnection.class);
        commands = mock(RedisCommands.class);

        when(factory.create()).thenReturn(redisClient);
        when(redisClient.connect(StringCodec.UTF8)).thenReturn(connection);
        when(connection.sync()).thenReturn(commands);
        when(connection.isOpen()).thenReturn(true);
        when(commands.ping()).thenReturn("PONG");

        client = new LettuceMemoryDbClient(MemoryDbConfig.builder("cache.example.com").build(), factory);
    }

    @Test
    void shouldReportCommandTimeout() {
        when(commands.get("slow")).thenThrow(new RedisCommandTimeoutException("Command timed out after 5 second(s)"));
        assertTrue(client.connect());

        StoreResult<String> result = client.tryGet("slow");

        assertEquals(ResultKind.TIMEOUT, result.getKind());
        assertEquals(Optional.empty(), client.getValue("slow"));
        assertEquals(ConnectionState.CONNECTED, client.getState());
    }

    @Test
    void shouldReportLostConnectionOnWrite() {
        when(commands.set(anyString(), anyString())).thenThrow(new RedisConnectionException("Connection closed"));
        assertTrue(client.connect());

        assertEquals(ResultKind.CONNECTION_ERROR, client.trySet("k", "v").getKind());
    }

    @Test
    void shouldReportServerErrorOnExpiringWrite() {
        when(commands.setex(anyString(), anyLong(), anyString()))
                .thenThrow(new RedisCommandExecutionException("ERR invalid expire time in 'setex' command"));
        assertTrue(client.connect());

        StoreResult<Void> result = client.trySet("k", "v", 10);

        assertEquals(ResultKind.OTHER_ERROR, result.getKind());
        assertTrue(result.getMessage().contains("invalid expire time"));
    }

    @Test
    void shouldTreatUnexpectedSetReplyAsFailure() {
        when(commands.set("k", "v")).thenReturn(null);
        assertTrue(client.connect());

        assertFalse(client.setValue("k", "v"));
    }

    @Test
    void shouldIssueSetexOnlyWhenTtlGiven() {
        when(commands.set("k", "v")).thenReturn("OK");
        when(commands.setex("k", 60L, "v")).thenReturn("OK");
        assertTrue(client.connect());

        assertTrue(client.setValue("k", "v"));
        assertTrue(client.setValue("k", "v", 60));

        verify(commands, times(1)).set("k", "v");
        verify(commands, times(1)).setex("k", 60L, "v");
    }

    @Test
    void shouldReleaseResourcesWhenPingFails() {
        when(commands.ping()).thenThrow(new RedisCommandExecutionException("NOAUTH Authentication required."));

        StoreResult<String> result = client.tryConnect();

        assertEquals(ResultKind.AUTH_ERROR, result.getKind());
        assertEquals(ConnectionState.DISCONNECTED, client.getState());
        verify(connection).close();
        verify(factory).close();
    }

    @Test
    void shouldRejectUnexpectedPingReply() {
        when(commands.ping()).thenReturn("LOADING");

        assertEquals(ResultKind.OTHER_ERROR, client.tryConnect().getKind());
        assertEquals(ConnectionState.DISCONNECTED, client.getState());
    }

    @Test
    void shouldReportConnectFailureWithoutThrowing() {
        when(redisClient.connect(StringCodec.UTF8))
                .thenThrow(new RedisConnectionException("Unable to connect to cache.example.com:6379"));

        assertFalse(client.connect());
        verify(factory).close();
    }

    @Test
    void shouldNotTouchCommandsWhenNotConnected() {
        assertEquals(ResultKind.INVALID_STATE, client.tryGet("k").getKind());
        verify(commands, never()).get(anyString());
    }

    @Test
    void shouldCloseConnectionOnlyOnce() {
        assertTrue(client.connect());

        client.close();
        client.close();

        verify(connection, times(1)).close();
        assertEquals(ConnectionState.CLOSED, client.getState());
    }

    @Test
    void shouldDropClosedConnectionAfterFailedCommand() {
        when(commands.get("k")).thenThrow(new RedisException("Currently not connected. Commands are rejected."));
        assertTrue(client.connect());
        when(connection.isOpen()).thenReturn(false);

        StoreResult<String> result = client.tryGet("k");

        assertEquals(ResultKind.CONNECTION_ERROR, result.getKind());
        assertEquals(ConnectionState.DISCONNECTED, client.getState());
        verify(connection).close();
        verify(factory).close();
    }

    @Test
    void shouldKeepConnectionWhenCommandTimesOutOnOpenChannel() {
        when(commands.del("k")).thenThrow(new RedisCommandTimeoutException("Command timed out"));
        assertTrue(client.connect());

        assertEquals(ResultKind.TIMEOUT, client.tryDelete("k").getKind());
        assertEquals(ConnectionState.CONNECTED, client.getState());
        verify(connection, never()).close();
    }

    @Test
    void shouldReconnectWhenExistingConnectionIsDead() {
        assertTrue(client.connect());
        when(connection.isOpen()).thenReturn(false, true);

        assertTrue(client.connect());

        verify(redisClient, times(2)).connect(StringCodec.UTF8);
        assertEquals(ConnectionState.CONNECTED, client.getState());
    }

    @Test
    void shouldReconnectWhenLivenessCheckFails() {
        assertTrue(client.connect());
        when(commands.ping()).thenThrow(new RedisConnectionException("Connection closed")).thenReturn("PONG");

        assertTrue(client.connect());

        verify(redisClient, times(2)).connect(StringCodec.UTF8);
    }

    @Test
    void shouldNotReconnectWhenAlreadyConnected() {
        assertTrue(client.connect());
        assertTrue(client.connect());

        verify(redisClient, times(1)).connect(StringCodec.UTF8);
    }
}
