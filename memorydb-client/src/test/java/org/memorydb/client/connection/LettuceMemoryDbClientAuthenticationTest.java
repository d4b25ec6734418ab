package org.memorydb.client.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.memorydb.client.ConnectionState;
import org.memorydb.client.MemoryDbClient;
import org.memorydb.client.ResultKind;
import org.memorydb.client.StoreResult;
import org.memorydb.client.testing.EmbeddedRedisServer;

class LettuceMemoryDbClientAuthenticationTest {

    private static final String PASSWORD = "s3cret-pass";

    private static EmbeddedRedisServer server;

    @BeforeAll
    static void startServer() {
        server = EmbeddedRedisServer.builder()
                .startupTimeout(Duration.ofSeconds(5))
                .requirePassword(PASSWORD)
                .start();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void shouldAuthenticateWithPasswordOnly() {
        try (MemoryDbClient client = new LettuceMemoryDbClient(server.configBuilder().password(PASSWORD).build())) {
            assertTrue(client.connect());
            assertTrue(client.setValue("auth-key", "value"));
            assertEquals(Optional.of("value"), client.getValue("auth-key"));
        }
    }

    @Test
    void shouldAuthenticateWithUsernameAndPassword() {
        try (MemoryDbClient client = new LettuceMemoryDbClient(server.configBuilder()
                .username("default")
                .password(PASSWORD)
                .build())) {
            assertTrue(client.connect());
            assertEquals(ConnectionState.CONNECTED, client.getState());
        }
    }

    @Test
    void shouldReportWrongPasswordAsAuthError() {
        try (MemoryDbClient client = new LettuceMemoryDbClient(server.configBuilder().password("wrong").build())) {
            StoreResult<String> result = client.tryConnect();

            assertEquals(ResultKind.AUTH_ERROR, result.getKind());
            assertEquals(ConnectionState.DISCONNECTED, client.getState());
        }
    }

    @Test
    void shouldReportMissingCredentialsAsAuthError() {
        try (MemoryDbClient client = new LettuceMemoryDbClient(server.configBuilder().build())) {
            assertFalse(client.connect());
            assertEquals(ResultKind.AUTH_ERROR, client.tryConnect().getKind());
        }
    }
}
