package org.memorydb.client;

/**
 * Lifecycle of a {@link MemoryDbClient}. {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    CLOSED
}
