package org.memorydb.client;

/**
 * Outcome categories reported by {@link StoreResult}.
 */
public enum ResultKind {
    SUCCESS,
    /** The key does not exist. Not a failure. */
    NOT_FOUND,
    CONNECTION_ERROR,
    AUTH_ERROR,
    TIMEOUT,
    /** The client was not connected, or already closed. */
    INVALID_STATE,
    OTHER_ERROR;

    public boolean isFailure() {
        return this != SUCCESS && this != NOT_FOUND;
    }
}
