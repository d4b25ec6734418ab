package org.memorydb.client.connection;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;

import org.memorydb.client.ResultKind;

import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;

/**
 * Maps exceptions raised by Lettuce to {@link ResultKind} values.
 */
final class StoreFailures {

    private static final int MAX_CAUSE_DEPTH = 16;
    private static final String[] AUTH_PREFIXES = {"WRONGPASS", "NOAUTH", "NOPERM"};
    private static final String[] AUTH_FRAGMENTS = {"invalid password", "invalid username-password",
            "without any password configured"};
    private static final String[] DISCONNECTED_FRAGMENTS = {"currently not connected", "connection closed"};

    private StoreFailures() {
    }

    static ResultKind classify(Throwable failure) {
        if (findCause(failure, RedisCommandTimeoutException.class) != null) {
            return ResultKind.TIMEOUT;
        }
        if (hasAuthMessage(failure)) {
            return ResultKind.AUTH_ERROR;
        }
        if (findCause(failure, RedisConnectionException.class) != null
                || findCause(failure, ConnectException.class) != null
                || findCause(failure, UnknownHostException.class) != null
                || findCause(failure, ClosedChannelException.class) != null
                || hasDisconnectedMessage(failure)) {
            return ResultKind.CONNECTION_ERROR;
        }
        return ResultKind.OTHER_ERROR;
    }

    /**
     * @return the message of the innermost cause, which is the one naming the actual problem.
     */
    static String describe(Throwable failure) {
        Throwable current = failure;
        String message = null;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current.getMessage() != null && !current.getMessage().isBlank()) {
                message = current.getMessage();
            }
            current = current.getCause();
        }
        return message != null ? message : failure.getClass().getSimpleName();
    }

    private static boolean hasAuthMessage(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String message = current.getMessage();
            if (message != null && isAuthMessage(message)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean hasDisconnectedMessage(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String fragment : DISCONNECTED_FRAGMENTS) {
                    if (lower.contains(fragment)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isAuthMessage(String message) {
        String trimmed = message.trim();
        for (String prefix : AUTH_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String fragment : AUTH_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static <T extends Throwable> T findCause(Throwable failure, Class<T> type) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
