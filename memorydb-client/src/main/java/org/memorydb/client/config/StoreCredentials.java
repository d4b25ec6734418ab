package org.memorydb.client.config;

import java.util.Objects;

import io.lettuce.core.RedisURI;

/**
 * Authentication settings resolved from an optional username/password pair.
 *
 * <p>Exactly one of three modes applies: no authentication, legacy password-only {@code AUTH}, or ACL style
 * {@code AUTH username password}. A username without a password is rejected.</p>
 */
public final class StoreCredentials {

    private static final StoreCredentials NONE = new StoreCredentials(Mode.NONE, null, null);

    private final Mode mode;
    private final String username;
    private final String password;

    private StoreCredentials(Mode mode, String username, String password) {
        this.mode = mode;
        this.username = username;
        this.password = password;
    }

    public static StoreCredentials none() {
        return NONE;
    }

    public static StoreCredentials password(String password) {
        return new StoreCredentials(Mode.PASSWORD, null, requireText(password, "password"));
    }

    public static StoreCredentials acl(String username, String password) {
        return new StoreCredentials(Mode.ACL, requireText(username, "username"), requireText(password, "password"));
    }

    /**
     * Resolves the authentication mode from optional values. Blank values count as absent.
     *
     * @throws IllegalArgumentException if a username is given without a password
     */
    public static StoreCredentials of(String username, String password) {
        String user = trimToNull(username);
        String secret = password == null || password.isEmpty() ? null : password;
        if (user != null && secret == null) {
            throw new IllegalArgumentException("A username requires a password");
        }
        if (secret == null) {
            return NONE;
        }
        return user == null ? password(secret) : acl(user, secret);
    }

    public Mode getMode() {
        return mode;
    }

    public String getUsername() {
        return username;
    }

    public boolean hasPassword() {
        return password != null;
    }

    void applyTo(RedisURI redisURI) {
        switch (mode) {
            case ACL -> {
                redisURI.setUsername(username);
                redisURI.setPassword(password);
            }
            case PASSWORD -> redisURI.setPassword(password);
            case NONE -> {
                // no AUTH during the handshake
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreCredentials)) {
            return false;
        }
        StoreCredentials that = (StoreCredentials) o;
        return mode == that.mode && Objects.equals(username, that.username) && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, username, password);
    }

    @Override
    public String toString() {
        return "StoreCredentials{" +
                "mode=" + mode +
                ", username='" + username + '\'' +
                ", password=" + (password == null ? "none" : "***") +
                '}';
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public enum Mode {
        NONE,
        PASSWORD,
        ACL
    }
}
