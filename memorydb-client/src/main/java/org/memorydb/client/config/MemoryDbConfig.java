package org.memorydb.client.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

import io.lettuce.core.RedisURI;

/**
 * Immutable configuration model describing which store to connect to and how.
 */
public class MemoryDbConfig {

    public static final String DEFAULT_RESOURCE = "memorydb.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "memorydb.";

    public static final String DEFAULT_ENDPOINT = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_DATABASE = 0;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SHUTDOWN_QUIET_PERIOD = Duration.ofMillis(100);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    private final String endpoint;
    private final int port;
    private final StoreCredentials credentials;
    private final boolean ssl;
    private final boolean verifyPeer;
    private final int database;
    private final String clientName;
    private final Duration connectTimeout;
    private final Duration commandTimeout;
    private final Duration shutdownQuietPeriod;
    private final Duration shutdownTimeout;

    private MemoryDbConfig(Builder builder) {
        this.endpoint = validateEndpoint(builder.endpoint);
        this.port = validatePort(builder.port);
        this.credentials = StoreCredentials.of(builder.username, builder.password);
        this.ssl = builder.ssl;
        this.verifyPeer = builder.verifyPeer;
        this.database = validateDatabase(builder.database);
        this.clientName = trimToNull(builder.clientName);
        this.connectTimeout = requirePositive(builder.connectTimeout, "connectTimeout");
        this.commandTimeout = requirePositive(builder.commandTimeout, "commandTimeout");
        this.shutdownQuietPeriod = requireNonNegative(builder.shutdownQuietPeriod, "shutdownQuietPeriod");
        this.shutdownTimeout = requireNonNegative(builder.shutdownTimeout, "shutdownTimeout");
    }

    public static Builder builder(String endpoint) {
        return new Builder().endpoint(endpoint);
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getPort() {
        return port;
    }

    public StoreCredentials getCredentials() {
        return credentials;
    }

    public boolean isSsl() {
        return ssl;
    }

    public boolean isVerifyPeer() {
        return verifyPeer;
    }

    public int getDatabase() {
        return database;
    }

    public String getClientName() {
        return clientName;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public Duration getShutdownQuietPeriod() {
        return shutdownQuietPeriod;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * @return {@code host:port} with the scheme and username when present, never the password.
     */
    public String getSanitizedEndpoint() {
        StringBuilder sb = new StringBuilder(ssl ? "rediss://" : "redis://");
        if (credentials.getMode() != StoreCredentials.Mode.NONE) {
            if (credentials.getUsername() != null) {
                sb.append(credentials.getUsername());
            }
            sb.append(":***@");
        }
        return sb.append(endpoint).append(':').append(port).append('/').append(database).toString();
    }

    public RedisURI toRedisURI() {
        RedisURI redisURI = RedisURI.create(endpoint, port);
        redisURI.setDatabase(database);
        redisURI.setTimeout(commandTimeout);
        if (ssl) {
            redisURI.setSsl(true);
            redisURI.setVerifyPeer(verifyPeer);
        }
        credentials.applyTo(redisURI);
        if (clientName != null) {
            redisURI.setClientName(clientName);
        }
        return redisURI;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the class path, when present, and applies {@code memorydb.*} system
     * property overrides on top of it.
     */
    public static MemoryDbConfig load() {
        Properties properties = new Properties();
        try (InputStream in = MemoryDbConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException("Failed to read " + DEFAULT_RESOURCE, ex);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return from(properties);
    }

    public static MemoryDbConfig from(Properties properties) {
        String endpoint = trimToNull(properties.getProperty("endpoint"));
        Builder builder = builder(endpoint == null ? DEFAULT_ENDPOINT : endpoint)
                .port(readInt(properties, "port", DEFAULT_PORT))
                .username(properties.getProperty("username"))
                .password(properties.getProperty("password"))
                .ssl(readBoolean(properties, "ssl", true))
                .verifyPeer(readBoolean(properties, "verify-peer", true))
                .database(readInt(properties, "database", DEFAULT_DATABASE))
                .clientName(properties.getProperty("client-name"))
                .connectTimeout(readDuration(properties, "connect-timeout", DEFAULT_CONNECT_TIMEOUT))
                .commandTimeout(readDuration(properties, "command-timeout", DEFAULT_COMMAND_TIMEOUT))
                .shutdownQuietPeriod(readDuration(properties, "shutdown-quiet-period", DEFAULT_SHUTDOWN_QUIET_PERIOD))
                .shutdownTimeout(readDuration(properties, "shutdown-timeout", DEFAULT_SHUTDOWN_TIMEOUT));
        return builder.build();
    }

    private static Duration readDuration(Properties properties, String key, Duration defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            if (isOnlyDigits(value)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Invalid duration for key '" + key + "': " + value, ex);
        }
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for key '" + key + "': " + value, ex);
        }
    }

    private static boolean readBoolean(Properties properties, String key, boolean defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    private static boolean isOnlyDigits(String candidate) {
        for (int i = 0; i < candidate.length(); i++) {
            if (!Character.isDigit(candidate.charAt(i))) {
                return false;
            }
        }
        return !candidate.isEmpty();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return "MemoryDbConfig{" +
                "endpoint='" + endpoint + '\'' +
                ", port=" + port +
                ", credentials=" + credentials +
                ", ssl=" + ssl +
                ", verifyPeer=" + verifyPeer +
                ", database=" + database +
                ", clientName='" + clientName + '\'' +
                ", connectTimeout=" + connectTimeout +
                ", commandTimeout=" + commandTimeout +
                ", shutdownQuietPeriod=" + shutdownQuietPeriod +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }

    private static String validateEndpoint(String endpoint) {
        String candidate = Objects.requireNonNull(endpoint, "Endpoint must not be null");
        if (candidate.isBlank()) {
            throw new IllegalArgumentException("Endpoint must not be blank");
        }
        return candidate.trim();
    }

    private static int validatePort(int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        return port;
    }

    private static int validateDatabase(int database) {
        if (database < 0) {
            throw new IllegalArgumentException("database must not be negative");
        }
        return database;
    }

    private static Duration requirePositive(Duration duration, String name) {
        Duration value = Objects.requireNonNull(duration, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requireNonNegative(Duration duration, String name) {
        Duration value = Objects.requireNonNull(duration, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }

    public static final class Builder {
        private String endpoint;
        private int port = DEFAULT_PORT;
        private String username;
        private String password;
        private boolean ssl = true;
        private boolean verifyPeer = true;
        private int database = DEFAULT_DATABASE;
        private String clientName;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
        private Duration shutdownQuietPeriod = DEFAULT_SHUTDOWN_QUIET_PERIOD;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        private Builder() {
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder verifyPeer(boolean verifyPeer) {
            this.verifyPeer = verifyPeer;
            return this;
        }

        public Builder database(int database) {
            this.database = database;
            return this;
        }

        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder shutdownQuietPeriod(Duration shutdownQuietPeriod) {
            this.shutdownQuietPeriod = shutdownQuietPeriod;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public MemoryDbConfig build() {
            return new MemoryDbConfig(this);
        }
    }
}
