package com.tonyguerra.net.pgwire.configurations;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for a single {@code Connector}.
 *
 * <pre>
 * ConnectionSettings settings = ConnectionSettings.builder()
 *         .host("127.0.0.1")
 *         .user("app")
 *         .database("inventory")
 *         .password("secret")
 *         .build();
 * </pre>
 */
public final class ConnectionSettings {
    public static final int DEFAULT_PORT = 5432;

    private final String host;
    private final int port;
    private final String user;
    private final String database;
    private final String password;
    private final String applicationName;
    private final Map<String, String> startupParameters;
    private final int socketTimeoutMs;
    private final int connectTimeoutMs;
    private final int copyBufferSize;
    private final boolean listenForNotifications;
    private final long notificationPollIntervalMs;

    private ConnectionSettings(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.user = b.user;
        this.database = (b.database != null) ? b.database : b.user;
        this.password = b.password;
        this.applicationName = b.applicationName;
        this.startupParameters = Map.copyOf(b.startupParameters);
        this.socketTimeoutMs = b.socketTimeoutMs;
        this.connectTimeoutMs = b.connectTimeoutMs;
        this.copyBufferSize = b.copyBufferSize;
        this.listenForNotifications = b.listenForNotifications;
        this.notificationPollIntervalMs = b.notificationPollIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String user() {
        return user;
    }

    public String database() {
        return database;
    }

    /** May be null when the server does not ask for a password. */
    public String password() {
        return password;
    }

    public String applicationName() {
        return applicationName;
    }

    public Map<String, String> startupParameters() {
        return startupParameters;
    }

    /** 0 means reads never time out. */
    public int socketTimeoutMs() {
        return socketTimeoutMs;
    }

    public int connectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int copyBufferSize() {
        return copyBufferSize;
    }

    public boolean listenForNotifications() {
        return listenForNotifications;
    }

    public long notificationPollIntervalMs() {
        return notificationPollIntervalMs;
    }

    @Override
    public String toString() {
        return String.format("%s@%s:%d/%s", user, host, port, database);
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = DEFAULT_PORT;
        private String user;
        private String database;
        private String password;
        private String applicationName = Globals.getDefaultApplicationName();
        private final Map<String, String> startupParameters = new LinkedHashMap<>();
        private int socketTimeoutMs = 0;
        private int connectTimeoutMs = 10_000;
        private int copyBufferSize = Globals.getDefaultCopyBufferSize();
        private boolean listenForNotifications = true;
        private long notificationPollIntervalMs = 50;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535)
                throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder applicationName(String applicationName) {
            this.applicationName = applicationName;
            return this;
        }

        public Builder startupParameter(String name, String value) {
            startupParameters.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder socketTimeoutMs(int timeoutMs) {
            if (timeoutMs < 0)
                throw new IllegalArgumentException("timeoutMs must be >= 0");
            this.socketTimeoutMs = timeoutMs;
            return this;
        }

        public Builder connectTimeoutMs(int timeoutMs) {
            if (timeoutMs < 0)
                throw new IllegalArgumentException("timeoutMs must be >= 0");
            this.connectTimeoutMs = timeoutMs;
            return this;
        }

        public Builder copyBufferSize(int size) {
            if (size <= 0)
                throw new IllegalArgumentException("size must be > 0");
            this.copyBufferSize = size;
            return this;
        }

        public Builder listenForNotifications(boolean enabled) {
            this.listenForNotifications = enabled;
            return this;
        }

        public Builder notificationPollIntervalMs(long intervalMs) {
            if (intervalMs <= 0)
                throw new IllegalArgumentException("intervalMs must be > 0");
            this.notificationPollIntervalMs = intervalMs;
            return this;
        }

        public ConnectionSettings build() {
            if (user == null || user.isBlank())
                throw new IllegalArgumentException("user must not be null/blank");
            return new ConnectionSettings(this);
        }
    }
}
