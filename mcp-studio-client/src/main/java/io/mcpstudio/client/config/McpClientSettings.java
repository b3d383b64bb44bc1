package io.mcpstudio.client.config;

import java.time.Duration;
import java.util.Objects;

/// Immutable settings of the MCP client core.
///
/// ### Configuration
/// | Property                                 | Default      | Description                                  |
/// |------------------------------------------|--------------|----------------------------------------------|
/// | `mcp.client.connect-timeout`             | `30s`        | Bound of transport open plus handshake       |
/// | `mcp.client.request-timeout`             | `30s`        | Deadline of `tools/list` and other requests  |
/// | `mcp.client.call-timeout`                | `30s`        | Deadline of `tools/call`                     |
/// | `mcp.client.probe-timeout`               | `5s`         | Deadline of one heartbeat probe              |
/// | `mcp.client.heartbeat-interval`          | `10s`        | Probe period, clamped to [5s, 300s]          |
/// | `mcp.client.heartbeat-max-failures`      | `3`          | Consecutive probe failures before error      |
/// | `mcp.client.auto-reconnect`              | `false`      | Retry lost connections automatically         |
/// | `mcp.client.reconnect-interval`          | `10s`        | Fixed delay between reconnect attempts       |
/// | `mcp.client.refresh-tools-on-connect`    | `true`       | Load the tool list right after connecting    |
/// | `mcp.client.client-name`                 | `MCP Studio` | `clientInfo.name` sent in the handshake      |
/// | `mcp.client.client-version`              | `0.1.0`      | `clientInfo.version` sent in the handshake   |
/// | `mcp.client.protocol-version`            | `2025-03-26` | Requested protocol revision                  |
///
/// @see McpClientSettingsProducer for the MicroProfile Config binding
public record McpClientSettings(
        Duration connectTimeout,
        Duration requestTimeout,
        Duration callTimeout,
        Duration probeTimeout,
        Duration heartbeatInterval,
        int heartbeatMaxFailures,
        boolean autoReconnect,
        Duration reconnectInterval,
        boolean refreshToolsOnConnect,
        String clientName,
        String clientVersion,
        String protocolVersion) {

    public static final Duration MIN_HEARTBEAT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration MAX_HEARTBEAT_INTERVAL = Duration.ofSeconds(300);

    /// Compact constructor with validation and clamping.
    public McpClientSettings {
        connectTimeout = positive(connectTimeout, "connectTimeout");
        requestTimeout = positive(requestTimeout, "requestTimeout");
        callTimeout = positive(callTimeout, "callTimeout");
        probeTimeout = positive(probeTimeout, "probeTimeout");
        heartbeatInterval = clampHeartbeat(positive(heartbeatInterval, "heartbeatInterval"));
        reconnectInterval = positive(reconnectInterval, "reconnectInterval");
        if (heartbeatMaxFailures < 1) {
            throw new IllegalArgumentException("heartbeatMaxFailures must be at least 1");
        }
        Objects.requireNonNull(clientName, "clientName must not be null");
        Objects.requireNonNull(clientVersion, "clientVersion must not be null");
        Objects.requireNonNull(protocolVersion, "protocolVersion must not be null");
    }

    /// Returns the built-in defaults.
    ///
    /// @return default settings, never null
    public static McpClientSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with these settings.
    ///
    /// @return pre-filled builder, never null
    public Builder toBuilder() {
        return new Builder()
                .connectTimeout(connectTimeout)
                .requestTimeout(requestTimeout)
                .callTimeout(callTimeout)
                .probeTimeout(probeTimeout)
                .heartbeatInterval(heartbeatInterval)
                .heartbeatMaxFailures(heartbeatMaxFailures)
                .autoReconnect(autoReconnect)
                .reconnectInterval(reconnectInterval)
                .refreshToolsOnConnect(refreshToolsOnConnect)
                .clientName(clientName)
                .clientVersion(clientVersion)
                .protocolVersion(protocolVersion);
    }

    private static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration clampHeartbeat(Duration interval) {
        if (interval.compareTo(MIN_HEARTBEAT_INTERVAL) < 0) {
            return MIN_HEARTBEAT_INTERVAL;
        }
        if (interval.compareTo(MAX_HEARTBEAT_INTERVAL) > 0) {
            return MAX_HEARTBEAT_INTERVAL;
        }
        return interval;
    }

    /// Builder for {@link McpClientSettings}.
    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private int heartbeatMaxFailures = 3;
        private boolean autoReconnect = false;
        private Duration reconnectInterval = Duration.ofSeconds(10);
        private boolean refreshToolsOnConnect = true;
        private String clientName = "MCP Studio";
        private String clientVersion = "0.1.0";
        private String protocolVersion = "2025-03-26";

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder heartbeatMaxFailures(int heartbeatMaxFailures) {
            this.heartbeatMaxFailures = heartbeatMaxFailures;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder reconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = reconnectInterval;
            return this;
        }

        public Builder refreshToolsOnConnect(boolean refreshToolsOnConnect) {
            this.refreshToolsOnConnect = refreshToolsOnConnect;
            return this;
        }

        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        public Builder clientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public McpClientSettings build() {
            return new McpClientSettings(
                    connectTimeout,
                    requestTimeout,
                    callTimeout,
                    probeTimeout,
                    heartbeatInterval,
                    heartbeatMaxFailures,
                    autoReconnect,
                    reconnectInterval,
                    refreshToolsOnConnect,
                    clientName,
                    clientVersion,
                    protocolVersion);
        }
    }
}
