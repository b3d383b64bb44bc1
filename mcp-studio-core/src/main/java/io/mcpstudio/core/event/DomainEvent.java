package io.mcpstudio.core.event;

import java.time.Instant;
import java.util.Objects;

/// Events reported by the client core to observers outside of it.
///
/// Events are plain values. They hold the server id, never a reference to the
/// connection that produced them.
///
/// ### Event Types
/// - `connection.established` - handshake completed, server is usable
/// - `connection.lost` - connecting failed or an established connection broke
/// - `tool.invoked` - a tool call produced a result
/// - `tools.refreshed` - the cached tool list of a server was replaced
///
/// ### Ordering
/// Events of one server are published in the order of the transitions that caused them.
/// There is no ordering across servers.
///
/// @see EventPublisher for the delivery seam
public sealed interface DomainEvent {

    /// Returns the event type identifier.
    ///
    /// @return dotted event type, never null
    String type();

    /// Returns the server this event belongs to.
    ///
    /// @return server identifier, never null
    String serverId();

    /// Returns when the event occurred.
    ///
    /// @return event timestamp, never null
    Instant timestamp();

    /// A connection reached the connected state.
    record ConnectionEstablished(String serverId, Instant timestamp) implements DomainEvent {

        public ConnectionEstablished {
            Objects.requireNonNull(serverId, "serverId must not be null");
            Objects.requireNonNull(timestamp, "timestamp must not be null");
        }

        @Override
        public String type() {
            return "connection.established";
        }

        public static ConnectionEstablished now(String serverId) {
            return new ConnectionEstablished(serverId, Instant.now());
        }
    }

    /// A connection entered the error state.
    ///
    /// @param serverId affected server
    /// @param error failure description, may be null
    /// @param reason machine-readable cause such as `heartbeat_failed`, may be null
    /// @param timestamp when the loss was detected
    record ConnectionLost(String serverId, String error, String reason, Instant timestamp)
            implements DomainEvent {

        public ConnectionLost {
            Objects.requireNonNull(serverId, "serverId must not be null");
            Objects.requireNonNull(timestamp, "timestamp must not be null");
        }

        @Override
        public String type() {
            return "connection.lost";
        }

        public static ConnectionLost now(String serverId, String error, String reason) {
            return new ConnectionLost(serverId, error, reason, Instant.now());
        }
    }

    /// A tool call returned a result, successful or not.
    record ToolInvoked(String serverId, String toolName, boolean success, Instant timestamp)
            implements DomainEvent {

        public ToolInvoked {
            Objects.requireNonNull(serverId, "serverId must not be null");
            Objects.requireNonNull(toolName, "toolName must not be null");
            Objects.requireNonNull(timestamp, "timestamp must not be null");
        }

        @Override
        public String type() {
            return "tool.invoked";
        }

        public static ToolInvoked now(String serverId, String toolName, boolean success) {
            return new ToolInvoked(serverId, toolName, success, Instant.now());
        }
    }

    /// The cached tool list of a server was replaced by a successful refresh.
    record ToolsRefreshed(String serverId, int toolCount, Instant timestamp)
            implements DomainEvent {

        public ToolsRefreshed {
            Objects.requireNonNull(serverId, "serverId must not be null");
            Objects.requireNonNull(timestamp, "timestamp must not be null");
        }

        @Override
        public String type() {
            return "tools.refreshed";
        }

        public static ToolsRefreshed now(String serverId, int toolCount) {
            return new ToolsRefreshed(serverId, toolCount, Instant.now());
        }
    }
}
