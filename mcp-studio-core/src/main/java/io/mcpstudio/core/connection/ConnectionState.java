package io.mcpstudio.core.connection;

import java.util.Objects;

/// Lifecycle state of a connection to one MCP server.
///
/// Exactly one connection owns a state value and only that connection changes it.
///
/// ### State Flow
/// ```
/// Disconnected → Connecting → Connected → Disconnected
///                     ↓            ↓
///                   Error  ←———————+
///                     ↓
///                 Connecting (explicit or automatic reconnect)
/// ```
public sealed interface ConnectionState {

    ConnectionState DISCONNECTED = new Disconnected();
    ConnectionState CONNECTING = new Connecting();
    ConnectionState CONNECTED = new Connected();

    /// Returns the lowercase label shown to users and sent in notifications.
    ///
    /// @return state label, never null
    String label();

    /// Returns whether operations against the server are currently allowed.
    ///
    /// @return true only in the connected state
    default boolean isConnected() {
        return this instanceof Connected;
    }

    /// Creates an error state.
    ///
    /// @param message failure description, may be null
    /// @return error state, never null
    static ConnectionState error(String message) {
        return new Error(message);
    }

    /// No transport is open.
    record Disconnected() implements ConnectionState {
        @Override
        public String label() {
            return "disconnected";
        }
    }

    /// Transport is opening and the handshake is running.
    record Connecting() implements ConnectionState {
        @Override
        public String label() {
            return "connecting";
        }
    }

    /// Handshake completed, the server accepts tool operations.
    record Connected() implements ConnectionState {
        @Override
        public String label() {
            return "connected";
        }
    }

    /// Connecting failed or an established connection was lost.
    ///
    /// @param message failure description, never null
    record Error(String message) implements ConnectionState {

        public Error {
            message = Objects.requireNonNullElse(message, "Unknown error");
        }

        @Override
        public String label() {
            return "error";
        }
    }
}
