package io.mcpstudio.core.connection;

import io.mcpstudio.core.server.ServerDescriptor;
import java.util.Objects;

/// Point-in-time view of a managed server and its connection state.
///
/// @param descriptor the server descriptor, not null
/// @param state the connection state at the time of the snapshot, not null
public record ServerSnapshot(ServerDescriptor descriptor, ConnectionState state) {

    public ServerSnapshot {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    /// Returns the server identifier.
    ///
    /// @return server id, never null
    public String serverId() {
        return descriptor.id();
    }

    /// Returns whether the server was connected when the snapshot was taken.
    ///
    /// @return true if connected
    public boolean isConnected() {
        return state.isConnected();
    }
}
