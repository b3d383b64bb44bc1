package io.mcpstudio.client.connection;

/// Callbacks from a connection to the component that owns its tool metadata.
public interface ConnectionListener {

    ConnectionListener NONE = new ConnectionListener() {};

    /// The connection left the connected state without an explicit disconnect.
    ///
    /// @param serverId affected server
    default void onConnectionLost(String serverId) {}

    /// The server announced that its tool list changed.
    ///
    /// @param serverId affected server
    default void onToolsChanged(String serverId) {}
}
