package io.mcpstudio.client.event;

import io.mcpstudio.core.event.DomainEvent;
import java.util.Objects;

/// Outbound notification about a lost server connection, as shown to the user.
///
/// @param serverId affected server
/// @param status always `disconnected`
/// @param error failure description, never null
/// @param reason machine-readable cause, may be null
public record ConnectionLostNotification(
        String serverId, String status, String error, String reason) {

    public static final String STATUS = "disconnected";

    public ConnectionLostNotification {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(error, "error must not be null");
    }

    /// Builds the notification for a `ConnectionLost` event.
    ///
    /// A missing error becomes `Transport closed: <reason>`.
    ///
    /// @param event the event, not null
    /// @return notification, never null
    public static ConnectionLostNotification from(DomainEvent.ConnectionLost event) {
        String error =
                event.error() != null
                        ? event.error()
                        : "Transport closed: " + (event.reason() != null ? event.reason() : "unknown");
        return new ConnectionLostNotification(event.serverId(), STATUS, error, event.reason());
    }
}
