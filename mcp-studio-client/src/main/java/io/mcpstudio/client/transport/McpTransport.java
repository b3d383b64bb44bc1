package io.mcpstudio.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpstudio.client.jsonrpc.JsonRpcResponse;
import io.smallrye.mutiny.Uni;
import java.time.Duration;

/// Client side of one MCP transport session.
///
/// A transport is opened once, used for any number of requests and closed once. It is
/// never reopened: a new connection attempt creates a new transport.
///
/// ### Contract
/// - {@link #open()} performs the MCP handshake and yields the server's `initialize`
///   result. On failure the transport is closed before the failure is emitted.
/// - {@link #request} always terminates, with a response, or with an
///   {@link io.mcpstudio.core.exception.McpException} once its deadline expires.
/// - {@link #close()} is idempotent, never throws and fails every pending request
///   with `CONNECTION_CLOSED`. It does not notify the {@link Listener}.
/// - {@link Listener#onDisconnect} fires at most once, and only for an unexpected loss.
///
/// @see AbstractMcpTransport for the shared handshake and request bookkeeping
/// @see McpTransportFactory for variant selection
public interface McpTransport {

    /// Opens the channel and performs the `initialize` handshake.
    ///
    /// @return Uni emitting the `initialize` result object
    Uni<JsonNode> open();

    /// Sends a request and awaits the matching response.
    ///
    /// A JSON-RPC error response is a successful emission, callers inspect
    /// {@link JsonRpcResponse#isError()}.
    ///
    /// @param method JSON-RPC method name, not null
    /// @param params request parameters, omitted when null
    /// @param timeout deadline for the answer, not null
    /// @return Uni emitting the response
    Uni<JsonRpcResponse> request(String method, Object params, Duration timeout);

    /// Sends a notification. Completes once the frame has been handed to the server.
    ///
    /// @param method JSON-RPC method name, not null
    /// @param params notification parameters, omitted when null
    /// @return Uni completing when the notification was sent
    Uni<Void> notify(String method, Object params);

    /// Closes the transport and releases its sockets and streams.
    void close();

    /// Returns whether the handshake completed and the transport has not been closed or lost.
    ///
    /// @return true if usable
    boolean isOpen();

    /// Returns the endpoint this transport talks to.
    ///
    /// @return endpoint URL, never null
    String endpoint();

    /// Registers the listener for disconnects and server notifications.
    ///
    /// @param listener the listener, replaces any previous one
    void setListener(Listener listener);

    /// Callbacks from the transport to its owner.
    interface Listener {

        Listener NONE = new Listener() {};

        /// The transport was lost without an explicit close.
        ///
        /// @param reason machine-readable reason such as `sse_stream_closed`
        /// @param cause the failure that ended the transport, may be null
        default void onDisconnect(String reason, Throwable cause) {}

        /// The server sent a notification.
        ///
        /// @param method notification method
        /// @param params notification parameters, may be null
        default void onNotification(String method, JsonNode params) {}
    }
}
