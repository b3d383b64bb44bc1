package io.mcpstudio.core.exception;

import java.io.Serial;
import java.time.Duration;
import java.util.Objects;

/// Exception thrown when an MCP operation produced no usable answer from the server.
///
/// The {@link Kind} tells callers what went wrong:
/// - transport failures (socket, stream, HTTP status)
/// - protocol violations (malformed or unexpected messages)
/// - deadlines exceeded
/// - operations against a server that is not connected
/// - calls cut off because the connection was closed
///
/// A tool that ran and reported a failure is not an exception, it is an
/// {@link io.mcpstudio.core.tool.InvocationResult} with `success == false`.
public class McpException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127305889204518817L;

    /// Failure category.
    public enum Kind {
        /// Socket, stream or HTTP level failure, malformed handshake.
        TRANSPORT,
        /// Well-formed transport but an invalid or unexpected message.
        PROTOCOL,
        /// Deadline exceeded without an answer.
        TIMEOUT,
        /// Operation attempted while the server is not connected.
        NOT_CONNECTED,
        /// The transport was closed while the operation was pending.
        CONNECTION_CLOSED
    }

    private final Kind kind;
    private final int httpStatus;

    /// Creates an exception of the given kind.
    ///
    /// @param kind failure category, not null
    /// @param message the error message
    public McpException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.httpStatus = -1;
    }

    /// Creates an exception of the given kind with a cause.
    ///
    /// @param kind failure category, not null
    /// @param message the error message
    /// @param cause the underlying cause
    public McpException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.httpStatus = -1;
    }

    private McpException(String message, int httpStatus) {
        super(message);
        this.kind = Kind.TRANSPORT;
        this.httpStatus = httpStatus;
    }

    /// Returns the failure category.
    ///
    /// @return kind, never null
    public Kind getKind() {
        return kind;
    }

    /// Returns whether the transport that raised this error can no longer be used.
    ///
    /// @return true for closed connections
    public boolean isUnrecoverable() {
        return kind == Kind.CONNECTION_CLOSED;
    }

    /// Returns the HTTP status the server answered with.
    ///
    /// @return status code, or -1 when no HTTP reply was received
    public int getHttpStatus() {
        return httpStatus;
    }

    /// Returns whether the channel to the server broke.
    ///
    /// A server that answered with an HTTP error status is still reachable, so such a
    /// failure does not count.
    ///
    /// @return true for closed connections and transport failures without an HTTP reply
    public boolean isTransportFailure() {
        return kind == Kind.CONNECTION_CLOSED || (kind == Kind.TRANSPORT && httpStatus < 0);
    }

    public static McpException transport(String message) {
        return new McpException(Kind.TRANSPORT, message);
    }

    public static McpException transport(String message, Throwable cause) {
        return new McpException(Kind.TRANSPORT, message, cause);
    }

    /// Creates an exception for a request the server rejected with an HTTP error status.
    ///
    /// @param endpoint the MCP endpoint
    /// @param status the HTTP status code
    /// @return new exception of kind TRANSPORT
    public static McpException httpStatus(String endpoint, int status) {
        return new McpException("MCP server at " + endpoint + " returned HTTP " + status, status);
    }

    public static McpException protocol(String message) {
        return new McpException(Kind.PROTOCOL, message);
    }

    public static McpException protocol(String message, Throwable cause) {
        return new McpException(Kind.PROTOCOL, message, cause);
    }

    /// Creates an exception for a connection failure.
    ///
    /// @param endpoint the MCP endpoint
    /// @param cause the underlying cause
    /// @return new exception
    public static McpException connectionFailed(String endpoint, Throwable cause) {
        return new McpException(
                Kind.TRANSPORT, "Failed to connect to MCP server at " + endpoint, cause);
    }

    /// Creates an exception for a deadline that expired.
    ///
    /// @param operation the operation that timed out, such as a method name
    /// @param timeout the deadline that was exceeded
    /// @return new exception
    public static McpException timeout(String operation, Duration timeout) {
        return new McpException(
                Kind.TIMEOUT, "Request timed out after " + timeout.toMillis() + "ms: " + operation);
    }

    public static McpException unsupportedTransport(String serverId, String transport) {
        return new McpException(
                Kind.TRANSPORT,
                "Transport '" + transport + "' is not supported for server " + serverId);
    }

    public static McpException notConnected(String serverId) {
        return new McpException(Kind.NOT_CONNECTED, "Not connected to server: " + serverId);
    }

    public static McpException unknownServer(String serverId) {
        return new McpException(Kind.NOT_CONNECTED, "Unknown server: " + serverId);
    }

    public static McpException connectionClosed(String serverId) {
        return new McpException(Kind.CONNECTION_CLOSED, "Connection closed: " + serverId);
    }

    public static McpException connectionClosed(String serverId, Throwable cause) {
        return new McpException(Kind.CONNECTION_CLOSED, "Connection closed: " + serverId, cause);
    }
}
