package io.mcpstudio.client.transport;

import io.mcpstudio.core.server.ServerDescriptor;

/// Creates transports for server descriptors.
///
/// Injected into the connections so tests can substitute scripted transports.
@FunctionalInterface
public interface McpTransportFactory {

    /// Creates a new, unopened transport for the descriptor's endpoint.
    ///
    /// @param descriptor the server to talk to, not null
    /// @return new transport, never null
    /// @throws io.mcpstudio.core.exception.McpException with kind TRANSPORT if the
    ///     descriptor's transport kind is not supported
    McpTransport create(ServerDescriptor descriptor);
}
