package io.mcpstudio.client.transport;

import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.jsonrpc.JsonRpc;
import io.mcpstudio.core.exception.McpException;
import io.mcpstudio.core.server.ServerDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.net.http.HttpClient;
import java.util.Objects;

/// Creates the HTTP based transports over one shared {@link HttpClient}.
///
/// `stdio` servers are recognized but not supported: asking for one is a
/// `TRANSPORT` error.
@ApplicationScoped
public class DefaultMcpTransportFactory implements McpTransportFactory {

    private final HttpClient httpClient;
    private final JsonRpc jsonRpc;
    private final McpClientSettings settings;

    @Inject
    public DefaultMcpTransportFactory(
            HttpClient httpClient, JsonRpc jsonRpc, McpClientSettings settings) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public McpTransport create(ServerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        return switch (descriptor.kind()) {
            case SSE -> new SseClientTransport(descriptor.url(), httpClient, jsonRpc, settings);
            case STREAMABLE_HTTP ->
                    new StreamableHttpClientTransport(descriptor.url(), httpClient, jsonRpc, settings);
            case STDIO -> throw McpException.unsupportedTransport(
                    descriptor.id(), descriptor.kind().value());
        };
    }
}
