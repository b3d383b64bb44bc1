package io.mcpstudio.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.http.HttpClient;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// CDI producer for the client settings and the shared infrastructure objects.
///
/// Binds the `mcp.client.*` properties to an immutable {@link McpClientSettings} and
/// produces the HTTP client every transport uses. The HTTP client talks HTTP/1.1 and
/// bypasses system proxies: MCP servers under test usually run on localhost.
///
/// @see McpClientSettings for the property table
@ApplicationScoped
public class McpClientSettingsProducer {

    private static final Logger LOG = Logger.getLogger(McpClientSettingsProducer.class);

    private final McpClientSettings settings;

    @Inject
    public McpClientSettingsProducer(
            @ConfigProperty(name = "mcp.client.connect-timeout", defaultValue = "30s")
                    Duration connectTimeout,
            @ConfigProperty(name = "mcp.client.request-timeout", defaultValue = "30s")
                    Duration requestTimeout,
            @ConfigProperty(name = "mcp.client.call-timeout", defaultValue = "30s")
                    Duration callTimeout,
            @ConfigProperty(name = "mcp.client.probe-timeout", defaultValue = "5s")
                    Duration probeTimeout,
            @ConfigProperty(name = "mcp.client.heartbeat-interval", defaultValue = "10s")
                    Duration heartbeatInterval,
            @ConfigProperty(name = "mcp.client.heartbeat-max-failures", defaultValue = "3")
                    int heartbeatMaxFailures,
            @ConfigProperty(name = "mcp.client.auto-reconnect", defaultValue = "false")
                    boolean autoReconnect,
            @ConfigProperty(name = "mcp.client.reconnect-interval", defaultValue = "10s")
                    Duration reconnectInterval,
            @ConfigProperty(name = "mcp.client.refresh-tools-on-connect", defaultValue = "true")
                    boolean refreshToolsOnConnect,
            @ConfigProperty(name = "mcp.client.client-name", defaultValue = "MCP Studio")
                    String clientName,
            @ConfigProperty(name = "mcp.client.client-version", defaultValue = "0.1.0")
                    String clientVersion,
            @ConfigProperty(name = "mcp.client.protocol-version", defaultValue = "2025-03-26")
                    String protocolVersion) {
        this.settings =
                new McpClientSettings(
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
        if (!this.settings.heartbeatInterval().equals(heartbeatInterval)) {
            LOG.warnv(
                    "Heartbeat interval {0} is outside [{1}, {2}], using {3}",
                    heartbeatInterval,
                    McpClientSettings.MIN_HEARTBEAT_INTERVAL,
                    McpClientSettings.MAX_HEARTBEAT_INTERVAL,
                    this.settings.heartbeatInterval());
        }
    }

    /// Produces the bound client settings.
    ///
    /// @return settings singleton, never null
    @Produces
    @Singleton
    public McpClientSettings settings() {
        return settings;
    }

    /// Produces the HTTP client shared by all transports.
    ///
    /// @return HTTP client, never null
    @Produces
    @Singleton
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .proxy(HttpClient.Builder.NO_PROXY)
                .connectTimeout(settings.connectTimeout())
                .build();
    }

    /// Produces the JSON mapper used for JSON-RPC framing.
    ///
    /// @return object mapper, never null
    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
