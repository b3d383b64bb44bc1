package io.mcpstudio.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.connection.ConnectionListener;
import io.mcpstudio.client.connection.McpServerConnection;
import io.mcpstudio.client.jsonrpc.JsonRpc;
import io.mcpstudio.client.jsonrpc.JsonRpcResponse;
import io.mcpstudio.client.tool.ToolCache;
import io.mcpstudio.client.tool.ToolDescriptorParser;
import io.mcpstudio.client.transport.McpTransportFactory;
import io.mcpstudio.client.util.LogSanitizer;
import io.mcpstudio.core.connection.ConnectionState;
import io.mcpstudio.core.connection.ServerSnapshot;
import io.mcpstudio.core.event.DomainEvent;
import io.mcpstudio.core.event.EventPublisher;
import io.mcpstudio.core.exception.McpException;
import io.mcpstudio.core.server.ServerDescriptor;
import io.mcpstudio.core.server.TransportKind;
import io.mcpstudio.core.tool.InvocationResult;
import io.mcpstudio.core.tool.ToolDescriptor;
import io.mcpstudio.core.tool.ToolsListResult;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Entry point of the MCP client core.
///
/// Owns one {@link McpServerConnection} per server id, the {@link ToolCache} and the
/// event publisher. Callers (command and query handlers) use server ids only, never
/// connection objects.
///
/// ### Usage
/// {@snippet :
/// ServerSnapshot snapshot = manager.connect("local", "http://localhost:8080/mcp",
///         TransportKind.STREAMABLE_HTTP);
/// List<ToolDescriptor> tools = manager.getCachedTools("local");
/// InvocationResult result = manager.callTool("local", "echo", Map.of("text", "hi"));
/// }
///
/// ### Error Handling
/// Operations that could not obtain an answer throw {@link McpException}:
/// `NOT_CONNECTED` for unknown or non-connected servers, `TIMEOUT`, `TRANSPORT`,
/// `PROTOCOL` and `CONNECTION_CLOSED`. A tool the server reports as failed is a normal
/// {@link InvocationResult} with `success == false`.
///
/// ### Thread Safety
/// Operations on distinct servers run fully in parallel. Mutations of one server are
/// serialized by its connection lock. {@link #getCachedTools(String)} and the state
/// queries never block.
///
/// @see McpServerConnection for the per-server state machine
@ApplicationScoped
public class McpClientManager {

    private static final Logger LOG = Logger.getLogger(McpClientManager.class);

    static final String TOOLS_LIST = "tools/list";
    static final String TOOLS_CALL = "tools/call";
    static final String DEFAULT_TOOL_ERROR = "Tool execution failed";

    private final Map<String, McpServerConnection> connections = new ConcurrentHashMap<>();
    private final McpTransportFactory transportFactory;
    private final EventPublisher events;
    private final ToolCache toolCache;
    private final JsonRpc jsonRpc;
    private final ToolDescriptorParser toolParser;
    private final McpClientSettings settings;
    private final ConnectionListener connectionListener = new CacheMaintenance();

    @Inject
    public McpClientManager(
            McpTransportFactory transportFactory,
            EventPublisher events,
            ToolCache toolCache,
            JsonRpc jsonRpc,
            McpClientSettings settings) {
        this.transportFactory =
                Objects.requireNonNull(transportFactory, "transportFactory must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.toolCache = Objects.requireNonNull(toolCache, "toolCache must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.toolParser = new ToolDescriptorParser(jsonRpc);
    }

    /// Connects to a server, registering it on first use.
    ///
    /// @param serverId server identifier, not blank
    /// @param url endpoint URL, not blank
    /// @param kind transport variant
    /// @return resulting snapshot
    /// @throws McpException if the connection attempt failed, the state is then Error
    public ServerSnapshot connect(String serverId, String url, TransportKind kind) {
        McpServerConnection existing = serverId != null ? connections.get(serverId) : null;
        ServerDescriptor descriptor =
                existing != null
                        ? existing.descriptor().withEndpoint(existing.descriptor().name(), url, kind)
                        : ServerDescriptor.of(serverId, url, kind);
        return connect(descriptor);
    }

    /// Connects to a server, registering it on first use.
    ///
    /// Servers whose transport kind is not supported are rejected before registration.
    /// Idempotent while connected: no transport is opened and the existing snapshot is
    /// returned. A changed endpoint or transport kind replaces the descriptor of a server
    /// that is not connected. When tools are refreshed on connect, a failed refresh is
    /// logged and does not fail the connect.
    ///
    /// @param descriptor the server, not null
    /// @return resulting snapshot
    /// @throws McpException if the connection attempt failed, the state is then Error
    public ServerSnapshot connect(ServerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        if (!descriptor.kind().isSupported()) {
            throw McpException.unsupportedTransport(descriptor.id(), descriptor.kind().value());
        }
        McpServerConnection connection =
                connections.computeIfAbsent(descriptor.id(), id -> newConnection(descriptor));

        if (!connection.descriptor().equals(descriptor)
                && !connection.replaceDescriptor(descriptor)
                && !connection.descriptor().sameEndpoint(descriptor)) {
            LOG.warnv(
                    "Server {0} is connected, keeping endpoint {1}",
                    LogSanitizer.sanitize(descriptor.id()),
                    LogSanitizer.sanitize(connection.descriptor().url()));
        }

        boolean wasConnected = connection.state().isConnected();
        connection.connect();
        if (!wasConnected && settings.refreshToolsOnConnect()) {
            refreshQuietly(descriptor.id());
        }
        return connection.snapshot();
    }

    /// Replaces the transport of a known server with a fresh one.
    ///
    /// @param serverId server identifier
    /// @return resulting snapshot
    /// @throws McpException with kind NOT_CONNECTED for unknown servers, or the failure
    ///     of the connection attempt
    public ServerSnapshot reconnect(String serverId) {
        McpServerConnection connection = require(serverId);
        toolCache.invalidate(serverId);
        connection.reconnect();
        if (settings.refreshToolsOnConnect()) {
            refreshQuietly(serverId);
        }
        return connection.snapshot();
    }

    /// Disconnects a server and drops its cached tools.
    ///
    /// @param serverId server identifier
    /// @return resulting snapshot, state Disconnected
    /// @throws McpException with kind NOT_CONNECTED for unknown servers
    public ServerSnapshot disconnect(String serverId) {
        McpServerConnection connection = require(serverId);
        ServerSnapshot snapshot = connection.disconnect();
        toolCache.invalidate(serverId);
        return snapshot;
    }

    /// Disconnects a server and forgets it.
    ///
    /// @param serverId server identifier
    /// @return true if the server was known
    public boolean remove(String serverId) {
        McpServerConnection connection = connections.remove(serverId);
        if (connection == null) {
            return false;
        }
        connection.disconnect();
        toolCache.invalidate(serverId);
        LOG.infov("Removed MCP server {0}", LogSanitizer.sanitize(serverId));
        return true;
    }

    /// Loads the complete tool list of a connected server and replaces its cache entry.
    ///
    /// Follows `nextCursor` pagination. On failure the previous cache entry stays
    /// untouched.
    ///
    /// @param serverId server identifier
    /// @return the new tool list and the raw response document
    /// @throws McpException with kind NOT_CONNECTED, TIMEOUT, TRANSPORT, PROTOCOL or
    ///     CONNECTION_CLOSED
    public ToolsListResult refreshTools(String serverId) {
        McpServerConnection connection = require(serverId);
        return connection.withLock(() -> loadTools(connection));
    }

    /// Returns the cached tools of a server without any I/O.
    ///
    /// @param serverId server identifier
    /// @return cached tools, empty if none are cached
    public List<ToolDescriptor> getCachedTools(String serverId) {
        return toolCache.get(serverId);
    }

    /// Calls a tool on a connected server.
    ///
    /// @param serverId server identifier
    /// @param toolName tool to call, not null
    /// @param arguments tool arguments, may be null
    /// @return the invocation result, successful or not
    /// @throws McpException with kind NOT_CONNECTED, TIMEOUT, TRANSPORT, PROTOCOL or
    ///     CONNECTION_CLOSED when no answer was obtained
    public InvocationResult callTool(
            String serverId, String toolName, Map<String, Object> arguments) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        McpServerConnection connection = require(serverId);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());

        LOG.debugv(
                "Calling tool {0} on {1}",
                LogSanitizer.sanitize(toolName),
                LogSanitizer.sanitize(serverId));
        long start = System.nanoTime();
        JsonRpcResponse response = connection.request(TOOLS_CALL, params, settings.callTimeout());
        Duration duration = Duration.ofNanos(System.nanoTime() - start);

        InvocationResult result = toInvocationResult(response, duration);
        LOG.infov(
                "Tool {0} on {1} finished in {2}ms, success={3}",
                LogSanitizer.sanitize(toolName),
                LogSanitizer.sanitize(serverId),
                result.durationMs(),
                result.success());
        publish(DomainEvent.ToolInvoked.now(serverId, toolName, result.success()));
        return result;
    }

    /// Lists every registered server with its current state, ordered by name.
    ///
    /// @return snapshots, never null
    public List<ServerSnapshot> listManagedServers() {
        return connections.values().stream()
                .map(McpServerConnection::snapshot)
                .sorted(Comparator.comparing((ServerSnapshot s) -> s.descriptor().name())
                        .thenComparing(ServerSnapshot::serverId))
                .toList();
    }

    /// Returns the state of a server, Disconnected for unknown ids.
    ///
    /// @param serverId server identifier
    /// @return current state, never null
    public ConnectionState getState(String serverId) {
        McpServerConnection connection = connections.get(serverId);
        return connection != null ? connection.state() : ConnectionState.DISCONNECTED;
    }

    /// Returns the pretty-printed `initialize` result of a connected server.
    ///
    /// @param serverId server identifier
    /// @return server info document, empty when unknown or not connected
    public Optional<String> getServerInfo(String serverId) {
        McpServerConnection connection = connections.get(serverId);
        if (connection == null || connection.serverInfo() == null) {
            return Optional.empty();
        }
        return Optional.of(jsonRpc.prettyPrint(connection.serverInfo()));
    }

    /// Disconnects every server. Called on shutdown.
    @PreDestroy
    public void disconnectAll() {
        LOG.infov("Disconnecting {0} MCP server(s)", connections.size());
        for (McpServerConnection connection : connections.values()) {
            try {
                connection.disconnect();
            } catch (RuntimeException e) {
                LOG.warnv(
                        e, "Failed to disconnect {0}", LogSanitizer.sanitize(connection.serverId()));
            }
        }
        toolCache.clear();
    }

    private McpServerConnection newConnection(ServerDescriptor descriptor) {
        McpServerConnection connection =
                new McpServerConnection(descriptor, transportFactory, events, settings);
        connection.setListener(connectionListener);
        return connection;
    }

    private McpServerConnection require(String serverId) {
        McpServerConnection connection = serverId != null ? connections.get(serverId) : null;
        if (connection == null) {
            throw McpException.unknownServer(serverId);
        }
        return connection;
    }

    private ToolsListResult loadTools(McpServerConnection connection) {
        String serverId = connection.serverId();
        List<ToolDescriptor> tools = new ArrayList<>();
        List<JsonRpcResponse> pages = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;

        do {
            Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : null;
            JsonRpcResponse response =
                    connection.request(TOOLS_LIST, params, settings.requestTimeout());
            JsonNode result = jsonRpc.requireResult(response);
            tools.addAll(toolParser.parse(result));
            pages.add(response);

            JsonNode next = result.get("nextCursor");
            cursor = next != null && next.isTextual() && !next.asText().isEmpty() ? next.asText() : null;
            if (cursor != null && !seenCursors.add(cursor)) {
                throw McpException.protocol("tools/list repeated cursor " + cursor);
            }
        } while (cursor != null);

        toolCache.replace(serverId, tools);
        LOG.infov("Loaded {0} tool(s) from {1}", tools.size(), LogSanitizer.sanitize(serverId));
        publish(DomainEvent.ToolsRefreshed.now(serverId, tools.size()));
        return new ToolsListResult(tools, rawDocument(pages));
    }

    private String rawDocument(List<JsonRpcResponse> pages) {
        if (pages.size() == 1) {
            return jsonRpc.prettyPrint(pages.get(0).raw());
        }
        ArrayNode all = jsonRpc.mapper().createArrayNode();
        pages.forEach(page -> all.add(page.raw()));
        return jsonRpc.prettyPrint(all);
    }

    private InvocationResult toInvocationResult(JsonRpcResponse response, Duration duration) {
        String raw = jsonRpc.prettyPrint(response.raw());
        if (response.isError()) {
            Object data = jsonRpc.toJava(response.error().get("data"));
            return InvocationResult.failure(raw, data, response.errorMessage(), duration);
        }

        JsonNode result = response.result();
        Object payload = payload(result);
        if (result != null && result.path("isError").asBoolean(false)) {
            return InvocationResult.failure(raw, payload, firstText(result), duration);
        }
        return InvocationResult.success(raw, payload, duration);
    }

    private Object payload(JsonNode result) {
        if (result == null || result.isNull()) {
            return null;
        }
        if (result.hasNonNull("structuredContent")) {
            return jsonRpc.toJava(result.get("structuredContent"));
        }
        if (result.has("content")) {
            return jsonRpc.toJava(result.get("content"));
        }
        return jsonRpc.toJava(result);
    }

    private static String firstText(JsonNode result) {
        for (JsonNode item : result.path("content")) {
            if ("text".equals(item.path("type").asText()) && item.hasNonNull("text")) {
                return item.get("text").asText();
            }
        }
        return DEFAULT_TOOL_ERROR;
    }

    private void refreshQuietly(String serverId) {
        try {
            refreshTools(serverId);
        } catch (McpException e) {
            LOG.warnv(
                    "Tool refresh after connect failed for {0}: {1}",
                    LogSanitizer.sanitize(serverId),
                    LogSanitizer.sanitize(e.getMessage()));
        }
    }

    private void publish(DomainEvent event) {
        try {
            events.publish(event);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Event publisher failed for {0}", event.type());
        }
    }

    /// Keeps the tool cache in line with connection changes.
    private final class CacheMaintenance implements ConnectionListener {

        @Override
        public void onConnectionLost(String serverId) {
            toolCache.invalidate(serverId);
        }

        @Override
        public void onToolsChanged(String serverId) {
            LOG.debugv("Tool list of {0} changed, refreshing", LogSanitizer.sanitize(serverId));
            Uni.createFrom()
                    .item(() -> refreshTools(serverId))
                    .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                    .subscribe()
                    .with(
                            result -> {},
                            failure ->
                                    LOG.warnv(
                                            "Tool refresh after change notification failed for {0}: {1}",
                                            LogSanitizer.sanitize(serverId),
                                            LogSanitizer.sanitize(failure.getMessage())));
        }
    }
}
