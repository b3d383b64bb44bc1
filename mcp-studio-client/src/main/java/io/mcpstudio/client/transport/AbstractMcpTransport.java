package io.mcpstudio.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.jsonrpc.JsonRpc;
import io.mcpstudio.client.jsonrpc.JsonRpcResponse;
import io.mcpstudio.client.util.LogSanitizer;
import io.mcpstudio.core.exception.McpException;
import io.smallrye.mutiny.Uni;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/// Base class of the HTTP based transports.
///
/// Owns everything that does not depend on how frames travel:
/// - the `initialize` / `notifications/initialized` handshake
/// - request ids, deadlines and the pending-request table
/// - routing of inbound frames (responses, server requests, notifications)
/// - the once-only close and loss bookkeeping
///
/// ### Subclass Contract
/// - {@link #connectChannel()} establishes whatever must exist before the first request
/// - {@link #exchange} sends a request frame and yields the raw response frame
/// - {@link #send} delivers a frame that expects no answer
/// - {@link #releaseResources()} cancels streams and in-flight exchanges
///
/// Subclasses report an unexpected end of their channel with {@link #transportLost}.
///
/// @implNote Thread-safe. Inbound frames arrive on HTTP client threads while requests are
/// issued from arbitrary caller threads. All shared state is held in concurrent maps and
/// atomics.
public abstract class AbstractMcpTransport implements McpTransport {

    private static final Logger LOG = Logger.getLogger(AbstractMcpTransport.class);

    static final int METHOD_NOT_FOUND = -32601;

    protected final String endpoint;
    protected final JsonRpc jsonRpc;
    protected final McpClientSettings settings;

    private final Map<String, CompletableFuture<String>> pendingRequests =
            new ConcurrentHashMap<>();
    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean lost = new AtomicBoolean();
    private volatile Listener listener = Listener.NONE;

    protected AbstractMcpTransport(String endpoint, JsonRpc jsonRpc, McpClientSettings settings) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public final Uni<JsonNode> open() {
        if (closed.get()) {
            return Uni.createFrom().failure(McpException.connectionClosed(endpoint));
        }
        Duration timeout = settings.connectTimeout();
        return connectChannel()
                .chain(() -> request("initialize", initializeParams(), timeout))
                .map(this::validateHandshake)
                .call(result -> notify("notifications/initialized", null))
                .ifNoItem()
                .after(timeout)
                .failWith(() -> McpException.timeout("initialize", timeout))
                .onFailure()
                .transform(failure -> TransportFailures.map(failure, endpoint))
                .invoke(
                        result -> {
                            opened.set(true);
                            LOG.debugv(
                                    "MCP handshake completed with {0}",
                                    LogSanitizer.sanitize(endpoint));
                        })
                .onFailure()
                .invoke(failure -> close());
    }

    @Override
    public final Uni<JsonRpcResponse> request(String method, Object params, Duration timeout) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (closed.get()) {
            return Uni.createFrom().failure(McpException.connectionClosed(endpoint));
        }

        String requestId = UUID.randomUUID().toString();
        String frame = jsonRpc.createRequest(requestId, method, params);
        LOG.debugv("Sending MCP request: method={0}, id={1}", method, requestId);

        return Uni.createFrom()
                .deferred(() -> exchange(requestId, frame, timeout))
                .ifNoItem()
                .after(timeout)
                .failWith(() -> McpException.timeout(method, timeout))
                .onFailure()
                .transform(this::mapFailure)
                .onTermination()
                .invoke(() -> abandon(requestId))
                .map(jsonRpc::parseResponse);
    }

    @Override
    public final Uni<Void> notify(String method, Object params) {
        Objects.requireNonNull(method, "method must not be null");
        if (closed.get()) {
            return Uni.createFrom().failure(McpException.connectionClosed(endpoint));
        }
        String frame = jsonRpc.createNotification(method, params);
        return Uni.createFrom()
                .deferred(() -> send(frame))
                .onFailure()
                .transform(this::mapFailure);
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.debugv("Closing MCP transport to {0}", LogSanitizer.sanitize(endpoint));
        shutdown(McpException.connectionClosed(endpoint));
    }

    @Override
    public boolean isOpen() {
        return opened.get() && !closed.get();
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener != null ? listener : Listener.NONE;
    }

    /// Prepares the channel before the handshake. Completes immediately by default.
    ///
    /// @return Uni completing when requests may be sent
    protected Uni<Void> connectChannel() {
        return Uni.createFrom().voidItem();
    }

    /// Sends a request frame and yields the raw response frame.
    ///
    /// Implementations register the id with {@link #registerPending(String)} when the answer
    /// arrives through {@link #dispatchInbound(String)}.
    ///
    /// @param requestId id of the request
    /// @param frame serialized request
    /// @param timeout per-request deadline for the underlying exchange
    /// @return Uni emitting the raw response frame
    protected abstract Uni<String> exchange(String requestId, String frame, Duration timeout);

    /// Delivers a frame that expects no answer.
    ///
    /// @param frame serialized notification or response
    /// @return Uni completing once the frame was accepted
    protected abstract Uni<Void> send(String frame);

    /// Cancels streams and in-flight exchanges. Must not throw.
    protected abstract void releaseResources();

    /// Hook invoked with a validated `initialize` result before `notifications/initialized`.
    ///
    /// @param initializeResult server's handshake answer
    protected void onInitialized(JsonNode initializeResult) {}

    /// Drops a pending request whose caller stopped waiting.
    ///
    /// @param requestId id of the request
    protected void abandon(String requestId) {
        CompletableFuture<String> pending = pendingRequests.remove(requestId);
        if (pending != null) {
            pending.cancel(false);
        }
    }

    /// Registers a request that will be answered through {@link #dispatchInbound(String)}.
    ///
    /// @param requestId id of the request
    /// @return future completed with the raw response frame
    protected final CompletableFuture<String> registerPending(String requestId) {
        CompletableFuture<String> future = new CompletableFuture<>();
        pendingRequests.put(requestId, future);
        if (closed.get()) {
            pendingRequests.remove(requestId);
            future.completeExceptionally(McpException.connectionClosed(endpoint));
        }
        return future;
    }

    /// Fails one pending request, if it is still pending.
    ///
    /// @param requestId id of the request
    /// @param failure failure to complete it with
    protected final void failPending(String requestId, Throwable failure) {
        CompletableFuture<String> pending = pendingRequests.remove(requestId);
        if (pending != null) {
            pending.completeExceptionally(failure);
        }
    }

    /// Returns the number of requests still awaiting an answer.
    ///
    /// @return pending request count
    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    /// Returns whether {@link #close()} was called or the transport was lost.
    ///
    /// @return true once closed
    protected final boolean isClosed() {
        return closed.get();
    }

    /// Routes one inbound JSON-RPC frame.
    ///
    /// Responses complete their pending request, `ping` requests are answered with an empty
    /// result, other server requests get a method-not-found error, and notifications go to
    /// the listener. Malformed frames are logged and dropped.
    ///
    /// @param frame raw JSON-RPC frame
    protected final void dispatchInbound(String frame) {
        JsonNode node;
        try {
            node = jsonRpc.parse(frame);
        } catch (McpException e) {
            LOG.warnv(
                    "Dropping malformed frame from {0}: {1}",
                    LogSanitizer.sanitize(endpoint),
                    LogSanitizer.abbreviate(frame));
            return;
        }

        if (jsonRpc.isResponse(node)) {
            String id = jsonRpc.extractId(node);
            CompletableFuture<String> pending = id != null ? pendingRequests.remove(id) : null;
            if (pending != null) {
                pending.complete(frame);
            } else {
                LOG.debugv("Received response for unknown or timed-out ID: {0}", id);
            }
        } else if (jsonRpc.isRequest(node)) {
            answerServerRequest(node);
        } else if (jsonRpc.isNotification(node)) {
            String method = jsonRpc.extractMethod(node);
            LOG.debugv("Received MCP notification: {0}", LogSanitizer.sanitize(method));
            try {
                listener.onNotification(method, node.get("params"));
            } catch (RuntimeException e) {
                LOG.warnv(e, "Notification listener failed for {0}", LogSanitizer.sanitize(method));
            }
        }
    }

    /// Ends the transport after an unexpected loss of its channel.
    ///
    /// Only the first call has an effect, and none after an explicit {@link #close()}.
    ///
    /// @param reason machine-readable reason
    /// @param cause the failure, may be null
    protected final void transportLost(String reason, Throwable cause) {
        if (closed.get() || !lost.compareAndSet(false, true)) {
            return;
        }
        closed.set(true);
        LOG.warnv(
                "MCP transport to {0} lost: {1}",
                LogSanitizer.sanitize(endpoint),
                reason);
        McpException failure =
                cause != null
                        ? McpException.connectionClosed(endpoint, cause)
                        : McpException.connectionClosed(endpoint);
        shutdown(failure);
        if (opened.get()) {
            try {
                listener.onDisconnect(reason, cause);
            } catch (RuntimeException e) {
                LOG.warnv(e, "Disconnect listener failed for {0}", LogSanitizer.sanitize(endpoint));
            }
        }
    }

    private void shutdown(McpException failure) {
        try {
            releaseResources();
        } catch (RuntimeException e) {
            LOG.debugv(e, "Error releasing transport resources for {0}", endpoint);
        }
        pendingRequests.values().forEach(future -> future.completeExceptionally(failure));
        pendingRequests.clear();
    }

    private void answerServerRequest(JsonNode node) {
        String method = jsonRpc.extractMethod(node);
        String reply =
                "ping".equals(method)
                        ? jsonRpc.createResponse(node.get("id"), Map.of())
                        : jsonRpc.createErrorResponse(
                                node.get("id"), METHOD_NOT_FOUND, "Method not found: " + method);
        send(reply)
                .subscribe()
                .with(
                        ignored -> {},
                        failure ->
                                LOG.debugv(
                                        "Failed to answer server request {0}: {1}",
                                        LogSanitizer.sanitize(method),
                                        failure.getMessage()));
    }

    private Throwable mapFailure(Throwable failure) {
        McpException mapped = TransportFailures.map(failure, endpoint);
        if (closed.get() && mapped.getKind() != McpException.Kind.TIMEOUT) {
            return mapped.isUnrecoverable() ? mapped : McpException.connectionClosed(endpoint, mapped);
        }
        return mapped;
    }

    private JsonNode validateHandshake(JsonRpcResponse response) {
        if (response.isError()) {
            throw McpException.protocol(
                    "Initialize rejected: " + response.errorMessage() + " (" + response.errorCode() + ")");
        }
        JsonNode result = response.result();
        if (result == null || !result.isObject() || !result.hasNonNull("protocolVersion")) {
            throw McpException.protocol("Invalid initialize result from " + endpoint);
        }
        onInitialized(result);
        return result;
    }

    private Map<String, Object> initializeParams() {
        Map<String, Object> clientInfo = new LinkedHashMap<>();
        clientInfo.put("name", settings.clientName());
        clientInfo.put("version", settings.clientVersion());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", settings.protocolVersion());
        params.put("capabilities", Map.of());
        params.put("clientInfo", clientInfo);
        return params;
    }
}
