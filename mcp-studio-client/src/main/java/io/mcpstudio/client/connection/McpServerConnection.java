package io.mcpstudio.client.connection;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.jsonrpc.JsonRpcResponse;
import io.mcpstudio.client.transport.McpTransport;
import io.mcpstudio.client.transport.McpTransportFactory;
import io.mcpstudio.client.util.LogSanitizer;
import io.mcpstudio.core.connection.ConnectionState;
import io.mcpstudio.core.connection.ServerSnapshot;
import io.mcpstudio.core.event.DomainEvent;
import io.mcpstudio.core.event.EventPublisher;
import io.mcpstudio.core.exception.McpException;
import io.mcpstudio.core.server.ServerDescriptor;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.smallrye.mutiny.subscription.Cancellable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/// Connection to one MCP server and the state machine around it.
///
/// ### State Machine
/// ```
///              connect                 handshake ok
/// Disconnected ————————> Connecting ————————————————> Connected
///      ^  ^                   │                          │  │
///      │  │                   │ handshake failed         │  │ heartbeat failed,
///      │  │                   v                          │  │ transport lost
///      │  └—————————————— Error <———————————————————————————┘
///      │     disconnect     │  ^
///      │                    └——┘ reconnect (explicit or automatic)
///      └——————————————————————————————————————————————————┘
///                          disconnect
/// ```
///
/// ### Events
/// - `ConnectionEstablished` on every transition into Connected
/// - `ConnectionLost` on Connecting to Error (reason `connect_failed`) and on Connected
///   to Error (reason `heartbeat_failed`, `transport_error` or the transport's own reason)
/// - nothing on explicit disconnect, nothing for failed automatic reconnect attempts
///
/// ### Thread Safety
/// Every mutation runs under a per-connection {@link ReentrantLock}. The state is
/// published through an atomic reference, so readers never block and always see either
/// the old or the new state. Each transport opened by this connection gets a generation
/// number; loss signals carrying an older generation are ignored.
public class McpServerConnection {

    private static final Logger LOG = Logger.getLogger(McpServerConnection.class);

    static final String PING = "ping";

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicLong generation = new AtomicLong();
    private final McpTransportFactory transportFactory;
    private final EventPublisher events;
    private final McpClientSettings settings;
    private final HeartbeatMonitor heartbeat;

    private volatile ServerDescriptor descriptor;
    private volatile McpTransport transport;
    private volatile JsonNode serverInfo;
    private volatile ConnectionListener listener = ConnectionListener.NONE;
    private Cancellable reconnectLoop;

    public McpServerConnection(
            ServerDescriptor descriptor,
            McpTransportFactory transportFactory,
            EventPublisher events,
            McpClientSettings settings) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.transportFactory =
                Objects.requireNonNull(transportFactory, "transportFactory must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.heartbeat =
                new HeartbeatMonitor(
                        descriptor.id(), settings.heartbeatInterval(), settings.heartbeatMaxFailures());
    }

    /// Drives the connection to Connected.
    ///
    /// Returns at once when already connected. Otherwise a new transport is opened and
    /// the handshake performed; a pending automatic reconnect is cancelled.
    ///
    /// @return resulting snapshot, state Connected
    /// @throws McpException if the transport could not be opened, the state is then Error
    public ServerSnapshot connect() {
        lock.lock();
        try {
            cancelReconnect();
            if (state.get().isConnected()) {
                return snapshot();
            }
            openTransport(true);
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /// Drops the current transport, if any, and opens a fresh one.
    ///
    /// No `ConnectionLost` is published for the dropped transport.
    ///
    /// @return resulting snapshot, state Connected
    /// @throws McpException if the transport could not be opened, the state is then Error
    public ServerSnapshot reconnect() {
        lock.lock();
        try {
            cancelReconnect();
            releaseTransport();
            state.set(ConnectionState.DISCONNECTED);
            openTransport(true);
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /// Stops the heartbeat, closes the transport and moves to Disconnected.
    ///
    /// In-flight requests fail with `CONNECTION_CLOSED`. No event is published.
    ///
    /// @return resulting snapshot, state Disconnected
    public ServerSnapshot disconnect() {
        lock.lock();
        try {
            cancelReconnect();
            boolean wasDisconnected = state.get() instanceof ConnectionState.Disconnected;
            releaseTransport();
            state.set(ConnectionState.DISCONNECTED);
            if (!wasDisconnected) {
                LOG.infov("Disconnected from MCP server {0}", LogSanitizer.sanitize(descriptor.id()));
            }
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /// Sends a request over the live transport.
    ///
    /// Fails without touching any transport when not connected. A broken channel moves the
    /// connection to Error before the failure is rethrown; an HTTP error reply does not.
    ///
    /// @param method JSON-RPC method
    /// @param params request parameters, may be null
    /// @param timeout deadline of the request
    /// @return the response, possibly a JSON-RPC error
    /// @throws McpException with kind NOT_CONNECTED, TIMEOUT, TRANSPORT, PROTOCOL or
    ///     CONNECTION_CLOSED
    public JsonRpcResponse request(String method, Object params, Duration timeout) {
        long requestGeneration = generation.get();
        McpTransport current = transport;
        if (current == null || !state.get().isConnected()) {
            throw McpException.notConnected(descriptor.id());
        }
        try {
            return current.request(method, params, timeout).await().indefinitely();
        } catch (McpException e) {
            if (e.isTransportFailure()) {
                markLost(requestGeneration, "transport_error", e.getMessage());
            }
            throw e;
        }
    }

    /// Runs an action while holding this connection's lock.
    ///
    /// Used for operations that must not interleave with connect, disconnect or loss
    /// handling, such as a tool refresh.
    ///
    /// @param action the action
    /// @param <T> result type
    /// @return the action's result
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /// Replaces the descriptor when the connection is not live.
    ///
    /// @param replacement new descriptor with the same id
    /// @return true if replaced, false while connected
    public boolean replaceDescriptor(ServerDescriptor replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (!replacement.id().equals(descriptor.id())) {
            throw new IllegalArgumentException("Descriptor id mismatch: " + replacement.id());
        }
        lock.lock();
        try {
            if (state.get().isConnected()) {
                return false;
            }
            descriptor = replacement;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Runs one heartbeat probe synchronously.
    ///
    /// @return true if this probe moved the connection to Error
    boolean probe() {
        return heartbeat.check().await().indefinitely();
    }

    HeartbeatMonitor heartbeat() {
        return heartbeat;
    }

    /// Moves a connected connection to Error after its transport broke.
    ///
    /// Ignored when the generation is stale or the connection is not connected, so each
    /// loss yields exactly one `ConnectionLost`.
    ///
    /// @param lostGeneration generation of the transport that broke
    /// @param reason machine-readable reason
    /// @param error failure description, may be null
    void markLost(long lostGeneration, String reason, String error) {
        lock.lock();
        try {
            if (lostGeneration != generation.get() || !state.get().isConnected()) {
                return;
            }
            releaseTransport();
            String message = error != null ? error : "Transport closed: " + reason;
            state.set(ConnectionState.error(message));
            LOG.warnv(
                    "Lost connection to MCP server {0} ({1}): {2}",
                    LogSanitizer.sanitize(descriptor.id()),
                    reason,
                    LogSanitizer.sanitize(message));
            publish(DomainEvent.ConnectionLost.now(descriptor.id(), message, reason));
            notifyListener(() -> listener.onConnectionLost(descriptor.id()));
            if (settings.autoReconnect()) {
                scheduleReconnect();
            }
        } finally {
            lock.unlock();
        }
    }

    public ConnectionState state() {
        return state.get();
    }

    public ServerDescriptor descriptor() {
        return descriptor;
    }

    public String serverId() {
        return descriptor.id();
    }

    public ServerSnapshot snapshot() {
        return new ServerSnapshot(descriptor, state.get());
    }

    /// Returns the `initialize` result of the live transport.
    ///
    /// @return handshake result, or null when not connected
    public JsonNode serverInfo() {
        return serverInfo;
    }

    public void setListener(ConnectionListener listener) {
        this.listener = listener != null ? listener : ConnectionListener.NONE;
    }

    /// Returns whether an automatic reconnect loop is scheduled.
    ///
    /// @return true while retrying
    public boolean isReconnecting() {
        lock.lock();
        try {
            return reconnectLoop != null;
        } finally {
            lock.unlock();
        }
    }

    private void openTransport(boolean publishFailure) {
        long openGeneration = generation.incrementAndGet();
        ServerDescriptor target = descriptor;
        state.set(ConnectionState.CONNECTING);
        LOG.infov(
                "Connecting to MCP server {0} at {1} ({2})",
                LogSanitizer.sanitize(target.id()),
                LogSanitizer.sanitize(target.url()),
                target.kind());

        McpTransport created = null;
        try {
            created = transportFactory.create(target);
            created.setListener(new TransportEvents(openGeneration));
            JsonNode info = created.open().await().indefinitely();

            McpTransport live = created;
            transport = live;
            serverInfo = info;
            state.set(ConnectionState.CONNECTED);
            LOG.infov("Connected to MCP server {0}", LogSanitizer.sanitize(target.id()));
            publish(DomainEvent.ConnectionEstablished.now(target.id()));
            heartbeat.start(
                    () -> probeTransport(live),
                    error -> markLost(openGeneration, "heartbeat_failed", error));
        } catch (RuntimeException e) {
            if (created != null) {
                created.close();
            }
            McpException failure =
                    e instanceof McpException mcp
                            ? mcp
                            : McpException.connectionFailed(target.url(), e);
            state.set(ConnectionState.error(failure.getMessage()));
            LOG.warnv(
                    "Failed to connect to MCP server {0}: {1}",
                    LogSanitizer.sanitize(target.id()),
                    LogSanitizer.sanitize(failure.getMessage()));
            if (publishFailure) {
                publish(
                        DomainEvent.ConnectionLost.now(
                                target.id(), failure.getMessage(), "connect_failed"));
            }
            throw failure;
        }
    }

    private Uni<Void> probeTransport(McpTransport target) {
        // any JSON-RPC answer, even an error, proves the server is alive
        return target.request(PING, null, settings.probeTimeout()).replaceWithVoid();
    }

    private void releaseTransport() {
        generation.incrementAndGet();
        heartbeat.stop();
        McpTransport current = transport;
        transport = null;
        serverInfo = null;
        if (current != null) {
            current.close();
        }
    }

    private void scheduleReconnect() {
        Duration interval = settings.reconnectInterval();
        LOG.infov(
                "Reconnecting to MCP server {0} every {1}",
                LogSanitizer.sanitize(descriptor.id()),
                interval);
        reconnectLoop =
                Multi.createFrom()
                        .ticks()
                        .startingAfter(interval)
                        .every(interval)
                        .onOverflow()
                        .drop()
                        .onItem()
                        .transformToUniAndConcatenate(
                                tick ->
                                        Uni.createFrom()
                                                .item(this::attemptReconnect)
                                                .runSubscriptionOn(
                                                        Infrastructure.getDefaultWorkerPool()))
                        .subscribe()
                        .with(
                                done -> {},
                                failure ->
                                        LOG.errorv(
                                                failure,
                                                "Reconnect loop failed for {0}",
                                                LogSanitizer.sanitize(descriptor.id())));
    }

    /// One automatic reconnect attempt.
    ///
    /// @return true once the loop is finished
    boolean attemptReconnect() {
        lock.lock();
        try {
            if (!(state.get() instanceof ConnectionState.Error)) {
                cancelReconnect();
                return true;
            }
            try {
                openTransport(false);
                cancelReconnect();
                return true;
            } catch (McpException e) {
                LOG.debugv(
                        "Reconnect attempt to {0} failed: {1}",
                        LogSanitizer.sanitize(descriptor.id()),
                        LogSanitizer.sanitize(e.getMessage()));
                return false;
            }
        } finally {
            lock.unlock();
        }
    }

    private void cancelReconnect() {
        if (reconnectLoop != null) {
            reconnectLoop.cancel();
            reconnectLoop = null;
        }
    }

    private void publish(DomainEvent event) {
        try {
            events.publish(event);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Event publisher failed for {0}", event.type());
        }
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warnv(e, "Connection listener failed for {0}", LogSanitizer.sanitize(descriptor.id()));
        }
    }

    /// Transport callbacks bound to the generation of the transport that raised them.
    private final class TransportEvents implements McpTransport.Listener {

        private final long transportGeneration;

        private TransportEvents(long transportGeneration) {
            this.transportGeneration = transportGeneration;
        }

        @Override
        public void onDisconnect(String reason, Throwable cause) {
            String error = "Transport closed: " + reason;
            markLost(transportGeneration, reason, error);
        }

        @Override
        public void onNotification(String method, JsonNode params) {
            if ("notifications/tools/list_changed".equals(method)
                    && transportGeneration == generation.get()) {
                notifyListener(() -> listener.onToolsChanged(descriptor.id()));
            }
        }
    }
}
