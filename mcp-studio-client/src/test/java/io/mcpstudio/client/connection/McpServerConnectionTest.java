package io.mcpstudio.client.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.jsonrpc.JsonRpcResponse;
import io.mcpstudio.client.transport.McpTransport;
import io.mcpstudio.client.transport.McpTransportFactory;
import io.mcpstudio.core.connection.ConnectionState;
import io.mcpstudio.core.connection.ServerSnapshot;
import io.mcpstudio.core.event.DomainEvent;
import io.mcpstudio.core.exception.McpException;
import io.mcpstudio.core.server.ServerDescriptor;
import io.mcpstudio.core.server.TransportKind;
import io.smallrye.mutiny.Uni;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;

class McpServerConnectionTest {

    private static final ServerDescriptor DESCRIPTOR =
            ServerDescriptor.of("s1", "http://localhost:8080/mcp", TransportKind.STREAMABLE_HTTP);

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<DomainEvent> events = new CopyOnWriteArrayList<>();
    private McpTransportFactory factory;
    private McpTransport transport;
    private McpServerConnection connection;

    @BeforeEach
    void setUp() {
        transport = mock(McpTransport.class);
        factory = mock(McpTransportFactory.class);
        when(factory.create(any())).thenReturn(transport);
        when(transport.open()).thenReturn(Uni.createFrom().item(initializeResult()));
        connection = newConnection(McpClientSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        connection.disconnect();
    }

    @Nested
    class Connect {

        @Test
        void shouldReachConnectedAndPublishEstablished() {
            ServerSnapshot snapshot = connection.connect();

            assertThat(snapshot.state()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(connection.serverInfo().get("protocolVersion").asText())
                    .isEqualTo("2025-03-26");
            assertThat(events).extracting(DomainEvent::type).containsExactly("connection.established");
            assertThat(connection.heartbeat().isRunning()).isTrue();
        }

        @Test
        void shouldBeIdempotentWhileConnected() {
            connection.connect();
            connection.connect();

            verify(factory, times(1)).create(any());
            verify(transport, times(1)).open();
            assertThat(events).hasSize(1);
        }

        @Test
        void shouldMoveToErrorAndPublishConnectFailed() {
            when(transport.open())
                    .thenReturn(Uni.createFrom().failure(McpException.transport("refused")));

            assertThatThrownBy(() -> connection.connect())
                    .isInstanceOf(McpException.class)
                    .hasMessage("refused");

            assertThat(connection.state()).isEqualTo(ConnectionState.error("refused"));
            assertThat(events).hasSize(1);
            DomainEvent.ConnectionLost lost = (DomainEvent.ConnectionLost) events.get(0);
            assertThat(lost.reason()).isEqualTo("connect_failed");
            assertThat(lost.error()).isEqualTo("refused");
            verify(transport).close();
        }

        @Test
        void shouldReportUnsupportedTransportAsError() {
            when(factory.create(any())).thenThrow(McpException.transport("Transport 'stdio' is not supported"));

            assertThatThrownBy(() -> connection.connect()).isInstanceOf(McpException.class);

            assertThat(connection.state()).isInstanceOf(ConnectionState.Error.class);
        }

        @Test
        void shouldLeaveErrorOnExplicitConnect() {
            when(transport.open())
                    .thenReturn(Uni.createFrom().failure(McpException.transport("refused")))
                    .thenReturn(Uni.createFrom().item(initializeResult()));

            assertThatThrownBy(() -> connection.connect()).isInstanceOf(McpException.class);
            connection.connect();

            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
        }
    }

    @Nested
    class Disconnect {

        @Test
        void shouldCloseTransportWithoutEvent() {
            connection.connect();

            ServerSnapshot snapshot = connection.disconnect();

            assertThat(snapshot.state()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(connection.serverInfo()).isNull();
            assertThat(connection.heartbeat().isRunning()).isFalse();
            assertThat(events).extracting(DomainEvent::type).containsExactly("connection.established");
            verify(transport).close();
        }

        @Test
        void shouldBeNoOpWhenAlreadyDisconnected() {
            ServerSnapshot snapshot = connection.disconnect();

            assertThat(snapshot.state()).isEqualTo(ConnectionState.DISCONNECTED);
            verify(factory, never()).create(any());
        }
    }

    @Nested
    class Request {

        @Test
        void shouldRejectWhenNotConnectedWithoutTransportCall() {
            assertThatThrownBy(() -> connection.request("tools/list", null, Duration.ofSeconds(1)))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getKind())
                    .isEqualTo(McpException.Kind.NOT_CONNECTED);

            verify(factory, never()).create(any());
        }

        @Test
        void shouldMoveToErrorOnTransportFailure() {
            connection.connect();
            when(transport.request(eq("tools/list"), any(), any()))
                    .thenReturn(Uni.createFrom().failure(McpException.connectionClosed("s1")));

            assertThatThrownBy(() -> connection.request("tools/list", null, Duration.ofSeconds(1)))
                    .isInstanceOf(McpException.class);

            assertThat(connection.state()).isInstanceOf(ConnectionState.Error.class);
            assertThat(lostEvents()).singleElement().extracting(DomainEvent.ConnectionLost::reason)
                    .isEqualTo("transport_error");
        }

        @Test
        void shouldStayConnectedOnTimeout() {
            connection.connect();
            when(transport.request(eq("tools/list"), any(), any()))
                    .thenReturn(
                            Uni.createFrom()
                                    .failure(McpException.timeout("tools/list", Duration.ofSeconds(1))));

            assertThatThrownBy(() -> connection.request("tools/list", null, Duration.ofSeconds(1)))
                    .isInstanceOf(McpException.class);

            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
        }
    }

    @Nested
    class Heartbeat {

        @Test
        void shouldPublishExactlyOneConnectionLostAfterConsecutiveFailures() {
            connection.connect();
            when(transport.request(eq("ping"), any(), any()))
                    .thenReturn(
                            Uni.createFrom().failure(McpException.timeout("ping", Duration.ofSeconds(5))));

            assertThat(connection.probe()).isFalse();
            assertThat(connection.probe()).isFalse();
            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(connection.probe()).isTrue();
            assertThat(connection.probe()).isFalse();

            assertThat(connection.state()).isInstanceOf(ConnectionState.Error.class);
            assertThat(lostEvents()).singleElement().extracting(DomainEvent.ConnectionLost::reason)
                    .isEqualTo("heartbeat_failed");
            assertThat(connection.heartbeat().isRunning()).isFalse();
            verify(transport).close();
        }

        @Test
        void shouldResetFailureCountAfterSuccessfulProbe() {
            connection.connect();
            when(transport.request(eq("ping"), any(), any()))
                    .thenReturn(Uni.createFrom().failure(McpException.transport("blip")))
                    .thenReturn(Uni.createFrom().failure(McpException.transport("blip")))
                    .thenReturn(Uni.createFrom().item(emptyResponse()))
                    .thenReturn(Uni.createFrom().failure(McpException.transport("blip")));

            connection.probe();
            connection.probe();
            connection.probe();
            connection.probe();

            assertThat(connection.heartbeat().consecutiveFailures()).isEqualTo(1);
            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
        }

        @Test
        void shouldTreatErrorAnswerAsAlive() {
            connection.connect();
            ObjectNode error = mapper.createObjectNode().put("code", -32601).put("message", "nope");
            when(transport.request(eq("ping"), any(), any()))
                    .thenReturn(Uni.createFrom().item(new JsonRpcResponse("1", null, error, error)));

            connection.probe();
            connection.probe();
            connection.probe();

            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
        }

        @Test
        void shouldFailAtOnceWhenTransportIsGone() {
            connection.connect();
            when(transport.request(eq("ping"), any(), any()))
                    .thenReturn(Uni.createFrom().failure(McpException.connectionClosed("s1")));

            assertThat(connection.probe()).isTrue();

            assertThat(connection.state()).isInstanceOf(ConnectionState.Error.class);
            assertThat(lostEvents()).hasSize(1);
        }
    }

    @Nested
    class TransportSignals {

        @Test
        void shouldMoveToErrorOnUnexpectedDisconnect() {
            connection.connect();
            McpTransport.Listener listener = capturedListener(transport);

            listener.onDisconnect("sse_stream_closed", null);
            listener.onDisconnect("sse_stream_closed", null);

            assertThat(connection.state())
                    .isEqualTo(ConnectionState.error("Transport closed: sse_stream_closed"));
            assertThat(lostEvents()).singleElement().extracting(DomainEvent.ConnectionLost::reason)
                    .isEqualTo("sse_stream_closed");
        }

        @Test
        void shouldIgnoreSignalsFromReplacedTransport() {
            McpTransport second = mock(McpTransport.class);
            when(second.open()).thenReturn(Uni.createFrom().item(initializeResult()));
            when(factory.create(any())).thenReturn(transport, second);

            connection.connect();
            McpTransport.Listener stale = capturedListener(transport);
            connection.disconnect();
            connection.connect();

            stale.onDisconnect("sse_stream_error", null);

            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(lostEvents()).isEmpty();
        }

        @Test
        void shouldForwardToolListChanges() {
            ConnectionListener listener = mock(ConnectionListener.class);
            connection.setListener(listener);
            connection.connect();

            capturedListener(transport).onNotification("notifications/tools/list_changed", null);
            capturedListener(transport).onNotification("notifications/message", null);

            verify(listener, times(1)).onToolsChanged("s1");
        }

        @Test
        void shouldNotifyListenerOnLoss() {
            ConnectionListener listener = mock(ConnectionListener.class);
            connection.setListener(listener);
            connection.connect();

            capturedListener(transport).onDisconnect("session_expired", null);

            verify(listener).onConnectionLost("s1");
        }
    }

    @Nested
    class AutomaticReconnect {

        @BeforeEach
        void enableReconnect() {
            connection = newConnection(McpClientSettings.builder().autoReconnect(true).build());
        }

        @Test
        void shouldScheduleRetryAfterLossAndRecover() {
            connection.connect();
            capturedListener(transport).onDisconnect("sse_stream_closed", null);
            assertThat(connection.isReconnecting()).isTrue();

            assertThat(connection.attemptReconnect()).isTrue();

            assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(connection.isReconnecting()).isFalse();
            assertThat(events)
                    .extracting(DomainEvent::type)
                    .containsExactly("connection.established", "connection.lost", "connection.established");
        }

        @Test
        void shouldNotPublishAdditionalLossForFailedRetries() {
            connection.connect();
            capturedListener(transport).onDisconnect("sse_stream_closed", null);
            when(transport.open())
                    .thenReturn(Uni.createFrom().failure(McpException.transport("still down")));

            assertThat(connection.attemptReconnect()).isFalse();
            assertThat(connection.attemptReconnect()).isFalse();

            assertThat(connection.state()).isEqualTo(ConnectionState.error("still down"));
            assertThat(lostEvents()).hasSize(1);
            assertThat(connection.isReconnecting()).isTrue();
        }

        @Test
        void shouldStopRetryingOnExplicitDisconnect() {
            connection.connect();
            capturedListener(transport).onDisconnect("sse_stream_closed", null);

            connection.disconnect();

            assertThat(connection.isReconnecting()).isFalse();
            assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
        }

        @Test
        @Timeout(10)
        void shouldSerializeDisconnectWithRunningRetry() throws Exception {
            McpTransport retried = mock(McpTransport.class);
            CountDownLatch openStarted = new CountDownLatch(1);
            CompletableFuture<JsonNode> handshake = new CompletableFuture<>();
            when(retried.open())
                    .thenReturn(
                            Uni.createFrom()
                                    .completionStage(
                                            () -> {
                                                openStarted.countDown();
                                                return handshake;
                                            }));
            when(factory.create(any())).thenReturn(transport).thenReturn(retried);
            connection.connect();
            capturedListener(transport).onDisconnect("sse_stream_closed", null);

            ExecutorService threads = Executors.newFixedThreadPool(2);
            try {
                Future<Boolean> retry = threads.submit(connection::attemptReconnect);
                assertThat(openStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Future<ServerSnapshot> disconnecting = threads.submit(connection::disconnect);

                Thread.sleep(200);
                assertThat(disconnecting.isDone()).isFalse();
                assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTING);

                handshake.complete(initializeResult());

                assertThat(retry.get(5, TimeUnit.SECONDS)).isTrue();
                assertThat(disconnecting.get(5, TimeUnit.SECONDS).state())
                        .isEqualTo(ConnectionState.DISCONNECTED);
            } finally {
                threads.shutdownNow();
            }

            assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(connection.isReconnecting()).isFalse();
            assertThat(connection.heartbeat().isRunning()).isFalse();
            verify(retried).close();
            assertThat(lostEvents()).hasSize(1);
        }
    }

    private McpServerConnection newConnection(McpClientSettings settings) {
        return new McpServerConnection(DESCRIPTOR, factory, events::add, settings);
    }

    private McpTransport.Listener capturedListener(McpTransport target) {
        ArgumentCaptor<McpTransport.Listener> captor =
                ArgumentCaptor.forClass(McpTransport.Listener.class);
        verify(target, atLeastOnce()).setListener(captor.capture());
        return captor.getValue();
    }

    private List<DomainEvent.ConnectionLost> lostEvents() {
        return events.stream()
                .filter(DomainEvent.ConnectionLost.class::isInstance)
                .map(DomainEvent.ConnectionLost.class::cast)
                .toList();
    }

    private ObjectNode initializeResult() {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", "2025-03-26");
        result.putObject("serverInfo").put("name", "test-server").put("version", "1.0.0");
        result.putObject("capabilities").putObject("tools");
        return result;
    }

    private JsonRpcResponse emptyResponse() {
        ObjectNode result = mapper.createObjectNode();
        return new JsonRpcResponse("1", result, null, result);
    }
}
