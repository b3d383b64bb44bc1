package io.mcpstudio.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.jsonrpc.JsonRpc;
import io.mcpstudio.client.util.LogSanitizer;
import io.mcpstudio.core.exception.McpException;
import io.smallrye.mutiny.Uni;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/// MCP transport where every message is its own HTTP POST.
///
/// The server answers a request either with an `application/json` body holding the
/// response, or with a `text/event-stream` body whose `message` events carry the response
/// and any notifications sent before it.
///
/// ### Session Handling
/// The `Mcp-Session-Id` header returned with the `initialize` response is echoed on every
/// later request, together with `MCP-Protocol-Version` once the handshake is done. A 404
/// while a session is active means the server dropped the session: the transport is lost
/// with reason `session_expired`. Closing the transport sends a best-effort `DELETE`.
public class StreamableHttpClientTransport extends AbstractMcpTransport {

    private static final Logger LOG = Logger.getLogger(StreamableHttpClientTransport.class);

    static final String SESSION_HEADER = "Mcp-Session-Id";
    static final String PROTOCOL_VERSION_HEADER = "MCP-Protocol-Version";
    static final String ACCEPT = "application/json, text/event-stream";

    private final HttpClient httpClient;
    private final URI uri;
    private final AtomicReference<String> sessionId = new AtomicReference<>();
    private final Map<String, CompletableFuture<HttpResponse<Void>>> inFlight =
            new ConcurrentHashMap<>();
    private volatile String negotiatedVersion;

    public StreamableHttpClientTransport(
            String endpoint, HttpClient httpClient, JsonRpc jsonRpc, McpClientSettings settings) {
        super(endpoint, jsonRpc, settings);
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.uri = URI.create(endpoint);
    }

    @Override
    protected Uni<String> exchange(String requestId, String frame, Duration timeout) {
        CompletableFuture<String> response = registerPending(requestId);
        CompletableFuture<HttpResponse<Void>> call =
                httpClient.sendAsync(post(frame, timeout), bodyHandler());
        inFlight.put(requestId, call);
        call.whenComplete(
                (httpResponse, failure) -> {
                    inFlight.remove(requestId);
                    if (failure != null) {
                        failPending(requestId, failure);
                        return;
                    }
                    McpException statusFailure = checkStatus(httpResponse.statusCode());
                    if (statusFailure != null) {
                        failPending(requestId, statusFailure);
                        return;
                    }
                    failPending(
                            requestId,
                            McpException.protocol("No response received for request " + requestId));
                });
        return Uni.createFrom().completionStage(response);
    }

    @Override
    protected Uni<Void> send(String frame) {
        return Uni.createFrom()
                .completionStage(
                        () -> httpClient.sendAsync(post(frame, settings.requestTimeout()), bodyHandler()))
                .onItem()
                .transformToUni(
                        response -> {
                            McpException statusFailure = checkStatus(response.statusCode());
                            return statusFailure == null
                                    ? Uni.createFrom().voidItem()
                                    : Uni.createFrom().<Void>failure(statusFailure);
                        });
    }

    @Override
    protected void onInitialized(JsonNode initializeResult) {
        negotiatedVersion = initializeResult.get("protocolVersion").asText();
    }

    @Override
    protected void abandon(String requestId) {
        super.abandon(requestId);
        CompletableFuture<HttpResponse<Void>> call = inFlight.remove(requestId);
        if (call != null) {
            call.cancel(true);
        }
    }

    @Override
    protected void releaseResources() {
        inFlight.values().forEach(call -> call.cancel(true));
        inFlight.clear();

        String session = sessionId.get();
        if (session != null) {
            HttpRequest delete =
                    HttpRequest.newBuilder(uri)
                            .header(SESSION_HEADER, session)
                            .timeout(settings.probeTimeout())
                            .DELETE()
                            .build();
            httpClient
                    .sendAsync(delete, HttpResponse.BodyHandlers.discarding())
                    .whenComplete(
                            (response, failure) -> {
                                if (failure != null) {
                                    LOG.debugv(
                                            "Session DELETE to {0} failed: {1}",
                                            LogSanitizer.sanitize(endpoint),
                                            failure.getMessage());
                                }
                            });
        }
    }

    /// Returns the session id assigned by the server, null before the handshake.
    ///
    /// @return session id or null
    String sessionId() {
        return sessionId.get();
    }

    private HttpRequest post(String frame, Duration timeout) {
        HttpRequest.Builder builder =
                HttpRequest.newBuilder(uri)
                        .header("Content-Type", "application/json")
                        .header("Accept", ACCEPT)
                        .timeout(timeout)
                        .POST(HttpRequest.BodyPublishers.ofString(frame));
        String session = sessionId.get();
        if (session != null) {
            builder.header(SESSION_HEADER, session);
        }
        String version = negotiatedVersion;
        if (version != null) {
            builder.header(PROTOCOL_VERSION_HEADER, version);
        }
        return builder.build();
    }

    private BodyHandler<Void> bodyHandler() {
        return info -> {
            info.headers().firstValue(SESSION_HEADER).ifPresent(id -> sessionId.compareAndSet(null, id));
            if (info.statusCode() / 100 != 2) {
                return BodySubscribers.discarding();
            }
            String contentType = info.headers().firstValue("Content-Type").orElse("");
            if (contentType.startsWith("text/event-stream")) {
                return BodySubscribers.fromLineSubscriber(
                        new SseLineSubscriber(
                                event -> {
                                    if (event.isMessage()) {
                                        dispatchInbound(event.data());
                                    }
                                },
                                () -> {},
                                failure ->
                                        LOG.debugv(
                                                "Response stream from {0} failed: {1}",
                                                LogSanitizer.sanitize(endpoint),
                                                failure.getMessage())));
            }
            return BodySubscribers.mapping(
                    BodySubscribers.ofString(StandardCharsets.UTF_8),
                    body -> {
                        if (!body.isBlank()) {
                            dispatchInbound(body);
                        }
                        return null;
                    });
        };
    }

    private McpException checkStatus(int status) {
        if (status / 100 == 2) {
            return null;
        }
        if (status == 404 && sessionId.get() != null) {
            McpException expired = McpException.connectionClosed(endpoint);
            transportLost("session_expired", expired);
            return expired;
        }
        return McpException.httpStatus(endpoint, status);
    }
}
