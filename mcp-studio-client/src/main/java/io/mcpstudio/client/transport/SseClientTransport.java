package io.mcpstudio.client.transport;

import io.mcpstudio.client.config.McpClientSettings;
import io.mcpstudio.client.jsonrpc.JsonRpc;
import io.mcpstudio.client.util.LogSanitizer;
import io.mcpstudio.core.exception.McpException;
import io.smallrye.mutiny.Uni;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscribers;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.jboss.logging.Logger;

/// MCP transport over a long-lived Server-Sent Events stream.
///
/// ### Wire Flow
/// ```
/// +——————————————+                         +——————————————+
/// │  Client      │———— GET (stream) ——————>│  MCP Server  │
/// │              │<——— event: endpoint ————│              │
/// │              │———— POST request ——————>│  /messages   │
/// │  pending map │<——— event: message —————│              │
/// +——————————————+                         +——————————————+
/// ```
///
/// The `endpoint` event names the URL requests are posted to, relative URLs are resolved
/// against the stream URL. Responses arrive as `message` events on the stream and are
/// correlated by id.
///
/// ### Disconnect Reasons
/// - `sse_initial_response_error` - the GET was answered with a non-2xx status
/// - `sse_stream_error` - the stream failed
/// - `sse_stream_closed` - the server ended the stream
/// - `post_send_error` - a POST failed
public class SseClientTransport extends AbstractMcpTransport {

    private static final Logger LOG = Logger.getLogger(SseClientTransport.class);

    static final String ENDPOINT_EVENT = "endpoint";

    private final HttpClient httpClient;
    private final URI streamUri;
    private final CompletableFuture<URI> postEndpoint = new CompletableFuture<>();
    private volatile SseLineSubscriber streamSubscriber;
    private volatile CompletableFuture<HttpResponse<Void>> streamExchange;

    public SseClientTransport(
            String endpoint, HttpClient httpClient, JsonRpc jsonRpc, McpClientSettings settings) {
        super(endpoint, jsonRpc, settings);
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.streamUri = URI.create(endpoint);
    }

    @Override
    protected Uni<Void> connectChannel() {
        SseLineSubscriber subscriber =
                new SseLineSubscriber(
                        this::onEvent,
                        () -> streamEnded("sse_stream_closed", null),
                        failure -> streamEnded("sse_stream_error", failure));
        streamSubscriber = subscriber;

        HttpRequest request =
                HttpRequest.newBuilder(streamUri)
                        .header("Accept", "text/event-stream")
                        .header("Cache-Control", "no-cache")
                        .GET()
                        .build();

        LOG.debugv("Opening SSE stream to {0}", LogSanitizer.sanitize(endpoint));
        streamExchange =
                httpClient.sendAsync(
                        request,
                        info ->
                                isSuccess(info.statusCode())
                                        ? BodySubscribers.fromLineSubscriber(subscriber)
                                        : BodySubscribers.discarding());
        streamExchange.whenComplete(
                (response, failure) -> {
                    if (failure != null) {
                        streamEnded("sse_stream_error", failure);
                    } else if (!isSuccess(response.statusCode())) {
                        streamEnded(
                                "sse_initial_response_error",
                                McpException.transport(
                                        "SSE stream rejected with HTTP " + response.statusCode()));
                    }
                });

        return Uni.createFrom().completionStage(postEndpoint).replaceWithVoid();
    }

    @Override
    protected Uni<String> exchange(String requestId, String frame, Duration timeout) {
        CompletableFuture<String> response = registerPending(requestId);
        return send(frame).chain(() -> Uni.createFrom().completionStage(response));
    }

    @Override
    protected Uni<Void> send(String frame) {
        URI target = postEndpoint.getNow(null);
        if (target == null) {
            return Uni.createFrom()
                    .failure(McpException.protocol("No message endpoint received from " + endpoint));
        }

        HttpRequest request =
                HttpRequest.newBuilder(target)
                        .header("Content-Type", "application/json")
                        .timeout(settings.requestTimeout())
                        .POST(HttpRequest.BodyPublishers.ofString(frame))
                        .build();

        return Uni.createFrom()
                .completionStage(() -> httpClient.sendAsync(request, BodyHandlers.discarding()))
                .onItem()
                .transformToUni(
                        response ->
                                isSuccess(response.statusCode())
                                        ? Uni.createFrom().voidItem()
                                        : Uni.createFrom()
                                                .<Void>failure(
                                                        McpException.transport(
                                                                "POST to "
                                                                        + target
                                                                        + " returned HTTP "
                                                                        + response.statusCode())))
                .onFailure()
                .invoke(failure -> transportLost("post_send_error", failure));
    }

    @Override
    protected void releaseResources() {
        SseLineSubscriber subscriber = streamSubscriber;
        if (subscriber != null) {
            subscriber.cancel();
        }
        CompletableFuture<HttpResponse<Void>> exchange = streamExchange;
        if (exchange != null) {
            exchange.cancel(true);
        }
        postEndpoint.completeExceptionally(McpException.connectionClosed(endpoint));
    }

    /// Returns the resolved POST endpoint, null until the `endpoint` event arrived.
    ///
    /// @return message endpoint or null
    URI messageEndpoint() {
        return postEndpoint.getNow(null);
    }

    private void onEvent(SseEvent event) {
        if (ENDPOINT_EVENT.equals(event.event())) {
            URI resolved;
            try {
                resolved = streamUri.resolve(event.data().trim());
            } catch (IllegalArgumentException e) {
                postEndpoint.completeExceptionally(
                        McpException.protocol("Invalid message endpoint: " + event.data(), e));
                return;
            }
            if (postEndpoint.complete(resolved)) {
                LOG.debugv("SSE message endpoint: {0}", LogSanitizer.sanitize(resolved.toString()));
            }
        } else if (event.isMessage()) {
            dispatchInbound(event.data());
        } else {
            LOG.debugv("Ignoring SSE event {0}", LogSanitizer.sanitize(event.event()));
        }
    }

    private void streamEnded(String reason, Throwable failure) {
        if (isClosed()) {
            return;
        }
        McpException cause =
                failure != null
                        ? TransportFailures.map(failure, endpoint)
                        : McpException.connectionClosed(endpoint);
        postEndpoint.completeExceptionally(cause);
        transportLost(reason, failure);
    }

    private static boolean isSuccess(int status) {
        return status / 100 == 2;
    }
}
