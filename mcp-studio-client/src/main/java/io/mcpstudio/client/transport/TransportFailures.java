package io.mcpstudio.client.transport;

import io.mcpstudio.core.exception.McpException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/// Maps low-level I/O failures onto {@link McpException} kinds.
///
/// | Failure                                                  | Kind                |
/// |----------------------------------------------------------|---------------------|
/// | `HttpTimeoutException`                                   | `TIMEOUT`           |
/// | `ConnectException`, `ClosedChannelException`, `EOFException`, cancellation | `CONNECTION_CLOSED` |
/// | any other `IOException`                                  | `TRANSPORT`         |
final class TransportFailures {

    private TransportFailures() {}

    static McpException map(Throwable failure, String endpoint) {
        Throwable cause = unwrap(failure);
        if (cause instanceof McpException mcp) {
            return mcp;
        }
        if (cause instanceof HttpTimeoutException) {
            return new McpException(
                    McpException.Kind.TIMEOUT, "HTTP request to " + endpoint + " timed out", cause);
        }
        if (cause instanceof ConnectException
                || cause instanceof ClosedChannelException
                || cause instanceof EOFException
                || cause instanceof CancellationException) {
            return McpException.connectionClosed(endpoint, cause);
        }
        if (cause instanceof IOException) {
            return McpException.transport(
                    "I/O failure talking to " + endpoint + ": " + cause.getMessage(), cause);
        }
        return McpException.transport(
                "Unexpected failure talking to " + endpoint + ": " + cause, cause);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
