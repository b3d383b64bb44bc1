package io.mcpstudio.core.tool;

import java.time.Duration;
import java.util.Objects;

/// Outcome of a remote tool invocation.
///
/// A result exists whenever the server answered. Remote failures (unknown tool, tool
/// reported an error) are results with `success == false`, not exceptions. Failures where
/// no answer was obtained at all are raised as {@link io.mcpstudio.core.exception.McpException}.
///
/// The caller owns the result and is responsible for recording it in call history.
///
/// @param success whether the remote tool completed successfully
/// @param rawResponse pretty-printed response document, not null
/// @param result parsed payload (maps, lists, scalars), may be null
/// @param error error message reported by the server, may be null
/// @param duration wall-clock time between sending the call and receiving the answer, not null
public record InvocationResult(
        boolean success, String rawResponse, Object result, String error, Duration duration) {

    /// Compact constructor with validation.
    public InvocationResult {
        Objects.requireNonNull(rawResponse, "rawResponse must not be null");
        duration = duration != null ? duration : Duration.ZERO;
    }

    /// Creates a successful result.
    ///
    /// @param rawResponse response document, not null
    /// @param result parsed payload, may be null
    /// @param duration measured duration, not null
    /// @return successful result, never null
    public static InvocationResult success(String rawResponse, Object result, Duration duration) {
        return new InvocationResult(true, rawResponse, result, null, duration);
    }

    /// Creates a result for a call the server rejected or reported as failed.
    ///
    /// @param rawResponse response document, not null
    /// @param result payload the server sent alongside the error, may be null
    /// @param error error message, not null
    /// @param duration measured duration, not null
    /// @return failed result, never null
    public static InvocationResult failure(
            String rawResponse, Object result, String error, Duration duration) {
        Objects.requireNonNull(error, "error must not be null");
        return new InvocationResult(false, rawResponse, result, error, duration);
    }

    /// Returns the measured duration in milliseconds.
    ///
    /// @return duration in milliseconds
    public long durationMs() {
        return duration.toMillis();
    }
}
