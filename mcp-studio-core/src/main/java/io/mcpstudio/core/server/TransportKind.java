package io.mcpstudio.core.server;

import java.util.Locale;

/// Wire transport used to reach an MCP server.
///
/// The set is closed so that every switch over it is checked for exhaustiveness.
///
/// | Kind              | Wire value        | Status      |
/// |-------------------|-------------------|-------------|
/// | `SSE`             | `sse`             | supported   |
/// | `STREAMABLE_HTTP` | `streamable_http` | supported   |
/// | `STDIO`           | `stdio`           | reserved    |
public enum TransportKind {

    /// Long-lived GET event stream plus a POST command channel.
    SSE("sse"),

    /// One HTTP request/response exchange per call, optionally streamed.
    STREAMABLE_HTTP("streamable_http"),

    /// Local process pipe. Reserved, no transport implements it yet.
    STDIO("stdio");

    private final String value;

    TransportKind(String value) {
        this.value = value;
    }

    /// Returns the persisted/wire representation.
    ///
    /// @return lowercase identifier, never null
    public String value() {
        return value;
    }

    /// Returns whether a transport implementation exists for this kind.
    ///
    /// @return false for reserved kinds
    public boolean isSupported() {
        return this != STDIO;
    }

    /// Parses a stored transport value.
    ///
    /// Unknown or missing values fall back to {@link #SSE}, which is what server
    /// definitions created before the kind was recorded used.
    ///
    /// @param value stored value, may be null
    /// @return matching kind, never null
    public static TransportKind fromValue(String value) {
        if (value == null) {
            return SSE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransportKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return SSE;
    }

    @Override
    public String toString() {
        return value;
    }
}
