package io.mcpstudio.core.server;

import java.util.Objects;
import java.util.UUID;

/// Describes a remote MCP server the client can connect to.
///
/// Descriptors are immutable. An update produces a new descriptor with the same id
/// via {@link #withEndpoint(String, String, TransportKind)}.
///
/// ### Contracts
/// - **Precondition**: `id` and `url` must not be null or blank
/// - **Postcondition**: `name` defaults to the id when blank, `kind` defaults to SSE
///
/// @param id unique server identifier, not null
/// @param name display name, not null
/// @param url endpoint URL, not null
/// @param kind transport used to reach the server, not null
public record ServerDescriptor(String id, String name, String url, TransportKind kind) {

    /// Compact constructor with validation.
    public ServerDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(url, "url must not be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        kind = kind != null ? kind : TransportKind.SSE;
    }

    /// Creates a descriptor with a generated identifier.
    ///
    /// @param name display name, may be null
    /// @param url endpoint URL, not null
    /// @param kind transport kind, may be null
    /// @return new descriptor, never null
    public static ServerDescriptor create(String name, String url, TransportKind kind) {
        return new ServerDescriptor(UUID.randomUUID().toString(), name, url, kind);
    }

    /// Creates a descriptor whose display name is its id.
    ///
    /// @param id server identifier, not null
    /// @param url endpoint URL, not null
    /// @param kind transport kind, may be null
    /// @return new descriptor, never null
    public static ServerDescriptor of(String id, String url, TransportKind kind) {
        return new ServerDescriptor(id, id, url, kind);
    }

    /// Returns an updated copy keeping this descriptor's id.
    ///
    /// @param newName display name, may be null
    /// @param newUrl endpoint URL, not null
    /// @param newKind transport kind, may be null
    /// @return updated descriptor, never null
    public ServerDescriptor withEndpoint(String newName, String newUrl, TransportKind newKind) {
        return new ServerDescriptor(id, newName, newUrl, newKind);
    }

    /// Returns whether the other descriptor points to the same endpoint over the same transport.
    ///
    /// @param other descriptor to compare, not null
    /// @return true if url and kind match
    public boolean sameEndpoint(ServerDescriptor other) {
        return url.equals(other.url) && kind == other.kind;
    }
}
