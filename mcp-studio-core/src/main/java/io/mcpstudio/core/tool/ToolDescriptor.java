package io.mcpstudio.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Describes a tool advertised by an MCP server.
///
/// Schemas and metadata are opaque structured documents (JSON objects converted to maps).
/// Descriptors are only ever produced by a successful capability refresh and live in a
/// volatile cache, they are never persisted.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: map fields are unmodifiable and never null
///
/// @param name tool name, unique within one server, not null
/// @param description human-readable description, may be null
/// @param inputSchema JSON schema of the arguments, empty if absent
/// @param outputSchema JSON schema of the structured output, empty if absent
/// @param extra any other fields the server sent (title, annotations, _meta), empty if none
public record ToolDescriptor(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Map<String, Object> outputSchema,
        Map<String, Object> extra) {

    /// Compact constructor with validation.
    public ToolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        inputSchema = freeze(inputSchema);
        outputSchema = freeze(outputSchema);
        extra = freeze(extra);
    }

    /// Creates a descriptor with only a name and a description.
    ///
    /// @param name tool name, not null
    /// @param description description, may be null
    /// @return new descriptor, never null
    public static ToolDescriptor of(String name, String description) {
        return new ToolDescriptor(name, description, Map.of(), Map.of(), Map.of());
    }

    // JSON documents may contain null values, which Map.copyOf rejects
    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
