package io.mcpstudio.core.tool;

import java.util.List;
import java.util.Objects;

/// Outcome of a capability refresh.
///
/// @param tools the complete tool list of the server, not null
/// @param rawResponse pretty-printed response document for diagnostic display, not null
public record ToolsListResult(List<ToolDescriptor> tools, String rawResponse) {

    public ToolsListResult {
        tools = tools != null ? List.copyOf(tools) : List.of();
        Objects.requireNonNull(rawResponse, "rawResponse must not be null");
    }

    /// Returns the tool names in server order.
    ///
    /// @return tool names, never null
    public List<String> toolNames() {
        return tools.stream().map(ToolDescriptor::name).toList();
    }
}
