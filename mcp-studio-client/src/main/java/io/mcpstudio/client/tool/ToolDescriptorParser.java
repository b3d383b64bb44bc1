package io.mcpstudio.client.tool;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpstudio.client.jsonrpc.JsonRpc;
import io.mcpstudio.core.exception.McpException;
import io.mcpstudio.core.tool.ToolDescriptor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Converts the `tools` array of a `tools/list` result into descriptors.
///
/// `name`, `description`, `inputSchema` and `outputSchema` map to their own fields, every
/// other member of a wire tool object is kept in {@link ToolDescriptor#extra()}.
public final class ToolDescriptorParser {

    private final JsonRpc jsonRpc;

    public ToolDescriptorParser(JsonRpc jsonRpc) {
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
    }

    /// Parses one page of a `tools/list` result.
    ///
    /// @param result the result object
    /// @return descriptors in server order, never null
    /// @throws McpException with kind PROTOCOL if `tools` is missing or malformed
    public List<ToolDescriptor> parse(JsonNode result) {
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            throw McpException.protocol("tools/list result has no tools array");
        }

        List<ToolDescriptor> descriptors = new ArrayList<>(toolsNode.size());
        for (JsonNode tool : toolsNode) {
            descriptors.add(parseTool(tool));
        }
        return descriptors;
    }

    private ToolDescriptor parseTool(JsonNode tool) {
        JsonNode name = tool.get("name");
        if (!tool.isObject() || name == null || !name.isTextual() || name.asText().isBlank()) {
            throw McpException.protocol("Tool entry without a name: " + tool);
        }

        JsonNode description = tool.get("description");
        Map<String, Object> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tool.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            switch (field.getKey()) {
                case "name", "description", "inputSchema", "outputSchema" -> {}
                default -> extra.put(field.getKey(), jsonRpc.toJava(field.getValue()));
            }
        }

        return new ToolDescriptor(
                name.asText(),
                description != null && !description.isNull() ? description.asText() : null,
                jsonRpc.toMap(tool.get("inputSchema")),
                jsonRpc.toMap(tool.get("outputSchema")),
                extra);
    }
}
