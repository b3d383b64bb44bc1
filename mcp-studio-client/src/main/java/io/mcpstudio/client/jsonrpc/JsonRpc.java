package io.mcpstudio.client.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpstudio.core.exception.McpException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.Objects;

/// JSON-RPC 2.0 helper for MCP protocol messages.
///
/// Creates outbound frames and parses inbound ones for the client transports.
///
/// ### Message Types
/// - **Request**: Has `id`, `method`, `params` - expects a response
/// - **Notification**: Has `method`, `params` - no response expected
/// - **Response**: Has `id`, `result` or `error`
///
/// Malformed JSON surfaces as a {@link McpException.Kind#PROTOCOL} error.
///
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
@ApplicationScoped
public class JsonRpc {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    @Inject
    public JsonRpc(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Creates a JSON-RPC request (expects a response).
    ///
    /// @param id unique request identifier for response correlation
    /// @param method the method to invoke (e.g., "tools/call")
    /// @param params method parameters, omitted when null
    /// @return JSON-RPC request string
    public String createRequest(String id, String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", id);
        root.put("method", method);
        if (params != null) {
            root.set("params", mapper.valueToTree(params));
        }
        return root.toString();
    }

    /// Creates a JSON-RPC notification (no response expected).
    ///
    /// @param method the method to invoke
    /// @param params method parameters, omitted when null
    /// @return JSON-RPC notification string
    public String createNotification(String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("method", method);
        if (params != null) {
            root.set("params", mapper.valueToTree(params));
        }
        return root.toString();
    }

    /// Creates a JSON-RPC success response, used to answer server `ping` requests.
    ///
    /// @param id the request ID being responded to, echoed with its original JSON type
    /// @param result the result data
    /// @return JSON-RPC response string
    public String createResponse(JsonNode id, Object result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id);
        root.set("result", mapper.valueToTree(result));
        return root.toString();
    }

    /// Creates a JSON-RPC error response.
    ///
    /// @param id the request ID being responded to
    /// @param code error code
    /// @param message error message
    /// @return JSON-RPC error response string
    public String createErrorResponse(JsonNode id, int code, String message) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id);
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return root.toString();
    }

    /// Parses a raw frame into a JSON tree.
    ///
    /// @param json the frame text
    /// @return parsed tree, never null
    /// @throws McpException with kind PROTOCOL if the text is not a JSON object
    public JsonNode parse(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw McpException.protocol("JSON-RPC frame is not an object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw McpException.protocol("Failed to parse JSON-RPC message: " + e.getOriginalMessage(), e);
        }
    }

    /// Parses a JSON-RPC response frame.
    ///
    /// @param json the frame text
    /// @return parsed response, never null
    /// @throws McpException with kind PROTOCOL if the frame is malformed or not a response
    public JsonRpcResponse parseResponse(String json) {
        return toResponse(parse(json));
    }

    /// Converts an already parsed frame into a response.
    ///
    /// @param node the frame
    /// @return parsed response, never null
    /// @throws McpException with kind PROTOCOL if the frame is not a response
    public JsonRpcResponse toResponse(JsonNode node) {
        if (!isResponse(node)) {
            throw McpException.protocol("JSON-RPC frame is not a response");
        }
        return new JsonRpcResponse(extractId(node), node.get("result"), node.get("error"), node);
    }

    /// Returns the result of a response, turning an error member into an exception.
    ///
    /// @param response the response
    /// @return result node, never null (a missing result is an empty object)
    /// @throws McpException with kind PROTOCOL if the response carries an error
    public JsonNode requireResult(JsonRpcResponse response) {
        if (response.isError()) {
            throw McpException.protocol(
                    "JSON-RPC error " + response.errorCode() + ": " + response.errorMessage());
        }
        JsonNode result = response.result();
        return result == null || result.isNull() ? mapper.createObjectNode() : result;
    }

    /// Extracts the ID from a JSON-RPC message.
    ///
    /// @param node the JSON-RPC message
    /// @return the ID as text, or null if not present
    public String extractId(JsonNode node) {
        JsonNode idNode = node.get("id");
        return idNode != null && !idNode.isNull() ? idNode.asText() : null;
    }

    /// Extracts the method from a JSON-RPC message.
    ///
    /// @param node the JSON-RPC message
    /// @return the method name, or null if not present
    public String extractMethod(JsonNode node) {
        JsonNode methodNode = node.get("method");
        return methodNode != null && !methodNode.isNull() ? methodNode.asText() : null;
    }

    /// Checks if a message is a JSON-RPC response (has result or error, no method).
    ///
    /// @param node the JSON-RPC message
    /// @return true if this is a response
    public boolean isResponse(JsonNode node) {
        return (node.has("result") || node.has("error")) && !node.has("method");
    }

    /// Checks if a message is a JSON-RPC request (has method and id).
    ///
    /// @param node the JSON-RPC message
    /// @return true if this is a request
    public boolean isRequest(JsonNode node) {
        return node.has("method") && extractId(node) != null;
    }

    /// Checks if a message is a JSON-RPC notification (has method, no id).
    ///
    /// @param node the JSON-RPC message
    /// @return true if this is a notification
    public boolean isNotification(JsonNode node) {
        return node.has("method") && extractId(node) == null;
    }

    /// Renders a JSON tree as an indented document.
    ///
    /// @param node the tree, may be null
    /// @return pretty-printed JSON, `null` for a null tree
    public String prettyPrint(JsonNode node) {
        if (node == null) {
            return "null";
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    /// Converts a JSON tree into plain Java values (maps, lists, strings, numbers, booleans).
    ///
    /// @param node the tree, may be null
    /// @return converted value, null for a missing or JSON null node
    public Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return mapper.convertValue(node, Object.class);
    }

    /// Converts a JSON object into a map, empty for anything that is not an object.
    ///
    /// @param node the tree, may be null
    /// @return map view of the object, never null
    public Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    /// Returns the underlying mapper.
    ///
    /// @return object mapper, never null
    public ObjectMapper mapper() {
        return mapper;
    }
}
