package io.mcpstudio.client.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/// A parsed JSON-RPC 2.0 response frame.
///
/// Exactly one of {@code result} and {@code error} is meaningful. A response with an
/// error is a valid answer from the server, it only reaches callers as an exception
/// when they ask for the result via {@link JsonRpc#requireResult(JsonRpcResponse)}.
///
/// @param id request id this frame answers, may be null for malformed servers
/// @param result the `result` member, may be null
/// @param error the `error` member, null on success
/// @param raw the whole frame, used for raw-document rendering
public record JsonRpcResponse(String id, JsonNode result, JsonNode error, JsonNode raw) {

    public boolean isError() {
        return error != null && !error.isNull();
    }

    /// Returns the error code, or {@code -1} when absent.
    public int errorCode() {
        return isError() && error.has("code") ? error.get("code").asInt() : -1;
    }

    /// Returns the error message, or {@code "Unknown error"} when absent.
    public String errorMessage() {
        if (!isError()) {
            return null;
        }
        JsonNode message = error.get("message");
        return message != null && !message.isNull() ? message.asText() : "Unknown error";
    }
}
