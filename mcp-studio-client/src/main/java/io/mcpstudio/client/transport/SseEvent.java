package io.mcpstudio.client.transport;

/// One dispatched Server-Sent Event.
///
/// @param event event name, `message` when the stream did not name it
/// @param data event data, multiple `data:` lines joined with newlines
/// @param id last event id, may be null
public record SseEvent(String event, String data, String id) {

    public static final String DEFAULT_EVENT = "message";

    public boolean isMessage() {
        return DEFAULT_EVENT.equals(event);
    }
}
