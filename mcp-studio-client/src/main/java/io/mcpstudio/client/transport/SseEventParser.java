package io.mcpstudio.client.transport;

import java.util.Objects;
import java.util.function.Consumer;

/// Incremental parser for `text/event-stream` bodies.
///
/// Fed one line at a time. A blank line dispatches the accumulated event, lines starting
/// with `:` are comments. Events without data are dropped. Not thread-safe, a parser
/// belongs to one stream.
public final class SseEventParser {

    private final Consumer<SseEvent> sink;
    private final StringBuilder data = new StringBuilder();
    private String eventName;
    private String lastEventId;
    private boolean hasData;

    public SseEventParser(Consumer<SseEvent> sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /// Consumes one line without its terminator.
    ///
    /// @param line the line, not null
    public void feed(String line) {
        if (line.isEmpty()) {
            dispatch();
            return;
        }
        if (line.charAt(0) == ':') {
            return;
        }

        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            case "id" -> lastEventId = value;
            default -> {
                // retry and unknown fields are ignored
            }
        }
    }

    /// Dispatches a trailing event that was not terminated by a blank line.
    public void flush() {
        dispatch();
    }

    private void dispatch() {
        if (hasData) {
            String name = eventName == null || eventName.isEmpty()
                    ? SseEvent.DEFAULT_EVENT
                    : eventName;
            sink.accept(new SseEvent(name, data.toString(), lastEventId));
        }
        data.setLength(0);
        eventName = null;
        hasData = false;
    }
}
