package io.agentloom.mcp;

import java.util.Map;

/// One server-sent event.
///
/// @param id event id, may be null
/// @param event event type, `message` when the frame names none
/// @param data payload, data lines joined with `\n`, never null
/// @param fields any other `name: value` fields, not null
public record SseFrame(String id, String event, String data, Map<String, String> fields) {

    public SseFrame {
        event = event != null ? event : "message";
        data = data != null ? data : "";
        fields = Map.copyOf(fields);
    }
}
