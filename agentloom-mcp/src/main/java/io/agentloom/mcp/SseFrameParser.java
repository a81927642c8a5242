package io.agentloom.mcp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Incremental parser of a server-sent event stream.
///
/// Text is fed in arbitrary chunks, as it arrives from the network. The parser
/// buffers the unfinished line, accumulates the fields of the current frame and
/// yields the frame when a blank line ends it.
///
/// ```
/// feed("event: endp")        -> []
/// feed("oint\ndata: /msg\n") -> []
/// feed("\n")                 -> [SseFrame(event=endpoint, data=/msg)]
/// ```
///
/// `\n`, `\r\n` and `\r` all end a line. Lines starting with `:` are comments.
///
/// @implNote Not thread-safe; owned by the stream reader thread.
public final class SseFrameParser {

    private final StringBuilder line = new StringBuilder();
    private final Map<String, String> fields = new LinkedHashMap<>();
    private String id;
    private String event;
    private StringBuilder data;
    private boolean pendingCarriageReturn;

    /// Feeds the next chunk.
    ///
    /// @param chunk received text, not null
    /// @return frames completed by this chunk, in stream order, never null
    public List<SseFrame> feed(CharSequence chunk) {
        List<SseFrame> frames = new ArrayList<>();
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (pendingCarriageReturn) {
                pendingCarriageReturn = false;
                if (c == '\n') {
                    continue;
                }
            }
            if (c == '\r') {
                pendingCarriageReturn = true;
                endLine(frames);
            } else if (c == '\n') {
                endLine(frames);
            } else {
                line.append(c);
            }
        }
        return frames;
    }

    /// Returns whether a frame is partially accumulated.
    ///
    /// @return `true` if fields or an unfinished line are buffered
    public boolean hasPartialFrame() {
        return line.length() > 0 || id != null || event != null || data != null || !fields.isEmpty();
    }

    private void endLine(List<SseFrame> frames) {
        if (line.length() == 0) {
            if (id != null || event != null || data != null || !fields.isEmpty()) {
                frames.add(new SseFrame(id, event, data != null ? data.toString() : null, fields));
            }
            reset();
            return;
        }
        String text = line.toString();
        line.setLength(0);
        if (text.startsWith(":")) {
            return;
        }
        int colon = text.indexOf(':');
        String name = colon >= 0 ? text.substring(0, colon) : text;
        String value = colon >= 0 ? text.substring(colon + 1).trim() : "";
        switch (name) {
            case "id" -> id = value;
            case "event" -> event = value;
            case "data" -> {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            default -> fields.put(name, value);
        }
    }

    private void reset() {
        id = null;
        event = null;
        data = null;
        fields.clear();
    }
}
