package io.agentloom.core.reasoning;

import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.execution.CancellationToken;
import java.util.ArrayList;
import java.util.List;

/// Keeps the head of the transcript and a window of recent messages.
///
/// The head is the leading system message and the first user message. The window
/// is moved backwards when it would otherwise start with tool results, so every
/// result keeps its call. Dropped messages are replaced by a single note.
public final class SlidingWindowCompressor implements HistoryCompressor {

    /// Default number of recent messages kept.
    public static final int DEFAULT_WINDOW = 10;

    private final int window;

    public SlidingWindowCompressor() {
        this(DEFAULT_WINDOW);
    }

    /// @param window number of recent messages kept, must be positive
    public SlidingWindowCompressor(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
    }

    @Override
    public List<Message> compress(
            String agentId,
            List<Message> messages,
            List<CapabilityDescriptor> capabilities,
            CancellationToken cancellation) {
        int head = headSize(messages);
        if (messages.size() <= head + window) {
            return List.copyOf(messages);
        }

        int start = messages.size() - window;
        while (start > head && messages.get(start) instanceof Message.ToolResultMessage) {
            start--;
        }

        List<Message> compressed = new ArrayList<>(messages.subList(0, head));
        int dropped = start - head;
        if (dropped > 0) {
            compressed.add(
                    new Message.UserMessage(
                            "[" + dropped + " earlier messages were removed to save context]"));
        }
        compressed.addAll(messages.subList(start, messages.size()));
        return compressed;
    }

    static int headSize(List<Message> messages) {
        int head = 0;
        if (!messages.isEmpty() && messages.get(0) instanceof Message.SystemMessage) {
            head++;
        }
        if (messages.size() > head && messages.get(head) instanceof Message.UserMessage) {
            head++;
        }
        return head;
    }
}
