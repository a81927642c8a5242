package io.agentloom.core.reasoning;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Ordered message history of one agent.
///
/// @implNote Confined to the agent's loop thread. Results of a concurrent
/// capability batch are collected first and appended by the loop thread.
public final class Transcript {

    /// Rough characters-per-token ratio used for size estimates.
    static final int CHARS_PER_TOKEN = 4;

    private final List<Message> messages = new ArrayList<>();

    public Transcript() {}

    public Transcript(List<? extends Message> initial) {
        messages.addAll(initial);
    }

    public void add(Message message) {
        messages.add(Objects.requireNonNull(message, "message must not be null"));
    }

    public void addAll(List<? extends Message> more) {
        more.forEach(this::add);
    }

    /// Replaces the whole history, e.g. with a compressed version.
    ///
    /// @param replacement new history, not null
    public void replaceAll(List<? extends Message> replacement) {
        List<Message> copy = List.copyOf(replacement);
        messages.clear();
        messages.addAll(copy);
    }

    /// Returns an immutable snapshot.
    ///
    /// @return messages in order, never null
    public List<Message> messages() {
        return List.copyOf(messages);
    }

    public Message get(int index) {
        return messages.get(index);
    }

    public void set(int index, Message message) {
        messages.set(index, Objects.requireNonNull(message, "message must not be null"));
    }

    public int size() {
        return messages.size();
    }

    /// Estimates the token count of the history.
    ///
    /// @return estimated tokens, never negative
    public int estimatedTokens() {
        return estimateTokens(messages);
    }

    /// Estimates the token count of the given messages.
    ///
    /// @param messages messages to measure, not null
    /// @return estimated tokens, never negative
    public static int estimateTokens(List<? extends Message> messages) {
        long chars = 0;
        for (Message message : messages) {
            chars += message.length();
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / CHARS_PER_TOKEN);
    }
}
