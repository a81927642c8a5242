package io.agentloom.core.capability;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Outcome of one capability invocation as shown to the reasoning engine.
///
/// A result flagged with `error` is still a normal value: it is appended to the
/// transcript so the engine can react, rather than being thrown.
///
/// @param content ordered content parts, not null
/// @param error whether the capability reported a failure
public record CapabilityResult(List<Content> content, boolean error) {

    public CapabilityResult {
        content = List.copyOf(content);
    }

    /// Creates a successful text result.
    ///
    /// @param text result text, not null
    /// @return new result, never null
    public static CapabilityResult text(String text) {
        return new CapabilityResult(List.of(new Content.Text(text)), false);
    }

    /// Creates an error-flagged text result.
    ///
    /// @param text error description, not null
    /// @return new result, never null
    public static CapabilityResult error(String text) {
        return new CapabilityResult(List.of(new Content.Text(text)), true);
    }

    /// Concatenates the text parts, one per line.
    ///
    /// @return joined text, never null (empty when there is no text part)
    public String text() {
        return content.stream()
                .filter(Content.Text.class::isInstance)
                .map(part -> ((Content.Text) part).text())
                .collect(Collectors.joining("\n"));
    }

    /// One part of a result.
    public sealed interface Content {

        /// Plain text part.
        ///
        /// @param text the text, not null
        record Text(String text) implements Content {
            public Text {
                Objects.requireNonNull(text, "text must not be null");
            }
        }

        /// Binary part, such as a screenshot.
        ///
        /// @param mimeType media type, not null
        /// @param data base64-encoded payload, not null
        record Media(String mimeType, String data) implements Content {
            public Media {
                Objects.requireNonNull(mimeType, "mimeType must not be null");
                Objects.requireNonNull(data, "data must not be null");
            }
        }
    }
}
