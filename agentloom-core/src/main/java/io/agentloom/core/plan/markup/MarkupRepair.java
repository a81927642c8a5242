package io.agentloom.core.plan.markup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Completes a truncated plan document so that it can be handed to an XML parser.
///
/// Planner output arrives incrementally; any prefix of a valid document should
/// become a well-formed document describing the part received so far.
///
/// ### Repair steps
/// 1. Trim; drop a trailing unfinished closing tag (`</na`) or a dangling `<`.
/// 2. Escape every `&` that does not start an entity reference.
/// 3. Inside an open tag: complete a trailing `attr=` with `""`, a bare known attribute
///    name with `=""`, and drop any other bare partial word.
/// 4. Balance quotes and angle brackets.
/// 5. Close all still-open elements in reverse order.
///
/// @implNote Stateless utility; the repaired text is only ever used for a
/// non-final parse.
public final class MarkupRepair {

    /// Attribute names of the plan vocabulary that may be cut off before their value.
    static final Set<String> KNOWN_ATTRIBUTES =
            Set.of(
                    "name", "id", "depen", "depends", "dependsOn", "input", "output", "items",
                    "event", "loop");

    private static final Pattern BARE_AMPERSAND = Pattern.compile("&(?![a-zA-Z0-9#]+;)");
    private static final Pattern TAG_NAME = Pattern.compile("<(\\w+)");

    private MarkupRepair() {}

    /// Returns a well-formed completion of the given prefix.
    ///
    /// @param text truncated document, not null
    /// @return completed document, never null
    public static String complete(String text) {
        String code = text.trim();
        code = dropUnfinishedClosingTag(code);
        if (code.endsWith("<")) {
            code = code.substring(0, code.length() - 1);
        }
        if (code.indexOf('&') > -1) {
            code = BARE_AMPERSAND.matcher(code).replaceAll("&amp;");
        }
        code = completeTrailingAttribute(code);
        code = balanceQuotesAndBrackets(code);
        return code + closeOpenElements(code);
    }

    private static String dropUnfinishedClosingTag(String code) {
        int open = code.lastIndexOf('<');
        if (open > -1 && open > code.lastIndexOf('>') && code.startsWith("</", open)) {
            return code.substring(0, open);
        }
        return code;
    }

    private static String completeTrailingAttribute(String code) {
        int open = code.lastIndexOf('<');
        boolean insideTag = open > code.lastIndexOf('>');
        if (!insideTag || insideQuote(code, open)) {
            return code;
        }
        if (code.endsWith("=")) {
            return code + "\"\"";
        }
        int space = code.lastIndexOf(' ');
        if (space <= open) {
            return code;
        }
        String word = code.substring(space + 1);
        if (word.isEmpty() || word.contains("=")) {
            return code;
        }
        if (KNOWN_ATTRIBUTES.contains(word)) {
            return code + "=\"\"";
        }
        return code.substring(0, space);
    }

    private static boolean insideQuote(String code, int from) {
        int quotes = 0;
        for (int i = from; i < code.length(); i++) {
            if (code.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 == 1;
    }

    private static String balanceQuotesAndBrackets(String code) {
        Deque<Character> stack = new ArrayDeque<>();
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '<') {
                stack.push('>');
            } else if (c == '>') {
                if (!stack.isEmpty()) {
                    stack.pop();
                }
            } else if (c == '"' && !stack.isEmpty()) {
                if (stack.peek() == '"') {
                    stack.pop();
                } else {
                    stack.push('"');
                }
            }
        }
        StringBuilder missing = new StringBuilder(code);
        while (!stack.isEmpty()) {
            missing.append(stack.pop());
        }
        return missing.toString();
    }

    private static String closeOpenElements(String code) {
        Deque<String> open = new ArrayDeque<>();
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) != '<') {
                continue;
            }
            int end = code.indexOf('>', i);
            if (end == -1) {
                break;
            }
            String tag = code.substring(i, end + 1);
            if (tag.startsWith("<?") || tag.startsWith("<!")) {
                // declaration or comment
            } else if (tag.startsWith("</")) {
                if (!open.isEmpty()) {
                    open.pop();
                }
            } else if (!tag.endsWith("/>")) {
                Matcher matcher = TAG_NAME.matcher(tag);
                if (matcher.lookingAt()) {
                    open.push(matcher.group(1));
                }
            }
            i = end;
        }
        StringBuilder closing = new StringBuilder();
        while (!open.isEmpty()) {
            closing.append("</").append(open.pop()).append('>');
        }
        return closing.toString();
    }
}
