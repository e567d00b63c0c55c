package json.editor.core;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.logging.Logger;

/// Layout used when values are written fresh, either for a whole document
/// with no original text or for the parts of an edited document that have no
/// counterpart in the original.
///
/// @param indentUnit     the text added per nesting level
/// @param keySeparator   the text between a member name and its value, such as `": "`
/// @param lineSeparator  `"\n"` or `"\r\n"`
/// @param multiline      `false` for documents written on a single line
public record SerializationStyle(String indentUnit, String keySeparator, String lineSeparator, boolean multiline) {

    private static final Logger LOG = Logger.getLogger(SerializationStyle.class.getName());

    /// Two-space indent, `": "` and `\n`, as used by the canonical printer.
    public static final SerializationStyle CANONICAL = new SerializationStyle("  ", ": ", "\n", true);

    public SerializationStyle {
        Objects.requireNonNull(indentUnit, "indentUnit must not be null");
        Objects.requireNonNull(keySeparator, "keySeparator must not be null");
        Objects.requireNonNull(lineSeparator, "lineSeparator must not be null");
        if (!keySeparator.strip().equals(":")) {
            throw new IllegalArgumentException("keySeparator must be a colon with optional whitespace: '" + keySeparator + "'");
        }
    }

    /// {@return the style inferred from `text`} Falls back to
    /// {@link #CANONICAL} for every aspect that `text` does not show.
    public static SerializationStyle detect(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String keySeparator = CANONICAL.keySeparator();
        try {
            final SourceTree tree = JsonParser.parseTracked(text);
            keySeparator = keySeparatorOf(tree.text(), tree.root());
        } catch (JsonParseException notJson) {
            LOG.fine(() -> "Style detection on malformed text: " + notJson.getMessage());
        }
        return detect(text, keySeparator);
    }

    static SerializationStyle detect(SourceTree source) {
        return detect(source.text(), keySeparatorOf(source.text(), source.root()));
    }

    private static SerializationStyle detect(String text, String keySeparator) {
        final String lineSeparator = text.contains("\r\n") ? "\r\n" : "\n";
        final boolean multiline = text.strip().indexOf('\n') >= 0;
        return new SerializationStyle(detectIndent(text), keySeparator, lineSeparator, multiline);
    }

    /// {@return this style with a different multiline flag}
    public SerializationStyle withMultiline(boolean multiline) {
        return multiline == this.multiline ? this : new SerializationStyle(indentUnit, keySeparator, lineSeparator, multiline);
    }

    /// Separator between elements when written on one line.
    String inlineItemSeparator() {
        return keySeparator.endsWith(" ") ? ", " : ",";
    }

    private static String detectIndent(String text) {
        int smallest = Integer.MAX_VALUE;
        int lineStart = 0;
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            if (lineStart > 0 && lineStart < lineEnd) {
                final char first = text.charAt(lineStart);
                if (first == '\t') {
                    return "\t";
                }
                int spaces = 0;
                while (lineStart + spaces < lineEnd && text.charAt(lineStart + spaces) == ' ') {
                    spaces++;
                }
                if (spaces > 0 && spaces < smallest) {
                    smallest = spaces;
                }
            }
            lineStart = lineEnd + 1;
        }
        return smallest == Integer.MAX_VALUE ? CANONICAL.indentUnit() : " ".repeat(smallest);
    }

    /// The separator of the first member found in document order, or the
    /// canonical one for documents without members.
    static String keySeparatorOf(String text, SourceNode root) {
        final var stack = new ArrayDeque<SourceNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final SourceNode node = stack.pop();
            if (node instanceof SourceNode.ObjectNode object && !object.members().isEmpty()) {
                final SourceNode.MemberNode first = object.members().get(0);
                // a line break between name and value collapses to a single space
                return text.substring(first.keyEnd(), first.value().start()).replaceAll("[\\r\\n]+[ \\t]*", " ");
            }
            if (node instanceof SourceNode.ArrayNode array) {
                for (int i = array.elements().size() - 1; i >= 0; i--) {
                    stack.push(array.elements().get(i));
                }
            }
        }
        return CANONICAL.keySeparator();
    }
}
