package json.editor.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Writes {@link JsonValue} trees as JSON text.
///
/// A writer instance renders fresh text in a {@link SerializationStyle},
/// optionally with object members sorted by name. The static helpers cover
/// string quoting and the compact form used by `toString()`.
final class JsonWriter {

    private final SerializationStyle style;
    private final boolean sortKeys;

    JsonWriter(SerializationStyle style, boolean sortKeys) {
        this.style = style;
        this.sortKeys = sortKeys;
    }

    /// {@return `value` as a JSON string literal, quotes included}
    static String quote(String value) {
        final var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || isLoneSurrogate(value, i)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    // a lone surrogate cannot be encoded as UTF-8, so it is escaped
    private static boolean isLoneSurrogate(String s, int i) {
        final char c = s.charAt(i);
        if (Character.isHighSurrogate(c)) {
            return i + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(i + 1));
        }
        if (Character.isLowSurrogate(c)) {
            return i == 0 || !Character.isHighSurrogate(s.charAt(i - 1));
        }
        return false;
    }

    /// {@return `value` on one line without optional whitespace, members in
    /// insertion order} Non-finite floats are written as Java prints them, so
    /// the result is only guaranteed to be JSON when
    /// {@link Json#isRepresentable(JsonValue)} holds.
    static String compact(JsonValue value) {
        final var sb = new StringBuilder();
        new JsonWriter(new SerializationStyle("", ":", "\n", false), false).write(sb, value, "");
        return sb.toString();
    }

    /// Appends `value` to `sb`. Nested lines are indented relative to
    /// `indent`, the indentation of the line the value starts on.
    void write(StringBuilder sb, JsonValue value, String indent) {
        if (value instanceof JsonObject object) {
            writeObject(sb, object, indent);
        } else if (value instanceof JsonArray array) {
            writeArray(sb, array, indent);
        } else {
            sb.append(scalar(value));
        }
    }

    /// {@return `value` rendered starting at `indent`}
    String render(JsonValue value, String indent) {
        final var sb = new StringBuilder();
        write(sb, value, indent);
        return sb.toString();
    }

    private void writeObject(StringBuilder sb, JsonObject object, String indent) {
        if (object.members().isEmpty()) {
            sb.append("{}");
            return;
        }
        List<Map.Entry<String, JsonValue>> entries = new ArrayList<>(object.members().entrySet());
        if (sortKeys) {
            entries.sort(Map.Entry.comparingByKey());
        }
        final String inner = indent + style.indentUnit();
        sb.append('{');
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(style.multiline() ? "," : style.inlineItemSeparator());
            }
            if (style.multiline()) {
                sb.append(style.lineSeparator()).append(inner);
            }
            final var entry = entries.get(i);
            sb.append(quote(entry.getKey())).append(style.keySeparator());
            write(sb, entry.getValue(), inner);
        }
        if (style.multiline()) {
            sb.append(style.lineSeparator()).append(indent);
        }
        sb.append('}');
    }

    private void writeArray(StringBuilder sb, JsonArray array, String indent) {
        if (array.elements().isEmpty()) {
            sb.append("[]");
            return;
        }
        final String inner = indent + style.indentUnit();
        sb.append('[');
        for (int i = 0; i < array.size(); i++) {
            if (i > 0) {
                sb.append(style.multiline() ? "," : style.inlineItemSeparator());
            }
            if (style.multiline()) {
                sb.append(style.lineSeparator()).append(inner);
            }
            write(sb, array.elements().get(i), inner);
        }
        if (style.multiline()) {
            sb.append(style.lineSeparator()).append(indent);
        }
        sb.append(']');
    }

    private static String scalar(JsonValue value) {
        if (value instanceof JsonString s) {
            return quote(s.value());
        }
        if (value instanceof JsonInteger i) {
            return Long.toString(i.value());
        }
        if (value instanceof JsonFloat f) {
            return Double.toString(f.value());
        }
        if (value instanceof JsonBoolean b) {
            return b.value() ? "true" : "false";
        }
        return "null";
    }
}
