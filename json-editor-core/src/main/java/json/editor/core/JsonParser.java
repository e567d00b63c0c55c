package json.editor.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.logging.Logger;

/// Recursive descent parser for RFC 8259 JSON text that records the source
/// span of every value it produces.
///
/// Whitespace is the four JSON whitespace characters. A byte order mark is
/// accepted as the very first character and is kept as part of the prefix.
/// Nesting deeper than {@link #MAX_DEPTH} is rejected so that parsing cannot
/// exhaust the thread stack.
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    static final int MAX_DEPTH = 1000;

    private final String text;
    private int pos;
    private int depth;

    private JsonParser(String text) {
        this.text = text;
    }

    /// Parses a complete document and keeps the span tree.
    static SourceTree parseTracked(String text) {
        final var parser = new JsonParser(text);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            parser.pos = 1;
        }
        parser.skipWhitespace();
        final SourceNode root = parser.parseValue();
        parser.skipWhitespace();
        if (parser.pos != text.length()) {
            throw parser.error("Unexpected content after the root value");
        }
        LOG.finer(() -> "Parsed " + text.length() + " chars, root " + root.value().typeName());
        return new SourceTree(text, root);
    }

    private SourceNode parseValue() {
        if (pos >= text.length()) {
            throw error("Unexpected end of input, expected a value");
        }
        final char c = text.charAt(pos);
        return switch (c) {
            case '{' -> parseObject();
            case '[' -> parseArray();
            case '"' -> {
                final int start = pos;
                final String s = parseString();
                yield new SourceNode.ScalarNode(JsonString.of(s), start, pos);
            }
            case 't' -> literal("true", JsonBoolean.TRUE);
            case 'f' -> literal("false", JsonBoolean.FALSE);
            case 'n' -> literal("null", JsonNull.of());
            default -> {
                if (c == '-' || (c >= '0' && c <= '9')) {
                    yield parseNumber();
                }
                throw error("Unexpected character '" + printable(c) + "'");
            }
        };
    }

    private SourceNode.ObjectNode parseObject() {
        final int start = pos;
        enter();
        pos++; // {
        final var members = new ArrayList<SourceNode.MemberNode>();
        final var values = new LinkedHashMap<String, JsonValue>();
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            depth--;
            return new SourceNode.ObjectNode(JsonObject.of(values), start, pos, members);
        }
        while (true) {
            skipWhitespace();
            if (peek() != '"') {
                throw error("Expected a member name");
            }
            final int keyStart = pos;
            final String key = parseString();
            final int keyEnd = pos;
            if (values.containsKey(key)) {
                pos = keyStart;
                throw error("Duplicate member name \"" + key + "\"");
            }
            skipWhitespace();
            expect(':');
            skipWhitespace();
            final SourceNode value = parseValue();
            members.add(new SourceNode.MemberNode(key, keyStart, keyEnd, value));
            values.put(key, value.value());
            skipWhitespace();
            final char c = peek();
            if (c == ',') {
                pos++;
            } else if (c == '}') {
                pos++;
                break;
            } else {
                throw error("Expected ',' or '}' in object");
            }
        }
        depth--;
        return new SourceNode.ObjectNode(JsonObject.of(values), start, pos, members);
    }

    private SourceNode.ArrayNode parseArray() {
        final int start = pos;
        enter();
        pos++; // [
        final var elements = new ArrayList<SourceNode>();
        skipWhitespace();
        if (peek() == ']') {
            pos++;
            depth--;
            return new SourceNode.ArrayNode(JsonArray.empty(), start, pos, elements);
        }
        while (true) {
            skipWhitespace();
            elements.add(parseValue());
            skipWhitespace();
            final char c = peek();
            if (c == ',') {
                pos++;
            } else if (c == ']') {
                pos++;
                break;
            } else {
                throw error("Expected ',' or ']' in array");
            }
        }
        depth--;
        final List<JsonValue> values = new ArrayList<>(elements.size());
        for (SourceNode element : elements) {
            values.add(element.value());
        }
        return new SourceNode.ArrayNode(JsonArray.of(values), start, pos, elements);
    }

    private String parseString() {
        pos++; // opening quote
        StringBuilder sb = null;
        int runStart = pos;
        while (true) {
            if (pos >= text.length()) {
                throw error("Unterminated string");
            }
            final char c = text.charAt(pos);
            if (c == '"') {
                final String result = sb == null
                        ? text.substring(runStart, pos)
                        : sb.append(text, runStart, pos).toString();
                pos++;
                return result;
            }
            if (c < 0x20) {
                throw error("Unescaped control character in string");
            }
            if (c == '\\') {
                if (sb == null) {
                    sb = new StringBuilder();
                }
                sb.append(text, runStart, pos);
                pos++;
                if (pos >= text.length()) {
                    throw error("Unterminated escape sequence");
                }
                final char e = text.charAt(pos);
                switch (e) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case '/' -> sb.append('/');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 >= text.length()) {
                            throw error("Truncated unicode escape");
                        }
                        int code = 0;
                        for (int i = 1; i <= 4; i++) {
                            final int digit = hexDigit(text.charAt(pos + i));
                            if (digit < 0) {
                                throw error("Invalid unicode escape");
                            }
                            code = (code << 4) | digit;
                        }
                        sb.append((char) code);
                        pos += 4;
                    }
                    default -> throw error("Invalid escape character '" + printable(e) + "'");
                }
                pos++;
                runStart = pos;
            } else {
                pos++;
            }
        }
    }

    private SourceNode parseNumber() {
        final int start = pos;
        boolean integral = true;
        if (peek() == '-') {
            pos++;
        }
        if (peek() == '0') {
            pos++;
        } else if (isDigit(peek())) {
            digits();
        } else {
            throw error("Invalid number");
        }
        if (peek() == '.') {
            integral = false;
            pos++;
            if (!isDigit(peek())) {
                throw error("Expected digits after decimal point");
            }
            digits();
        }
        if (peek() == 'e' || peek() == 'E') {
            integral = false;
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (!isDigit(peek())) {
                throw error("Expected digits in exponent");
            }
            digits();
        }
        final String literal = text.substring(start, pos);
        if (integral) {
            try {
                return new SourceNode.ScalarNode(JsonInteger.of(Long.parseLong(literal)), start, pos);
            } catch (NumberFormatException tooLarge) {
                LOG.finer(() -> "Integer literal outside long range, reading as float: " + literal);
            }
        }
        final double d = Double.parseDouble(literal);
        if (!Double.isFinite(d)) {
            pos = start;
            throw error("Number out of range");
        }
        return new SourceNode.ScalarNode(JsonFloat.of(d), start, pos);
    }

    private SourceNode literal(String word, JsonValue value) {
        if (!text.startsWith(word, pos)) {
            throw error("Invalid literal, expected '" + word + "'");
        }
        final int start = pos;
        pos += word.length();
        return new SourceNode.ScalarNode(value, start, pos);
    }

    private void digits() {
        while (isDigit(peek())) {
            pos++;
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("Nesting deeper than " + MAX_DEPTH);
        }
    }

    private void expect(char c) {
        if (peek() != c) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            final char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                pos++;
            } else {
                break;
            }
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // ASCII only: Character.digit also accepts other Unicode digits
    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static String printable(char c) {
        return c < 0x20 ? String.format("\\u%04x", (int) c) : String.valueOf(c);
    }

    private JsonParseException error(String reason) {
        final int at = Math.min(pos, text.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < at; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new JsonParseException(reason, at, line, at - lineStart + 1);
    }
}
