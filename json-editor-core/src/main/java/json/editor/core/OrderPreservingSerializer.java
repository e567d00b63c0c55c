package json.editor.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.logging.Logger;

/// Writes a JSON tree back over the text it was loaded from, changing only
/// what the tree changed.
///
/// The original text is parsed with source spans and walked in lock-step
/// with the new tree:
///
/// - a subtree equal to its original is copied from the original text;
/// - an object keeps its surviving members in their original order, each
///   with its original name text and separators, and appends new members
///   after them in the layout of their siblings;
/// - an array matches old and new elements by longest common subsequence,
///   pairs the unmatched ones that fall between the same matches and
///   descends into those pairs; anything left over is written fresh;
/// - any other change writes the new value fresh, indented for the line it
///   starts on.
///
/// Text before and after the root value is kept as is. Without an original
/// text the tree is written canonically, see {@link Json#toCanonicalString(JsonValue)}.
///
/// Re-parsing the output always yields a tree equal to the one written.
public final class OrderPreservingSerializer {

    private static final Logger LOG = Logger.getLogger(OrderPreservingSerializer.class.getName());

    /// Arrays whose element count product exceeds this are paired by position.
    static final long MAX_MATCH_CELLS = 1L << 20;

    private OrderPreservingSerializer() {}

    /// {@return `tree` written over `originalText`, or empty if `tree` holds a
    /// non-finite number} A `null` or malformed `originalText` gives the
    /// canonical form.
    public static Optional<String> serialize(JsonValue tree, String originalText) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (originalText == null) {
            return canonical(tree);
        }
        final SourceTree source;
        try {
            source = JsonParser.parseTracked(originalText);
        } catch (JsonParseException e) {
            LOG.warning(() -> "Original text no longer parses, writing canonical form: " + e.getMessage());
            return canonical(tree);
        }
        return serialize(tree, source);
    }

    /// {@return `tree` in canonical form, or empty if it holds a non-finite number}
    public static Optional<String> canonical(JsonValue tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (!Json.isRepresentable(tree)) {
            LOG.fine("Tree holds a non-finite number and cannot be written");
            return Optional.empty();
        }
        return Optional.of(Json.toCanonicalString(tree));
    }

    static Optional<String> serialize(JsonValue tree, SourceTree source) {
        if (!Json.isRepresentable(tree)) {
            LOG.fine("Tree holds a non-finite number and cannot be written");
            return Optional.empty();
        }
        final SerializationStyle style = SerializationStyle.detect(source);
        final var splicer = new Splicer(source.text(), style);
        final String body = splicer.emit(source.root(), tree, !style.multiline());
        LOG.fine(() -> "Serialized " + body.length() + " chars over " + source.text().length() + " original chars");
        return Optional.of(source.prefix() + body + source.suffix());
    }

    private static final class Splicer {

        private final String text;
        private final JsonWriter blockWriter;
        private final JsonWriter inlineWriter;

        Splicer(String text, SerializationStyle style) {
            this.text = text;
            this.blockWriter = new JsonWriter(style.withMultiline(true), false);
            this.inlineWriter = new JsonWriter(style.withMultiline(false), false);
        }

        /// `inline` is set when `original` sits in a container written on one line.
        String emit(SourceNode original, JsonValue current, boolean inline) {
            if (original.value().equals(current)) {
                return text.substring(original.start(), original.end());
            }
            if (original instanceof SourceNode.ObjectNode o && current instanceof JsonObject obj
                    && !o.members().isEmpty() && !obj.members().isEmpty()) {
                return emitObject(o, obj, inline);
            }
            if (original instanceof SourceNode.ArrayNode a && current instanceof JsonArray arr
                    && !a.elements().isEmpty() && !arr.elements().isEmpty()) {
                return emitArray(a, arr, inline);
            }
            LOG.finer(() -> "Rewriting " + original.value().typeName() + " at offset " + original.start());
            return fresh(current, lineIndent(original.start()), inline);
        }

        private String emitObject(SourceNode.ObjectNode o, JsonObject obj, boolean inline) {
            final List<SourceNode.MemberNode> members = o.members();
            final int n = members.size();
            final SourceNode.MemberNode first = members.get(0);
            final String leading = text.substring(o.start() + 1, first.keyStart());
            final String trailing = text.substring(members.get(n - 1).value().end(), o.end() - 1);
            final boolean childInline = inline || leading.indexOf('\n') < 0;
            final String indent = lineIndent(first.keyStart());
            final String keySeparator = SerializationStyle.keySeparatorOf(text, o);

            final var pieces = new ArrayList<String>(obj.members().size());
            final var origins = new ArrayList<Integer>(obj.members().size());
            final Set<String> originalKeys = new HashSet<>();
            for (int i = 0; i < n; i++) {
                final SourceNode.MemberNode member = members.get(i);
                originalKeys.add(member.key());
                final JsonValue now = obj.get(member.key());
                if (now != null) {
                    pieces.add(text.substring(member.keyStart(), member.value().start())
                            + emit(member.value(), now, childInline));
                    origins.add(i);
                }
            }
            for (Map.Entry<String, JsonValue> entry : obj.members().entrySet()) {
                if (!originalKeys.contains(entry.getKey())) {
                    pieces.add(JsonWriter.quote(entry.getKey()) + keySeparator
                            + fresh(entry.getValue(), indent, childInline));
                    origins.add(-1);
                }
            }
            return join('{', leading, pieces, origins, n,
                    i -> text.substring(members.get(i).value().end(), members.get(i + 1).keyStart()),
                    trailing, '}');
        }

        private String emitArray(SourceNode.ArrayNode a, JsonArray arr, boolean inline) {
            final List<SourceNode> olds = a.elements();
            final List<JsonValue> news = arr.elements();
            final int n = olds.size();
            final int m = news.size();
            final String leading = text.substring(a.start() + 1, olds.get(0).start());
            final String trailing = text.substring(olds.get(n - 1).end(), a.end() - 1);
            final boolean childInline = inline || leading.indexOf('\n') < 0;
            final String indent = lineIndent(olds.get(0).start());

            final int[] match = matchElements(olds, news);
            // for each unmatched new element, the old index of the next match after it
            final int[] bound = new int[m];
            int next = n;
            for (int j = m - 1; j >= 0; j--) {
                if (match[j] >= 0) {
                    next = match[j];
                }
                bound[j] = next;
            }

            final var pieces = new ArrayList<String>(m);
            final var origins = new ArrayList<Integer>(m);
            int i = 0;
            for (int j = 0; j < m; j++) {
                if (match[j] >= 0) {
                    pieces.add(text.substring(olds.get(match[j]).start(), olds.get(match[j]).end()));
                    origins.add(match[j]);
                    i = match[j] + 1;
                } else if (i < bound[j]) {
                    pieces.add(emit(olds.get(i), news.get(j), childInline));
                    origins.add(i);
                    i++;
                } else {
                    pieces.add(fresh(news.get(j), indent, childInline));
                    origins.add(-1);
                }
            }
            return join('[', leading, pieces, origins, n,
                    k -> text.substring(olds.get(k).end(), olds.get(k + 1).start()),
                    trailing, ']');
        }

        /// Joins the pieces with the separator that followed their original in
        /// the source. New pieces and pieces whose original was last use the
        /// separator of the last original pair, or a comma and the leading
        /// whitespace when there was only one original.
        private static String join(char open, String leading, List<String> pieces, List<Integer> origins,
                                   int originalCount, IntFunction<String> separatorAfter,
                                   String trailing, char close) {
            final String typical = originalCount >= 2 ? separatorAfter.apply(originalCount - 2) : "," + leading;
            final var sb = new StringBuilder();
            sb.append(open).append(leading);
            for (int k = 0; k < pieces.size(); k++) {
                sb.append(pieces.get(k));
                if (k < pieces.size() - 1) {
                    final int origin = origins.get(k);
                    sb.append(origin >= 0 && origin < originalCount - 1 ? separatorAfter.apply(origin) : typical);
                }
            }
            return sb.append(trailing).append(close).toString();
        }

        private String fresh(JsonValue value, String indent, boolean inline) {
            return (inline ? inlineWriter : blockWriter).render(value, indent);
        }

        /// The spaces and tabs that start the line containing `pos`.
        private String lineIndent(int pos) {
            final int lineStart = text.lastIndexOf('\n', pos - 1) + 1;
            int end = lineStart;
            while (end < pos && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
                end++;
            }
            return text.substring(lineStart, end);
        }
    }

    /// {@return for each new element, the index of the old element it is
    /// matched with, or -1} Matches form a longest common subsequence.
    static int[] matchElements(List<SourceNode> olds, List<JsonValue> news) {
        final int n = olds.size();
        final int m = news.size();
        final int[] match = new int[m];
        Arrays.fill(match, -1);
        if ((long) n * m > MAX_MATCH_CELLS) {
            LOG.fine(() -> "Arrays of " + n + " and " + m + " elements are paired by position");
            return match;
        }
        final JsonValue[] oldValues = new JsonValue[n];
        final int[] oldHashes = new int[n];
        for (int i = 0; i < n; i++) {
            oldValues[i] = olds.get(i).value();
            oldHashes[i] = oldValues[i].hashCode();
        }
        final int[] newHashes = new int[m];
        for (int j = 0; j < m; j++) {
            newHashes[j] = news.get(j).hashCode();
        }
        final int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = oldHashes[i] == newHashes[j] && oldValues[i].equals(news.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (oldHashes[i] == newHashes[j] && oldValues[i].equals(news.get(j))
                    && lcs[i][j] == lcs[i + 1][j + 1] + 1) {
                match[j] = i;
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                i++;
            } else {
                j++;
            }
        }
        return match;
    }
}
