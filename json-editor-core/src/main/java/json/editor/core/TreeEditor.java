package json.editor.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.logging.Logger;

/// Copy-on-write edits of a JSON tree.
///
/// A path is resolved from the root by walking one segment at a time. The
/// containers on the way are remembered, the addressed node is edited, and the
/// chain is rebuilt from the edit back up to a new root. Containers off the
/// path are shared with the input tree.
///
/// Nothing here creates missing containers: a segment that does not resolve
/// makes the whole edit fail with an empty result.
final class TreeEditor {

    private static final Logger LOG = Logger.getLogger(TreeEditor.class.getName());

    private TreeEditor() {}

    /// {@return the node at `path`, or empty if some segment does not resolve}
    static Optional<JsonValue> resolve(JsonValue root, NodePath path) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        JsonValue current = root;
        for (String segment : path.segments()) {
            final Optional<JsonValue> next = child(current, segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /// Applies `edit` to the node at `path` and returns the rebuilt root.
    ///
    /// @param edit returns the replacement for the addressed node, or empty to
    ///             fail the whole edit
    static Optional<JsonValue> modify(JsonValue root, NodePath path,
                                      Function<JsonValue, Optional<JsonValue>> edit) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        final List<String> segments = path.segments();
        final var chain = new ArrayList<JsonValue>(segments.size() + 1);
        chain.add(root);
        JsonValue current = root;
        for (int i = 0; i < segments.size(); i++) {
            final Optional<JsonValue> next = child(current, segments.get(i));
            if (next.isEmpty()) {
                final int failedAt = i;
                LOG.finer(() -> "Segment " + failedAt + " of '" + path + "' does not resolve");
                return Optional.empty();
            }
            current = next.get();
            chain.add(current);
        }
        final Optional<JsonValue> edited = edit.apply(current);
        if (edited.isEmpty()) {
            return Optional.empty();
        }
        JsonValue rebuilt = edited.get();
        for (int i = segments.size() - 1; i >= 0; i--) {
            rebuilt = withChild(chain.get(i), segments.get(i), rebuilt);
        }
        return Optional.of(rebuilt);
    }

    /// {@return the child of `container` named by `segment`}
    static Optional<JsonValue> child(JsonValue container, String segment) {
        if (container instanceof JsonObject obj) {
            return Optional.ofNullable(obj.get(segment));
        }
        if (container instanceof JsonArray arr) {
            final OptionalInt index = index(segment);
            if (index.isPresent() && index.getAsInt() < arr.size()) {
                return Optional.of(arr.elements().get(index.getAsInt()));
            }
        }
        return Optional.empty();
    }

    /// {@return the decimal index in `segment`} Only canonical digit strings
    /// are indices; signs, whitespace, leading zeros and values beyond `int`
    /// are not, so every element has exactly one path.
    static OptionalInt index(String segment) {
        if (segment.isEmpty() || segment.length() > 10) {
            return OptionalInt.empty();
        }
        if (segment.length() > 1 && segment.charAt(0) == '0') {
            return OptionalInt.empty();
        }
        for (int i = 0; i < segment.length(); i++) {
            final char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalInt.empty();
            }
        }
        final long value = Long.parseLong(segment);
        return value > Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of((int) value);
    }

    static JsonObject put(JsonObject obj, String key, JsonValue value) {
        final var out = new LinkedHashMap<String, JsonValue>(obj.members());
        out.put(key, value);
        return JsonObject.of(out);
    }

    static JsonObject remove(JsonObject obj, String key) {
        final var out = new LinkedHashMap<String, JsonValue>(obj.members());
        out.remove(key);
        return JsonObject.of(out);
    }

    static JsonArray set(JsonArray arr, int index, JsonValue value) {
        final var out = new ArrayList<JsonValue>(arr.elements());
        out.set(index, value);
        return JsonArray.of(out);
    }

    static JsonArray insert(JsonArray arr, int index, JsonValue value) {
        final var out = new ArrayList<JsonValue>(arr.size() + 1);
        out.addAll(arr.elements());
        out.add(index, value);
        return JsonArray.of(out);
    }

    static JsonArray removeAt(JsonArray arr, int index) {
        final var out = new ArrayList<JsonValue>(arr.elements());
        out.remove(index);
        return JsonArray.of(out);
    }

    // segment was resolved against container on the way down
    private static JsonValue withChild(JsonValue container, String segment, JsonValue child) {
        if (container instanceof JsonObject obj) {
            return put(obj, segment, child);
        }
        return set((JsonArray) container, index(segment).orElseThrow(), child);
    }
}
