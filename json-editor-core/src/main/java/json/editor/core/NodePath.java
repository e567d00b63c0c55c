package json.editor.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A location in a JSON tree: member names and array indices, outermost
/// first. Array indices are written as decimal strings.
///
/// The empty path addresses the root.
public record NodePath(List<String> segments) {

    private static final NodePath ROOT = new NodePath(List.of());

    public NodePath {
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    public static NodePath root() {
        return ROOT;
    }

    public static NodePath of(String... segments) {
        return new NodePath(Arrays.asList(segments));
    }

    public static NodePath of(List<String> segments) {
        return new NodePath(segments);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    /// {@return the final segment}
    /// @throws IllegalStateException for the root path
    public String last() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    /// {@return the path of the containing node}
    /// @throws IllegalStateException for the root path
    public NodePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no parent");
        }
        return new NodePath(segments.subList(0, segments.size() - 1));
    }

    public NodePath child(String key) {
        Objects.requireNonNull(key, "key must not be null");
        final var next = new ArrayList<String>(segments.size() + 1);
        next.addAll(segments);
        next.add(key);
        return new NodePath(next);
    }

    public NodePath child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        return child(Integer.toString(index));
    }

    /// {@return the segments joined with `.`} The root is the empty string.
    public String dotted() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return isRoot() ? "(root)" : dotted();
    }
}
