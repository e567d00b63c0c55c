package json.editor.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Compares a current tree with the tree it was loaded as and reports a
/// {@link ChangeStatus} per dotted path.
///
/// Leaves are reported as added or modified. Containers are descended,
/// array elements by position. A removed member or element is reported as
/// deleted together with every path nested below it. A value that changes
/// between leaf, object and array is modified; the old value's nested paths
/// are deleted and the new value's nested leaves are added. Unchanged paths
/// are not reported.
public final class ChangeDetector {

    private static final Logger LOG = Logger.getLogger(ChangeDetector.class.getName());

    private ChangeDetector() {}

    private record Frame(JsonValue current, JsonValue original, NodePath path) {}

    /// {@return changed paths in discovery order} `original` may be `null`,
    /// in which case nothing is reported.
    public static Map<String, ChangeStatus> compute(JsonValue current, JsonValue original) {
        Objects.requireNonNull(current, "current must not be null");
        if (original == null) {
            return Map.of();
        }
        final var changes = new LinkedHashMap<String, ChangeStatus>();
        final var stack = new ArrayDeque<Frame>();
        stack.push(new Frame(current, original, NodePath.root()));
        while (!stack.isEmpty()) {
            final Frame frame = stack.pop();
            final JsonValue now = frame.current();
            final JsonValue was = frame.original();
            if (now instanceof JsonObject obj) {
                final JsonObject wasObj = was instanceof JsonObject o ? o : null;
                if (wasObj == null) {
                    markReplaced(changes, was, frame.path());
                }
                final var children = new ArrayList<Frame>(obj.members().size());
                obj.members().forEach((key, value) ->
                        children.add(new Frame(value, wasObj == null ? null : wasObj.get(key), frame.path().child(key))));
                pushReversed(stack, children);
                if (wasObj != null) {
                    wasObj.members().forEach((key, value) -> {
                        if (!obj.members().containsKey(key)) {
                            markDeleted(changes, value, frame.path().child(key));
                        }
                    });
                }
            } else if (now instanceof JsonArray arr) {
                final JsonArray wasArr = was instanceof JsonArray a ? a : null;
                if (wasArr == null) {
                    markReplaced(changes, was, frame.path());
                }
                final var children = new ArrayList<Frame>(arr.size());
                for (int i = 0; i < arr.size(); i++) {
                    final JsonValue wasChild = wasArr != null && i < wasArr.size() ? wasArr.elements().get(i) : null;
                    children.add(new Frame(arr.elements().get(i), wasChild, frame.path().child(i)));
                }
                pushReversed(stack, children);
                if (wasArr != null) {
                    for (int i = arr.size(); i < wasArr.size(); i++) {
                        markDeleted(changes, wasArr.elements().get(i), frame.path().child(i));
                    }
                }
            } else if (!frame.path().isRoot()) {
                if (was == null) {
                    changes.put(frame.path().dotted(), ChangeStatus.ADDED);
                } else if (!now.equals(was)) {
                    markReplaced(changes, was, frame.path());
                }
            }
        }
        LOG.fine(() -> "Detected " + changes.size() + " changed paths");
        return Collections.unmodifiableMap(changes);
    }

    private static void pushReversed(ArrayDeque<Frame> stack, List<Frame> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /// The value at `at` changed kind or content: the path itself is modified
    /// and whatever `was` held below it is gone. Children that still exist
    /// are re-reported when the new value is descended.
    private static void markReplaced(Map<String, ChangeStatus> changes, JsonValue was, NodePath at) {
        if (was == null || at.isRoot()) {
            return;
        }
        changes.put(at.dotted(), ChangeStatus.MODIFIED);
        if (was instanceof JsonObject obj) {
            obj.members().forEach((key, child) -> markDeleted(changes, child, at.child(key)));
        } else if (was instanceof JsonArray arr) {
            for (int i = 0; i < arr.size(); i++) {
                markDeleted(changes, arr.elements().get(i), at.child(i));
            }
        }
    }

    private static void markDeleted(Map<String, ChangeStatus> changes, JsonValue removed, NodePath at) {
        final var pending = new ArrayDeque<Map.Entry<NodePath, JsonValue>>();
        pending.push(Map.entry(at, removed));
        while (!pending.isEmpty()) {
            final var entry = pending.pop();
            changes.put(entry.getKey().dotted(), ChangeStatus.DELETED);
            final JsonValue value = entry.getValue();
            if (value instanceof JsonObject obj) {
                obj.members().forEach((key, child) -> pending.push(Map.entry(entry.getKey().child(key), child)));
            } else if (value instanceof JsonArray arr) {
                for (int i = 0; i < arr.size(); i++) {
                    pending.push(Map.entry(entry.getKey().child(i), arr.elements().get(i)));
                }
            }
        }
    }
}
