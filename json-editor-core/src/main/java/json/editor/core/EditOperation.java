package json.editor.core;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// A structural change to a JSON tree, expressed as data.
///
/// Every operation is pure. {@link #apply(JsonValue)} returns a new tree and
/// leaves its argument untouched, or returns an empty `Optional` when the
/// operation cannot be carried out (a path that does not resolve, an index out
/// of range, a container of the wrong kind). An empty result always means the
/// edit failed; it is never used for "nothing to change".
///
/// Paths never create intermediate containers.
///
/// ## Example Usage
/// ```java
/// JsonValue tree = Json.parse("{\"arr\":[\"x\",\"y\"]}");
/// Optional<JsonValue> edited = EditOperation.InsertArrayElement
///     .append(NodePath.of("arr"), JsonString.of("z"))
///     .apply(tree);
/// ```
public sealed interface EditOperation {

    /// {@return the edited tree, or empty if the operation does not apply to `tree`}
    Optional<JsonValue> apply(JsonValue tree);

    /// {@return the path this operation changes} For member additions this is
    /// the path of the new member.
    NodePath targetPath();

    /// {@return a short human readable summary, such as `Set value at a.b`}
    String description();

    /// Writes `value` at `path`. In an object parent the member is replaced, or
    /// appended after the existing members when absent. In an array parent the
    /// index must already exist.
    record SetValue(NodePath path, JsonValue value) implements EditOperation {

        public SetValue {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Optional<JsonValue> apply(JsonValue tree) {
            if (path.isRoot()) {
                return Optional.empty();
            }
            final String last = path.last();
            return TreeEditor.modify(tree, path.parent(), parent -> {
                if (parent instanceof JsonObject obj) {
                    return Optional.of(TreeEditor.put(obj, last, value));
                }
                if (parent instanceof JsonArray arr) {
                    final OptionalInt index = TreeEditor.index(last);
                    if (index.isPresent() && index.getAsInt() < arr.size()) {
                        return Optional.of(TreeEditor.set(arr, index.getAsInt(), value));
                    }
                }
                return Optional.empty();
            });
        }

        @Override
        public NodePath targetPath() {
            return path;
        }

        @Override
        public String description() {
            return "Set value at " + path;
        }
    }

    /// Adds or replaces member `key` of the object at `parentPath`. Same as
    /// `SetValue(parentPath + key, value)` except that the parent must be an object.
    record AddField(NodePath parentPath, String key, JsonValue value) implements EditOperation {

        public AddField {
            Objects.requireNonNull(parentPath, "parentPath must not be null");
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Optional<JsonValue> apply(JsonValue tree) {
            return TreeEditor.modify(tree, parentPath, parent -> parent instanceof JsonObject obj
                    ? Optional.of(TreeEditor.put(obj, key, value))
                    : Optional.empty());
        }

        @Override
        public NodePath targetPath() {
            return parentPath.child(key);
        }

        @Override
        public String description() {
            return "Add field '" + key + "' to " + parentPath;
        }
    }

    /// Removes the object member at `path`. The member must exist.
    record DeleteField(NodePath path) implements EditOperation {

        public DeleteField {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public Optional<JsonValue> apply(JsonValue tree) {
            if (path.isRoot()) {
                return Optional.empty();
            }
            final String key = path.last();
            return TreeEditor.modify(tree, path.parent(), parent ->
                    parent instanceof JsonObject obj && obj.members().containsKey(key)
                            ? Optional.of(TreeEditor.remove(obj, key))
                            : Optional.empty());
        }

        @Override
        public NodePath targetPath() {
            return path;
        }

        @Override
        public String description() {
            return "Delete field " + path;
        }
    }

    /// Removes the array element at `path`, whose last segment is the index.
    record DeleteArrayElement(NodePath path) implements EditOperation {

        public DeleteArrayElement {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public Optional<JsonValue> apply(JsonValue tree) {
            if (path.isRoot()) {
                return Optional.empty();
            }
            final OptionalInt index = TreeEditor.index(path.last());
            if (index.isEmpty()) {
                return Optional.empty();
            }
            final int i = index.getAsInt();
            return TreeEditor.modify(tree, path.parent(), parent ->
                    parent instanceof JsonArray arr && i < arr.size()
                            ? Optional.of(TreeEditor.removeAt(arr, i))
                            : Optional.empty());
        }

        @Override
        public NodePath targetPath() {
            return path;
        }

        @Override
        public String description() {
            return "Delete array element " + path;
        }
    }

    /// Inserts `value` into the array at `path`. A `null` index appends;
    /// otherwise `0 <= index <= size` must hold.
    record InsertArrayElement(NodePath path, JsonValue value, Integer index) implements EditOperation {

        private static final Logger LOG = Logger.getLogger(InsertArrayElement.class.getName());

        public InsertArrayElement {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        public static InsertArrayElement append(NodePath path, JsonValue value) {
            return new InsertArrayElement(path, value, null);
        }

        public static InsertArrayElement at(NodePath path, JsonValue value, int index) {
            return new InsertArrayElement(path, value, index);
        }

        @Override
        public Optional<JsonValue> apply(JsonValue tree) {
            return TreeEditor.modify(tree, path, target -> {
                if (!(target instanceof JsonArray arr)) {
                    return Optional.empty();
                }
                final int at = index == null ? arr.size() : index;
                if (at < 0 || at > arr.size()) {
                    LOG.finer(() -> "Insert index " + at + " outside 0.." + arr.size());
                    return Optional.empty();
                }
                return Optional.of(TreeEditor.insert(arr, at, value));
            });
        }

        @Override
        public NodePath targetPath() {
            return path;
        }

        @Override
        public String description() {
            return index == null
                    ? "Append array element to " + path
                    : "Insert array element at " + index + " in " + path;
        }
    }

    /// Removes the element at `fromIndex` and inserts it at `toIndex` of the
    /// shortened array, so moving 0 to 2 in `[1,2,3,4]` gives `[2,3,1,4]`.
    /// Both indices must lie in `[0, size)` of the original array.
    record MoveArrayElement(NodePath arrayPath, int fromIndex, int toIndex) implements EditOperation {

        public MoveArrayElement {
            Objects.requireNonNull(arrayPath, "arrayPath must not be null");
        }

        @Override
        public Optional<JsonValue> apply(JsonValue tree) {
            return TreeEditor.modify(tree, arrayPath, target -> {
                if (!(target instanceof JsonArray arr)
                        || fromIndex < 0 || fromIndex >= arr.size()
                        || toIndex < 0 || toIndex >= arr.size()) {
                    return Optional.empty();
                }
                final JsonValue moved = arr.elements().get(fromIndex);
                return Optional.of(TreeEditor.insert(TreeEditor.removeAt(arr, fromIndex), toIndex, moved));
            });
        }

        @Override
        public NodePath targetPath() {
            return arrayPath;
        }

        @Override
        public String description() {
            return "Move array element " + fromIndex + " to " + toIndex + " in " + arrayPath;
        }
    }
}
