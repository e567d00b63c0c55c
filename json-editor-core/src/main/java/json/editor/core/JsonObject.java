package json.editor.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// The record that represents a JSON object.
///
/// Member names are unique. The members keep the order of the map they were
/// created from, which is the order they appear in when parsed from text.
/// Two objects are equal when their members map to equal values, regardless
/// of order.
///
/// ## Example Usage
/// ```java
/// // Create from a Map
/// JsonObject obj = JsonObject.of(Map.of(
///     "name", JsonString.of("Alice"),
///     "age", JsonInteger.of(30),
///     "active", JsonBoolean.of(true)
/// ));
///
/// // Access members
/// JsonString name = (JsonString) obj.members().get("name");
/// ```
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    private static final JsonObject EMPTY = new JsonObject(Map.of());

    /// @throws NullPointerException if `members` is `null`, contains any keys
    ///         that are `null`, or contains any values that are `null`.
    public JsonObject {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, JsonValue>(members.size() * 2);
        members.forEach((k, v) -> copy.put(Objects.requireNonNull(k), Objects.requireNonNull(v)));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return the `JsonObject` created from the given map of `String` to
    /// `JsonValue`s} The members occur in the same order as the map's entries.
    ///
    /// @param map the map of `JsonValue`s. Non-null.
    public static JsonObject of(Map<String, ? extends JsonValue> map) {
        return new JsonObject(new LinkedHashMap<>(map));
    }

    /// {@return the empty `JsonObject`}
    public static JsonObject empty() {
        return EMPTY;
    }

    /// {@return the member value for `name`, or `null` when absent}
    public JsonValue get(String name) {
        return members.get(name);
    }

    @Override
    public String toString() {
        return JsonWriter.compact(this);
    }
}
