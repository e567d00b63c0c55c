package json.editor.core;

import java.util.List;
import java.util.Objects;

/// The record that represents a JSON array.
///
/// A `JsonArray` can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of(List)} can be used to obtain a `JsonArray`.
/// The element list is copied on construction and cannot be modified.
///
/// ## Example Usage
/// ```java
/// JsonArray arr = JsonArray.of(List.of(JsonString.of("x"), JsonInteger.of(1)));
/// JsonValue first = arr.elements().get(0);
/// ```
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    private static final JsonArray EMPTY = new JsonArray(List.of());

    /// @throws NullPointerException if `elements` is `null` or contains `null`
    public JsonArray {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    /// {@return the `JsonArray` created from the given list of `JsonValue`s}
    ///
    /// @param elements the list of `JsonValue`s. Non-null.
    public static JsonArray of(List<? extends JsonValue> elements) {
        return new JsonArray(List.copyOf(elements));
    }

    /// {@return the empty `JsonArray`}
    public static JsonArray empty() {
        return EMPTY;
    }

    /// {@return the number of elements}
    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return JsonWriter.compact(this);
    }
}
