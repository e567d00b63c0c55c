package json.editor.core;

import java.util.Objects;

/// A JSON string, held unescaped.
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a `JsonString` holding `value`}
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public String toString() {
        return JsonWriter.quote(value);
    }
}
