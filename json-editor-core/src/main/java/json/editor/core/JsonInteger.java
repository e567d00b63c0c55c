package json.editor.core;

/// A JSON number written without fraction or exponent that fits in a `long`.
///
/// Whole numbers outside the `long` range are parsed as {@link JsonFloat}.
public record JsonInteger(long value) implements JsonValue {

    /// {@return a `JsonInteger` holding `value`}
    public static JsonInteger of(long value) {
        return new JsonInteger(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
