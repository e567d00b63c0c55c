package json.editor.core;

/// A JSON number with a fraction or exponent, held as a `double`.
///
/// Non-finite values can be constructed but cannot be written as JSON text;
/// serializing a tree that contains one yields no result.
public record JsonFloat(double value) implements JsonValue {

    /// {@return a `JsonFloat` holding `value`}
    public static JsonFloat of(double value) {
        return new JsonFloat(value);
    }

    /// {@return `true` if this value can be written as a JSON number}
    public boolean isFinite() {
        return Double.isFinite(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
