package json.editor.core;

/// The interface that represents a JSON value.
///
/// The set of variants is closed: every consumer can branch over
/// `JsonNull`, `JsonBoolean`, `JsonInteger`, `JsonFloat`, `JsonString`,
/// `JsonArray` and `JsonObject` and know it has covered every case.
///
/// Instances of `JsonValue` are immutable and thread safe. Containers own
/// their children, so a value is always a tree.
///
/// A `JsonValue` can be produced by {@link Json#parse(String)} or by the
/// static `of` factories on each variant.
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonInteger, JsonFloat, JsonString, JsonArray, JsonObject {

    /// {@return the JSON Schema name of this value's type} One of `null`,
    /// `boolean`, `integer`, `number`, `string`, `array` or `object`.
    default String typeName() {
        if (this instanceof JsonNull) {
            return "null";
        } else if (this instanceof JsonBoolean) {
            return "boolean";
        } else if (this instanceof JsonInteger) {
            return "integer";
        } else if (this instanceof JsonFloat) {
            return "number";
        } else if (this instanceof JsonString) {
            return "string";
        } else if (this instanceof JsonArray) {
            return "array";
        }
        return "object";
    }

    /// {@return the compact String representation of this `JsonValue` that
    /// conforms to the JSON syntax} For an indented representation use
    /// {@link Json#toCanonicalString(JsonValue)}.
    String toString();
}
