package json.editor.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// This class provides static methods for producing and writing a {@link JsonValue}.
///
/// {@link #parse(String)} produces a `JsonValue` by parsing data adhering to
/// the JSON syntax defined in RFC 8259.
///
/// {@link #toCanonicalString(JsonValue)} is a deterministic pretty printer
/// with sorted member names and two-space indentation.
///
/// {@link #fromUntyped(Object)} and {@link #toUntyped(JsonValue)} provide a conversion
/// between `JsonValue` and an untyped object.
///
/// ## Example Usage
/// ```java
/// // Parse JSON string
/// JsonValue json = Json.parse("{\"name\":\"John\",\"age\":30}");
///
/// // Convert to standard Java types
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(json);
///
/// // Create JSON from Java objects
/// JsonValue fromJava = Json.fromUntyped(Map.of("active", true, "score", 95));
/// ```
///
/// See RFC 8259, The JavaScript Object Notation (JSON) Data Interchange Format.
public final class Json {

    /// Parses and creates a `JsonValue` from the given JSON document.
    /// If parsing succeeds, it guarantees that the input document conforms to
    /// the JSON syntax. If the document contains any JSON Object that has
    /// duplicate names, a `JsonParseException` is thrown.
    ///
    /// `JsonObject`s preserve the order of their members declared in and parsed from
    /// the JSON document. Integers that fit a `long` become `JsonInteger`, all
    /// other numbers become `JsonFloat`.
    ///
    /// ## Example
    /// ```java
    /// JsonValue value = Json.parse("{\"name\":\"Alice\",\"active\":true}");
    /// if (value instanceof JsonObject obj) {
    ///     String name = ((JsonString) obj.get("name")).value();
    ///     boolean active = ((JsonBoolean) obj.get("active")).value();
    /// }
    /// ```
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @throws JsonParseException if the input JSON document does not conform
    ///         to the JSON document format or a JSON object containing
    ///         duplicate names is encountered.
    /// @throws NullPointerException if `in` is `null`
    /// @return the parsed `JsonValue`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in);
        return JsonParser.parseTracked(in).root().value();
    }

    /// {@return a `JsonValue` created from the given `src` object}
    /// The mapping from an untyped `src` object to a `JsonValue`
    /// follows the table below.
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|----------|
    /// | `List<Object>` | `JsonArray` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `null` | `JsonNull` |
    /// | `Byte`, `Short`, `Integer`, `Long`, `BigInteger` in `long` range | `JsonInteger` |
    /// | other `Number` | `JsonFloat` |
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `String` | `JsonString` |
    ///
    /// If `src` is an instance of `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted
    ///         to a `JsonValue`.
    /// @see #toUntyped(JsonValue)
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        }
        if (src instanceof JsonValue jv) {
            return jv;
        }
        if (src instanceof Map<?, ?> map) {
            final Map<String, JsonValue> m = new LinkedHashMap<>(map.size() * 2);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                m.put(key, fromUntyped(entry.getValue()));
            }
            return JsonObject.of(m);
        }
        if (src instanceof List<?> list) {
            final List<JsonValue> l = new ArrayList<>(list.size());
            for (Object o : list) {
                l.add(fromUntyped(o));
            }
            return JsonArray.of(l);
        }
        if (src instanceof String str) {
            return JsonString.of(str);
        }
        if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        }
        if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
            return JsonInteger.of(((Number) src).longValue());
        }
        if (src instanceof BigInteger bi) {
            return bi.bitLength() < Long.SIZE ? JsonInteger.of(bi.longValue()) : JsonFloat.of(bi.doubleValue());
        }
        if (src instanceof BigDecimal || src instanceof Float || src instanceof Double) {
            return JsonFloat.of(((Number) src).doubleValue());
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return an `Object` created from the given `src` `JsonValue`}
    /// The mapping from a `JsonValue` to an untyped `src` object follows the table below.
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonArray` | `List<Object>` |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    /// | `JsonInteger` | `Long` |
    /// | `JsonFloat` | `Double` |
    /// | `JsonObject` | `Map<String, Object>` |
    /// | `JsonString` | `String` |
    ///
    /// A `JsonObject` in `src` is converted to a `Map` whose
    /// entries occur in the same order as the `JsonObject`'s members.
    ///
    /// @param src the `JsonValue` to convert to untyped. Non-null.
    /// @throws NullPointerException if `src` is `null`
    /// @see #fromUntyped(Object)
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        if (src instanceof JsonObject jo) {
            final Map<String, Object> m = new LinkedHashMap<>(jo.members().size() * 2);
            jo.members().forEach((k, v) -> m.put(k, toUntyped(v)));
            return m;
        }
        if (src instanceof JsonArray ja) {
            final List<Object> l = new ArrayList<>(ja.size());
            for (JsonValue v : ja.elements()) {
                l.add(toUntyped(v));
            }
            return l;
        }
        if (src instanceof JsonBoolean jb) {
            return jb.value();
        }
        if (src instanceof JsonInteger ji) {
            return ji.value();
        }
        if (src instanceof JsonFloat jf) {
            return jf.value();
        }
        if (src instanceof JsonString js) {
            return js.value();
        }
        return null;
    }

    /// {@return the canonical text of `value`} Members are sorted by name and
    /// nested values are indented by two spaces per level. Equal trees always
    /// produce equal text.
    ///
    /// ## Example
    /// ```java
    /// JsonValue json = Json.parse("{\"scores\":[85,90],\"name\":\"Alice\"}");
    /// System.out.println(Json.toCanonicalString(json));
    /// // Output:
    /// // {
    /// //   "name": "Alice",
    /// //   "scores": [
    /// //     85,
    /// //     90
    /// //   ]
    /// // }
    /// ```
    ///
    /// @param value the `JsonValue` to write. Non-null.
    /// @throws IllegalArgumentException if `value` contains a non-finite float
    /// @see JsonValue#toString()
    public static String toCanonicalString(JsonValue value) {
        Objects.requireNonNull(value);
        if (!isRepresentable(value)) {
            throw new IllegalArgumentException("Value contains a non-finite number");
        }
        return new JsonWriter(SerializationStyle.CANONICAL, true).render(value, "");
    }

    /// {@return `true` if every number in `value` is finite} JSON text cannot
    /// express `NaN` or infinities.
    public static boolean isRepresentable(JsonValue value) {
        final var stack = new ArrayDeque<JsonValue>();
        stack.push(value);
        while (!stack.isEmpty()) {
            final JsonValue v = stack.pop();
            if (v instanceof JsonFloat f && !f.isFinite()) {
                return false;
            }
            if (v instanceof JsonObject o) {
                o.members().values().forEach(stack::push);
            } else if (v instanceof JsonArray a) {
                a.elements().forEach(stack::push);
            }
        }
        return true;
    }

    // no instantiation is allowed for this class
    private Json() {}
}
