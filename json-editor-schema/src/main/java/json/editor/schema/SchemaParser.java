package json.editor.schema;

import json.editor.core.Json;
import json.editor.core.JsonArray;
import json.editor.core.JsonBoolean;
import json.editor.core.JsonFloat;
import json.editor.core.JsonInteger;
import json.editor.core.JsonObject;
import json.editor.core.JsonParseException;
import json.editor.core.JsonString;
import json.editor.core.JsonValue;
import json.editor.core.NodePath;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static json.editor.schema.SchemaLogging.LOG;

/// Reads schema files and answers lookups over the parsed {@link Schema}.
///
/// Keywords outside the supported subset are ignored. A supported keyword with
/// a value of the wrong shape fails the whole parse.
public final class SchemaParser {

  private static final Set<String> KEYWORDS = Set.of(
      "$schema", "title", "description", "type", "properties", "required", "additionalProperties",
      "items", "pattern", "format", "enum", "minimum", "maximum", "minLength", "maxLength",
      "deprecated", "default");

  /// Parses UTF-8 schema text.
  /// @throws SchemaParseException if the bytes are not UTF-8 JSON or do not
  ///         describe a schema
  public static Schema parse(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    final String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new SchemaParseException("Schema is not valid UTF-8", e);
    }
    return parse(text);
  }

  /// Parses schema text.
  /// @throws SchemaParseException if the text is not JSON or does not describe a schema
  public static Schema parse(String text) {
    Objects.requireNonNull(text, "text");
    final JsonValue json;
    try {
      json = Json.parse(text);
    } catch (JsonParseException e) {
      throw new SchemaParseException("Invalid JSON in schema: " + e.getMessage(), e);
    }
    return parse(json);
  }

  /// Builds a schema from an already parsed JSON value.
  /// @throws SchemaParseException if the value does not describe a schema
  public static Schema parse(JsonValue json) {
    Objects.requireNonNull(json, "json");
    StructuredLog.fine(LOG, "schema.parse.start", "kind", json.typeName());
    final Schema schema = compile(json, "#");
    StructuredLog.fine(LOG, "schema.parse.done", "properties", schema.properties().size());
    return schema;
  }

  private static Schema compile(JsonValue json, String pointer) {
    if (!(json instanceof JsonObject obj)) {
      throw new SchemaParseException(pointer, "schema must be an object, got " + json.typeName());
    }
    for (String key : obj.members().keySet()) {
      if (!KEYWORDS.contains(key)) {
        StructuredLog.finestSampled(LOG, "schema.keyword.ignored", 1, "pointer", pointer, "keyword", key);
      }
    }

    final Map<String, Schema> properties = new LinkedHashMap<>();
    final JsonValue props = obj.get("properties");
    if (props != null) {
      if (!(props instanceof JsonObject propsObj)) {
        throw new SchemaParseException(pointer, "properties must be an object");
      }
      propsObj.members().forEach((name, sub) ->
          properties.put(name, compile(sub, pointer + "/properties/" + escape(name))));
    }

    final JsonValue itemsValue = obj.get("items");
    final Schema items = itemsValue == null ? null : compile(itemsValue, pointer + "/items");

    AdditionalProperties additional = null;
    final JsonValue ap = obj.get("additionalProperties");
    if (ap instanceof JsonBoolean b) {
      additional = b.value() ? AdditionalProperties.ALLOWED : AdditionalProperties.FORBIDDEN;
    } else if (ap instanceof JsonObject) {
      additional = new AdditionalProperties.Constrained(compile(ap, pointer + "/additionalProperties"));
    } else if (ap != null) {
      throw new SchemaParseException(pointer, "additionalProperties must be a boolean or a schema");
    }

    final String patternSource = string(obj, "pattern", pointer);
    Pattern pattern = null;
    if (patternSource != null) {
      try {
        pattern = Pattern.compile(patternSource);
      } catch (PatternSyntaxException e) {
        throw new SchemaParseException(pointer, "pattern does not compile: " + e.getDescription());
      }
    }

    List<JsonValue> enumValues = null;
    final JsonValue en = obj.get("enum");
    if (en != null) {
      if (!(en instanceof JsonArray arr)) {
        throw new SchemaParseException(pointer, "enum must be an array");
      }
      enumValues = arr.elements();
    }

    final JsonValue deprecatedValue = obj.get("deprecated");
    if (deprecatedValue != null && !(deprecatedValue instanceof JsonBoolean)) {
      throw new SchemaParseException(pointer, "deprecated must be a boolean");
    }

    return new Schema(
        string(obj, "$schema", pointer),
        string(obj, "title", pointer),
        string(obj, "description", pointer),
        types(obj.get("type"), pointer),
        properties,
        required(obj.get("required"), pointer),
        additional,
        items,
        pattern,
        string(obj, "format", pointer),
        enumValues,
        number(obj, "minimum", pointer),
        number(obj, "maximum", pointer),
        length(obj, "minLength", pointer),
        length(obj, "maxLength", pointer),
        deprecatedValue instanceof JsonBoolean d && d.value(),
        obj.get("default"));
  }

  private static Set<SchemaType> types(JsonValue value, String pointer) {
    final Set<SchemaType> types = new LinkedHashSet<>();
    if (value == null) {
      return types;
    }
    final List<JsonValue> names;
    if (value instanceof JsonString) {
      names = List.of(value);
    } else if (value instanceof JsonArray arr) {
      names = arr.elements();
    } else {
      throw new SchemaParseException(pointer, "type must be a string or an array of strings");
    }
    for (JsonValue name : names) {
      if (!(name instanceof JsonString s)) {
        throw new SchemaParseException(pointer, "type array must contain only strings");
      }
      final SchemaType type = SchemaType.byName(s.value());
      if (type == null) {
        throw new SchemaParseException(pointer, "unknown type: " + s.value());
      }
      types.add(type);
    }
    return types;
  }

  private static Set<String> required(JsonValue value, String pointer) {
    final Set<String> required = new LinkedHashSet<>();
    if (value == null) {
      return required;
    }
    if (!(value instanceof JsonArray arr)) {
      throw new SchemaParseException(pointer, "required must be an array of strings");
    }
    for (JsonValue name : arr.elements()) {
      if (!(name instanceof JsonString s)) {
        throw new SchemaParseException(pointer, "required must be an array of strings");
      }
      required.add(s.value());
    }
    return required;
  }

  private static String string(JsonObject obj, String keyword, String pointer) {
    final JsonValue value = obj.get(keyword);
    if (value == null) {
      return null;
    }
    if (!(value instanceof JsonString s)) {
      throw new SchemaParseException(pointer, keyword + " must be a string");
    }
    return s.value();
  }

  private static Double number(JsonObject obj, String keyword, String pointer) {
    final JsonValue value = obj.get(keyword);
    if (value == null) {
      return null;
    }
    if (value instanceof JsonInteger i) {
      return (double) i.value();
    }
    if (value instanceof JsonFloat f) {
      return f.value();
    }
    throw new SchemaParseException(pointer, keyword + " must be a number");
  }

  private static Integer length(JsonObject obj, String keyword, String pointer) {
    final JsonValue value = obj.get(keyword);
    if (value == null) {
      return null;
    }
    if (value instanceof JsonInteger i && i.value() >= 0 && i.value() <= Integer.MAX_VALUE) {
      return (int) i.value();
    }
    throw new SchemaParseException(pointer, keyword + " must be a non-negative integer");
  }

  // JSON pointer escaping, RFC 6901
  private static String escape(String name) {
    return name.replace("~", "~0").replace("/", "~1");
  }

  /// {@return one entry per property reachable through nested `properties`,
  /// keyed by dotted path} Entries appear depth-first in declaration order;
  /// each property is followed by its descendants. When a key containing a dot
  /// collides with a nested path, the entry for the nested path is kept.
  public static Map<String, PropertyInfo> extractPropertyInfo(Schema schema) {
    Objects.requireNonNull(schema, "schema");
    final Map<String, PropertyInfo> result = new LinkedHashMap<>();
    extractPropertyInfo(schema, NodePath.root(), result);
    return result;
  }

  private static void extractPropertyInfo(Schema schema, NodePath base, Map<String, PropertyInfo> result) {
    for (Map.Entry<String, Schema> entry : schema.properties().entrySet()) {
      final NodePath path = base.child(entry.getKey());
      final Schema child = entry.getValue();
      final PropertyInfo info = PropertyInfo.of(path, child, schema.isRequired(entry.getKey()));
      final PropertyInfo existing = result.get(path.dotted());
      if (existing == null) {
        result.put(path.dotted(), info);
      } else {
        // same dotted key from two paths: the deeper one wins in either declaration order
        final PropertyInfo kept = path.size() >= existing.path().size() ? info : existing;
        StructuredLog.warning(LOG, "schema.property.shadowed", "key", path.dotted(),
            "kept", kept.path().segments(), "dropped", (kept == info ? existing : info).path().segments());
        result.put(path.dotted(), kept);
      }
      if (!child.properties().isEmpty()) {
        extractPropertyInfo(child, path, result);
      }
    }
  }

  /// {@return the names required at `path`} Empty when the path does not
  /// resolve to a sub-schema.
  public static Set<String> requiredFields(Schema schema, NodePath path) {
    return schema.schemaAt(path).map(Schema::required).orElse(Set.of());
  }

  /// {@return whether members outside `properties` are accepted at `path`}
  /// `true` when the path does not resolve, when the keyword is absent, or when
  /// it is a schema.
  public static boolean allowsAdditionalProperties(Schema schema, NodePath path) {
    return schema.schemaAt(path).map(Schema::allowsAdditionalProperties).orElse(true);
  }

  private SchemaParser() {}
}
