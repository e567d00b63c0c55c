package json.editor.schema;

import json.editor.core.JsonArray;
import json.editor.core.JsonBoolean;
import json.editor.core.JsonFloat;
import json.editor.core.JsonInteger;
import json.editor.core.JsonNull;
import json.editor.core.JsonObject;
import json.editor.core.JsonString;
import json.editor.core.JsonValue;

import java.util.Locale;

/// The `type` names a schema may declare.
///
/// Both the JSON Schema spelling and the short editor spelling are accepted:
/// `integer`/`int`, `number`/`float`, `boolean`/`bool`.
public enum SchemaType {
  STRING("string"),
  INTEGER("integer"),
  NUMBER("number"),
  BOOLEAN("boolean"),
  NULL("null"),
  ARRAY("array"),
  OBJECT("object");

  private final String schemaName;

  SchemaType(String schemaName) {
    this.schemaName = schemaName;
  }

  /// {@return the JSON Schema name, e.g. `integer`}
  public String schemaName() {
    return schemaName;
  }

  /// {@return the type for `name`, or null when it is not a known type name}
  public static SchemaType byName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "string":
        return STRING;
      case "integer":
      case "int":
        return INTEGER;
      case "number":
      case "float":
        return NUMBER;
      case "boolean":
      case "bool":
        return BOOLEAN;
      case "null":
        return NULL;
      case "array":
        return ARRAY;
      case "object":
        return OBJECT;
      default:
        return null;
    }
  }

  /// {@return the type of a runtime value} Integers report `INTEGER`, other
  /// numbers `NUMBER`.
  public static SchemaType of(JsonValue value) {
    if (value instanceof JsonString) return STRING;
    if (value instanceof JsonInteger) return INTEGER;
    if (value instanceof JsonFloat) return NUMBER;
    if (value instanceof JsonBoolean) return BOOLEAN;
    if (value instanceof JsonNull) return NULL;
    if (value instanceof JsonArray) return ARRAY;
    if (value instanceof JsonObject) return OBJECT;
    throw new AssertionError("unknown JsonValue " + value.getClass());
  }

  /// {@return `true` if a value of this runtime type satisfies `declared`}
  /// An integer satisfies `number`.
  public boolean satisfies(SchemaType declared) {
    return this == declared || (this == INTEGER && declared == NUMBER);
  }
}
