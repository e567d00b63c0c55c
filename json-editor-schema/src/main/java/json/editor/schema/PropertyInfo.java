package json.editor.schema;

import json.editor.core.JsonValue;
import json.editor.core.NodePath;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// One property of a schema, flattened out of the tree and addressed by its
/// full path. Built by {@link SchemaParser#extractPropertyInfo(Schema)}.
///
/// @param isRequired whether the parent schema lists this property in `required`
public record PropertyInfo(
    NodePath path,
    Set<SchemaType> types,
    String description,
    String format,
    Pattern pattern,
    List<JsonValue> enumValues,
    boolean isRequired,
    boolean isDeprecated,
    Double minimum,
    Double maximum,
    Integer minLength,
    Integer maxLength,
    JsonValue defaultValue
) {

  public PropertyInfo {
    types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
    enumValues = enumValues == null ? null : List.copyOf(enumValues);
  }

  static PropertyInfo of(NodePath path, Schema schema, boolean isRequired) {
    return new PropertyInfo(path, schema.types(), schema.description(), schema.format(), schema.pattern(),
        schema.enumValues(), isRequired, schema.deprecated(), schema.minimum(), schema.maximum(),
        schema.minLength(), schema.maxLength(), schema.defaultValue());
  }

  public String pathString() {
    return path.dotted();
  }

  /// {@return the declared types joined with ` | `, or empty when the type is
  /// unconstrained}
  public String typeString() {
    return types.stream().map(SchemaType::schemaName).collect(Collectors.joining(" | "));
  }

  Facets facets() {
    return new Facets(types, pattern, format, enumValues, minimum, maximum, minLength, maxLength, isDeprecated);
  }
}
