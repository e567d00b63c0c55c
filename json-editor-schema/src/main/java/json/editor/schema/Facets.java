package json.editor.schema;

import json.editor.core.JsonValue;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// The checks that apply to a single value, shared by a {@link Schema} node
/// and a flattened {@link PropertyInfo}.
record Facets(
    Set<SchemaType> types,
    Pattern pattern,
    String format,
    List<JsonValue> enumValues,
    Double minimum,
    Double maximum,
    Integer minLength,
    Integer maxLength,
    boolean deprecated
) {
}
