/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package json.editor.schema;

import json.editor.core.JsonValue;
import json.editor.core.NodePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/// A parsed schema: the subset of JSON Schema draft-07 that a config editor
/// needs to describe and check its files.
///
/// ## Usage
/// ```java
/// Schema schema = SchemaParser.parse(schemaBytes);
///
/// ValidationResult result = SchemaValidator.validate(document, schema);
/// if (!result.isValid()) {
///     result.errorsByPath().forEach((path, errors) -> ...);
/// }
/// ```
///
/// Absent keywords are `null` (or empty collections), never defaults. A schema
/// with no keywords accepts every value. Instances are immutable.
///
/// @param schemaUri the `$schema` identifier
/// @param title the `title`
/// @param description the `description`
/// @param types the declared `type` names in declaration order; empty when any type is allowed
/// @param properties member schemas by name, in declaration order
/// @param required names the object must contain
/// @param additionalProperties the `additionalProperties` keyword, or null when absent
/// @param items schema for every array element, or null
/// @param pattern compiled `pattern`, or null
/// @param format the `format` name, or null
/// @param enumValues the permitted values, or null when not an enumeration
/// @param minimum inclusive lower bound for numbers
/// @param maximum inclusive upper bound for numbers
/// @param minLength lower bound on string length or array size
/// @param maxLength upper bound on string length or array size
/// @param deprecated whether values here should no longer be used
/// @param defaultValue the `default`, or null
public record Schema(
    String schemaUri,
    String title,
    String description,
    Set<SchemaType> types,
    Map<String, Schema> properties,
    Set<String> required,
    AdditionalProperties additionalProperties,
    Schema items,
    Pattern pattern,
    String format,
    List<JsonValue> enumValues,
    Double minimum,
    Double maximum,
    Integer minLength,
    Integer maxLength,
    boolean deprecated,
    JsonValue defaultValue
) {

  /// Accepts every value.
  public static final Schema ANY = new Schema(null, null, null, Set.of(), Map.of(), Set.of(),
      null, null, null, null, null, null, null, null, null, false, null);

  public Schema {
    types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
    enumValues = enumValues == null ? null : List.copyOf(enumValues);
  }

  /// {@return the sub-schema at `path`, or empty when the path leaves the
  /// schema} Each segment selects a member of `properties`; where there is no
  /// such member, the `items` schema stands for any array element.
  public Optional<Schema> schemaAt(NodePath path) {
    Schema current = this;
    for (String segment : path.segments()) {
      Schema next = current.properties.get(segment);
      if (next == null) {
        next = current.items;
      }
      if (next == null) {
        return Optional.empty();
      }
      current = next;
    }
    return Optional.of(current);
  }

  public boolean isRequired(String name) {
    return required.contains(name);
  }

  /// {@return `false` only when `additionalProperties` is `false`}
  public boolean allowsAdditionalProperties() {
    return additionalProperties == null || additionalProperties.allowsExtraMembers();
  }

  /// {@return the declared member names, sorted}
  public List<String> propertyNames() {
    final List<String> names = new ArrayList<>(properties.keySet());
    Collections.sort(names);
    return names;
  }

  Facets facets() {
    return new Facets(types, pattern, format, enumValues, minimum, maximum, minLength, maxLength, deprecated);
  }
}
