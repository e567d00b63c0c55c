package json.editor.schema;

import json.editor.core.JsonArray;
import json.editor.core.JsonEditable;
import json.editor.core.JsonFloat;
import json.editor.core.JsonInteger;
import json.editor.core.JsonObject;
import json.editor.core.JsonString;
import json.editor.core.JsonValue;
import json.editor.core.NodePath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.stream.Collectors;

import static json.editor.schema.SchemaLogging.LOG;

/// Checks JSON trees against a {@link Schema}.
///
/// Validation never throws and never stops at the first problem: every
/// finding in the tree is collected in one pass, in document order. Findings
/// with severity {@link Severity#WARNING} do not make the result invalid, so a
/// caller may still save a document that only carries warnings.
///
/// ## Usage
/// ```java
/// Schema schema = SchemaParser.parse(schemaText);
/// ValidationResult result = SchemaValidator.validate(Json.parse(doc), schema);
/// for (var error : result.errors()) {
///     System.out.println(error.pathString() + ": " + error.message());
/// }
/// ```
public final class SchemaValidator {

  private static final int WARNING_THRESHOLD = 10_000;

  /// Validation frame for stack-based processing
  record ValidationFrame(NodePath path, Schema schema, JsonValue json) {
  }

  public static ValidationResult validate(JsonValue tree, Schema schema) {
    return validate(tree, schema, ValidationOptions.DEFAULT);
  }

  public static ValidationResult validate(JsonValue tree, Schema schema, ValidationOptions options) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(options, "options");
    StructuredLog.fine(LOG, "schema.validate.start", "root", tree.typeName());
    final List<ValidationError> errors = new ArrayList<>();
    final Deque<ValidationFrame> stack = new ArrayDeque<>();
    stack.push(new ValidationFrame(NodePath.root(), schema, tree));

    int iterationCount = 0;
    try {
      while (!stack.isEmpty()) {
        iterationCount++;
        if (iterationCount % WARNING_THRESHOLD == 0) {
          final int processed = iterationCount;
          final int pending = stack.size();
          LOG.fine(() -> "PERFORMANCE WARNING: Validation stack processed=" + processed + " pending=" + pending);
        }
        final ValidationFrame frame = stack.pop();
        StructuredLog.finestSampled(LOG, "schema.validate.frame", 100, "path", frame.path());
        validateAt(frame, options, errors, stack);
      }
    } catch (RuntimeException e) {
      errors.add(internalFailure(e));
    }
    return result(errors, iterationCount);
  }

  /// Validates the current content of `document`.
  public static ValidationResult validate(JsonEditable<?> document, Schema schema) {
    return validate(document, schema, ValidationOptions.DEFAULT);
  }

  public static ValidationResult validate(JsonEditable<?> document, Schema schema, ValidationOptions options) {
    Objects.requireNonNull(document, "document");
    return validate(document.content(), schema, options);
  }

  /// Checks `tree` against a flattened property table, as built by
  /// {@link SchemaParser#extractPropertyInfo(Schema)}.
  ///
  /// Each entry is checked where it occurs in the tree. An entry whose parent
  /// object is absent is skipped; the parent's own entry reports it if it is
  /// required. `additionalProperties` is not part of a table, so extra members
  /// are never reported here.
  public static ValidationResult validate(JsonValue tree, Map<String, PropertyInfo> propertyTable) {
    return validate(tree, propertyTable, ValidationOptions.DEFAULT);
  }

  public static ValidationResult validate(JsonValue tree, Map<String, PropertyInfo> propertyTable,
                                          ValidationOptions options) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(propertyTable, "propertyTable");
    Objects.requireNonNull(options, "options");
    StructuredLog.fine(LOG, "schema.validate.table.start", "entries", propertyTable.size());
    final List<ValidationError> errors = new ArrayList<>();
    int checked = 0;
    try {
      for (PropertyInfo info : propertyTable.values()) {
        final NodePath path = info.path();
        if (path.isRoot()) {
          continue;
        }
        final Optional<JsonValue> parent = resolve(tree, path.parent());
        if (parent.isEmpty() || !(parent.get() instanceof JsonObject obj)) {
          continue;
        }
        checked++;
        final JsonValue value = obj.get(path.last());
        if (value == null) {
          if (info.isRequired()) {
            errors.add(ValidationError.of(ErrorCode.REQUIRED_FIELD_MISSING, path.parent(), path.last()));
          }
          continue;
        }
        checkValue(path, value, info.facets(), options, errors);
      }
    } catch (RuntimeException e) {
      errors.add(internalFailure(e));
    }
    return result(errors, checked);
  }

  private static void validateAt(ValidationFrame frame, ValidationOptions options,
                                 List<ValidationError> errors, Deque<ValidationFrame> stack) {
    final NodePath path = frame.path();
    final Schema schema = frame.schema();
    final JsonValue json = frame.json();
    checkValue(path, json, schema.facets(), options, errors);

    final List<ValidationFrame> children = new ArrayList<>();
    if (json instanceof JsonObject obj) {
      for (String name : schema.required()) {
        if (!obj.members().containsKey(name)) {
          errors.add(ValidationError.of(ErrorCode.REQUIRED_FIELD_MISSING, path, name));
        }
      }
      for (Map.Entry<String, JsonValue> member : obj.members().entrySet()) {
        final String key = member.getKey();
        final Schema propertySchema = schema.properties().get(key);
        if (propertySchema != null) {
          children.add(new ValidationFrame(path.child(key), propertySchema, member.getValue()));
        } else if (schema.additionalProperties() instanceof AdditionalProperties.Constrained c) {
          children.add(new ValidationFrame(path.child(key), c.schema(), member.getValue()));
        } else if (!schema.allowsAdditionalProperties()) {
          errors.add(ValidationError.of(ErrorCode.ADDITIONAL_PROPERTY_NOT_ALLOWED, path, key));
        }
      }
    } else if (json instanceof JsonArray arr && schema.items() != null) {
      for (int i = 0; i < arr.size(); i++) {
        children.add(new ValidationFrame(path.child(i), schema.items(), arr.elements().get(i)));
      }
    }
    // pushed last-first so children pop in document order
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(children.get(i));
    }
  }

  private static void checkValue(NodePath path, JsonValue json, Facets facets, ValidationOptions options,
                                 List<ValidationError> errors) {
    if (facets.deprecated() && options.reportDeprecated()) {
      errors.add(ValidationError.of(ErrorCode.DEPRECATED, path));
    }

    if (facets.enumValues() != null && facets.enumValues().stream().noneMatch(e -> sameValue(json, e))) {
      errors.add(ValidationError.of(ErrorCode.ENUM_VIOLATION, path, describe(facets.enumValues())));
    }

    if (!facets.types().isEmpty()) {
      final SchemaType actual = SchemaType.of(json);
      if (facets.types().stream().noneMatch(actual::satisfies)) {
        final String expected = facets.types().stream().map(SchemaType::schemaName).collect(Collectors.joining(" or "));
        errors.add(ValidationError.of(ErrorCode.TYPE_MISMATCH, path, expected, actual.schemaName()));
      }
    }

    if (json instanceof JsonString str) {
      final String value = str.value();
      if (facets.pattern() != null && !facets.pattern().matcher(value).find()) {
        errors.add(ValidationError.of(ErrorCode.PATTERN_MISMATCH, path, facets.pattern().pattern()));
      }
      if (facets.format() != null && options.assertFormats()) {
        final FormatValidator format = Format.byName(facets.format());
        if (format != null && !format.test(value)) {
          errors.add(ValidationError.of(ErrorCode.INVALID_FORMAT, path, facets.format(), value));
        }
      }
      checkLength(path, value.codePointCount(0, value.length()), facets, errors);
    } else if (json instanceof JsonInteger || json instanceof JsonFloat) {
      final double number = json instanceof JsonInteger i ? i.value() : ((JsonFloat) json).value();
      if (facets.minimum() != null && number < facets.minimum()) {
        errors.add(ValidationError.of(ErrorCode.MINIMUM_VIOLATION, path, display(json), display(facets.minimum())));
      }
      if (facets.maximum() != null && number > facets.maximum()) {
        errors.add(ValidationError.of(ErrorCode.MAXIMUM_VIOLATION, path, display(json), display(facets.maximum())));
      }
    } else if (json instanceof JsonArray arr) {
      checkLength(path, arr.size(), facets, errors);
    }
  }

  private static void checkLength(NodePath path, int length, Facets facets, List<ValidationError> errors) {
    if (facets.minLength() != null && length < facets.minLength()) {
      errors.add(ValidationError.of(ErrorCode.MIN_LENGTH_VIOLATION, path, length, facets.minLength()));
    }
    if (facets.maxLength() != null && length > facets.maxLength()) {
      errors.add(ValidationError.of(ErrorCode.MAX_LENGTH_VIOLATION, path, length, facets.maxLength()));
    }
  }

  /// Numbers compare by value, so `1` equals `1.0`. Booleans are not numbers.
  static boolean sameValue(JsonValue actual, JsonValue expected) {
    if (actual instanceof JsonInteger a && expected instanceof JsonInteger b) {
      return a.value() == b.value();
    }
    if (isNumber(actual) && isNumber(expected)) {
      return toDouble(actual) == toDouble(expected);
    }
    if (actual instanceof JsonArray a && expected instanceof JsonArray b) {
      if (a.size() != b.size()) {
        return false;
      }
      for (int i = 0; i < a.size(); i++) {
        if (!sameValue(a.elements().get(i), b.elements().get(i))) {
          return false;
        }
      }
      return true;
    }
    if (actual instanceof JsonObject a && expected instanceof JsonObject b) {
      if (a.members().size() != b.members().size()) {
        return false;
      }
      for (Map.Entry<String, JsonValue> entry : b.members().entrySet()) {
        final JsonValue other = a.get(entry.getKey());
        if (other == null || !sameValue(other, entry.getValue())) {
          return false;
        }
      }
      return true;
    }
    return actual.equals(expected);
  }

  private static boolean isNumber(JsonValue value) {
    return value instanceof JsonInteger || value instanceof JsonFloat;
  }

  private static double toDouble(JsonValue value) {
    return value instanceof JsonInteger i ? i.value() : ((JsonFloat) value).value();
  }

  private static String describe(List<JsonValue> values) {
    return values.stream().map(SchemaValidator::display).collect(Collectors.joining(", "));
  }

  private static String display(JsonValue value) {
    if (value instanceof JsonString s) {
      return s.value();
    }
    if (value instanceof JsonFloat f) {
      return display(f.value());
    }
    return value.toString();
  }

  // whole numbers print without a fraction: 10, not 10.0
  private static String display(double d) {
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  private static Optional<JsonValue> resolve(JsonValue root, NodePath path) {
    JsonValue current = root;
    for (String segment : path.segments()) {
      if (current instanceof JsonObject obj) {
        current = obj.get(segment);
      } else if (current instanceof JsonArray arr && segment.matches("0|[1-9]\\d{0,8}")) {
        final int index = Integer.parseInt(segment);
        current = index < arr.size() ? arr.elements().get(index) : null;
      } else {
        current = null;
      }
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  private static ValidationError internalFailure(RuntimeException e) {
    LOG.log(Level.WARNING, e, () -> "Validation aborted by an internal failure");
    return ValidationError.of(ErrorCode.OTHER, NodePath.root(), "Validation failed: " + e);
  }

  private static ValidationResult result(List<ValidationError> errors, int checked) {
    final ValidationResult result = errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    StructuredLog.fine(LOG, "schema.validate.done", "checked", checked,
        "errors", result.errorCount(), "warnings", result.warningCount());
    return result;
  }

  private SchemaValidator() {}
}
