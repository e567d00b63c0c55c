package json.editor.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The findings of one validation run, in the order they were found.
/// Warnings never make a result invalid.
public record ValidationResult(List<ValidationError> errors) {

  private static final ValidationResult SUCCESS = new ValidationResult(List.of());

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  public static ValidationResult success() {
    return SUCCESS;
  }

  public static ValidationResult failure(List<ValidationError> errors) {
    return new ValidationResult(errors);
  }

  /// {@return `true` if no finding has severity `ERROR`}
  public boolean isValid() {
    return errors.stream().noneMatch(ValidationError::isError);
  }

  public int errorCount() {
    return (int) errors.stream().filter(ValidationError::isError).count();
  }

  public int warningCount() {
    return errors.size() - errorCount();
  }

  /// {@return the findings grouped by {@link ValidationError#pathString()}}
  /// Groups appear in the order of their first finding.
  public Map<String, List<ValidationError>> errorsByPath() {
    final Map<String, List<ValidationError>> grouped = new LinkedHashMap<>();
    for (ValidationError error : errors) {
      grouped.computeIfAbsent(error.pathString(), k -> new ArrayList<>()).add(error);
    }
    grouped.replaceAll((k, v) -> List.copyOf(v));
    return Collections.unmodifiableMap(grouped);
  }
}
