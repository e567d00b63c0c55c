package json.editor.schema;

/// Switches for a validation run.
///
/// @param assertFormats report strings that do not match their `format`
/// @param reportDeprecated report values whose schema is marked `deprecated`
public record ValidationOptions(boolean assertFormats, boolean reportDeprecated) {

  public static final ValidationOptions DEFAULT = new ValidationOptions(true, true);

  public ValidationOptions withAssertFormats(boolean assertFormats) {
    return new ValidationOptions(assertFormats, reportDeprecated);
  }

  public ValidationOptions withReportDeprecated(boolean reportDeprecated) {
    return new ValidationOptions(assertFormats, reportDeprecated);
  }
}
