package json.editor.schema;

/// The kinds of validation finding, each with its message template and
/// default severity.
public enum ErrorCode {
  /// Runtime type outside the declared type set
  TYPE_MISMATCH("typeMismatch", Severity.ERROR, "Type mismatch: expected %s, got %s"),

  /// A name listed in `required` is absent from the object
  REQUIRED_FIELD_MISSING("requiredFieldMissing", Severity.ERROR, "Missing required field: %s"),

  /// String does not have the shape its `format` names
  INVALID_FORMAT("invalidFormat", Severity.WARNING, "Invalid %s format: %s"),

  /// String has no match for `pattern`
  PATTERN_MISMATCH("patternMismatch", Severity.ERROR, "Value does not match pattern: %s"),

  /// Value equals none of the `enum` entries
  ENUM_VIOLATION("enumViolation", Severity.ERROR, "Value must be one of: %s"),

  MINIMUM_VIOLATION("minimumViolation", Severity.ERROR, "Value %s is less than minimum %s"),

  MAXIMUM_VIOLATION("maximumViolation", Severity.ERROR, "Value %s exceeds maximum %s"),

  /// String or array shorter than `minLength`
  MIN_LENGTH_VIOLATION("minLengthViolation", Severity.ERROR, "Length %d is less than minimum %d"),

  /// String or array longer than `maxLength`
  MAX_LENGTH_VIOLATION("maxLengthViolation", Severity.ERROR, "Length %d exceeds maximum %d"),

  /// Member not named in `properties` under `additionalProperties: false`
  ADDITIONAL_PROPERTY_NOT_ALLOWED("additionalPropertyNotAllowed", Severity.WARNING, "Additional property not allowed: %s"),

  DEPRECATED("deprecated", Severity.WARNING, "This field is deprecated"),

  /// The validator itself failed
  OTHER("other", Severity.ERROR, "%s");

  private final String code;
  private final Severity severity;
  private final String messageTemplate;

  ErrorCode(String code, Severity severity, String messageTemplate) {
    this.code = code;
    this.severity = severity;
    this.messageTemplate = messageTemplate;
  }

  /// {@return the stable camel-case code, e.g. `requiredFieldMissing`}
  public String code() {
    return code;
  }

  public Severity severity() {
    return severity;
  }

  public String message(Object... args) {
    return String.format(messageTemplate, args);
  }
}
