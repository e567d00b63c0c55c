package json.editor.schema;

/// How a validation finding affects saving: errors block, warnings do not.
public enum Severity {
  ERROR,
  WARNING
}
