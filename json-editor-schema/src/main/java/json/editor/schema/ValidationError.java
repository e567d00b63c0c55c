package json.editor.schema;

import json.editor.core.NodePath;

import java.util.Objects;

/// One validation finding.
///
/// @param path where the finding applies; for a missing or extra member this
///             is the path of the containing object
/// @param message human-readable text
/// @param severity whether the finding blocks saving
/// @param code the kind of finding
public record ValidationError(NodePath path, String message, Severity severity, ErrorCode code) {

  public ValidationError {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(code, "code");
  }

  /// {@return a finding of kind `code` at its default severity}
  public static ValidationError of(ErrorCode code, NodePath path, Object... args) {
    return new ValidationError(path, code.message(args), code.severity(), code);
  }

  /// {@return the dotted path, or `(root)` for the root}
  public String pathString() {
    return path.toString();
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }
}
