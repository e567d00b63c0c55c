package json.editor.schema;

/// Checks the lexical shape of a string against a named `format`.
sealed public interface FormatValidator permits Format {
  /// @param s the string to test
  /// @return true if the string has the expected shape
  boolean test(String s);
}
