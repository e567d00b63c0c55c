package json.editor.schema;

/// Thrown when schema text is not JSON, is not an object, or uses a keyword
/// with a value of the wrong shape.
public class SchemaParseException extends RuntimeException {

  private final String pointer;

  public SchemaParseException(String pointer, String message) {
    super("Invalid schema at " + pointer + ": " + message);
    this.pointer = pointer;
  }

  public SchemaParseException(String message, Throwable cause) {
    super(message, cause);
    this.pointer = "#";
  }

  /// {@return the JSON pointer of the offending schema, e.g. `#/properties/age`}
  public String pointer() {
    return pointer;
  }
}
