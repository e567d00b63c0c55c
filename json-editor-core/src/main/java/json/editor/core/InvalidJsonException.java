package json.editor.core;

/// Thrown when bytes cannot be loaded as a document: they are not UTF-8, not
/// JSON, or their root value is not an object.
public class InvalidJsonException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public InvalidJsonException(String message) {
        super(message);
    }

    public InvalidJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
