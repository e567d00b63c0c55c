package json.editor.core;

/// Signals that JSON text does not conform to the RFC 8259 grammar, or that
/// an object in it repeats a member name.
///
/// The failure location is reported as a zero-based character offset and as
/// a one-based line and column.
public class JsonParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int offset;
    private final int line;
    private final int column;

    /// Creates a new parse exception.
    /// @param reason what was wrong at the failure location
    /// @param offset zero-based character offset of the failure
    /// @param line one-based line of the failure
    /// @param column one-based column of the failure
    public JsonParseException(String reason, int offset, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /// {@return the zero-based character offset of the failure}
    public int offset() {
        return offset;
    }

    /// {@return the one-based line of the failure}
    public int line() {
        return line;
    }

    /// {@return the one-based column of the failure}
    public int column() {
        return column;
    }
}
