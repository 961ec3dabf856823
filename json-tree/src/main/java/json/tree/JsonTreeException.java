package json.tree;

/// Base class of every failure reported by the JSON tree engine.
///
/// All failures are unchecked: malformed input, a wrong node type or a
/// too-small buffer are caller errors that the caller can retry with
/// different input, never conditions that abort the process.
public abstract class JsonTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected JsonTreeException(String message) {
        super(message);
    }

    protected JsonTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
