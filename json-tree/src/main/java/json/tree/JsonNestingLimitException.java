package json.tree;

/// Exception thrown when a tree is nested deeper than the configured limit.
///
/// The parser raises it when input nests containers beyond
/// {@link JsonConfig#nestingLimit()}; duplicate, compare and print raise it
/// when their walk passes {@link JsonConfig#circularLimit()} on a very deep
/// hand-built tree.
public class JsonNestingLimitException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    private final int limit;
    private final int offset;

    public JsonNestingLimitException(int limit, int offset) {
        super(offset < 0
                ? "Nesting depth exceeds limit of " + limit
                : "Nesting depth exceeds limit of " + limit + " at position " + offset);
        this.limit = limit;
        this.offset = offset;
    }

    /// Returns the limit that was exceeded.
    public int limit() {
        return limit;
    }

    /// Returns the byte offset where parsing tripped the limit, or -1 outside parsing.
    public int offset() {
        return offset;
    }
}
