package json.tree;

/// Exception thrown when an array index lies outside `[0, size)`.
public class JsonIndexException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final int size;

    public JsonIndexException(int index, int size) {
        super("Array index %d out of bounds for length %d".formatted(index, size));
        this.index = index;
        this.size = size;
    }

    public int index() {
        return index;
    }

    public int size() {
        return size;
    }
}
