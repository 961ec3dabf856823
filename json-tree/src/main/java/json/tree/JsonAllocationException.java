package json.tree;

/// Exception thrown when the configured {@link JsonAllocator} refuses an allocation.
public class JsonAllocationException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    private final int requested;

    public JsonAllocationException(int requested) {
        super("Allocator refused request for " + requested + " bytes");
        this.requested = requested;
    }

    /// Returns the size of the refused request in bytes.
    public int requested() {
        return requested;
    }
}
