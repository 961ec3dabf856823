package json.tree;

/// Exception thrown when printing into a caller-supplied fixed buffer cannot fit the output.
/// Nothing written into the buffer before the failure should be relied upon.
public class JsonBufferTooSmallException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final boolean formatted;

    public JsonBufferTooSmallException(int capacity, boolean formatted) {
        super("Preallocated buffer of " + capacity + " bytes is too small for "
                + (formatted ? "formatted" : "unformatted") + " output");
        this.capacity = capacity;
        this.formatted = formatted;
    }

    /// Returns the capacity of the buffer that overflowed.
    public int capacity() {
        return capacity;
    }

    /// Returns true if the failing print was in formatted mode.
    public boolean formatted() {
        return formatted;
    }
}
