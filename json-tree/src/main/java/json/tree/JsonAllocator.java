package json.tree;

/// Allocation hook consulted for every node, owned string and print buffer
/// the engine creates.
///
/// The JVM owns the memory itself; an allocator decides whether a request
/// may proceed and is told when the engine gives the space back. Returning
/// `false` from {@link #allocate(int)} makes the operation fail with a
/// {@link JsonAllocationException} and leaves any existing tree untouched.
///
/// An allocator is installed once through {@link JsonConfig} when a
/// {@link JsonEngine} is built and must not be swapped while trees created by
/// that engine are alive.
public interface JsonAllocator {

    /// Requests `bytes` bytes.
    /// @return true if the allocation may proceed
    boolean allocate(int bytes);

    /// Returns `bytes` bytes previously granted by {@link #allocate(int)}.
    void release(int bytes);

    /// {@return an allocator that grants every request}
    static JsonAllocator unbounded() {
        return UnboundedAllocator.INSTANCE;
    }
}

enum UnboundedAllocator implements JsonAllocator {
    INSTANCE;

    @Override
    public boolean allocate(int bytes) {
        return true;
    }

    @Override
    public void release(int bytes) {
    }

    @Override
    public String toString() {
        return "UnboundedAllocator";
    }
}
