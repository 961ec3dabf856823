package json.tree;

import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/// Output buffer for {@link JsonPrinter}.
///
/// A growable buffer doubles its capacity whenever a write would overflow,
/// charging each new array to the allocator and giving back the old one.
/// A fixed buffer wraps caller-owned storage and fails instead of growing.
final class PrintBuffer {

    private static final Logger LOG = Logger.getLogger(PrintBuffer.class.getName());

    private final NodeFactory nodes;
    private final boolean fixed;
    private final int capacityLimit;
    private final boolean formatted;
    private byte[] buffer;
    private int offset;

    private PrintBuffer(byte[] buffer, int capacityLimit, NodeFactory nodes, boolean fixed, boolean formatted) {
        this.buffer = buffer;
        this.capacityLimit = capacityLimit;
        this.nodes = nodes;
        this.fixed = fixed;
        this.formatted = formatted;
    }

    static PrintBuffer growable(int initialCapacity, NodeFactory nodes, boolean formatted) {
        nodes.claim(initialCapacity);
        return new PrintBuffer(new byte[initialCapacity], Integer.MAX_VALUE, nodes, false, formatted);
    }

    static PrintBuffer fixed(byte[] target, int capacity, boolean formatted) {
        return new PrintBuffer(target, capacity, null, true, formatted);
    }

    void append(byte b) {
        ensure(1);
        buffer[offset++] = b;
    }

    void append(byte[] bytes) {
        ensure(bytes.length);
        System.arraycopy(bytes, 0, buffer, offset, bytes.length);
        offset += bytes.length;
    }

    void appendAscii(String ascii) {
        ensure(ascii.length());
        for (int i = 0; i < ascii.length(); i++) {
            buffer[offset++] = (byte) ascii.charAt(i);
        }
    }

    void appendRepeated(byte b, int count) {
        ensure(count);
        for (int i = 0; i < count; i++) {
            buffer[offset++] = b;
        }
    }

    int length() {
        return offset;
    }

    String asString() {
        return new String(buffer, 0, offset, StandardCharsets.UTF_8);
    }

    /// Gives a growable buffer's storage back to the allocator.
    void release() {
        if (!fixed && buffer != null) {
            nodes.allocator().release(buffer.length);
            buffer = null;
        }
    }

    private void ensure(int needed) {
        final long required = (long) offset + needed;
        final int capacity = fixed ? capacityLimit : buffer.length;
        if (required <= capacity) {
            return;
        }
        if (fixed) {
            throw new JsonBufferTooSmallException(capacityLimit, formatted);
        }
        if (required > Integer.MAX_VALUE - 8) {
            throw new JsonAllocationException(Integer.MAX_VALUE);
        }
        long newSize = buffer.length;
        while (newSize < required) {
            newSize *= 2;
        }
        final int grown = (int) Math.min(newSize, Integer.MAX_VALUE - 8);
        nodes.claim(grown);
        final byte[] replacement = new byte[grown];
        System.arraycopy(buffer, 0, replacement, 0, offset);
        nodes.allocator().release(buffer.length);
        LOG.finer(() -> "Print buffer grown from " + buffer.length + " to " + grown);
        buffer = replacement;
    }
}
