package json.tree;

import java.util.ArrayDeque;
import java.util.logging.Logger;

/// Creates and releases nodes and owned strings, charging every allocation
/// to the configured {@link JsonAllocator}.
final class NodeFactory {

    private static final Logger LOG = Logger.getLogger(NodeFactory.class.getName());

    /// Bytes charged for one node, whatever its payload.
    static final int NODE_BYTES = 64;

    private final JsonAllocator allocator;

    NodeFactory(JsonAllocator allocator) {
        this.allocator = allocator;
    }

    JsonAllocator allocator() {
        return allocator;
    }

    JsonNode node(JsonType type) {
        claim(NODE_BYTES);
        return new JsonNode(type);
    }

    /// Creates a node that owns `text` as its string payload.
    JsonNode textNode(JsonType type, String text) {
        final var node = node(type);
        try {
            node.string = ownString(text);
        } catch (JsonAllocationException ex) {
            allocator.release(NODE_BYTES);
            throw ex;
        }
        return node;
    }

    String ownString(String text) {
        claim(sizeOf(text));
        return text;
    }

    void releaseString(String text) {
        allocator.release(sizeOf(text));
    }

    void claim(int bytes) {
        if (!allocator.allocate(bytes)) {
            LOG.fine(() -> "Allocation of " + bytes + " bytes refused by " + allocator);
            throw new JsonAllocationException(bytes);
        }
    }

    /// Releases a node and, unless it is a reference, everything it owns.
    /// Iterative so that deep trees cannot exhaust the stack.
    void deleteSubtree(JsonNode root) {
        final var pending = new ArrayDeque<JsonNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            if (!node.reference) {
                for (var c = node.child; c != null; c = c.next) {
                    pending.push(c);
                }
                if (node.string != null) {
                    releaseString(node.string);
                }
            }
            if (node.key != null && !node.keyConst) {
                releaseString(node.key);
            }
            node.child = null;
            node.next = null;
            node.prev = null;
            node.key = null;
            node.string = null;
            node.linked = false;
            node.released = true;
            allocator.release(NODE_BYTES);
        }
    }

    /// Drops the key of a node, giving back its storage if the node owned it.
    void clearKey(JsonNode node) {
        if (node.key != null && !node.keyConst) {
            releaseString(node.key);
        }
        node.key = null;
        node.keyConst = false;
    }

    /// {@return the bytes charged for a string: its UTF-8 length plus a terminator}
    static int sizeOf(String text) {
        int size = 1;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < 0x80) {
                size += 1;
            } else if (c < 0x800) {
                size += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                size += 4;
                i++;
            } else {
                size += 3;
            }
        }
        return size;
    }
}
