package json.tree;

import java.util.ArrayDeque;

/// Copies trees. A copy always owns its strings, keys and children, whatever
/// the ownership flags of the source: references are copied into real nodes.
///
/// The walk keeps its pending containers on an explicit worklist, so tree
/// depth is bounded by the circular limit and never by the thread's stack.
final class TreeDuplicator {

    private final NodeFactory nodes;
    private final int circularLimit;

    TreeDuplicator(NodeFactory nodes, int circularLimit) {
        this.nodes = nodes;
        this.circularLimit = circularLimit;
    }

    /// A source container whose children still need copying into `copy`.
    private record Pending(JsonNode source, JsonNode copy, int depth) {
    }

    /// The returned root is unlinked, so it carries no key even when `item`
    /// is an object member. Copied members keep their keys.
    /// @param recurse if false, containers are copied empty
    JsonNode duplicate(JsonNode item, boolean recurse) {
        final var root = shell(item, false, 0);
        if (!recurse || item.child == null) {
            return root;
        }
        final var pending = new ArrayDeque<Pending>();
        pending.push(new Pending(item, root, 0));
        try {
            while (!pending.isEmpty()) {
                final var next = pending.pop();
                JsonNode tail = null;
                for (var c = next.source().child; c != null; c = c.next) {
                    final var copy = shell(c, true, next.depth() + 1);
                    if (tail == null) {
                        next.copy().child = copy;
                    } else {
                        tail.next = copy;
                        copy.prev = tail;
                    }
                    copy.linked = true;
                    tail = copy;
                    if (c.child != null) {
                        pending.push(new Pending(c, copy, next.depth() + 1));
                    }
                }
            }
            return root;
        } catch (RuntimeException ex) {
            nodes.deleteSubtree(root);
            throw ex;
        }
    }

    /// Copies the node's own payload, and its key when `withKey`, into a new childless node.
    private JsonNode shell(JsonNode item, boolean withKey, int depth) {
        if (depth > circularLimit) {
            throw new JsonNestingLimitException(circularLimit, -1);
        }
        final var node = nodes.node(item.type);
        try {
            node.bool = item.bool;
            node.number = item.number;
            if (item.string != null) {
                node.string = nodes.ownString(item.string);
            }
            if (withKey && item.key != null) {
                node.key = nodes.ownString(item.key);
            }
            return node;
        } catch (RuntimeException ex) {
            nodes.deleteSubtree(node);
            throw ex;
        }
    }
}
