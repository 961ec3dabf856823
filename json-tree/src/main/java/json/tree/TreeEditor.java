package json.tree;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Structural edits on container nodes.
///
/// Every operation validates its arguments and performs every allocation it
/// needs before touching a sibling list, so a failure leaves the tree exactly
/// as it was. Nodes are addressed by index, by key or by identity from the
/// container that holds them.
final class TreeEditor {

    private static final Logger LOG = Logger.getLogger(TreeEditor.class.getName());

    private final NodeFactory nodes;

    TreeEditor(NodeFactory nodes) {
        this.nodes = nodes;
    }

    // ========== Array operations ==========

    int arraySize(JsonNode array) {
        array.requireType(JsonType.ARRAY);
        int size = 0;
        for (var c = array.child; c != null; c = c.next) {
            size++;
        }
        return size;
    }

    JsonNode arrayItem(JsonNode array, int index) {
        array.requireType(JsonType.ARRAY);
        return itemAt(array, index);
    }

    void addToArray(JsonNode array, JsonNode item) {
        array.requireType(JsonType.ARRAY);
        requireLinkable(array, item);
        nodes.clearKey(item);
        linkLast(array, item);
    }

    void insertInArray(JsonNode array, int index, JsonNode item) {
        array.requireType(JsonType.ARRAY);
        final var at = itemAt(array, index);
        requireLinkable(array, item);
        nodes.clearKey(item);
        linkBefore(array, at, item);
    }

    void replaceInArray(JsonNode array, int index, JsonNode replacement) {
        array.requireType(JsonType.ARRAY);
        final var old = itemAt(array, index);
        requireLinkable(array, replacement);
        nodes.clearKey(replacement);
        swap(array, old, replacement);
        nodes.deleteSubtree(old);
    }

    JsonNode detachFromArray(JsonNode array, int index) {
        array.requireType(JsonType.ARRAY);
        final var item = itemAt(array, index);
        requireWritable(array);
        return detach(array, item);
    }

    // ========== Object operations ==========

    Optional<JsonNode> objectItem(JsonNode object, String key, boolean caseSensitive) {
        object.requireType(JsonType.OBJECT);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TreeComparator.findMember(object, key, caseSensitive));
    }

    /// Links `item` at the end of `object` under `key`.
    /// @param constKey if true the key is borrowed and not charged to the allocator
    void addToObject(JsonNode object, String key, JsonNode item, boolean constKey) {
        object.requireType(JsonType.OBJECT);
        requireKey(key);
        requireLinkable(object, item);
        final String newKey = constKey ? key : nodes.ownString(key);
        nodes.clearKey(item);
        item.key = newKey;
        item.keyConst = constKey;
        linkLast(object, item);
    }

    boolean replaceInObject(JsonNode object, String key, JsonNode replacement, boolean caseSensitive) {
        object.requireType(JsonType.OBJECT);
        requireKey(key);
        final var old = TreeComparator.findMember(object, key, caseSensitive);
        if (old == null) {
            LOG.finer(() -> "No member '" + key + "' to replace");
            return false;
        }
        requireLinkable(object, replacement);
        final String newKey = nodes.ownString(key);
        nodes.clearKey(replacement);
        replacement.key = newKey;
        replacement.keyConst = false;
        swap(object, old, replacement);
        nodes.deleteSubtree(old);
        return true;
    }

    Optional<JsonNode> detachFromObject(JsonNode object, String key, boolean caseSensitive) {
        object.requireType(JsonType.OBJECT);
        requireKey(key);
        final var item = TreeComparator.findMember(object, key, caseSensitive);
        if (item == null) {
            return Optional.empty();
        }
        requireWritable(object);
        return Optional.of(detach(object, item));
    }

    // ========== Identity operations ==========

    /// Unlinks `item` from `parent`, found by identity.
    JsonNode detachViaPointer(JsonNode parent, JsonNode item) {
        requireContainer(parent);
        requireChild(parent, item);
        requireWritable(parent);
        return detach(parent, item);
    }

    /// Puts `replacement` where `item` stands in `parent` and deletes `item`.
    /// In an object the replacement takes over the replaced member's key.
    void replaceViaPointer(JsonNode parent, JsonNode item, JsonNode replacement) {
        requireContainer(parent);
        requireChild(parent, item);
        if (item == replacement) {
            return;
        }
        requireLinkable(parent, replacement);
        nodes.clearKey(replacement);
        if (parent.type == JsonType.OBJECT) {
            replacement.key = item.key;
            replacement.keyConst = item.keyConst;
            item.key = null;
            item.keyConst = false;
        }
        swap(parent, item, replacement);
        nodes.deleteSubtree(item);
    }

    // ========== Linkage ==========

    private JsonNode detach(JsonNode parent, JsonNode item) {
        if (item.prev == null) {
            parent.child = item.next;
        } else {
            item.prev.next = item.next;
        }
        if (item.next != null) {
            item.next.prev = item.prev;
        }
        item.next = null;
        item.prev = null;
        item.linked = false;
        nodes.clearKey(item);
        return item;
    }

    private static void linkLast(JsonNode container, JsonNode item) {
        item.next = null;
        if (container.child == null) {
            container.child = item;
            item.prev = null;
        } else {
            var tail = container.child;
            while (tail.next != null) {
                tail = tail.next;
            }
            tail.next = item;
            item.prev = tail;
        }
        item.linked = true;
    }

    private static void linkBefore(JsonNode container, JsonNode at, JsonNode item) {
        item.next = at;
        item.prev = at.prev;
        if (at.prev == null) {
            container.child = item;
        } else {
            at.prev.next = item;
        }
        at.prev = item;
        item.linked = true;
    }

    private static void swap(JsonNode container, JsonNode old, JsonNode replacement) {
        replacement.next = old.next;
        replacement.prev = old.prev;
        if (old.next != null) {
            old.next.prev = replacement;
        }
        if (old.prev == null) {
            container.child = replacement;
        } else {
            old.prev.next = replacement;
        }
        replacement.linked = true;
        old.next = null;
        old.prev = null;
        old.linked = false;
    }

    // ========== Validation ==========

    private static JsonNode itemAt(JsonNode array, int index) {
        if (index >= 0) {
            int i = 0;
            for (var c = array.child; c != null; c = c.next) {
                if (i++ == index) {
                    return c;
                }
            }
        }
        int size = 0;
        for (var c = array.child; c != null; c = c.next) {
            size++;
        }
        throw new JsonIndexException(index, size);
    }

    private static void requireContainer(JsonNode node) {
        if (!node.type.isContainer()) {
            throw new JsonTypeMismatchException(node.type, JsonType.ARRAY, JsonType.OBJECT);
        }
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
    }

    private static void requireChild(JsonNode parent, JsonNode item) {
        for (var c = parent.child; c != null; c = c.next) {
            if (c == item) {
                return;
            }
        }
        throw new JsonLinkageException("Node is not a child of the given parent");
    }

    static void requireWritable(JsonNode container) {
        if (container.released) {
            throw new JsonLinkageException("Container has been deleted");
        }
        if (container.reference) {
            throw new JsonLinkageException("Cannot edit the children of a reference node");
        }
    }

    /// Checks that `item` may become a child of `container`: both are live,
    /// the item is not already linked, and linking would not form a cycle.
    static void requireLinkable(JsonNode container, JsonNode item) {
        requireWritable(container);
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        if (item.released) {
            throw new JsonLinkageException("Node has been deleted");
        }
        if (item.linked) {
            throw new JsonLinkageException("Node is already a member of a container; detach it first");
        }
        if (reachable(item, container)) {
            throw new JsonLinkageException("Adding the node would make the tree contain itself");
        }
    }

    /// {@return true if `target`, or the child list it owns, can be reached from `from`}
    /// Sharing the list counts because a reference to `target` prints its members.
    private static boolean reachable(JsonNode from, JsonNode target) {
        final Set<JsonNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        final var pending = new ArrayDeque<JsonNode>();
        pending.push(from);
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            if (!seen.add(node)) {
                continue;
            }
            if (node == target || (target.child != null && node.child == target.child)) {
                return true;
            }
            for (var c = node.child; c != null; c = c.next) {
                pending.push(c);
            }
        }
        return false;
    }
}
