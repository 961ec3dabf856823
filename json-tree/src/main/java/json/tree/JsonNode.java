package json.tree;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/// One value in a mutable JSON tree.
///
/// A node is a tagged value: {@link #type()} says which payload is meaningful.
/// Container nodes ({@link JsonType#ARRAY}, {@link JsonType#OBJECT}) hold their
/// members as a doubly linked sibling list starting at {@link #firstChild()};
/// every member of an object carries a {@link #key()}.
///
/// Nodes are created and linked by a {@link JsonEngine}. There is no parent
/// pointer: edits are always addressed from the container that holds the node.
///
/// A *reference* node ({@link #isReference()}) shares the string payload or the
/// child list of another node without owning it; deleting a reference frees
/// only the reference itself. References are always fresh nodes built by the
/// `create*Reference` methods, never an owning node switched over later.
///
/// Nodes are not thread safe. A tree must be mutated by one thread at a time.
public final class JsonNode {

    JsonType type;
    boolean bool;
    double number;
    String string;

    JsonNode child;
    JsonNode next;
    JsonNode prev;

    String key;
    boolean keyConst;
    boolean reference;

    boolean linked;
    boolean released;

    JsonNode(JsonType type) {
        this.type = type;
    }

    /// {@return the type tag of this node}
    public JsonType type() {
        return type;
    }

    public boolean isNull() {
        return type == JsonType.NULL;
    }

    public boolean isBool() {
        return type == JsonType.BOOL;
    }

    public boolean isTrue() {
        return type == JsonType.BOOL && bool;
    }

    public boolean isFalse() {
        return type == JsonType.BOOL && !bool;
    }

    public boolean isNumber() {
        return type == JsonType.NUMBER;
    }

    public boolean isString() {
        return type == JsonType.STRING;
    }

    public boolean isArray() {
        return type == JsonType.ARRAY;
    }

    public boolean isObject() {
        return type == JsonType.OBJECT;
    }

    public boolean isRaw() {
        return type == JsonType.RAW;
    }

    /// {@return the value of a `BOOL` node}
    /// @throws JsonTypeMismatchException if this is not a `BOOL` node
    public boolean booleanValue() {
        requireType(JsonType.BOOL);
        return bool;
    }

    /// {@return the value of a `NUMBER` node}
    /// @throws JsonTypeMismatchException if this is not a `NUMBER` node
    public double numberValue() {
        requireType(JsonType.NUMBER);
        return number;
    }

    /// {@return the value of a `NUMBER` node as an `int`}
    /// Derived from {@link #numberValue()} on every call: values beyond the
    /// `int` range saturate, NaN maps to zero, anything else truncates.
    /// @throws JsonTypeMismatchException if this is not a `NUMBER` node
    public int intValue() {
        return saturate(numberValue());
    }

    /// {@return the text of a `STRING` node}
    /// @throws JsonTypeMismatchException if this is not a `STRING` node
    public String stringValue() {
        requireType(JsonType.STRING);
        return string;
    }

    /// {@return the verbatim JSON text of a `RAW` node}
    /// @throws JsonTypeMismatchException if this is not a `RAW` node
    public String rawValue() {
        requireType(JsonType.RAW);
        return string;
    }

    /// {@return the member name of this node while it belongs to an object}
    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    /// {@return true if the key is borrowed rather than owned by this node}
    public boolean isKeyConst() {
        return keyConst;
    }

    /// {@return true if this node aliases another node's payload without owning it}
    public boolean isReference() {
        return reference;
    }

    /// {@return the first member of a container, empty for an empty container or a scalar}
    public Optional<JsonNode> firstChild() {
        return Optional.ofNullable(child);
    }

    /// {@return the following sibling, empty at the end of the list or when not linked}
    public Optional<JsonNode> next() {
        return Optional.ofNullable(next);
    }

    /// {@return the preceding sibling, empty at the head of the list or when not linked}
    public Optional<JsonNode> prev() {
        return Optional.ofNullable(prev);
    }

    /// {@return the members of this node in sibling order}
    /// The iterable is live: it walks the sibling list as it stands when
    /// iterated, so the tree must not be edited during iteration.
    public Iterable<JsonNode> children() {
        return () -> new Iterator<>() {
            private JsonNode cursor = child;

            @Override
            public boolean hasNext() {
                return cursor != null;
            }

            @Override
            public JsonNode next() {
                if (cursor == null) {
                    throw new NoSuchElementException();
                }
                final var current = cursor;
                cursor = cursor.next;
                return current;
            }
        };
    }

    /// {@return the unformatted JSON text of this node}
    /// Intended for diagnostics; it does not consult any allocator.
    @Override
    public String toString() {
        return JsonPrinter.print(this, false, JsonConfig.defaults());
    }

    void requireType(JsonType expected) {
        if (type != expected) {
            throw new JsonTypeMismatchException(type, expected);
        }
    }

    static int saturate(double value) {
        if (value >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }
}
