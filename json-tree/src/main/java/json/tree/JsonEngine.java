package json.tree;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Entry point for parsing, building, editing, comparing, duplicating and
/// printing mutable JSON trees.
///
/// An engine is built from a {@link JsonConfig}; every node, owned string and
/// print buffer it creates is charged to that configuration's
/// {@link JsonAllocator}. Engines hold no tree state, so trees created by
/// different engines are independent.
///
/// ## Example Usage
/// ```java
/// JsonEngine json = JsonEngine.create();
/// JsonNode root = json.parse("{\"a\":1,\"b\":[true,false,null]}");
/// json.addItemToArray(json.getObjectItem(root, "b").orElseThrow(), json.createNumber(2));
/// String text = json.printUnformatted(root); // {"a":1,"b":[true,false,null,2]}
/// json.delete(root);
/// ```
///
/// ## Errors
/// Failures are reported with subclasses of {@link JsonTreeException}. An
/// editing, comparing or duplicating operation that fails leaves every
/// existing tree exactly as it was.
///
/// ## Threads
/// Parsing and printing different trees from different threads is safe.
/// A single tree must not be mutated, or printed while being mutated, from
/// more than one thread at a time; the engine does no locking.
public final class JsonEngine {

    private static final Logger LOG = Logger.getLogger(JsonEngine.class.getName());

    /// The version of this engine as `major.minor.patch`.
    public static final String VERSION = "0.1.0";

    private final JsonConfig config;
    private final NodeFactory nodes;
    private final TreeEditor editor;
    private final TreeDuplicator duplicator;

    private volatile int lastErrorOffset = -1;

    private JsonEngine(JsonConfig config) {
        this.config = config;
        this.nodes = new NodeFactory(config.allocator());
        this.editor = new TreeEditor(nodes);
        this.duplicator = new TreeDuplicator(nodes, config.circularLimit());
    }

    /// {@return an engine with the default configuration}
    public static JsonEngine create() {
        return new JsonEngine(JsonConfig.defaults());
    }

    /// {@return an engine using the given configuration}
    public static JsonEngine create(JsonConfig config) {
        Objects.requireNonNull(config);
        LOG.fine(() -> "Creating engine with " + config);
        return new JsonEngine(config);
    }

    public JsonConfig config() {
        return config;
    }

    // ========== Parsing ==========

    /// Parses a whole JSON document; only whitespace may follow the value.
    /// @throws JsonParseException if the text is not valid JSON
    /// @throws JsonNestingLimitException if containers nest deeper than the limit
    public JsonNode parse(String json) {
        Objects.requireNonNull(json);
        final byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        return parseWithOptions(bytes, bytes.length, true).root();
    }

    /// Parses a whole UTF-8 JSON document; only whitespace may follow the value.
    public JsonNode parse(byte[] json) {
        Objects.requireNonNull(json);
        return parseWithOptions(json, json.length, true).root();
    }

    /// Parses one value from the first `length` bytes of `json`.
    /// Bytes after the value are ignored, as is everything past `length`.
    public JsonNode parseWithLength(byte[] json, int length) {
        return parseWithOptions(json, length, false).root();
    }

    /// Parses one value from the first `length` UTF-8 bytes of `json`.
    public JsonNode parseWithLength(String json, int length) {
        Objects.requireNonNull(json);
        return parseWithLength(json.getBytes(StandardCharsets.UTF_8), length);
    }

    /// Parses one value from the first `length` bytes of `json`.
    ///
    /// @param requireEnd if true, only whitespace may follow the value within `length`
    /// @return the tree and the offset just past the value
    /// @throws IndexOutOfBoundsException if `length` is outside the buffer
    public JsonParseResult parseWithOptions(byte[] json, int length, boolean requireEnd) {
        Objects.requireNonNull(json);
        Objects.checkFromToIndex(0, length, json.length);
        lastErrorOffset = -1;
        final var parser = new JsonTreeParser(json, length, nodes, config.nestingLimit());
        try {
            return parser.parse(requireEnd);
        } catch (JsonTreeException ex) {
            lastErrorOffset = parser.position();
            throw ex;
        }
    }

    /// {@return the byte offset where the most recent failed parse stopped}
    /// Empty if the most recent parse succeeded or none has run.
    public OptionalInt lastParseErrorOffset() {
        final int offset = lastErrorOffset;
        return offset < 0 ? OptionalInt.empty() : OptionalInt.of(offset);
    }

    // ========== Printing ==========

    /// {@return formatted JSON text for `node`}
    public String print(JsonNode node) {
        return printBuffered(node, config.printBufferSize(), true);
    }

    /// {@return JSON text for `node` with no inserted whitespace}
    public String printUnformatted(JsonNode node) {
        return printBuffered(node, config.printBufferSize(), false);
    }

    /// Prints with an auto-growing buffer whose initial capacity is `prebuffer`.
    /// A good estimate avoids regrowth; the output is the same either way.
    public String printBuffered(JsonNode node, int prebuffer, boolean formatted) {
        Objects.requireNonNull(node);
        if (prebuffer < 1) {
            throw new IllegalArgumentException("prebuffer must be positive: " + prebuffer);
        }
        return JsonPrinter.printBuffered(node, prebuffer, formatted, nodes, config.circularLimit());
    }

    /// Prints UTF-8 text into the caller's buffer without ever growing it.
    ///
    /// @return the number of bytes written
    /// @throws JsonBufferTooSmallException if the output does not fit; the
    ///         buffer contents are then unspecified
    public int printPreallocated(JsonNode node, byte[] buffer, boolean formatted) {
        Objects.requireNonNull(node);
        Objects.requireNonNull(buffer);
        return JsonPrinter.printPreallocated(node, buffer, buffer.length, formatted, config.circularLimit());
    }

    // ========== Creating ==========

    public JsonNode createNull() {
        return nodes.node(JsonType.NULL);
    }

    public JsonNode createTrue() {
        return createBool(true);
    }

    public JsonNode createFalse() {
        return createBool(false);
    }

    public JsonNode createBool(boolean value) {
        final var node = nodes.node(JsonType.BOOL);
        node.bool = value;
        return node;
    }

    public JsonNode createNumber(double value) {
        final var node = nodes.node(JsonType.NUMBER);
        node.number = value;
        return node;
    }

    /// {@return a string node owning a copy of `value`}
    public JsonNode createString(String value) {
        Objects.requireNonNull(value);
        return nodes.textNode(JsonType.STRING, value);
    }

    /// {@return a node whose `json` text is printed verbatim}
    /// The text is not checked; the caller is responsible for it being valid JSON.
    public JsonNode createRaw(String json) {
        Objects.requireNonNull(json);
        return nodes.textNode(JsonType.RAW, json);
    }

    public JsonNode createArray() {
        return nodes.node(JsonType.ARRAY);
    }

    public JsonNode createObject() {
        return nodes.node(JsonType.OBJECT);
    }

    /// {@return a string node that borrows `value` instead of owning it}
    public JsonNode createStringReference(String value) {
        Objects.requireNonNull(value);
        final var node = nodes.node(JsonType.STRING);
        node.string = value;
        node.reference = true;
        return node;
    }

    /// {@return an array node sharing the members of `array` without owning them}
    /// The reference sees the members `array` has now; it is not updated if
    /// `array` is later emptied or gains a first member.
    public JsonNode createArrayReference(JsonNode array) {
        array.requireType(JsonType.ARRAY);
        return reference(array);
    }

    /// {@return an object node sharing the members of `object` without owning them}
    public JsonNode createObjectReference(JsonNode object) {
        object.requireType(JsonType.OBJECT);
        return reference(object);
    }

    public JsonNode createIntArray(int... values) {
        Objects.requireNonNull(values);
        final var array = createArray();
        try {
            for (int value : values) {
                editor.addToArray(array, createNumber(value));
            }
        } catch (JsonTreeException ex) {
            nodes.deleteSubtree(array);
            throw ex;
        }
        return array;
    }

    public JsonNode createFloatArray(float... values) {
        Objects.requireNonNull(values);
        final var array = createArray();
        try {
            for (float value : values) {
                editor.addToArray(array, createNumber(value));
            }
        } catch (JsonTreeException ex) {
            nodes.deleteSubtree(array);
            throw ex;
        }
        return array;
    }

    public JsonNode createDoubleArray(double... values) {
        Objects.requireNonNull(values);
        final var array = createArray();
        try {
            for (double value : values) {
                editor.addToArray(array, createNumber(value));
            }
        } catch (JsonTreeException ex) {
            nodes.deleteSubtree(array);
            throw ex;
        }
        return array;
    }

    public JsonNode createStringArray(String... values) {
        Objects.requireNonNull(values);
        final var array = createArray();
        try {
            for (String value : values) {
                editor.addToArray(array, createString(value));
            }
        } catch (JsonTreeException | NullPointerException ex) {
            nodes.deleteSubtree(array);
            throw ex;
        }
        return array;
    }

    private JsonNode reference(JsonNode target) {
        if (target.released) {
            throw new JsonLinkageException("Node has been deleted");
        }
        final var node = nodes.node(target.type);
        node.bool = target.bool;
        node.number = target.number;
        node.string = target.string;
        node.child = target.child;
        node.reference = true;
        return node;
    }

    // ========== Values ==========

    /// Sets the value of a number node; {@link JsonNode#intValue()} follows it.
    /// @return the new value
    public double setNumberValue(JsonNode node, double value) {
        node.requireType(JsonType.NUMBER);
        node.number = value;
        return value;
    }

    /// Replaces the text of a string node that owns its text.
    /// @return the new value
    /// @throws JsonLinkageException if the node is a reference and does not own its text
    public String setStringValue(JsonNode node, String value) {
        Objects.requireNonNull(value);
        node.requireType(JsonType.STRING);
        if (node.reference) {
            throw new JsonLinkageException("Cannot change the text of a string reference");
        }
        final String owned = nodes.ownString(value);
        nodes.releaseString(node.string);
        node.string = owned;
        return value;
    }

    /// Sets the value of a bool node.
    /// @return the new value
    public boolean setBoolValue(JsonNode node, boolean value) {
        node.requireType(JsonType.BOOL);
        node.bool = value;
        return value;
    }

    // ========== Arrays ==========

    /// {@return the number of members of `array`}
    public int getArraySize(JsonNode array) {
        return editor.arraySize(array);
    }

    /// {@return the member at `index`}
    /// @throws JsonIndexException if `index` is outside `[0, size)`
    public JsonNode getArrayItem(JsonNode array, int index) {
        return editor.arrayItem(array, index);
    }

    /// Appends `item` to `array`. An item coming from an object loses its key.
    /// @throws JsonLinkageException if `item` already belongs to a container
    public void addItemToArray(JsonNode array, JsonNode item) {
        editor.addToArray(array, item);
    }

    /// Appends a new reference to `item`, leaving `item` where it is.
    public void addItemReferenceToArray(JsonNode array, JsonNode item) {
        array.requireType(JsonType.ARRAY);
        TreeEditor.requireWritable(array);
        final var ref = reference(item);
        try {
            editor.addToArray(array, ref);
        } catch (JsonTreeException ex) {
            nodes.deleteSubtree(ref);
            throw ex;
        }
    }

    /// Inserts `item` before the member currently at `index`.
    /// @throws JsonIndexException if `index` is outside `[0, size)`
    public void insertItemInArray(JsonNode array, int index, JsonNode item) {
        editor.insertInArray(array, index, item);
    }

    /// Replaces the member at `index` with `replacement` and deletes the old member.
    public void replaceItemInArray(JsonNode array, int index, JsonNode replacement) {
        editor.replaceInArray(array, index, replacement);
    }

    /// Unlinks and returns the member at `index`; the caller now owns it.
    public JsonNode detachItemFromArray(JsonNode array, int index) {
        return editor.detachFromArray(array, index);
    }

    /// Unlinks and deletes the member at `index`.
    public void deleteItemFromArray(JsonNode array, int index) {
        nodes.deleteSubtree(editor.detachFromArray(array, index));
    }

    // ========== Objects ==========

    /// {@return true if `object` has a member whose key equals `key` exactly}
    public boolean hasObjectItem(JsonNode object, String key) {
        return editor.objectItem(object, key, true).isPresent();
    }

    /// {@return the first member whose key equals `key` exactly}
    public Optional<JsonNode> getObjectItem(JsonNode object, String key) {
        return editor.objectItem(object, key, true);
    }

    /// {@return the first member whose key equals `key` ignoring ASCII case}
    public Optional<JsonNode> getObjectItemIgnoreCase(JsonNode object, String key) {
        return editor.objectItem(object, key, false);
    }

    /// Appends `item` to `object` under a copy of `key`.
    /// Duplicate keys are not checked; lookups find the first.
    public void addItemToObject(JsonNode object, String key, JsonNode item) {
        editor.addToObject(object, key, item, false);
    }

    /// Appends `item` to `object` under `key` borrowed rather than copied.
    public void addItemToObjectCS(JsonNode object, String key, JsonNode item) {
        editor.addToObject(object, key, item, true);
    }

    /// Appends a new reference to `item` under `key`, leaving `item` where it is.
    public void addItemReferenceToObject(JsonNode object, String key, JsonNode item) {
        object.requireType(JsonType.OBJECT);
        TreeEditor.requireWritable(object);
        final var ref = reference(item);
        try {
            editor.addToObject(object, key, ref, false);
        } catch (RuntimeException ex) {
            nodes.deleteSubtree(ref);
            throw ex;
        }
    }

    public JsonNode addNullToObject(JsonNode object, String key) {
        return addCreated(object, key, createNull());
    }

    public JsonNode addTrueToObject(JsonNode object, String key) {
        return addCreated(object, key, createTrue());
    }

    public JsonNode addFalseToObject(JsonNode object, String key) {
        return addCreated(object, key, createFalse());
    }

    public JsonNode addBoolToObject(JsonNode object, String key, boolean value) {
        return addCreated(object, key, createBool(value));
    }

    public JsonNode addNumberToObject(JsonNode object, String key, double value) {
        return addCreated(object, key, createNumber(value));
    }

    public JsonNode addStringToObject(JsonNode object, String key, String value) {
        return addCreated(object, key, createString(value));
    }

    public JsonNode addRawToObject(JsonNode object, String key, String json) {
        return addCreated(object, key, createRaw(json));
    }

    public JsonNode addObjectToObject(JsonNode object, String key) {
        return addCreated(object, key, createObject());
    }

    public JsonNode addArrayToObject(JsonNode object, String key) {
        return addCreated(object, key, createArray());
    }

    private JsonNode addCreated(JsonNode object, String key, JsonNode item) {
        try {
            editor.addToObject(object, key, item, false);
            return item;
        } catch (RuntimeException ex) {
            nodes.deleteSubtree(item);
            throw ex;
        }
    }

    /// Replaces the first member keyed exactly `key` and deletes the old member.
    /// @return false if there is no such member; `replacement` then stays with the caller
    public boolean replaceItemInObject(JsonNode object, String key, JsonNode replacement) {
        return editor.replaceInObject(object, key, replacement, true);
    }

    /// Replaces the first member keyed `key` ignoring ASCII case; the
    /// replacement is stored under `key` as given.
    public boolean replaceItemInObjectIgnoreCase(JsonNode object, String key, JsonNode replacement) {
        return editor.replaceInObject(object, key, replacement, false);
    }

    /// Unlinks and returns the first member keyed exactly `key`; the caller
    /// now owns it. The detached node no longer carries a key.
    public Optional<JsonNode> detachItemFromObject(JsonNode object, String key) {
        return editor.detachFromObject(object, key, true);
    }

    public Optional<JsonNode> detachItemFromObjectIgnoreCase(JsonNode object, String key) {
        return editor.detachFromObject(object, key, false);
    }

    /// Unlinks and deletes the first member keyed exactly `key`.
    /// @return false if there is no such member
    public boolean deleteItemFromObject(JsonNode object, String key) {
        return editor.detachFromObject(object, key, true).map(this::deleteDetached).isPresent();
    }

    public boolean deleteItemFromObjectIgnoreCase(JsonNode object, String key) {
        return editor.detachFromObject(object, key, false).map(this::deleteDetached).isPresent();
    }

    private JsonNode deleteDetached(JsonNode node) {
        nodes.deleteSubtree(node);
        return node;
    }

    // ========== Identity ==========

    /// Unlinks `item`, which must be a direct member of `parent`, and returns it.
    /// @throws JsonLinkageException if `item` is not a member of `parent`
    public JsonNode detachItemViaPointer(JsonNode parent, JsonNode item) {
        Objects.requireNonNull(item);
        return editor.detachViaPointer(parent, item);
    }

    /// Puts `replacement` in the place of `item`, a direct member of `parent`,
    /// and deletes `item`. In an object `replacement` takes over `item`'s key.
    public void replaceItemViaPointer(JsonNode parent, JsonNode item, JsonNode replacement) {
        Objects.requireNonNull(item);
        Objects.requireNonNull(replacement);
        editor.replaceViaPointer(parent, item, replacement);
    }

    // ========== Compare, duplicate, delete ==========

    /// {@return true if the two trees are structurally equal}
    /// @param caseSensitive whether keys and string values must match in case
    public boolean compare(JsonNode a, JsonNode b, boolean caseSensitive) {
        return TreeComparator.equal(a, b, caseSensitive, config.circularLimit());
    }

    /// {@return a copy of `item` that owns all of its data}
    /// @param recurse if false a container is copied without its members
    public JsonNode duplicate(JsonNode item, boolean recurse) {
        Objects.requireNonNull(item);
        if (item.released) {
            throw new JsonLinkageException("Node has been deleted");
        }
        return duplicator.duplicate(item, recurse);
    }

    /// Deletes a tree that is not linked into any container. Everything the
    /// tree owns is released; data a reference merely borrows is left alone.
    /// @throws JsonLinkageException if `node` is still a member of a container
    ///         or has already been deleted
    public void delete(JsonNode node) {
        Objects.requireNonNull(node);
        if (node.released) {
            throw new JsonLinkageException("Node has already been deleted");
        }
        if (node.linked) {
            throw new JsonLinkageException("Node is still a member of a container; detach it first");
        }
        nodes.deleteSubtree(node);
    }
}
