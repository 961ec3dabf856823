package json.tree;

/// The type tag of a {@link JsonNode}.
public enum JsonType {
    /// JSON `null`.
    NULL,
    /// JSON `true` or `false`.
    BOOL,
    /// A JSON number held as an IEEE-754 double.
    NUMBER,
    /// A JSON string.
    STRING,
    /// A JSON array; members are the node's children in order.
    ARRAY,
    /// A JSON object; members are the node's children, each carrying a key.
    OBJECT,
    /// Pre-serialized JSON text that the printer emits verbatim.
    /// Never produced by the parser.
    RAW;

    /// {@return true for the two container types}
    public boolean isContainer() {
        return this == ARRAY || this == OBJECT;
    }
}
