package json.tree;

/// The outcome of {@link JsonEngine#parseWithOptions(byte[], int, boolean)}.
///
/// @param root the parsed tree
/// @param end byte offset just past the parsed value; with `requireEnd` set it
///            also covers trailing whitespace and equals the input length
public record JsonParseResult(JsonNode root, int end) {
}
