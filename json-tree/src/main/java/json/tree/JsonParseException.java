package json.tree;

/// Exception thrown when JSON text cannot be parsed.
/// Carries the byte offset of the failure point so that callers can report
/// or retry; the same offset is kept by {@link JsonEngine#lastParseErrorOffset()}.
public class JsonParseException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    /// Creates a new parse exception with the given message and no position.
    public JsonParseException(String message) {
        super(message);
        this.offset = -1;
    }

    /// Creates a new parse exception with position information.
    /// @param message what went wrong
    /// @param input the buffer being parsed, used only to quote the failing byte
    /// @param length the number of bytes of `input` that were in scope
    /// @param offset the byte offset of the failure
    public JsonParseException(String message, byte[] input, int length, int offset) {
        super(formatMessage(message, input, length, offset));
        this.offset = offset;
    }

    /// Returns the byte offset where parsing failed, or -1 if unknown.
    public int offset() {
        return offset;
    }

    static String formatMessage(String message, byte[] input, int length, int offset) {
        if (input == null || offset < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(offset);
        if (offset < length) {
            final int b = input[offset] & 0xFF;
            if (b >= 0x20 && b < 0x7F) {
                sb.append(" (near '").append((char) b).append("')");
            } else {
                sb.append(" (near byte 0x").append(String.format("%02X", b)).append(')');
            }
        } else {
            sb.append(" (end of input)");
        }
        return sb.toString();
    }
}
