package json.tree;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Strips insignificant whitespace from JSON text without building a tree.
///
/// A single pass over the lexical rules only: space, tab, carriage return and
/// line feed are dropped outside string literals, and string literals are
/// copied byte for byte with their escapes intact, so an escaped quote never
/// ends a string early. The input is not validated.
public final class JsonMinifier {

    /// Minifies `buffer[0, length)` in place.
    /// @return the new length; bytes from there up to `length` are left as they were
    /// @throws IndexOutOfBoundsException if `length` is outside the buffer
    public static int minify(byte[] buffer, int length) {
        Objects.requireNonNull(buffer);
        Objects.checkFromToIndex(0, length, buffer.length);
        int read = 0;
        int write = 0;
        while (read < length) {
            final byte c = buffer[read];
            switch (c) {
                case ' ', '\t', '\r', '\n' -> read++;
                case '"' -> {
                    buffer[write++] = buffer[read++];
                    while (read < length) {
                        final byte s = buffer[read];
                        buffer[write++] = s;
                        read++;
                        if (s == '\\' && read < length) {
                            buffer[write++] = buffer[read++];
                        } else if (s == '"') {
                            break;
                        }
                    }
                }
                default -> buffer[write++] = buffer[read++];
            }
        }
        return write;
    }

    /// Minifies the whole of `buffer` in place.
    /// @return the new length
    public static int minify(byte[] buffer) {
        return minify(buffer, buffer.length);
    }

    /// {@return `json` with insignificant whitespace removed}
    public static String minify(String json) {
        Objects.requireNonNull(json);
        final byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        final int length = minify(bytes, bytes.length);
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    // no instantiation is allowed for this class
    private JsonMinifier() {}
}
