package json.tree;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.Logger;

/// Recursive descent parser from UTF-8 JSON text to a {@link JsonNode} tree.
///
/// Follows RFC 8259 strictly: no comments, no trailing commas, no leading
/// zeros, no unescaped control characters inside strings. Whitespace is the
/// four JSON whitespace bytes. Container depth is bounded by the configured
/// nesting limit so that hostile input cannot exhaust the stack.
///
/// On failure every node built so far is released through the allocator and
/// {@link #position()} holds the byte offset of the failure.
final class JsonTreeParser {

    private static final Logger LOG = Logger.getLogger(JsonTreeParser.class.getName());

    private final byte[] input;
    private final int length;
    private final NodeFactory nodes;
    private final int nestingLimit;

    private int pos;
    private int depth;

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private byte[] scratch = new byte[64];
    private int scratchLength;

    JsonTreeParser(byte[] input, int length, NodeFactory nodes, int nestingLimit) {
        this.input = input;
        this.length = length;
        this.nodes = nodes;
        this.nestingLimit = nestingLimit;
    }

    /// Parses one JSON value starting at offset zero.
    /// @param requireEnd if true, only whitespace may follow the value
    JsonParseResult parse(boolean requireEnd) {
        LOG.fine(() -> "Parsing " + length + " bytes, requireEnd=" + requireEnd);
        skipByteOrderMark();
        skipWhitespace();
        final var root = parseValue();
        if (requireEnd) {
            skipWhitespace();
            if (pos < length) {
                nodes.deleteSubtree(root);
                throw error("Unexpected content after JSON value");
            }
        }
        final int end = pos;
        LOG.finer(() -> "Parsed " + root.type + " ending at " + end);
        return new JsonParseResult(root, end);
    }

    /// {@return the current byte offset, which is the failure point after an exception}
    int position() {
        return pos;
    }

    private JsonNode parseValue() {
        if (pos >= length) {
            throw error("Unexpected end of input");
        }
        final byte c = input[pos];
        return switch (c) {
            case '{' -> parseObject();
            case '[' -> parseArray();
            case '"' -> nodes.textNode(JsonType.STRING, parseString());
            case 't' -> parseLiteral("true", JsonType.BOOL, true);
            case 'f' -> parseLiteral("false", JsonType.BOOL, false);
            case 'n' -> parseLiteral("null", JsonType.NULL, false);
            default -> {
                if (c == '-' || isDigit(c)) {
                    yield parseNumber();
                }
                throw error("Unexpected character");
            }
        };
    }

    private JsonNode parseObject() {
        enterContainer();
        pos++; // skip {
        final var object = nodes.node(JsonType.OBJECT);
        try {
            skipWhitespace();
            if (pos < length && input[pos] == '}') {
                pos++;
                depth--;
                return object;
            }
            JsonNode tail = null;
            while (true) {
                skipWhitespace();
                if (pos >= length || input[pos] != '"') {
                    throw error("Expected string for object key");
                }
                final String key = parseString();
                skipWhitespace();
                expect(':', "Expected ':' after object key");
                skipWhitespace();
                final var value = parseValue();
                try {
                    value.key = nodes.ownString(key);
                } catch (JsonAllocationException ex) {
                    nodes.deleteSubtree(value);
                    throw ex;
                }
                tail = linkAfter(object, tail, value);
                skipWhitespace();
                if (pos >= length) {
                    throw error("Unexpected end of input in object");
                }
                final byte c = input[pos];
                if (c == ',') {
                    pos++;
                } else if (c == '}') {
                    pos++;
                    break;
                } else {
                    throw error("Expected ',' or '}' in object");
                }
            }
            depth--;
            return object;
        } catch (RuntimeException ex) {
            nodes.deleteSubtree(object);
            throw ex;
        }
    }

    private JsonNode parseArray() {
        enterContainer();
        pos++; // skip [
        final var array = nodes.node(JsonType.ARRAY);
        try {
            skipWhitespace();
            if (pos < length && input[pos] == ']') {
                pos++;
                depth--;
                return array;
            }
            JsonNode tail = null;
            while (true) {
                skipWhitespace();
                tail = linkAfter(array, tail, parseValue());
                skipWhitespace();
                if (pos >= length) {
                    throw error("Unexpected end of input in array");
                }
                final byte c = input[pos];
                if (c == ',') {
                    pos++;
                } else if (c == ']') {
                    pos++;
                    break;
                } else {
                    throw error("Expected ',' or ']' in array");
                }
            }
            depth--;
            return array;
        } catch (RuntimeException ex) {
            nodes.deleteSubtree(array);
            throw ex;
        }
    }

    private void enterContainer() {
        depth++;
        if (depth > nestingLimit) {
            LOG.fine(() -> "Nesting limit " + nestingLimit + " exceeded at " + pos);
            throw new JsonNestingLimitException(nestingLimit, pos);
        }
    }

    private static JsonNode linkAfter(JsonNode container, JsonNode tail, JsonNode item) {
        if (tail == null) {
            container.child = item;
        } else {
            tail.next = item;
            item.prev = tail;
        }
        item.linked = true;
        return item;
    }

    private JsonNode parseLiteral(String literal, JsonType type, boolean value) {
        if (pos + literal.length() > length) {
            throw error("Invalid literal");
        }
        for (int i = 0; i < literal.length(); i++) {
            if (input[pos + i] != literal.charAt(i)) {
                pos += i;
                throw error("Invalid literal");
            }
        }
        pos += literal.length();
        final var node = nodes.node(type);
        node.bool = value;
        return node;
    }

    private JsonNode parseNumber() {
        final int start = pos;
        if (input[pos] == '-') {
            pos++;
        }
        if (pos >= length || !isDigit(input[pos])) {
            throw error("Expected digit");
        }
        if (input[pos] == '0') {
            pos++;
            if (pos < length && isDigit(input[pos])) {
                throw error("Leading zeros are not allowed");
            }
        } else {
            skipDigits();
        }
        if (pos < length && input[pos] == '.') {
            pos++;
            if (pos >= length || !isDigit(input[pos])) {
                throw error("Expected digit after decimal point");
            }
            skipDigits();
        }
        if (pos < length && (input[pos] == 'e' || input[pos] == 'E')) {
            pos++;
            if (pos < length && (input[pos] == '+' || input[pos] == '-')) {
                pos++;
            }
            if (pos >= length || !isDigit(input[pos])) {
                throw error("Expected digit in exponent");
            }
            skipDigits();
        }
        final double value = Double.parseDouble(new String(input, start, pos - start, StandardCharsets.US_ASCII));
        final var node = nodes.node(JsonType.NUMBER);
        node.number = value;
        return node;
    }

    private void skipDigits() {
        while (pos < length && isDigit(input[pos])) {
            pos++;
        }
    }

    /// Parses a string literal at the current position and returns its decoded text.
    private String parseString() {
        final int start = pos;
        pos++; // skip opening quote
        scratchLength = 0;
        while (true) {
            if (pos >= length) {
                throw error("Unterminated string");
            }
            final int b = input[pos] & 0xFF;
            if (b == '"') {
                pos++;
                break;
            }
            if (b < 0x20) {
                throw error("Unescaped control character in string");
            }
            if (b == '\\') {
                parseEscape();
            } else {
                appendScratch(b);
                pos++;
            }
        }
        try {
            return decodeUtf8();
        } catch (CharacterCodingException ex) {
            pos = start;
            throw error("Invalid UTF-8 in string");
        }
    }

    private void parseEscape() {
        pos++; // skip backslash
        if (pos >= length) {
            throw error("Unterminated escape sequence");
        }
        final byte c = input[pos];
        switch (c) {
            case '"', '\\', '/' -> appendScratch(c);
            case 'b' -> appendScratch('\b');
            case 'f' -> appendScratch('\f');
            case 'n' -> appendScratch('\n');
            case 'r' -> appendScratch('\r');
            case 't' -> appendScratch('\t');
            case 'u' -> {
                parseUnicodeEscape();
                return;
            }
            default -> throw error("Invalid escape sequence");
        }
        pos++;
    }

    /// Decodes a `u` escape of four hex digits, plus a following low surrogate escape, into UTF-8 bytes.
    /// On entry `pos` is at the `u`; on exit it is just past the last hex digit.
    private void parseUnicodeEscape() {
        final int first = readHex4(pos + 1);
        pos += 5;
        final int codePoint;
        if (Character.isLowSurrogate((char) first)) {
            pos -= 6;
            throw error("Unexpected low surrogate in unicode escape");
        } else if (Character.isHighSurrogate((char) first)) {
            if (pos + 1 >= length || input[pos] != '\\' || input[pos + 1] != 'u') {
                throw error("High surrogate not followed by low surrogate in unicode escape");
            }
            final int second = readHex4(pos + 2);
            if (!Character.isLowSurrogate((char) second)) {
                throw error("Invalid low surrogate in unicode escape");
            }
            pos += 6;
            codePoint = Character.toCodePoint((char) first, (char) second);
        } else {
            codePoint = first;
        }
        appendCodePoint(codePoint);
    }

    private int readHex4(int from) {
        if (from + 4 > length) {
            pos = Math.min(from, length);
            throw error("Incomplete unicode escape");
        }
        int value = 0;
        for (int i = from; i < from + 4; i++) {
            final int digit = Character.digit(input[i], 16);
            if (digit < 0) {
                pos = i;
                throw error("Invalid hex digit in unicode escape");
            }
            value = (value << 4) | digit;
        }
        return value;
    }

    private void appendCodePoint(int cp) {
        if (cp < 0x80) {
            appendScratch(cp);
        } else if (cp < 0x800) {
            appendScratch(0xC0 | (cp >> 6));
            appendScratch(0x80 | (cp & 0x3F));
        } else if (cp < 0x10000) {
            appendScratch(0xE0 | (cp >> 12));
            appendScratch(0x80 | ((cp >> 6) & 0x3F));
            appendScratch(0x80 | (cp & 0x3F));
        } else {
            appendScratch(0xF0 | (cp >> 18));
            appendScratch(0x80 | ((cp >> 12) & 0x3F));
            appendScratch(0x80 | ((cp >> 6) & 0x3F));
            appendScratch(0x80 | (cp & 0x3F));
        }
    }

    private void appendScratch(int b) {
        if (scratchLength == scratch.length) {
            scratch = Arrays.copyOf(scratch, scratch.length * 2);
        }
        scratch[scratchLength++] = (byte) b;
    }

    private String decodeUtf8() throws CharacterCodingException {
        final CharBuffer chars = decoder.decode(ByteBuffer.wrap(scratch, 0, scratchLength));
        return chars.toString();
    }

    private void skipWhitespace() {
        while (pos < length) {
            final byte c = input[pos];
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return;
            }
            pos++;
        }
    }

    private void skipByteOrderMark() {
        if (length >= 3 && (input[0] & 0xFF) == 0xEF && (input[1] & 0xFF) == 0xBB && (input[2] & 0xFF) == 0xBF) {
            pos = 3;
        }
    }

    private void expect(char c, String message) {
        if (pos >= length || input[pos] != c) {
            throw error(message);
        }
        pos++;
    }

    private static boolean isDigit(byte c) {
        return c >= '0' && c <= '9';
    }

    private JsonParseException error(String message) {
        LOG.fine(() -> "Parse failed at " + pos + ": " + message);
        return new JsonParseException(message, input, length, pos);
    }
}
