package json.tree;

import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/// Serializes a {@link JsonNode} tree to UTF-8 JSON text.
///
/// Members print in sibling order, so objects keep insertion order. Formatted
/// output puts each container member on its own line, indents one tab per
/// level and separates keys from values with `": "`. Unformatted output
/// inserts no whitespace at all. Empty containers print as `[]` and `{}` in
/// both modes.
///
/// The three buffering strategies share this class and differ only in the
/// {@link PrintBuffer} they write into, so they produce identical bytes.
final class JsonPrinter {

    private static final Logger LOG = Logger.getLogger(JsonPrinter.class.getName());

    private static final byte[] HEX = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

    private final PrintBuffer out;
    private final boolean formatted;
    private final int circularLimit;

    private JsonPrinter(PrintBuffer out, boolean formatted, int circularLimit) {
        this.out = out;
        this.formatted = formatted;
        this.circularLimit = circularLimit;
    }

    /// Prints into an auto-growing buffer seeded with the configured default size.
    static String print(JsonNode node, boolean formatted, JsonConfig config) {
        return printBuffered(node, config.printBufferSize(), formatted, new NodeFactory(config.allocator()),
                config.circularLimit());
    }

    /// Prints into an auto-growing buffer seeded with `prebuffer` bytes.
    static String printBuffered(JsonNode node, int prebuffer, boolean formatted, NodeFactory nodes, int circularLimit) {
        final var out = PrintBuffer.growable(prebuffer, nodes, formatted);
        try {
            new JsonPrinter(out, formatted, circularLimit).write(node);
            LOG.finer(() -> "Printed " + out.length() + " bytes, formatted=" + formatted);
            return out.asString();
        } finally {
            out.release();
        }
    }

    /// Prints into the first `capacity` bytes of `target`, never growing it.
    /// @return the number of bytes written
    static int printPreallocated(JsonNode node, byte[] target, int capacity, boolean formatted, int circularLimit) {
        final var out = PrintBuffer.fixed(target, capacity, formatted);
        new JsonPrinter(out, formatted, circularLimit).write(node);
        return out.length();
    }

    /// An open container: `next` is the member to print after the current one.
    private static final class Frame {
        final JsonNode container;
        final int level;
        JsonNode next;

        Frame(JsonNode container, int level) {
            this.container = container;
            this.level = level;
            this.next = container.child;
        }
    }

    /// Walks the tree with an explicit stack of open containers, so the
    /// printable depth is bounded by the circular limit rather than the
    /// thread's stack.
    private void write(JsonNode root) {
        final var open = new ArrayDeque<Frame>();
        value(root, 0, open);
        while (!open.isEmpty()) {
            final var frame = open.peek();
            final var item = frame.next;
            if (item == null) {
                newline();
                indent(frame.level);
                out.append((byte) (frame.container.type == JsonType.ARRAY ? ']' : '}'));
                open.pop();
                continue;
            }
            if (item != frame.container.child) {
                out.append((byte) ',');
            }
            newline();
            indent(frame.level + 1);
            if (frame.container.type == JsonType.OBJECT) {
                if (item.key == null) {
                    throw new JsonLinkageException("Object member without a key");
                }
                string(item.key);
                out.append((byte) ':');
                if (formatted) {
                    out.append((byte) ' ');
                }
            }
            frame.next = item.next;
            value(item, frame.level + 1, open);
        }
    }

    /// Prints a scalar or empty container, or opens a container for `write` to fill.
    private void value(JsonNode node, int level, Deque<Frame> open) {
        if (level > circularLimit) {
            throw new JsonNestingLimitException(circularLimit, -1);
        }
        switch (node.type) {
            case NULL -> out.appendAscii("null");
            case BOOL -> out.appendAscii(node.bool ? "true" : "false");
            case NUMBER -> out.appendAscii(formatNumber(node.number));
            case STRING -> string(node.string);
            case RAW -> out.append(node.string.getBytes(StandardCharsets.UTF_8));
            case ARRAY, OBJECT -> {
                final boolean array = node.type == JsonType.ARRAY;
                if (node.child == null) {
                    out.appendAscii(array ? "[]" : "{}");
                } else {
                    out.append((byte) (array ? '[' : '{'));
                    open.push(new Frame(node, level));
                }
            }
        }
    }

    private void newline() {
        if (formatted) {
            out.append((byte) '\n');
        }
    }

    private void indent(int level) {
        if (formatted) {
            out.appendRepeated((byte) '\t', level);
        }
    }

    /// Writes a quoted string. Quotes, backslashes, control characters and
    /// unpaired surrogates are escaped; everything else is written as UTF-8.
    private void string(String text) {
        out.append((byte) '"');
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
                continue;
            }
            if (c >= 0x20 && c != '"' && c != '\\' && !Character.isSurrogate(c)) {
                continue;
            }
            if (i > start) {
                out.append(text.substring(start, i).getBytes(StandardCharsets.UTF_8));
            }
            start = i + 1;
            out.append((byte) '\\');
            switch (c) {
                case '"' -> out.append((byte) '"');
                case '\\' -> out.append((byte) '\\');
                case '\b' -> out.append((byte) 'b');
                case '\f' -> out.append((byte) 'f');
                case '\n' -> out.append((byte) 'n');
                case '\r' -> out.append((byte) 'r');
                case '\t' -> out.append((byte) 't');
                default -> {
                    out.append((byte) 'u');
                    out.append(HEX[(c >> 12) & 0xF]);
                    out.append(HEX[(c >> 8) & 0xF]);
                    out.append(HEX[(c >> 4) & 0xF]);
                    out.append(HEX[c & 0xF]);
                }
            }
        }
        if (start < text.length()) {
            out.append(text.substring(start).getBytes(StandardCharsets.UTF_8));
        }
        out.append((byte) '"');
    }

    /// Formats a double for output.
    ///
    /// Integral values in the exactly representable range print without a
    /// fractional part. Other finite values print with the fewest of 15, 16
    /// or 17 significant digits that read back to the same double, trailing
    /// zeros removed. NaN and the infinities have no JSON form and print as
    /// `0`, which existing consumers of this output rely on.
    static String formatNumber(double d) {
        if (!Double.isFinite(d)) {
            LOG.fine(() -> "Non-finite number " + d + " printed as 0");
            return "0";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1.0e15) {
            return Long.toString((long) d);
        }
        final var exact = new BigDecimal(d);
        for (int precision = 15; precision < 17; precision++) {
            final var rounded = exact.round(new MathContext(precision));
            if (Double.parseDouble(rounded.toString()) == d) {
                return rounded.stripTrailingZeros().toString();
            }
        }
        return exact.round(new MathContext(17)).stripTrailingZeros().toString();
    }
}
