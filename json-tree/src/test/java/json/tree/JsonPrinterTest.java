package json.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for printing trees as JSON text.
class JsonPrinterTest extends JsonTreeTestBase {

    private static final String SAMPLE = "{\"a\":1,\"b\":[true,false,null],\"c\":{\"d\":\"x\",\"e\":[]},\"f\":{}}";

    @Test
    void testUnformattedOutput() {
        assertThat(json.printUnformatted(json.parse(SAMPLE))).isEqualTo(SAMPLE);
    }

    @Test
    void testFormattedOutput() {
        final var expected = String.join("\n",
                "{",
                "\t\"a\": 1,",
                "\t\"b\": [",
                "\t\ttrue,",
                "\t\tfalse,",
                "\t\tnull",
                "\t],",
                "\t\"c\": {",
                "\t\t\"d\": \"x\",",
                "\t\t\"e\": []",
                "\t},",
                "\t\"f\": {}",
                "}");
        assertThat(json.print(json.parse(SAMPLE))).isEqualTo(expected);
    }

    @Test
    void testFormattedAndUnformattedShareTokens() {
        final var root = json.parse(SAMPLE);
        final var formatted = json.print(root);
        assertThat(JsonMinifier.minify(formatted)).isEqualTo(json.printUnformatted(root));
    }

    @Test
    void testScalarsAtRoot() {
        assertThat(json.printUnformatted(json.createNull())).isEqualTo("null");
        assertThat(json.printUnformatted(json.createTrue())).isEqualTo("true");
        assertThat(json.printUnformatted(json.createFalse())).isEqualTo("false");
        assertThat(json.print(json.createNumber(7))).isEqualTo("7");
        assertThat(json.print(json.createString("s"))).isEqualTo("\"s\"");
    }

    @Test
    void testToStringIsUnformatted() {
        assertThat(json.parse("[ 1 , { \"k\" : true } ]").toString()).isEqualTo("[1,{\"k\":true}]");
    }

    // ========== Numbers ==========

    @Test
    void testIntegralNumbersHaveNoFraction() {
        assertThat(JsonPrinter.formatNumber(1.0)).isEqualTo("1");
        assertThat(JsonPrinter.formatNumber(-3.0)).isEqualTo("-3");
        assertThat(JsonPrinter.formatNumber(0.0)).isEqualTo("0");
        assertThat(JsonPrinter.formatNumber(-0.0)).isEqualTo("0");
        assertThat(JsonPrinter.formatNumber(123456789012.0)).isEqualTo("123456789012");
    }

    @Test
    void testFractionalNumbersAreShortest() {
        assertThat(JsonPrinter.formatNumber(0.5)).isEqualTo("0.5");
        assertThat(JsonPrinter.formatNumber(0.1)).isEqualTo("0.1");
        assertThat(JsonPrinter.formatNumber(123.456)).isEqualTo("123.456");
        assertThat(JsonPrinter.formatNumber(0.1 + 0.2)).isEqualTo("0.30000000000000004");
        assertThat(JsonPrinter.formatNumber(3.0e-5)).isEqualTo("0.00003");
        assertThat(JsonPrinter.formatNumber(1.5e-7)).isEqualTo("1.5E-7");
        assertThat(JsonPrinter.formatNumber(1e20)).isEqualTo("1E+20");
        assertThat(JsonPrinter.formatNumber(2.82879384806159E17)).isEqualTo("2.82879384806159E+17");
        assertThat(JsonPrinter.formatNumber(9007199254740993.0)).isEqualTo("9007199254740992");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 1.0 / 3.0, Math.PI, -2.5e-300, 1.7976931348623157e308, 4.9e-324, 9007199254740993.0})
    void testNumbersRoundTrip(double value) {
        final var text = JsonPrinter.formatNumber(value);
        assertThat(json.parse(text).numberValue()).isEqualTo(value);
    }

    @Test
    void testNonFiniteNumbersPrintAsZero() {
        final var array = json.createDoubleArray(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);
        assertThat(json.printUnformatted(array)).isEqualTo("[0,0,0]");
    }

    // ========== Strings ==========

    @Test
    void testStringEscaping() {
        final var node = json.createString("a\"b\\c\nd\re\tf\bg\fh\u0001/é😀");
        assertThat(json.printUnformatted(node))
                .isEqualTo("\"a\\\"b\\\\c\\nd\\re\\tf\\bg\\fh\\u0001/é😀\"");
    }

    @Test
    void testUnpairedSurrogatesAreEscaped() {
        final char high = (char) 0xD800;
        final char low = (char) 0xDC01;
        final var array = json.createArray();
        json.addItemToArray(array, json.createString(String.valueOf(high)));
        json.addItemToArray(array, json.createString("x" + low + high));
        json.addItemToArray(array, json.createString("" + high + low));
        assertThat(json.printUnformatted(array))
                .isEqualTo("[\"\\ud800\",\"x\\udc01\\ud800\",\"\uD800\uDC01\"]");

        final var object = json.createObject();
        json.addNullToObject(object, "k" + low);
        assertThat(json.printUnformatted(object)).isEqualTo("{\"k\\udc01\":null}");
    }

    @Test
    void testKeysAreEscaped() {
        final var object = json.createObject();
        json.addNumberToObject(object, "line\nbreak", 1);
        assertThat(json.printUnformatted(object)).isEqualTo("{\"line\\nbreak\":1}");
    }

    @Test
    void testRawIsPrintedVerbatim() {
        final var array = json.createArray();
        json.addItemToArray(array, json.createRaw("{\"pre\":[1,2]}"));
        json.addItemToArray(array, json.createNumber(3));
        assertThat(json.printUnformatted(array)).isEqualTo("[{\"pre\":[1,2]},3]");
    }

    // ========== Buffering strategies ==========

    @Test
    void testAllStrategiesProduceIdenticalBytes() {
        final var root = json.parse("{\"name\":\"Grüße\",\"values\":[1,2.5,-3e-9],\"nested\":{\"ok\":true}}");
        for (boolean formatted : new boolean[]{true, false}) {
            final var auto = formatted ? json.print(root) : json.printUnformatted(root);
            final var tiny = json.printBuffered(root, 1, formatted);
            final var large = json.printBuffered(root, 4096, formatted);
            final byte[] target = new byte[4096];
            final int written = json.printPreallocated(root, target, formatted);

            assertThat(tiny).isEqualTo(auto);
            assertThat(large).isEqualTo(auto);
            assertThat(Arrays.copyOf(target, written)).isEqualTo(auto.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    void testPreallocatedFitsEmptyObject() {
        final var empty = json.parse("{}");
        final byte[] buffer = new byte[4];
        assertThat(json.printPreallocated(empty, buffer, false)).isEqualTo(2);
        assertThat(new String(buffer, 0, 2, StandardCharsets.US_ASCII)).isEqualTo("{}");
        assertThat(json.printPreallocated(empty, buffer, true)).isEqualTo(2);
    }

    @Test
    void testPreallocatedTooSmall() {
        final var object = json.parse("{\"a\":1}");
        assertThatThrownBy(() -> json.printPreallocated(object, new byte[4], false))
                .isInstanceOf(JsonBufferTooSmallException.class)
                .satisfies(e -> {
                    final var ex = (JsonBufferTooSmallException) e;
                    assertThat(ex.capacity()).isEqualTo(4);
                    assertThat(ex.formatted()).isFalse();
                });
    }

    @Test
    void testPreallocatedExactFit() {
        final var object = json.parse("{\"a\":1}");
        assertThat(json.printPreallocated(object, new byte[7], false)).isEqualTo(7);
    }

    @Test
    void testPrintBuffersAreReleased() {
        final var root = json.parse(SAMPLE);
        final long treeBytes = allocator.liveBytes();
        json.printBuffered(root, 1, true);
        json.print(root);
        assertThat(allocator.liveBytes()).isEqualTo(treeBytes);
        assertThat(allocator.peakBytes()).isGreaterThan(treeBytes);
    }

    @Test
    void testPrintAllocationFailure() {
        final var tight = new BoundedAllocator(100);
        final var engine = JsonEngine.create(JsonConfig.defaults().withAllocator(tight));
        final var object = engine.createObject();
        assertThatThrownBy(() -> engine.printUnformatted(object)).isInstanceOf(JsonAllocationException.class);
        assertThat(tight.liveBytes()).isEqualTo(NodeFactory.NODE_BYTES);
        assertThat(engine.printBuffered(object, 8, false)).isEqualTo("{}");
    }

    @Test
    void testPrintRefusesDepthBeyondCircularLimit() {
        final var engine = JsonEngine.create(JsonConfig.defaults().withCircularLimit(5));
        final var deep = engine.parse("[[[[[[[[[[1]]]]]]]]]]");
        assertThatThrownBy(() -> engine.printUnformatted(deep)).isInstanceOf(JsonNestingLimitException.class);
        assertThat(engine.printUnformatted(engine.parse("[[[1]]]"))).isEqualTo("[[[1]]]");
    }

    @Test
    void testObjectOrderIsInsertionOrder() {
        final var object = json.createObject();
        json.addNumberToObject(object, "z", 1);
        json.addNumberToObject(object, "a", 2);
        json.addNumberToObject(object, "m", 3);
        assertThat(json.printUnformatted(object)).isEqualTo("{\"z\":1,\"a\":2,\"m\":3}");
    }
}
