package json.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for structural comparison of trees.
class TreeComparatorTest extends JsonTreeTestBase {

    @Test
    void testNumbersCompareByValue() {
        assertThat(json.compare(json.parse("{\"x\":1}"), json.parse("{\"x\":1.0}"), true)).isTrue();
        assertThat(json.compare(json.parse("100"), json.parse("1e2"), true)).isTrue();
        assertThat(json.compare(json.parse("0.1"), json.parse("0.10000001"), true)).isFalse();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"a\":1,\"b\":2}|{\"b\":2,\"a\":1}|true",
            "[1,2]|[2,1]|false",
            "[1,2]|[1,2,3]|false",
            "{\"a\":1}|{\"a\":1,\"b\":2}|false",
            "{\"a\":1,\"b\":2}|{\"a\":1}|false",
            "null|null|true",
            "true|false|false",
            "1|\"1\"|false",
            "[]|{}|false",
            "{\"a\":[1,{\"b\":null}]}|{\"a\":[1,{\"b\":null}]}|true",
            "\"x\"|\"x\"|true"
    })
    void testStructuralEquality(String left, String right, boolean expected) {
        final var a = json.parse(left);
        final var b = json.parse(right);
        assertThat(json.compare(a, b, true)).isEqualTo(expected);
        assertThat(json.compare(b, a, true)).isEqualTo(expected);
    }

    @Test
    void testCaseFlagAppliesToKeysAndStrings() {
        final var a = json.parse("{\"Name\":\"Ada\"}");
        final var b = json.parse("{\"name\":\"ADA\"}");
        assertThat(json.compare(a, b, true)).isFalse();
        assertThat(json.compare(a, b, false)).isTrue();
    }

    @Test
    void testRawComparesExactly() {
        final var a = json.createRaw("{\"A\":1}");
        final var b = json.createRaw("{\"a\":1}");
        assertThat(json.compare(a, b, false)).isFalse();
        assertThat(json.compare(a, json.createRaw("{\"A\":1}"), true)).isTrue();
        assertThat(json.compare(a, json.parse("{\"A\":1}"), true)).isFalse();
    }

    @Test
    void testNodeEqualsItselfAndNullEqualsNothing() {
        final var node = json.parse("[1,{\"a\":true}]");
        assertThat(json.compare(node, node, true)).isTrue();
        assertThat(json.compare(node, null, true)).isFalse();
        assertThat(json.compare(null, node, true)).isFalse();
    }

    @Test
    void testReferenceEqualsTarget() {
        final var target = json.parse("{\"k\":[1,2]}");
        final var ref = json.createObjectReference(target);
        assertThat(json.compare(ref, target, true)).isTrue();
    }

    @Test
    void testDepthBeyondCircularLimit() {
        final var engine = JsonEngine.create(JsonConfig.defaults().withCircularLimit(3));
        final var a = engine.parse("[[[[[1]]]]]");
        final var b = engine.parse("[[[[[1]]]]]");
        assertThatThrownBy(() -> engine.compare(a, b, true))
                .isInstanceOf(JsonNestingLimitException.class)
                .satisfies(e -> assertThat(((JsonNestingLimitException) e).limit()).isEqualTo(3));
    }

    @Test
    void testAsciiFolding() {
        assertThat(TreeComparator.equalsIgnoreAsciiCase("HeLLo", "hello")).isTrue();
        assertThat(TreeComparator.equalsIgnoreAsciiCase("ÄB", "äb")).isFalse();
        assertThat(TreeComparator.equalsIgnoreAsciiCase("a", "ab")).isFalse();
        assertThat(TreeComparator.equalsIgnoreAsciiCase(null, null)).isTrue();
        assertThat(TreeComparator.equalsIgnoreAsciiCase("a", null)).isFalse();
    }
}
