package json.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Hand-built trees far deeper than the parser accepts. Print, compare and
/// duplicate must handle them up to the circular limit and report the limit
/// beyond it, never running out of stack.
class DeepTreeTest extends JsonTreeTestBase {

    private static final int DEEP = 9000;

    /// Builds a chain of `depth` nested arrays, linking each new level below the last.
    private JsonNode chain(int depth) {
        final var root = json.createArray();
        var current = root;
        for (int i = 1; i < depth; i++) {
            final var inner = json.createArray();
            json.addItemToArray(current, inner);
            current = inner;
        }
        return root;
    }

    @Test
    void testDeepChainPrints() {
        final var root = chain(DEEP);
        final var expected = "[".repeat(DEEP) + "]".repeat(DEEP);

        assertThat(json.printUnformatted(root)).isEqualTo(expected);
        assertThat(root.toString()).isEqualTo(expected);

        final byte[] buffer = new byte[2 * DEEP];
        assertThat(json.printPreallocated(root, buffer, false)).isEqualTo(2 * DEEP);
    }

    @Test
    void testDeepChainPrintsFormatted() {
        final int depth = 6000;
        final var formatted = json.print(chain(depth));
        assertThat(formatted).startsWith("[\n\t[\n\t\t[").endsWith("]\n\t]\n]");
        assertThat(JsonMinifier.minify(formatted)).isEqualTo("[".repeat(depth) + "]".repeat(depth));
    }

    @Test
    void testDeepChainComparesAndDuplicates() {
        final var root = chain(DEEP);
        final var copy = json.duplicate(root, true);

        assertThat(json.compare(root, copy, true)).isTrue();
        assertThat(json.compare(copy, chain(DEEP - 1), true)).isFalse();

        json.delete(copy);
        json.delete(root);
    }

    @Test
    void testChainBeyondCircularLimitIsReported() {
        final int depth = JsonConfig.DEFAULT_CIRCULAR_LIMIT + 2;
        final var root = chain(depth);
        final var other = chain(depth);
        final long live = allocator.liveBytes();

        assertThatThrownBy(() -> json.printUnformatted(root)).isInstanceOf(JsonNestingLimitException.class);
        assertThatThrownBy(() -> json.compare(root, other, true)).isInstanceOf(JsonNestingLimitException.class);
        assertThatThrownBy(() -> json.duplicate(root, true))
                .isInstanceOf(JsonNestingLimitException.class)
                .satisfies(e -> assertThat(((JsonNestingLimitException) e).limit())
                        .isEqualTo(JsonConfig.DEFAULT_CIRCULAR_LIMIT));
        assertThat(allocator.liveBytes()).isEqualTo(live);
    }
}
