package json.tree;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/// Cross-checks printed output against Jackson's reading of the same document.
class JacksonCompatibilityTest extends JsonTreeTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"a\":1,\"b\":[true,false,null]}",
            "[\"tab\\there\",\"quote\\\"\",\"slash\\\\\",\"ctl\\u0001\",\"caf\\u00e9\",\"\\ud83d\\ude00\"]",
            "{\"nested\":{\"list\":[[],{},[{\"deep\":-0.125}]],\"big\":123456789012}}",
            "{ \"spaced\" : [ 1 , 2.5 , -3 ] , \"empty\" : \"\" }",
            "\"just a string\"",
            "42"
    })
    void testJacksonReadsPrintedOutputAsOriginal(String document) throws Exception {
        final var expected = MAPPER.readTree(document);
        final var root = json.parse(document);

        assertThat(MAPPER.readTree(json.printUnformatted(root))).isEqualTo(expected);
        assertThat(MAPPER.readTree(json.print(root))).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"k\":[1,{\"x\":\"y\"}],\"s\":\"\\n\"}",
            "[null,true,\"€\"]"
    })
    void testJacksonOutputParsesToEqualTree(String document) throws Exception {
        final var jacksonText = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(MAPPER.readTree(document));
        assertThat(json.compare(json.parse(jacksonText), json.parse(document), true)).isTrue();
    }
}
