package json.tree;

import java.util.Arrays;
import java.util.stream.Collectors;

/// Exception thrown when an operation meant for one node type is applied to another,
/// for example an array operation on an object node.
public class JsonTypeMismatchException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    private final JsonType actual;

    public JsonTypeMismatchException(JsonType actual, JsonType... expected) {
        super("Expected " + describe(expected) + " but node is " + actual);
        this.actual = actual;
    }

    /// Returns the type of the node the operation was applied to.
    public JsonType actual() {
        return actual;
    }

    private static String describe(JsonType... expected) {
        return Arrays.stream(expected).map(JsonType::name).collect(Collectors.joining(" or "));
    }
}
