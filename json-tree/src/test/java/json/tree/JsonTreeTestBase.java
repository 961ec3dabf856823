package json.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for json-tree tests.
/// - Emits an INFO banner per test.
/// - Gives each test an engine whose allocator counts live bytes, so tests
///   can check that deleting a tree gives back everything it held.
public class JsonTreeTestBase extends JsonTreeLoggingConfig {

    static final Logger LOG = Logger.getLogger("json.tree");

    BoundedAllocator allocator;
    JsonEngine json;

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
        allocator = new BoundedAllocator(Long.MAX_VALUE);
        json = JsonEngine.create(JsonConfig.defaults().withAllocator(allocator));
    }
}
