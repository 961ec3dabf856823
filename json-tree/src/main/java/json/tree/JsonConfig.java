package json.tree;

import java.util.Objects;
import java.util.logging.Logger;

/// Configuration of a {@link JsonEngine}.
///
/// @param allocator hook consulted for every allocation the engine makes
/// @param nestingLimit maximum container depth the parser accepts
/// @param circularLimit maximum tree depth that duplicate, compare and print will walk
/// @param printBufferSize initial capacity of the auto-growing print buffer
public record JsonConfig(JsonAllocator allocator, int nestingLimit, int circularLimit, int printBufferSize) {

    private static final Logger LOG = Logger.getLogger(JsonConfig.class.getName());

    public static final int DEFAULT_NESTING_LIMIT = 1000;
    public static final int DEFAULT_CIRCULAR_LIMIT = 10000;
    public static final int DEFAULT_PRINT_BUFFER_SIZE = 256;

    /// Largest accepted {@link #nestingLimit()}. The parser recurses once per
    /// container level and must trip its limit well before a default-sized
    /// thread stack runs out.
    public static final int MAX_NESTING_LIMIT = 2000;

    /// System property overriding {@link #nestingLimit()}.
    public static final String NESTING_LIMIT_PROPERTY = "json.tree.nesting.limit";
    /// System property overriding {@link #circularLimit()}.
    public static final String CIRCULAR_LIMIT_PROPERTY = "json.tree.circular.limit";
    /// System property overriding {@link #printBufferSize()}.
    public static final String PRINT_BUFFER_PROPERTY = "json.tree.print.buffer";

    public JsonConfig {
        Objects.requireNonNull(allocator, "allocator must not be null");
        if (nestingLimit < 1 || nestingLimit > MAX_NESTING_LIMIT) {
            throw new IllegalArgumentException(
                    "nestingLimit must be between 1 and " + MAX_NESTING_LIMIT + ": " + nestingLimit);
        }
        if (circularLimit < 1) {
            throw new IllegalArgumentException("circularLimit must be positive: " + circularLimit);
        }
        if (printBufferSize < 1) {
            throw new IllegalArgumentException("printBufferSize must be positive: " + printBufferSize);
        }
    }

    /// {@return the default configuration with an unbounded allocator}
    public static JsonConfig defaults() {
        return new JsonConfig(JsonAllocator.unbounded(),
                DEFAULT_NESTING_LIMIT, DEFAULT_CIRCULAR_LIMIT, DEFAULT_PRINT_BUFFER_SIZE);
    }

    /// Builds a configuration from the `json.tree.*` system properties.
    /// Properties that are absent keep their default; properties that are
    /// malformed, not positive or above their ceiling are logged and ignored.
    public static JsonConfig fromSystemProperties() {
        return new JsonConfig(JsonAllocator.unbounded(),
                intProperty(NESTING_LIMIT_PROPERTY, DEFAULT_NESTING_LIMIT, MAX_NESTING_LIMIT),
                intProperty(CIRCULAR_LIMIT_PROPERTY, DEFAULT_CIRCULAR_LIMIT, Integer.MAX_VALUE),
                intProperty(PRINT_BUFFER_PROPERTY, DEFAULT_PRINT_BUFFER_SIZE, Integer.MAX_VALUE));
    }

    public JsonConfig withAllocator(JsonAllocator allocator) {
        return new JsonConfig(allocator, nestingLimit, circularLimit, printBufferSize);
    }

    public JsonConfig withNestingLimit(int nestingLimit) {
        return new JsonConfig(allocator, nestingLimit, circularLimit, printBufferSize);
    }

    public JsonConfig withCircularLimit(int circularLimit) {
        return new JsonConfig(allocator, nestingLimit, circularLimit, printBufferSize);
    }

    public JsonConfig withPrintBufferSize(int printBufferSize) {
        return new JsonConfig(allocator, nestingLimit, circularLimit, printBufferSize);
    }

    private static int intProperty(String name, int defaultValue, int max) {
        final String propertyValue = System.getProperty(name);
        if (propertyValue == null) {
            LOG.fine(() -> name + " not specified, using default: " + defaultValue);
            return defaultValue;
        }
        try {
            final int value = Integer.parseInt(propertyValue.trim());
            if (value < 1 || value > max) {
                LOG.warning(() -> "Invalid " + name + ": " + propertyValue + ". Using default: " + defaultValue);
                return defaultValue;
            }
            LOG.fine(() -> name + " set to " + value + " via system property");
            return value;
        } catch (NumberFormatException ex) {
            LOG.warning(() -> "Invalid " + name + ": " + propertyValue + ". Using default: " + defaultValue);
            return defaultValue;
        }
    }
}
