package json.tree;

import java.util.ArrayDeque;

/// Structural equality of two trees.
///
/// Type tags must match. Numbers compare by exact double value, so `1` and
/// `1.0` are equal. Arrays compare element by element in order. Objects
/// compare by membership: every key of one side needs an equal member under
/// a matching key on the other side, in either direction, whatever the order.
final class TreeComparator {

    private final boolean caseSensitive;
    private final int circularLimit;
    private final ArrayDeque<Pair> pending = new ArrayDeque<>();

    private TreeComparator(boolean caseSensitive, int circularLimit) {
        this.caseSensitive = caseSensitive;
        this.circularLimit = circularLimit;
    }

    /// Two nodes still to be compared, `depth` levels below the roots.
    private record Pair(JsonNode a, JsonNode b, int depth) {
    }

    static boolean equal(JsonNode a, JsonNode b, boolean caseSensitive, int circularLimit) {
        return new TreeComparator(caseSensitive, circularLimit).compare(a, b);
    }

    /// Compares pairs from a worklist rather than recursing, so deep trees
    /// hit the circular limit instead of exhausting the stack.
    private boolean compare(JsonNode a, JsonNode b) {
        pending.push(new Pair(a, b, 0));
        while (!pending.isEmpty()) {
            final var pair = pending.pop();
            if (!compareShallow(pair.a(), pair.b(), pair.depth())) {
                return false;
            }
        }
        return true;
    }

    /// Compares the two nodes' own values and queues their children.
    private boolean compareShallow(JsonNode a, JsonNode b, int depth) {
        if (a == null || b == null || a.type != b.type) {
            return false;
        }
        if (a == b) {
            return true;
        }
        if (depth > circularLimit) {
            throw new JsonNestingLimitException(circularLimit, -1);
        }
        return switch (a.type) {
            case NULL -> true;
            case BOOL -> a.bool == b.bool;
            case NUMBER -> a.number == b.number;
            case STRING -> caseSensitive ? a.string.equals(b.string) : equalsIgnoreAsciiCase(a.string, b.string);
            case RAW -> a.string.equals(b.string);
            case ARRAY -> queueElements(a, b, depth);
            case OBJECT -> queueMembers(a, b, depth) && queueMembers(b, a, depth);
        };
    }

    private boolean queueElements(JsonNode a, JsonNode b, int depth) {
        var left = a.child;
        var right = b.child;
        while (left != null && right != null) {
            pending.push(new Pair(left, right, depth + 1));
            left = left.next;
            right = right.next;
        }
        return left == null && right == null;
    }

    /// Queues every member of `a` against its counterpart under a matching key in `b`.
    /// @return false if some member of `a` has no counterpart
    private boolean queueMembers(JsonNode a, JsonNode b, int depth) {
        for (var member = a.child; member != null; member = member.next) {
            final var counterpart = findMember(b, member.key, caseSensitive);
            if (counterpart == null) {
                return false;
            }
            pending.push(new Pair(member, counterpart, depth + 1));
        }
        return true;
    }

    /// {@return the first member of `object` whose key matches, or null}
    static JsonNode findMember(JsonNode object, String key, boolean caseSensitive) {
        for (var member = object.child; member != null; member = member.next) {
            if (member.key == null) {
                continue;
            }
            if (caseSensitive ? member.key.equals(key) : equalsIgnoreAsciiCase(member.key, key)) {
                return member;
            }
        }
        return null;
    }

    /// Compares two strings folding only ASCII letters, as C-locale `tolower` does.
    static boolean equalsIgnoreAsciiCase(String a, String b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.length() != b.length()) {
            return false;
        }
        for (int i = 0; i < a.length(); i++) {
            if (foldAscii(a.charAt(i)) != foldAscii(b.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static char foldAscii(char c) {
        return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
    }
}
