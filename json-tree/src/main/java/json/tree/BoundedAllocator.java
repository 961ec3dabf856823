package json.tree;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// A {@link JsonAllocator} that refuses requests once the live byte count
/// would exceed a fixed quota. It also counts what is live, which makes it
/// useful for checking that deleted trees really give back everything they held.
public final class BoundedAllocator implements JsonAllocator {

    private static final Logger LOG = Logger.getLogger(BoundedAllocator.class.getName());

    private final long limit;
    private final AtomicLong live = new AtomicLong();
    private final AtomicLong peak = new AtomicLong();
    private final AtomicLong refused = new AtomicLong();

    /// @param limit the maximum number of bytes that may be live at once
    /// @throws IllegalArgumentException if `limit` is negative
    public BoundedAllocator(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit is negative: " + limit);
        }
        this.limit = limit;
    }

    @Override
    public boolean allocate(int bytes) {
        while (true) {
            final long current = live.get();
            final long next = current + bytes;
            if (next > limit) {
                refused.incrementAndGet();
                LOG.finer(() -> "Refusing " + bytes + " bytes; live=" + current + " limit=" + limit);
                return false;
            }
            if (live.compareAndSet(current, next)) {
                peak.accumulateAndGet(next, Math::max);
                return true;
            }
        }
    }

    @Override
    public void release(int bytes) {
        final long after = live.addAndGet(-bytes);
        if (after < 0) {
            throw new IllegalStateException("Released more bytes than were allocated: live=" + after);
        }
    }

    public long limit() {
        return limit;
    }

    /// {@return the number of bytes currently allocated}
    public long liveBytes() {
        return live.get();
    }

    /// {@return the highest number of bytes allocated at once}
    public long peakBytes() {
        return peak.get();
    }

    /// {@return how many requests were refused}
    public long refusedCount() {
        return refused.get();
    }

    @Override
    public String toString() {
        return "BoundedAllocator[limit=" + limit + ", live=" + live.get() + ", peak=" + peak.get() + "]";
    }
}
