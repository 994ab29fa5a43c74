package me.toymail.jobsync.enrich;

import java.time.Duration;
import java.time.Instant;

/**
 * At most {@code maxEvents} events in any trailing window. Start times are kept in a ring
 * buffer; callers pass the clock reading so the limiter can be driven by a fixed clock in tests.
 */
public final class SlidingWindowRateLimiter {
    private final long[] timestamps;
    private final long windowMs;
    private int index;
    private int count;

    public SlidingWindowRateLimiter(int maxEvents, Duration window) {
        if (maxEvents < 1) throw new IllegalArgumentException("maxEvents must be at least 1");
        if (window.toMillis() < 1) throw new IllegalArgumentException("window must be at least 1 ms");
        this.timestamps = new long[maxEvents];
        this.windowMs = window.toMillis();
    }

    /**
     * Milliseconds until an event may start; 0 when one may start now.
     */
    public synchronized long delayUntilPermit(Instant now) {
        long t = now.toEpochMilli();
        expire(t);
        if (count < timestamps.length) return 0;
        long oldest = timestamps[(index - count + timestamps.length) % timestamps.length];
        return Math.max(0, oldest + windowMs - t);
    }

    /**
     * Record an event that starts at {@code now}. The caller checks {@link #delayUntilPermit} first.
     */
    public synchronized void record(Instant now) {
        long t = ceilMillis(now);
        expire(t);
        if (count == timestamps.length) {
            // over the cap; the oldest slot is overwritten
            count--;
        }
        timestamps[index] = t;
        index = (index + 1) % timestamps.length;
        count++;
    }

    public synchronized int inWindow(Instant now) {
        expire(now.toEpochMilli());
        return count;
    }

    // starts round up and readings round down, so an event never expires early
    private static long ceilMillis(Instant at) {
        long ms = at.toEpochMilli();
        return at.getNano() % 1_000_000 == 0 ? ms : ms + 1;
    }

    private void expire(long now) {
        while (count > 0) {
            int oldestIdx = (index - count + timestamps.length) % timestamps.length;
            if (now - timestamps[oldestIdx] >= windowMs) {
                count--;
            } else {
                break;
            }
        }
    }
}
