package com.botcore.toolgate.application.ratelimit;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window log of admitted call instants for one category.
 * All mutation happens under the bucket's monitor, so prune-and-push is one atomic step.
 */
public final class RateBucket {

    private final String category;
    private final RateLimitRule rule;
    /** Returned by {@link #tryAdmit(long)} once the sweep has discarded this bucket. */
    public static final long RETIRED = -1L;

    private final Deque<Long> timestamps = new ArrayDeque<>();
    private long lastTouchedMs;
    private boolean retired;

    public RateBucket(String category, RateLimitRule rule, long createdAtMs) {
        this.category = category;
        this.rule = rule;
        this.lastTouchedMs = createdAtMs;
    }

    public String category() {
        return category;
    }

    public RateLimitRule rule() {
        return rule;
    }

    /**
     * @return 0 if admitted, {@link #RETIRED} if the bucket was discarded concurrently,
     *         otherwise the number of seconds until the oldest entry leaves the window
     */
    public synchronized long tryAdmit(long nowMs) {
        if (retired) return RETIRED;
        lastTouchedMs = nowMs;
        prune(nowMs);
        if (timestamps.size() >= rule.max()) {
            long oldest = timestamps.peekFirst();
            long waitMs = oldest + rule.windowMs() - nowMs;
            return Math.max(1L, (waitMs + 999L) / 1000L);
        }
        timestamps.addLast(nowMs);
        return 0L;
    }

    /**
     * Drops expired entries. When the bucket is empty and untouched for at least one window
     * it is marked retired and true is returned; the caller then removes it from the store.
     */
    public synchronized boolean pruneAndRetireIfIdle(long nowMs) {
        prune(nowMs);
        if (timestamps.isEmpty() && nowMs - lastTouchedMs >= rule.windowMs()) {
            retired = true;
        }
        return retired;
    }

    public synchronized int size(long nowMs) {
        prune(nowMs);
        return timestamps.size();
    }

    private void prune(long nowMs) {
        long cutoff = nowMs - rule.windowMs();
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }
}
