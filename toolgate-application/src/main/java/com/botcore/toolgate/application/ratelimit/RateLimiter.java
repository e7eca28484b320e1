package com.botcore.toolgate.application.ratelimit;

import com.botcore.toolgate.application.ports.RateBucketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Per-category sliding-window admission control in front of the backends.
 *
 * Categories are independent quotas: market-data calls never consume the real-trading budget.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitPolicy policy;
    private final RateBucketStore buckets;
    private final Clock clock;

    public RateLimiter(RateLimitPolicy policy, RateBucketStore buckets, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.buckets = Objects.requireNonNull(buckets, "buckets");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RateDecision admit(String category) {
        long now = clock.millis();
        RateBucket bucket;
        long retryAfter;
        do {
            bucket = buckets.getOrCreate(category, c -> new RateBucket(c, policy.ruleFor(c), now));
            retryAfter = bucket.tryAdmit(now);
            if (retryAfter == RateBucket.RETIRED) {
                // lost a race with the sweep; the store no longer holds this instance
                buckets.remove(bucket);
            }
        } while (retryAfter == RateBucket.RETIRED);

        if (retryAfter == 0L) {
            return RateDecision.allow();
        }
        log.warn("[RATE_LIMIT] category={} rule={} retryAfterSec={}", category, bucket.rule(), retryAfter);
        return RateDecision.deny(retryAfter);
    }

    /**
     * Prunes every bucket and discards the ones that are empty and idle.
     *
     * @return number of discarded buckets
     */
    public int sweep() {
        long now = clock.millis();
        int removed = 0;
        for (RateBucket b : buckets.all()) {
            if (b.pruneAndRetireIfIdle(now) && buckets.remove(b)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[RATE_LIMIT] sweep removed={} remaining={}", removed, buckets.size());
        }
        return removed;
    }

    public RateLimitPolicy policy() {
        return policy;
    }
}
