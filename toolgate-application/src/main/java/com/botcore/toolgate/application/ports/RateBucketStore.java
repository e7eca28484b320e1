package com.botcore.toolgate.application.ports;

import com.botcore.toolgate.application.ratelimit.RateBucket;

import java.util.Collection;
import java.util.function.Function;

/**
 * Holds one {@link RateBucket} per category.
 */
public interface RateBucketStore {

    RateBucket getOrCreate(String category, Function<String, RateBucket> factory);

    Collection<RateBucket> all();

    /** Removes the bucket only if it is still the instance passed in. */
    boolean remove(RateBucket bucket);

    int size();
}
