package com.botcore.toolgate.infrastructure.store;

import com.botcore.toolgate.application.ports.RateBucketStore;
import com.botcore.toolgate.application.ratelimit.RateBucket;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

public final class InMemoryRateBucketStore implements RateBucketStore {

    private final ConcurrentMap<String, RateBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateBucket getOrCreate(String category, Function<String, RateBucket> factory) {
        return buckets.computeIfAbsent(category, factory);
    }

    @Override
    public Collection<RateBucket> all() {
        return List.copyOf(buckets.values());
    }

    @Override
    public boolean remove(RateBucket bucket) {
        return buckets.remove(bucket.category(), bucket);
    }

    @Override
    public int size() {
        return buckets.size();
    }
}
