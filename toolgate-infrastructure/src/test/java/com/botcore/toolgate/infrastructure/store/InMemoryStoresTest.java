package com.botcore.toolgate.infrastructure.store;

import com.botcore.toolgate.application.ratelimit.RateBucket;
import com.botcore.toolgate.application.ratelimit.RateLimitRule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryStoresTest {

    @Test
    void usedTokenIsMarkedOnlyOnceUnderContention() throws Exception {
        InMemoryUsedTokenStore store = new InMemoryUsedTokenStore();
        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.markUsed("abc:1");
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.contains("abc:1")).isTrue();
        assertThat(store.contains(null)).isFalse();
    }

    @Test
    void removeIfCountsRemovedEntries() {
        InMemoryUsedTokenStore store = new InMemoryUsedTokenStore();
        store.markUsed("a:1");
        store.markUsed("b:2");
        store.markUsed("c:3");

        assertThat(store.removeIf(t -> !t.endsWith(":3"))).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void bucketRemovalIsIdentityBased() {
        InMemoryRateBucketStore store = new InMemoryRateBucketStore();
        RateLimitRule rule = new RateLimitRule(1, 1_000);
        RateBucket first = store.getOrCreate("ai", c -> new RateBucket(c, rule, 0));

        assertThat(store.getOrCreate("ai", c -> new RateBucket(c, rule, 5))).isSameAs(first);
        assertThat(store.remove(new RateBucket("ai", rule, 0))).isFalse();
        assertThat(store.remove(first)).isTrue();
        assertThat(store.size()).isZero();
        assertThat(store.all()).isEmpty();
    }

    @Test
    void cooldownKeepsTheLatestChange() {
        InMemoryAdjustmentCooldownStore store = new InMemoryAdjustmentCooldownStore();

        assertThat(store.lastAppliedAt("leverage")).isNull();
        assertThat(store.lastAppliedAt(null)).isNull();

        store.recordApplied("leverage", 2_000L);
        store.recordApplied("leverage", 1_000L);

        assertThat(store.lastAppliedAt("leverage")).isEqualTo(2_000L);
        assertThat(store.lastAppliedAt("rsi_oversold")).isNull();
    }
}
