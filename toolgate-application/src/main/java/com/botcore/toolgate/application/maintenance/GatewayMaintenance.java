package com.botcore.toolgate.application.maintenance;

import com.botcore.toolgate.application.confirm.ConfirmationAuthority;
import com.botcore.toolgate.application.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background sweeps tied to the gateway's lifecycle: rate buckets and consumed confirmation tokens.
 *
 * start() and shutdown() are called by the owner (the Spring context in the API module);
 * nothing runs before start().
 */
public class GatewayMaintenance {

    private static final Logger log = LoggerFactory.getLogger(GatewayMaintenance.class);

    private final RateLimiter rateLimiter;
    private final ConfirmationAuthority confirmations;
    private final long rateLimitSweepMs;
    private final long usedTokenSweepMs;

    private ScheduledExecutorService executor;

    public GatewayMaintenance(RateLimiter rateLimiter,
                              ConfirmationAuthority confirmations,
                              long rateLimitSweepMs,
                              long usedTokenSweepMs) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.confirmations = Objects.requireNonNull(confirmations, "confirmations");
        if (rateLimitSweepMs <= 0 || usedTokenSweepMs <= 0) {
            throw new IllegalArgumentException("sweep intervals must be positive");
        }
        this.rateLimitSweepMs = rateLimitSweepMs;
        this.usedTokenSweepMs = usedTokenSweepMs;
    }

    public synchronized void start() {
        if (executor != null) return;

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "toolgate-maintenance");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::sweepRateBuckets, rateLimitSweepMs, rateLimitSweepMs, TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(this::sweepUsedTokens, usedTokenSweepMs, usedTokenSweepMs, TimeUnit.MILLISECONDS);
        log.info("Gateway maintenance started (rateLimitSweepMs={}, usedTokenSweepMs={})", rateLimitSweepMs, usedTokenSweepMs);
    }

    public synchronized void shutdown() {
        if (executor == null) return;
        executor.shutdownNow();
        executor = null;
        log.info("Gateway maintenance stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    // a throwing task would cancel its schedule, so failures are contained here
    void sweepRateBuckets() {
        try {
            rateLimiter.sweep();
        } catch (RuntimeException e) {
            log.warn("Rate bucket sweep failed", e);
        }
    }

    void sweepUsedTokens() {
        try {
            confirmations.sweepUsedTokens();
        } catch (RuntimeException e) {
            log.warn("Used-token sweep failed", e);
        }
    }
}
