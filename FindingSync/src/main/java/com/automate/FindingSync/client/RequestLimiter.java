package com.automate.FindingSync.client;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Process-wide gate for outbound calls: at most {@code maxConcurrent} in flight
 * and consecutive dispatches at least {@code minInterval} apart. Callers queue
 * instead of failing until {@code maxWait} runs out.
 */
public class RequestLimiter {

    private final Bulkhead bulkhead;
    private final RateLimiter rateLimiter;
    private final long minIntervalNanos;

    private final Object dispatchLock = new Object();
    private long lastDispatchNanos;
    private boolean dispatched;

    public RequestLimiter(int maxConcurrent, Duration minInterval, Duration maxWait) {
        this.bulkhead = Bulkhead.of("sonar-api", BulkheadConfig.custom()
                .maxConcurrentCalls(maxConcurrent)
                .maxWaitDuration(maxWait)
                .fairCallHandlingStrategyEnabled(true)
                .build());
        // window-based, so it caps throughput; the gap itself is enforced in awaitDispatchSlot
        this.rateLimiter = RateLimiter.of("sonar-api", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(minInterval)
                .timeoutDuration(maxWait)
                .build());
        this.minIntervalNanos = minInterval.toNanos();
    }

    public <T> T execute(Supplier<T> call) {
        Supplier<T> spaced = () -> {
            awaitDispatchSlot();
            return call.get();
        };
        Supplier<T> limited = RateLimiter.decorateSupplier(rateLimiter, spaced);
        return Bulkhead.decorateSupplier(bulkhead, limited).get();
    }

    public int availableConcurrentCalls() {
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }

    private void awaitDispatchSlot() {
        synchronized (dispatchLock) {
            if (dispatched) {
                long wait = lastDispatchNanos + minIntervalNanos - System.nanoTime();
                while (wait > 0) {
                    try {
                        TimeUnit.NANOSECONDS.sleep(wait);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("Interrupted while waiting for a dispatch slot", e);
                    }
                    wait = lastDispatchNanos + minIntervalNanos - System.nanoTime();
                }
            }
            lastDispatchNanos = System.nanoTime();
            dispatched = true;
        }
    }
}
