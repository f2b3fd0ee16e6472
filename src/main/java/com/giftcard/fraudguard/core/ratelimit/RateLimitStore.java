package com.giftcard.fraudguard.core.ratelimit;

import java.time.Duration;

/**
 * Keyed fixed-window counters. Implementations must make {@link #checkAndIncrement}
 * atomic per (scope, key); different keys may proceed in parallel.
 */
public interface RateLimitStore {

    /**
     * Count one request against the window containing "now" and decide it.
     * Denied when the count after incrementing exceeds {@code limit}.
     */
    RateLimitDecision checkAndIncrement(RateLimitScope scope, String key, int limit, Duration window);

    /**
     * Current count of the window containing "now", without counting anything.
     */
    long currentCount(RateLimitScope scope, String key, Duration window);

    /**
     * Drop windows idle for at least twice their duration. Returns how many were dropped.
     */
    int evictExpired();

    /**
     * Start of the fixed window containing {@code nowMs}.
     */
    static long windowStart(long nowMs, Duration window) {
        long size = window.toMillis();
        return Math.floorDiv(nowMs, size) * size;
    }

    /**
     * Time left in the window containing {@code nowMs}, never below one millisecond.
     */
    static Duration retryAfter(long nowMs, Duration window) {
        long remaining = windowStart(nowMs, window) + window.toMillis() - nowMs;
        return Duration.ofMillis(Math.max(1L, remaining));
    }
}
