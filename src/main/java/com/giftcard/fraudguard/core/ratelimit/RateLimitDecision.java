package com.giftcard.fraudguard.core.ratelimit;

import lombok.Value;

import java.time.Duration;

/**
 * Result of one {@link RateLimitStore#checkAndIncrement} call.
 */
@Value
public class RateLimitDecision {

    boolean allowed;
    /** Counter value after this request was counted. */
    long count;
    int limit;
    /** Time until the current window closes; {@link Duration#ZERO} when allowed. */
    Duration retryAfter;

    public static RateLimitDecision allowed(long count, int limit) {
        return new RateLimitDecision(true, count, limit, Duration.ZERO);
    }

    public static RateLimitDecision denied(long count, int limit, Duration retryAfter) {
        return new RateLimitDecision(false, count, limit, retryAfter);
    }
}
