package com.giftcard.fraudguard.core.ratelimit;

/**
 * Namespace of a rate-limit counter.
 */
public enum RateLimitScope {
    IP,
    DEVICE,
    MERCHANT
}
