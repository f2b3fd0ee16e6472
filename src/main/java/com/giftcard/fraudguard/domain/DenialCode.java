package com.giftcard.fraudguard.domain;

/**
 * Machine-readable reason returned to the caller when the redemption guard denies a request.
 */
public enum DenialCode {
    RATE_LIMITED,
    /** An active defense rule covers the caller's IP, device or merchant. */
    DEFENSE_BLOCKED,
    REPLAYED_CODE,
    /** Another in-flight request holds the code. Reported to the caller exactly like a replay. */
    RESERVATION_CONFLICT,
    /** Unknown to the gift-card store. */
    INVALID_CODE,
    /** Known to the gift-card store but rejected (inactive, insufficient balance). */
    REJECTED_CODE,
    /** Durable store timed out or is unreachable; the guard fails closed. */
    UPSTREAM_UNAVAILABLE
}
