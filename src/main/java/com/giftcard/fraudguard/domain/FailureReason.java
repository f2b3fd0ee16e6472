package com.giftcard.fraudguard.domain;

/**
 * Why a fraud log row was written. Drives clustering ({@code threatTypes}) and the
 * statistics breakdown on the admin surface.
 */
public enum FailureReason {
    /** Code was already redeemed, or another request currently holds it. */
    REUSED_CODE,
    /** Code unknown to the gift-card store or rejected by it (inactive, no balance). */
    INVALID_CODE,
    IP_RATE_LIMIT,
    DEVICE_RATE_LIMIT,
    MERCHANT_RATE_LIMIT,
    /** Flagged pattern: device failure velocity, soft-threshold success, or an external detector signal. */
    SUSPICIOUS_ACTIVITY,
    /** Denied by an IP, device or merchant defense rule before any rate check. */
    BLOCKED_BY_DEFENSE_RULE
}
