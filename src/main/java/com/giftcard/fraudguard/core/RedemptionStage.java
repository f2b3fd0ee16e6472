package com.giftcard.fraudguard.core;

/**
 * Progress of one request through the redemption guard. Used in decision logs to show
 * how far a denied request got.
 */
public enum RedemptionStage {
    RECEIVED,
    FINGERPRINTED,
    RATE_CHECKED,
    REPLAY_CHECKED,
    COMMITTED,
    RELEASED
}
