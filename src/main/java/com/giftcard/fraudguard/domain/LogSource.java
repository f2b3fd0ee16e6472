package com.giftcard.fraudguard.domain;

/**
 * Origin of a fraud log row.
 */
public enum LogSource {
    /** Written by the redemption guard on the request path. */
    GUARD,
    /** Recorded from the inbound fraud-alert webhook of an external detector. */
    WEBHOOK
}
