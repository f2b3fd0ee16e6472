package com.giftcard.fraudguard.core.fingerprint;

/**
 * How much a derived device id can be trusted.
 */
public enum FingerprintConfidence {
    /** Caller supplied an explicit device identifier header. */
    HIGH,
    /** Derived from low-entropy headers. */
    LOW,
    /** No identifying headers at all; every such caller shares one device id. */
    DEGRADED
}
