package com.giftcard.fraudguard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One suspicious or denied redemption event. Immutable once written: rows are never
 * updated, only superseded by newer rows.
 */
@Value
@Builder
@Jacksonized
public class FraudLog {

    String id;
    String ipAddress;
    String userAgent;
    String deviceFingerprint;
    /** Null when the attempt carried no merchant context. */
    String merchantId;
    /** Masked: only the last four characters of the code are kept. */
    String codeAttempted;
    FailureReason failureReason;
    FraudSeverity severity;
    boolean blocked;
    LogSource source;
    String detail;
    Instant timestamp;
}
