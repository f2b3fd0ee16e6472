package com.giftcard.fraudguard.defense;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplayResult {

    String fraudLogId;
    Instant timestamp;
    String ipAddress;
    String deviceFingerprint;
    String merchantId;
    FailureReason failureReason;
    FraudSeverity severity;
    boolean originallyBlocked;
    boolean fraudulent;
    /** Rule that would deny this event today; null when none. */
    String matchedRuleId;
    ReplayOutcome outcome;
}
