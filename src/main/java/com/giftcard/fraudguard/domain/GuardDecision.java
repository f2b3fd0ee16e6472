package com.giftcard.fraudguard.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Outcome of {@code RedemptionGuard.evaluate}. Denials are values, not exceptions, so
 * the controller can map each one to a status code without a try/catch ladder.
 */
@Value
@Builder
public class GuardDecision {

    boolean allowed;
    DenialCode denialCode;
    /** Fraud log reason written for this denial; null for allowed requests and upstream outages. */
    FailureReason failureReason;
    /** Only set for {@link DenialCode#RATE_LIMITED}. */
    Duration retryAfter;
    BigDecimal amount;
    BigDecimal remainingBalance;

    public static GuardDecision allow(BigDecimal amount, BigDecimal remainingBalance) {
        return GuardDecision.builder()
                .allowed(true)
                .amount(amount)
                .remainingBalance(remainingBalance)
                .build();
    }

    public static GuardDecision deny(DenialCode code, FailureReason reason) {
        return GuardDecision.builder()
                .allowed(false)
                .denialCode(code)
                .failureReason(reason)
                .build();
    }

    public static GuardDecision rateLimited(FailureReason reason, Duration retryAfter) {
        return GuardDecision.builder()
                .allowed(false)
                .denialCode(DenialCode.RATE_LIMITED)
                .failureReason(reason)
                .retryAfter(retryAfter)
                .build();
    }
}
