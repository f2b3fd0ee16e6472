package com.giftcard.fraudguard.core.giftcard;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a redemption call against the external gift-card store.
 */
@Value
@Builder
public class RedemptionOutcome {

    RedemptionStatus status;
    BigDecimal amount;
    BigDecimal remainingBalance;
    /** Store-side explanation for non-REDEEMED outcomes. */
    String message;

    public static RedemptionOutcome of(RedemptionStatus status, String message) {
        return RedemptionOutcome.builder().status(status).message(message).build();
    }
}
