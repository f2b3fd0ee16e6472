package com.giftcard.fraudguard.core.giftcard;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Snapshot of a gift card as reported by the external store.
 */
@Value
@Builder
public class GiftCardStatus {

    String gan;
    boolean active;
    boolean redeemed;
    BigDecimal balance;
}
