package com.giftcard.fraudguard.alert;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Allowed redemption as shown on the live transaction feed. The code is masked.
 */
@Value
@Builder
@Jacksonized
public class TransactionFeedItem {

    String code;
    String merchantId;
    BigDecimal amount;
    String ipAddress;
    Instant timestamp;
}
