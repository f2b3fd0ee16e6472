package com.giftcard.fraudguard.core.replay;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Permanent marker that a code has been redeemed through this service or found
 * redeemed at the gift-card store.
 */
@Value
@Builder
@Jacksonized
public class RedeemedCodeRecord {

    String code;
    String redeemedBy;
    String merchantId;
    Instant redeemedAt;
}
