package com.giftcard.fraudguard.domain;

import com.giftcard.fraudguard.core.fingerprint.RequestMetadata;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Everything the redemption guard needs to decide one request: the business payload
 * plus the transport metadata the fingerprint is derived from.
 */
@Value
@Builder
public class RedemptionAttempt {

    String code;
    String redeemedBy;
    String merchantId;
    /** Null means "redeem the full balance". */
    BigDecimal amount;
    RequestMetadata requestMetadata;
}
