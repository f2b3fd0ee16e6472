package com.giftcard.fraudguard.alert;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Body POSTed to the configured fraud-alert webhook.
 */
@Value
@Builder
@Jacksonized
public class FraudWebhookPayload {

    /** Masked redemption code. */
    String gan;
    String ip;
    String reason;
    String merchantId;
    Instant timestamp;
}
