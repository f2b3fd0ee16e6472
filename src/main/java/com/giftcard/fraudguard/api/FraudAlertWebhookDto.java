package com.giftcard.fraudguard.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

/**
 * Fraud alert pushed by an external system (payment processor, partner risk engine).
 */
@Data
public class FraudAlertWebhookDto {

    private String gan;

    @NotBlank(message = "ip is required")
    @Size(max = 64)
    private String ip;

    @NotBlank(message = "reason is required")
    private String reason;

    private String merchantId;

    /** Defaults to the time of receipt. */
    private Instant timestamp;
}
