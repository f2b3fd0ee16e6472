package com.giftcard.fraudguard.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for redeeming a gift card.
 */
@Data
public class RedemptionRequestDto {

    /** The gift card's redemption code (GAN). */
    @NotBlank(message = "code is required")
    @Size(max = 64)
    private String code;

    @NotBlank(message = "redeemedBy is required")
    private String redeemedBy;

    private String merchantId;

    /** Omit to redeem the full balance. */
    @DecimalMin("0.01")
    private BigDecimal amount;
}
