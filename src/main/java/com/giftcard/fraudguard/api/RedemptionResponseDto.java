package com.giftcard.fraudguard.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.giftcard.fraudguard.domain.GuardDecision;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * REST API response for a redemption. Denials carry only a caller-safe message; fraud
 * detail (fingerprints, counters, clusters) never reaches the end caller.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RedemptionResponseDto {

    static final String NOT_FOUND = "Gift card not found";
    static final String REJECTED = "Invalid or inactive gift card";
    static final String RATE_LIMITED = "Too many redemption attempts. Please try again later.";
    static final String BLOCKED = "Access temporarily blocked due to suspicious activity.";
    static final String ALREADY_REDEEMED = "This gift card has already been redeemed.";
    static final String UNAVAILABLE = "Redemption is temporarily unavailable. Please try again later.";

    boolean success;
    BigDecimal amount;
    BigDecimal remainingBalance;
    String error;
    /** Seconds; only on 429. */
    Long retryAfter;

    public static RedemptionResponseDto allowed(GuardDecision decision) {
        return RedemptionResponseDto.builder()
                .success(true)
                .amount(decision.getAmount())
                .remainingBalance(decision.getRemainingBalance())
                .build();
    }

    public static RedemptionResponseDto denied(String error) {
        return RedemptionResponseDto.builder()
                .success(false)
                .error(error)
                .build();
    }

    public static RedemptionResponseDto rateLimited(long retryAfterSeconds) {
        return RedemptionResponseDto.builder()
                .success(false)
                .error(RATE_LIMITED)
                .retryAfter(retryAfterSeconds)
                .build();
    }
}
