package com.giftcard.fraudguard.core.replay;

import lombok.Value;

import java.time.Instant;

@Value
public class ReplayReservation {

    String code;
    Instant claimedAt;
    Instant expiresAt;
    /** Identifies the claimant so a late release cannot drop a newer reservation. */
    String token;

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
