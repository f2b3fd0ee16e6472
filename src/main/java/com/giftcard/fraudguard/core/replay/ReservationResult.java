package com.giftcard.fraudguard.core.replay;

import lombok.Value;

/**
 * Outcome of {@link ReplayGuard#reserve}; {@code reservation} is only set for
 * {@link ReservationOutcome#RESERVED} and is the handle to commit or release.
 */
@Value
public class ReservationResult {

    ReservationOutcome outcome;
    ReplayReservation reservation;

    public boolean isReserved() {
        return outcome == ReservationOutcome.RESERVED;
    }

    static ReservationResult of(ReservationOutcome outcome) {
        return new ReservationResult(outcome, null);
    }
}
