package com.giftcard.fraudguard.core.replay;

public enum ReservationOutcome {
    /** Caller holds the reservation and must commit or release it. */
    RESERVED,
    ALREADY_REDEEMED,
    /** Another in-flight request holds a live reservation for the code. */
    ALREADY_RESERVED,
    /** Durable redeemed check could not be completed; nothing is held. */
    UPSTREAM_UNAVAILABLE
}
