package com.giftcard.fraudguard.core.giftcard;

public enum RedemptionStatus {
    REDEEMED,
    /** No card with this code. */
    NOT_FOUND,
    ALREADY_REDEEMED,
    /** Card exists but cannot be redeemed (inactive, zero balance, amount over balance). */
    REJECTED
}
