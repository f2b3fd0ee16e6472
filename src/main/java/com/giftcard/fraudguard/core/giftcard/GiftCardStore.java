package com.giftcard.fraudguard.core.giftcard;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * The system of record for gift cards: issuance, balances and the durable redeemed flag
 * live behind this interface. The guard only reads card state and asks for a redemption.
 * Implementations may block on I/O; callers go through {@link GiftCardStoreGateway}.
 */
public interface GiftCardStore {

    /**
     * Look up a card by its redemption code.
     * @return empty if no card has this code
     */
    Optional<GiftCardStatus> lookup(String gan);

    /**
     * Redeem a card.
     * @param amount amount to redeem, or null for the full balance
     */
    RedemptionOutcome redeem(String gan, String redeemedBy, String merchantId, BigDecimal amount);

    default String getStoreName() {
        return this.getClass().getSimpleName();
    }
}
