package com.giftcard.fraudguard.adapters;

import com.giftcard.fraudguard.core.giftcard.GiftCardStatus;
import com.giftcard.fraudguard.core.giftcard.GiftCardStore;
import com.giftcard.fraudguard.core.giftcard.RedemptionOutcome;
import com.giftcard.fraudguard.core.giftcard.RedemptionStatus;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory gift-card store for local runs and demos. Cards are seeded from
 * {@code fraudguard.giftcard.mock.cards}, a comma-separated list of
 * {@code code:balance[:inactive]} entries. Codes are single use: a redeemed card stays
 * redeemed even when only part of its balance was taken.
 * In production, replace with an adapter for the real card platform implementing
 * {@link GiftCardStore}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraudguard.giftcard.mock.enabled", havingValue = "true", matchIfMissing = true)
public class MockGiftCardStore implements GiftCardStore {

    private final Map<String, GiftCardStatus> cards = new ConcurrentHashMap<>();

    @Value("${fraudguard.giftcard.mock.cards:}")
    private String seed;

    @PostConstruct
    void init() {
        if (seed == null || seed.isBlank()) {
            log.info("MockGiftCardStore started with no seeded cards");
            return;
        }
        for (String entry : seed.split(",")) {
            String[] parts = entry.trim().split(":");
            if (parts.length < 2 || parts[0].isBlank()) {
                log.warn("Ignoring malformed mock card entry '{}'", entry.trim());
                continue;
            }
            boolean active = parts.length < 3 || !"inactive".equalsIgnoreCase(parts[2].trim());
            addCard(parts[0].trim(), new BigDecimal(parts[1].trim()), active);
        }
        log.info("MockGiftCardStore seeded with {} cards", cards.size());
    }

    public void addCard(String gan, BigDecimal balance, boolean active) {
        cards.put(gan, GiftCardStatus.builder()
                .gan(gan)
                .active(active)
                .redeemed(false)
                .balance(balance)
                .build());
    }

    @Override
    public Optional<GiftCardStatus> lookup(String gan) {
        return Optional.ofNullable(cards.get(gan));
    }

    @Override
    public RedemptionOutcome redeem(String gan, String redeemedBy, String merchantId, BigDecimal amount) {
        RedemptionOutcome[] result = new RedemptionOutcome[1];
        GiftCardStatus updated = cards.computeIfPresent(gan, (k, card) -> {
            if (card.isRedeemed()) {
                result[0] = RedemptionOutcome.of(RedemptionStatus.ALREADY_REDEEMED, "Card already redeemed");
                return card;
            }
            if (!card.isActive()) {
                result[0] = RedemptionOutcome.of(RedemptionStatus.REJECTED, "Card is inactive");
                return card;
            }
            BigDecimal toRedeem = amount != null ? amount : card.getBalance();
            if (toRedeem.signum() <= 0 || toRedeem.compareTo(card.getBalance()) > 0) {
                result[0] = RedemptionOutcome.of(RedemptionStatus.REJECTED, "Insufficient balance");
                return card;
            }
            BigDecimal remaining = card.getBalance().subtract(toRedeem);
            result[0] = RedemptionOutcome.builder()
                    .status(RedemptionStatus.REDEEMED)
                    .amount(toRedeem)
                    .remainingBalance(remaining)
                    .build();
            return GiftCardStatus.builder()
                    .gan(card.getGan())
                    .active(card.isActive())
                    .redeemed(true)
                    .balance(remaining)
                    .build();
        });
        if (updated == null) {
            return RedemptionOutcome.of(RedemptionStatus.NOT_FOUND, "Gift card not found");
        }
        log.info("Mock store redemption: status={}, redeemedBy={}, merchantId={}",
                result[0].getStatus(), redeemedBy, merchantId);
        return result[0];
    }
}
