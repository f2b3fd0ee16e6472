package com.giftcard.fraudguard.core.replay;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.core.giftcard.GiftCardStoreGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Makes sure a code is redeemed at most once. A request first claims a short-lived
 * reservation for the code (at most one live reservation per code), then the durable
 * redeemed check runs while the reservation is held, so two concurrent requests for the
 * same code can never both reach the gift-card store.
 * <p>
 * Committed codes are remembered permanently in the {@link RedeemedCodeStore}.
 * Reservations abandoned by crashed requests expire after the reservation TTL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplayGuard {

    private final Map<String, ReplayReservation> reservations = new ConcurrentHashMap<>();

    private final RedeemedCodeStore redeemedCodes;
    private final GiftCardStoreGateway gateway;
    private final FraudGuardProperties properties;
    private final Clock clock;

    public ReservationResult reserve(String code) {
        try {
            if (redeemedCodes.isRedeemed(code)) {
                return ReservationResult.of(ReservationOutcome.ALREADY_REDEEMED);
            }
        } catch (Exception e) {
            log.warn("Redeemed-code record unavailable, failing closed: {}", e.getMessage());
            return ReservationResult.of(ReservationOutcome.UPSTREAM_UNAVAILABLE);
        }

        Instant now = clock.instant();
        Duration ttl = properties.getReplay().getReservationTtl();
        ReplayReservation mine = new ReplayReservation(code, now, now.plus(ttl), UUID.randomUUID().toString());
        ReplayReservation holder = reservations.compute(code,
                (k, existing) -> existing == null || existing.isExpired(now) ? mine : existing);
        if (holder != mine) {
            return ReservationResult.of(ReservationOutcome.ALREADY_RESERVED);
        }

        try {
            // A commit may have landed between the first check and the claim.
            if (redeemedCodes.isRedeemed(code)) {
                release(mine);
                return ReservationResult.of(ReservationOutcome.ALREADY_REDEEMED);
            }
            if (gateway.isRedeemed(code)) {
                redeemedCodes.record(RedeemedCodeRecord.builder()
                        .code(code)
                        .redeemedAt(clock.instant())
                        .build());
                release(mine);
                return ReservationResult.of(ReservationOutcome.ALREADY_REDEEMED);
            }
        } catch (Exception e) {
            log.warn("Durable redeemed check failed, releasing reservation: {}", e.getMessage());
            release(mine);
            return ReservationResult.of(ReservationOutcome.UPSTREAM_UNAVAILABLE);
        }
        return new ReservationResult(ReservationOutcome.RESERVED, mine);
    }

    /**
     * Record the code as permanently redeemed and drop the reservation.
     */
    public void commit(ReplayReservation reservation, String redeemedBy, String merchantId) {
        try {
            redeemedCodes.record(RedeemedCodeRecord.builder()
                    .code(reservation.getCode())
                    .redeemedBy(redeemedBy)
                    .merchantId(merchantId)
                    .redeemedAt(clock.instant())
                    .build());
        } catch (Exception e) {
            // The gift-card store already holds the redeemed flag; later requests still hit the durable check.
            log.error("Failed to record redeemed code, relying on the gift-card store's redeemed flag", e);
        } finally {
            reservations.remove(reservation.getCode(), reservation);
        }
    }

    /**
     * Drop the reservation without recording anything. No-op if it already expired and
     * was replaced by another request.
     */
    public void release(ReplayReservation reservation) {
        reservations.remove(reservation.getCode(), reservation);
    }

    @Scheduled(fixedDelayString = "${fraudguard.replay.purge-interval:PT10S}")
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = reservations.size();
        reservations.values().removeIf(r -> r.isExpired(now));
        int purged = before - reservations.size();
        if (purged > 0) {
            log.info("Purged {} abandoned replay reservations", purged);
        }
        return purged;
    }

    int liveReservations() {
        return reservations.size();
    }
}
