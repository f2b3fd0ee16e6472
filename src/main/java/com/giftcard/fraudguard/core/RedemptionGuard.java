package com.giftcard.fraudguard.core;

import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.alert.AlertEventType;
import com.giftcard.fraudguard.alert.FraudWebhookNotifier;
import com.giftcard.fraudguard.alert.TransactionFeedItem;
import com.giftcard.fraudguard.api.UpstreamUnavailableException;
import com.giftcard.fraudguard.compliance.CodeMasker;
import com.giftcard.fraudguard.compliance.RedemptionAuditLogger;
import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.core.fingerprint.Fingerprint;
import com.giftcard.fraudguard.core.fingerprint.FingerprintExtractor;
import com.giftcard.fraudguard.core.giftcard.GiftCardStoreGateway;
import com.giftcard.fraudguard.core.giftcard.RedemptionOutcome;
import com.giftcard.fraudguard.core.ratelimit.RateLimitDecision;
import com.giftcard.fraudguard.core.ratelimit.RateLimitScope;
import com.giftcard.fraudguard.core.ratelimit.RateLimitStore;
import com.giftcard.fraudguard.core.replay.ReplayGuard;
import com.giftcard.fraudguard.core.replay.ReplayReservation;
import com.giftcard.fraudguard.core.replay.ReservationResult;
import com.giftcard.fraudguard.defense.DefenseRuleRegistry;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DenialCode;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.domain.GuardDecision;
import com.giftcard.fraudguard.domain.LogSource;
import com.giftcard.fraudguard.domain.RedemptionAttempt;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Decides every redemption request. Checks run in a fixed order and stop at the first
 * denial: defense rules in force, IP rate, device failure velocity, device flood limit, merchant rate, replay
 * reservation, then the redemption itself at the gift-card store.
 * <p>
 * Every fraud-relevant denial writes one {@link FraudLog} before the decision is returned.
 * Upstream outages deny the request (fail closed) but are not fraud and are not logged as such.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedemptionGuard {

    static final String FAILURE_KEY_PREFIX = "failures:";
    /** Device failure count from which INVALID_CODE logs are raised to MEDIUM. */
    static final int ESCALATE_INVALID_AFTER = 3;

    private final FingerprintExtractor fingerprintExtractor;
    private final DefenseRuleRegistry defenseRules;
    private final RateLimitStore rateLimitStore;
    private final ReplayGuard replayGuard;
    private final GiftCardStoreGateway gateway;
    private final FraudLogStore fraudLogStore;
    private final AlertBroadcaster alertBroadcaster;
    private final FraudWebhookNotifier webhookNotifier;
    private final RedemptionAuditLogger auditLogger;
    private final FraudGuardProperties properties;
    private final Clock clock;

    @PostConstruct
    void init() {
        FraudGuardProperties.RateLimit rl = properties.getRateLimit();
        log.info("RedemptionGuard policies: ip={}/{}, device={}/{}, deviceFailures={}/{} (soft={}), merchant={}/{}, store={}",
                rl.getIp().getLimit(), rl.getIp().getWindow(),
                rl.getDevice().getLimit(), rl.getDevice().getWindow(),
                rl.getDeviceFailures().getLimit(), rl.getDeviceFailures().getWindow(),
                rl.getDeviceFailures().getSoftThreshold(),
                rl.getMerchant().getLimit(), rl.getMerchant().getWindow(),
                rateLimitStore.getClass().getSimpleName());
    }

    public GuardDecision evaluate(RedemptionAttempt attempt) {
        Fingerprint fingerprint = fingerprintExtractor.extract(attempt.getRequestMetadata());
        auditLogger.logAttempt(attempt, fingerprint.getIp());
        GuardDecision decision = decide(attempt, fingerprint);
        auditLogger.logDecision(attempt, decision);
        return decision;
    }

    private GuardDecision decide(RedemptionAttempt attempt, Fingerprint fingerprint) {
        FraudGuardProperties.RateLimit rl = properties.getRateLimit();
        RedemptionStage stage = RedemptionStage.FINGERPRINTED;

        Optional<DefenseRule> rule = defenseRules.match(fingerprint.getIp(), fingerprint.getDeviceId(), attempt.getMerchantId());
        if (rule.isPresent()) {
            return defenseBlocked(attempt, fingerprint, rule.get(), stage);
        }

        RateLimitDecision ip = rateLimitStore.checkAndIncrement(
                RateLimitScope.IP, fingerprint.getIp(), rl.getIp().getLimit(), rl.getIp().getWindow());
        if (!ip.isAllowed()) {
            return rateLimited(attempt, fingerprint, FailureReason.IP_RATE_LIMIT, FraudSeverity.MEDIUM, ip, rl.getIp(), stage);
        }

        FraudGuardProperties.DeviceFailures failures = rl.getDeviceFailures();
        long recentFailures = rateLimitStore.currentCount(RateLimitScope.DEVICE, failureKey(fingerprint), failures.getWindow());
        if (recentFailures >= failures.getLimit()) {
            Duration retryAfter = RateLimitStore.retryAfter(clock.millis(), failures.getWindow());
            RateLimitDecision blocked = RateLimitDecision.denied(recentFailures, failures.getLimit(), retryAfter);
            return rateLimited(attempt, fingerprint, FailureReason.DEVICE_RATE_LIMIT, FraudSeverity.HIGH, blocked, failures, stage);
        }

        RateLimitDecision device = rateLimitStore.checkAndIncrement(
                RateLimitScope.DEVICE, fingerprint.getDeviceId(), rl.getDevice().getLimit(), rl.getDevice().getWindow());
        if (!device.isAllowed()) {
            return rateLimited(attempt, fingerprint, FailureReason.DEVICE_RATE_LIMIT, FraudSeverity.HIGH, device, rl.getDevice(), stage);
        }

        if (attempt.getMerchantId() != null && !attempt.getMerchantId().isBlank()) {
            RateLimitDecision merchant = rateLimitStore.checkAndIncrement(
                    RateLimitScope.MERCHANT, attempt.getMerchantId(), rl.getMerchant().getLimit(), rl.getMerchant().getWindow());
            if (!merchant.isAllowed()) {
                return rateLimited(attempt, fingerprint, FailureReason.MERCHANT_RATE_LIMIT, FraudSeverity.MEDIUM, merchant, rl.getMerchant(), stage);
            }
        }
        stage = RedemptionStage.RATE_CHECKED;

        ReservationResult reservation = replayGuard.reserve(attempt.getCode());
        switch (reservation.getOutcome()) {
            case ALREADY_REDEEMED:
                return failure(attempt, fingerprint, DenialCode.REPLAYED_CODE, FailureReason.REUSED_CODE,
                        "Code already redeemed", stage);
            case ALREADY_RESERVED:
                return failure(attempt, fingerprint, DenialCode.RESERVATION_CONFLICT, FailureReason.REUSED_CODE,
                        "Code held by a concurrent redemption", stage);
            case UPSTREAM_UNAVAILABLE:
                return upstreamUnavailable(attempt, stage);
            default:
                break;
        }
        stage = RedemptionStage.REPLAY_CHECKED;

        ReplayReservation held = reservation.getReservation();
        RedemptionOutcome outcome;
        try {
            outcome = gateway.redeem(attempt.getCode(), attempt.getRedeemedBy(), attempt.getMerchantId(), attempt.getAmount());
        } catch (UpstreamUnavailableException e) {
            replayGuard.release(held);
            return upstreamUnavailable(attempt, RedemptionStage.RELEASED);
        }

        switch (outcome.getStatus()) {
            case REDEEMED:
                replayGuard.commit(held, attempt.getRedeemedBy(), attempt.getMerchantId());
                return allowed(attempt, fingerprint, outcome);
            case ALREADY_REDEEMED:
                // Redeemed behind our back (another channel); remember it permanently.
                replayGuard.commit(held, null, null);
                return failure(attempt, fingerprint, DenialCode.REPLAYED_CODE, FailureReason.REUSED_CODE,
                        "Code already redeemed at the gift-card store", RedemptionStage.COMMITTED);
            case NOT_FOUND:
                replayGuard.release(held);
                return failure(attempt, fingerprint, DenialCode.INVALID_CODE, FailureReason.INVALID_CODE,
                        "Unknown code", RedemptionStage.RELEASED);
            default:
                replayGuard.release(held);
                return failure(attempt, fingerprint, DenialCode.REJECTED_CODE, FailureReason.INVALID_CODE,
                        outcome.getMessage() != null ? outcome.getMessage() : "Card rejected", RedemptionStage.RELEASED);
        }
    }

    private GuardDecision allowed(RedemptionAttempt attempt, Fingerprint fingerprint, RedemptionOutcome outcome) {
        FraudGuardProperties.DeviceFailures failures = properties.getRateLimit().getDeviceFailures();
        long recentFailures = rateLimitStore.currentCount(RateLimitScope.DEVICE, failureKey(fingerprint), failures.getWindow());
        if (recentFailures >= failures.getSoftThreshold()) {
            recordFraud(baseLog(attempt, fingerprint)
                    .failureReason(FailureReason.SUSPICIOUS_ACTIVITY)
                    .severity(FraudSeverity.LOW)
                    .blocked(false)
                    .detail("Redeemed after " + recentFailures + " failed attempts in " + failures.getWindow().getSeconds() + "s")
                    .build());
        }

        alertBroadcaster.publish(AlertEventType.TRANSACTION_FEED, TransactionFeedItem.builder()
                .code(CodeMasker.maskCode(attempt.getCode()))
                .merchantId(attempt.getMerchantId())
                .amount(outcome.getAmount())
                .ipAddress(fingerprint.getIp())
                .timestamp(clock.instant())
                .build());
        log.debug("Redemption allowed: code={}, stage={}", CodeMasker.maskCode(attempt.getCode()), RedemptionStage.COMMITTED);
        return GuardDecision.allow(outcome.getAmount(), outcome.getRemainingBalance());
    }

    private GuardDecision defenseBlocked(RedemptionAttempt attempt, Fingerprint fingerprint, DefenseRule rule,
                                         RedemptionStage stage) {
        log.warn("Redemption blocked by defense rule: rule={}, target={}, ip={}, device={}, stage={}",
                rule.getId(), rule.getTarget(), CodeMasker.maskIp(fingerprint.getIp()),
                CodeMasker.maskDevice(fingerprint.getDeviceId()), stage);
        recordFraud(baseLog(attempt, fingerprint)
                .failureReason(FailureReason.BLOCKED_BY_DEFENSE_RULE)
                .severity(FraudSeverity.HIGH)
                .blocked(true)
                .detail("Blocked by " + rule.getTarget().getWireName() + " rule " + rule.getId()
                        + " until " + rule.getExpiresAt())
                .build());
        return GuardDecision.deny(DenialCode.DEFENSE_BLOCKED, FailureReason.BLOCKED_BY_DEFENSE_RULE);
    }

    private GuardDecision rateLimited(RedemptionAttempt attempt, Fingerprint fingerprint, FailureReason reason,
                                      FraudSeverity severity, RateLimitDecision decision,
                                      FraudGuardProperties.Policy policy, RedemptionStage stage) {
        log.warn("Rate limit hit: reason={}, count={}, limit={}, window={}, ip={}, device={}, stage={}",
                reason, decision.getCount(), decision.getLimit(), policy.getWindow(),
                CodeMasker.maskIp(fingerprint.getIp()), CodeMasker.maskDevice(fingerprint.getDeviceId()), stage);
        recordFraud(baseLog(attempt, fingerprint)
                .failureReason(reason)
                .severity(severity)
                .blocked(true)
                .detail(decision.getCount() + " attempts against limit " + decision.getLimit()
                        + " per " + policy.getWindow().getSeconds() + "s")
                .build());
        return GuardDecision.rateLimited(reason, decision.getRetryAfter());
    }

    /**
     * Denial caused by the code itself. Counts against the device's failure velocity and
     * flags the device once it reaches the failure threshold.
     */
    private GuardDecision failure(RedemptionAttempt attempt, Fingerprint fingerprint, DenialCode code,
                                  FailureReason reason, String detail, RedemptionStage stage) {
        FraudGuardProperties.DeviceFailures policy = properties.getRateLimit().getDeviceFailures();
        long deviceFailures = rateLimitStore.checkAndIncrement(
                RateLimitScope.DEVICE, failureKey(fingerprint), Integer.MAX_VALUE, policy.getWindow()).getCount();

        FraudSeverity severity;
        if (reason == FailureReason.INVALID_CODE) {
            severity = deviceFailures >= ESCALATE_INVALID_AFTER ? FraudSeverity.MEDIUM : FraudSeverity.LOW;
        } else {
            severity = FraudSeverity.HIGH;
        }
        log.info("Redemption denied: denial={}, reason={}, code={}, deviceFailures={}, stage={}",
                code, reason, CodeMasker.maskCode(attempt.getCode()), deviceFailures, stage);
        recordFraud(baseLog(attempt, fingerprint)
                .failureReason(reason)
                .severity(severity)
                .blocked(true)
                .detail(detail)
                .build());

        if (deviceFailures == policy.getLimit()) {
            log.warn("Device reached failure threshold: device={}, failures={}, window={}",
                    CodeMasker.maskDevice(fingerprint.getDeviceId()), deviceFailures, policy.getWindow());
            recordFraud(baseLog(attempt, fingerprint)
                    .failureReason(FailureReason.SUSPICIOUS_ACTIVITY)
                    .severity(FraudSeverity.HIGH)
                    .blocked(false)
                    .detail(deviceFailures + " failed attempts in " + policy.getWindow().getSeconds() + "s")
                    .build());
        }
        return GuardDecision.deny(code, reason);
    }

    private GuardDecision upstreamUnavailable(RedemptionAttempt attempt, RedemptionStage stage) {
        log.warn("Redemption denied, gift-card store unavailable: code={}, stage={}",
                CodeMasker.maskCode(attempt.getCode()), stage);
        return GuardDecision.deny(DenialCode.UPSTREAM_UNAVAILABLE, null);
    }

    private FraudLog.FraudLogBuilder baseLog(RedemptionAttempt attempt, Fingerprint fingerprint) {
        return FraudLog.builder()
                .ipAddress(fingerprint.getIp())
                .userAgent(fingerprint.getUserAgent())
                .deviceFingerprint(fingerprint.getDeviceId())
                .merchantId(attempt.getMerchantId())
                .codeAttempted(CodeMasker.maskCode(attempt.getCode()))
                .source(LogSource.GUARD)
                .timestamp(clock.instant());
    }

    /**
     * Write a fraud log and fan it out. A failed write is logged at ERROR; the decision the
     * log belongs to still stands.
     */
    private void recordFraud(FraudLog fraudLog) {
        FraudLog saved;
        try {
            saved = fraudLogStore.append(fraudLog);
        } catch (Exception e) {
            log.error("Failed to persist fraud log: reason={}, severity={}, blocked={}",
                    fraudLog.getFailureReason(), fraudLog.getSeverity(), fraudLog.isBlocked(), e);
            return;
        }
        alertBroadcaster.publish(AlertEventType.FRAUD_ALERT, saved);
        webhookNotifier.notifyFraud(saved);
    }

    static String failureKey(Fingerprint fingerprint) {
        return FAILURE_KEY_PREFIX + fingerprint.getDeviceId();
    }
}
