package com.giftcard.fraudguard.core;

import com.giftcard.fraudguard.MutableClock;
import com.giftcard.fraudguard.adapters.MockGiftCardStore;
import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.alert.AlertEventType;
import com.giftcard.fraudguard.alert.FraudWebhookNotifier;
import com.giftcard.fraudguard.compliance.RedemptionAuditLogger;
import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.core.fingerprint.FingerprintExtractor;
import com.giftcard.fraudguard.core.fingerprint.RequestMetadata;
import com.giftcard.fraudguard.core.giftcard.GiftCardStoreGateway;
import com.giftcard.fraudguard.core.ratelimit.InMemoryRateLimitStore;
import com.giftcard.fraudguard.core.replay.InMemoryRedeemedCodeStore;
import com.giftcard.fraudguard.core.replay.ReplayGuard;
import com.giftcard.fraudguard.defense.DefenseRuleRegistry;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseTarget;
import com.giftcard.fraudguard.domain.DenialCode;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.domain.GuardDecision;
import com.giftcard.fraudguard.domain.LogSource;
import com.giftcard.fraudguard.domain.RedemptionAttempt;
import com.giftcard.fraudguard.persistence.service.DefenseRuleStore;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for RedemptionGuard over real in-memory stores and the mock gift-card store;
 * fraud log persistence and alert fan-out are mocked.
 */
@ExtendWith(MockitoExtension.class)
class RedemptionGuardTest {

    private static final String UA = "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_4) Safari/605.1.15";

    @Mock
    private FraudLogStore fraudLogStore;

    @Mock
    private AlertBroadcaster alertBroadcaster;

    @Mock
    private FraudWebhookNotifier webhookNotifier;

    @Mock
    private DefenseRuleStore defenseRuleStore;

    private MutableClock clock;
    private MockGiftCardStore cardStore;
    private GiftCardStoreGateway gateway;
    private DefenseRuleRegistry defenseRules;
    private RedemptionGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        FraudGuardProperties properties = new FraudGuardProperties();
        cardStore = new MockGiftCardStore();
        cardStore.addCard("GAN-X", new BigDecimal("50.00"), true);
        cardStore.addCard("GAN-OFF", new BigDecimal("20.00"), false);
        gateway = new GiftCardStoreGateway(cardStore, CircuitBreakerRegistry.ofDefaults(), properties, 4);
        ReflectionTestUtils.invokeMethod(gateway, "init");
        ReplayGuard replayGuard = new ReplayGuard(new InMemoryRedeemedCodeStore(), gateway, properties, clock);
        defenseRules = new DefenseRuleRegistry(defenseRuleStore, properties, clock);
        guard = new RedemptionGuard(new FingerprintExtractor(properties), defenseRules, new InMemoryRateLimitStore(clock), replayGuard, gateway,
                fraudLogStore, alertBroadcaster, webhookNotifier, new RedemptionAuditLogger(), properties, clock);
        lenient().when(fraudLogStore.append(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        ReflectionTestUtils.invokeMethod(gateway, "shutdown");
    }

    private static RedemptionAttempt attempt(String code, String ip, String device) {
        RequestMetadata.RequestMetadataBuilder metadata = RequestMetadata.builder()
                .remoteAddress(ip)
                .header("User-Agent", UA);
        if (device != null) {
            metadata.header(FingerprintExtractor.DEVICE_HEADER, device);
        }
        return RedemptionAttempt.builder()
                .code(code)
                .redeemedBy("alice")
                .requestMetadata(metadata.build())
                .build();
    }

    private List<FraudLog> writtenLogs() {
        ArgumentCaptor<FraudLog> captor = ArgumentCaptor.forClass(FraudLog.class);
        verify(fraudLogStore, atLeastOnce()).append(captor.capture());
        return captor.getAllValues();
    }

    @Test
    void fourthAttemptFromSameIpIsRateLimited() {
        for (int i = 1; i <= 3; i++) {
            clock.advance(Duration.ofSeconds(2));
            GuardDecision decision = guard.evaluate(attempt("BAD-" + i, "203.0.113.10", null));
            assertThat(decision.getDenialCode()).isEqualTo(DenialCode.INVALID_CODE);
        }

        GuardDecision fourth = guard.evaluate(attempt("BAD-4", "203.0.113.10", null));

        assertThat(fourth.getDenialCode()).isEqualTo(DenialCode.RATE_LIMITED);
        assertThat(fourth.getFailureReason()).isEqualTo(FailureReason.IP_RATE_LIMIT);
        assertThat(fourth.getRetryAfter()).isPositive();
        FraudLog last = writtenLogs().get(3);
        assertThat(last.getFailureReason()).isEqualTo(FailureReason.IP_RATE_LIMIT);
        assertThat(last.isBlocked()).isTrue();
        assertThat(last.getSource()).isEqualTo(LogSource.GUARD);
    }

    @Test
    void successAfterFailuresAtSoftThresholdIsFlaggedButAllowed() {
        guard.evaluate(attempt("BAD-1", "203.0.113.20", "dev-9"));
        guard.evaluate(attempt("BAD-2", "203.0.113.20", "dev-9"));

        GuardDecision decision = guard.evaluate(attempt("GAN-X", "203.0.113.20", "dev-9"));

        assertThat(decision.isAllowed()).isTrue();
        List<FraudLog> logs = writtenLogs();
        assertThat(logs).hasSize(3);
        FraudLog flagged = logs.get(2);
        assertThat(flagged.getFailureReason()).isEqualTo(FailureReason.SUSPICIOUS_ACTIVITY);
        assertThat(flagged.getSeverity()).isEqualTo(FraudSeverity.LOW);
        assertThat(flagged.isBlocked()).isFalse();
        assertThat(flagged.getDeviceFingerprint()).isEqualTo("dev-9");
        assertThat(flagged.getCodeAttempted()).isEqualTo("****AN-X");
    }

    @Test
    void successBelowSoftThresholdWritesNoLog() {
        guard.evaluate(attempt("BAD-1", "203.0.113.21", "dev-8"));

        GuardDecision decision = guard.evaluate(attempt("GAN-X", "203.0.113.21", "dev-8"));

        assertThat(decision.isAllowed()).isTrue();
        assertThat(writtenLogs()).extracting(FraudLog::getFailureReason).containsExactly(FailureReason.INVALID_CODE);
    }

    @Test
    void defenseRuleOnIpDeniesBeforeAnyRateCheck() {
        DefenseRule rule = DefenseRule.builder()
                .id("rule-1")
                .target(DefenseTarget.IP)
                .value("203.0.113.66")
                .confidence(90)
                .origin(DefenseRuleOrigin.CLUSTER_POLICY)
                .active(true)
                .expiresAt(clock.instant().plus(Duration.ofHours(4)))
                .build();
        defenseRules.register(rule);

        GuardDecision decision = guard.evaluate(attempt("GAN-X", "203.0.113.66", "dev-5"));

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getDenialCode()).isEqualTo(DenialCode.DEFENSE_BLOCKED);
        FraudLog blocked = writtenLogs().get(0);
        assertThat(blocked.getFailureReason()).isEqualTo(FailureReason.BLOCKED_BY_DEFENSE_RULE);
        assertThat(blocked.getSeverity()).isEqualTo(FraudSeverity.HIGH);
        assertThat(blocked.isBlocked()).isTrue();
        assertThat(blocked.getDetail()).contains("rule-1");

        // the card was never touched, so another caller can still redeem it
        GuardDecision other = guard.evaluate(attempt("GAN-X", "203.0.113.67", "dev-6"));
        assertThat(other.isAllowed()).isTrue();
    }

    @Test
    void expiredDefenseRuleNoLongerBlocks() {
        defenseRules.register(DefenseRule.builder()
                .id("rule-2")
                .target(DefenseTarget.DEVICE)
                .value("dev-5")
                .origin(DefenseRuleOrigin.THREAT_REPLAY)
                .active(true)
                .expiresAt(clock.instant().plus(Duration.ofMinutes(10)))
                .build());
        assertThat(guard.evaluate(attempt("GAN-X", "203.0.113.70", "dev-5")).getDenialCode())
                .isEqualTo(DenialCode.DEFENSE_BLOCKED);

        clock.advance(Duration.ofMinutes(11));

        assertThat(guard.evaluate(attempt("GAN-X", "203.0.113.70", "dev-5")).isAllowed()).isTrue();
    }

    @Test
    void secondRedemptionOfSameCodeIsReplay() {
        GuardDecision first = guard.evaluate(attempt("GAN-X", "203.0.113.10", "dev-1"));
        GuardDecision second = guard.evaluate(attempt("GAN-X", "203.0.113.11", "dev-2"));

        assertThat(first.isAllowed()).isTrue();
        assertThat(first.getAmount()).isEqualByComparingTo("50.00");
        assertThat(first.getRemainingBalance()).isEqualByComparingTo("0");
        assertThat(second.isAllowed()).isFalse();
        assertThat(second.getDenialCode()).isEqualTo(DenialCode.REPLAYED_CODE);

        FraudLog replay = writtenLogs().get(0);
        assertThat(replay.getFailureReason()).isEqualTo(FailureReason.REUSED_CODE);
        assertThat(replay.getSeverity()).isEqualTo(FraudSeverity.HIGH);
        assertThat(replay.getCodeAttempted()).isEqualTo("****AN-X");
        verify(alertBroadcaster).publish(eq(AlertEventType.TRANSACTION_FEED), any());
        verify(alertBroadcaster).publish(AlertEventType.FRAUD_ALERT, replay);
        verify(webhookNotifier).notifyFraud(replay);
    }

    @Test
    void fiveFailuresFromOneDeviceFlagSuspiciousActivity() {
        for (int i = 1; i <= 5; i++) {
            clock.advance(Duration.ofSeconds(30));
            GuardDecision decision = guard.evaluate(attempt("BAD-" + i, "198.51.100." + i, "dev-777"));
            assertThat(decision.getDenialCode()).isEqualTo(DenialCode.INVALID_CODE);
        }

        List<FraudLog> logs = writtenLogs();
        assertThat(logs).hasSize(6);
        FraudLog flagged = logs.get(5);
        assertThat(flagged.getFailureReason()).isEqualTo(FailureReason.SUSPICIOUS_ACTIVITY);
        assertThat(flagged.getDeviceFingerprint()).isEqualTo("dev-777");
        assertThat(flagged.getSeverity()).isEqualTo(FraudSeverity.HIGH);
        assertThat(logs.get(0).getSeverity()).isEqualTo(FraudSeverity.LOW);
        assertThat(logs.get(2).getSeverity()).isEqualTo(FraudSeverity.MEDIUM);

        GuardDecision sixth = guard.evaluate(attempt("GAN-X", "198.51.100.99", "dev-777"));
        assertThat(sixth.getDenialCode()).isEqualTo(DenialCode.RATE_LIMITED);
        assertThat(sixth.getFailureReason()).isEqualTo(FailureReason.DEVICE_RATE_LIMIT);
        assertThat(cardStore.lookup("GAN-X").orElseThrow().isRedeemed()).isFalse();
    }

    @Test
    void inactiveCardIsRejectedAndCanBeRetriedLater() {
        GuardDecision decision = guard.evaluate(attempt("GAN-OFF", "203.0.113.10", "dev-1"));

        assertThat(decision.getDenialCode()).isEqualTo(DenialCode.REJECTED_CODE);
        assertThat(writtenLogs().get(0).getFailureReason()).isEqualTo(FailureReason.INVALID_CODE);
        cardStore.addCard("GAN-OFF", new BigDecimal("20.00"), true);
        assertThat(guard.evaluate(attempt("GAN-OFF", "203.0.113.10", "dev-1")).isAllowed()).isTrue();
    }

    @Test
    void merchantLimitAppliesAcrossDevices() {
        for (int i = 0; i < 10; i++) {
            guard.evaluate(RedemptionAttempt.builder()
                    .code("BAD-" + i)
                    .merchantId("m-1")
                    .requestMetadata(RequestMetadata.builder().remoteAddress("10.0.0." + i)
                            .header(FingerprintExtractor.DEVICE_HEADER, "dev-" + i).build())
                    .build());
        }

        GuardDecision eleventh = guard.evaluate(RedemptionAttempt.builder()
                .code("GAN-X")
                .merchantId("m-1")
                .requestMetadata(RequestMetadata.builder().remoteAddress("10.0.1.1")
                        .header(FingerprintExtractor.DEVICE_HEADER, "dev-new").build())
                .build());

        assertThat(eleventh.getFailureReason()).isEqualTo(FailureReason.MERCHANT_RATE_LIMIT);
    }

    @Test
    void upstreamOutageDeniesWithoutFraudLog() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.circuitBreaker("giftCardStore").transitionToOpenState();
        FraudGuardProperties properties = new FraudGuardProperties();
        GiftCardStoreGateway down = new GiftCardStoreGateway(cardStore, registry, properties, 1);
        ReflectionTestUtils.invokeMethod(down, "init");
        ReplayGuard replayGuard = new ReplayGuard(new InMemoryRedeemedCodeStore(), down, properties, clock);
        RedemptionGuard outageGuard = new RedemptionGuard(new FingerprintExtractor(properties), defenseRules, new InMemoryRateLimitStore(clock),
                replayGuard, down, fraudLogStore, alertBroadcaster, webhookNotifier, new RedemptionAuditLogger(),
                properties, clock);
        try {
            GuardDecision decision = outageGuard.evaluate(attempt("GAN-X", "203.0.113.10", "dev-1"));

            assertThat(decision.getDenialCode()).isEqualTo(DenialCode.UPSTREAM_UNAVAILABLE);
            assertThat(decision.getFailureReason()).isNull();
            verify(fraudLogStore, never()).append(any());
            assertThat(cardStore.lookup("GAN-X").orElseThrow().isRedeemed()).isFalse();
        } finally {
            ReflectionTestUtils.invokeMethod(down, "shutdown");
        }
    }

    @Test
    void fraudLogWriteFailureDoesNotChangeDecision() {
        lenient().when(fraudLogStore.append(any())).thenThrow(new IllegalStateException("db down"));

        GuardDecision decision = guard.evaluate(attempt("BAD-1", "203.0.113.10", "dev-1"));

        assertThat(decision.getDenialCode()).isEqualTo(DenialCode.INVALID_CODE);
        verify(alertBroadcaster, never()).publish(eq(AlertEventType.FRAUD_ALERT), any());
    }

    @Test
    void concurrentRedemptionsOfOneCodeSucceedOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<GuardDecision>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String ip = "192.0.2." + i;
                String device = "dev-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return guard.evaluate(attempt("GAN-X", ip, device));
                }));
            }
            start.countDown();
            int allowed = 0;
            for (Future<GuardDecision> future : futures) {
                GuardDecision decision = future.get(10, TimeUnit.SECONDS);
                if (decision.isAllowed()) {
                    allowed++;
                } else {
                    assertThat(decision.getDenialCode())
                            .isIn(DenialCode.REPLAYED_CODE, DenialCode.RESERVATION_CONFLICT);
                }
            }
            assertThat(allowed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
