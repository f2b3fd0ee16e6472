package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Learns IP, device and merchant rules from a threat replay.
 * <ul>
 *   <li>IP: fraud rate above 0.6, or more than two fraudulent events no rule caught.</li>
 *   <li>Device: fraud rate above 0.7, or more than three fraudulent events.</li>
 *   <li>Merchant: fraud rate above 0.8 and more than five fraudulent events.</li>
 * </ul>
 * IPs and devices also need the configured minimum of replayed events. Learned rules
 * expire after the learned-rule TTL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoDefenseLearner {

    static final double IP_FRAUD_RATE = 0.6;
    static final int IP_MISSED = 2;
    static final double DEVICE_FRAUD_RATE = 0.7;
    static final int DEVICE_FRAUDULENT = 3;
    static final double MERCHANT_FRAUD_RATE = 0.8;
    static final int MERCHANT_FRAUDULENT = 5;

    private static final String UNKNOWN = "unknown";

    private final DefenseRuleService ruleService;
    private final FraudGuardProperties properties;
    private final Clock clock;

    public LearningResult learn(ThreatReplayReport report) {
        FraudGuardProperties.Defense config = properties.getDefense();
        Instant expiresAt = clock.instant().plus(config.getLearnedRuleTtl());
        List<DefenseRule> candidates = new ArrayList<>();

        evidenceBy(report.getResults(), ReplayResult::getIpAddress).forEach((ip, e) -> {
            if (e.total >= config.getMinObservations() && e.fraudulent > 0
                    && (e.rate() > IP_FRAUD_RATE || e.missed > IP_MISSED)) {
                candidates.add(rule(DefenseTarget.IP, ip, e, Math.min(95, 50 + e.rate() * 45), expiresAt));
            }
        });
        evidenceBy(report.getResults(), ReplayResult::getDeviceFingerprint).forEach((device, e) -> {
            if (e.total >= config.getMinObservations() && e.fraudulent > 0
                    && (e.rate() > DEVICE_FRAUD_RATE || e.fraudulent > DEVICE_FRAUDULENT)) {
                candidates.add(rule(DefenseTarget.DEVICE, device, e, Math.min(90, 40 + e.rate() * 50), expiresAt));
            }
        });
        evidenceBy(report.getResults(), ReplayResult::getMerchantId).forEach((merchant, e) -> {
            if (e.rate() > MERCHANT_FRAUD_RATE && e.fraudulent > MERCHANT_FRAUDULENT) {
                candidates.add(rule(DefenseTarget.MERCHANT, merchant, e, Math.min(85, 30 + e.rate() * 55), expiresAt));
            }
        });

        int created = 0;
        List<DefenseRule> changed = new ArrayList<>(candidates.size());
        for (DefenseRule candidate : candidates) {
            DefenseRuleChange change = ruleService.enforce(candidate);
            if (change.created()) created++;
            changed.add(change.rule());
        }

        int caught = report.getBlockedCorrectly();
        int fraudulent = caught + report.getShouldHaveBlocked();
        double effectiveness = fraudulent == 0 ? 0.0 : Math.round(caught * 1000.0 / fraudulent) / 10.0;
        log.info("Auto-defense learning over {} events: created={}, updated={}, effectiveness={}%",
                report.getTotalReplayed(), created, changed.size() - created, effectiveness);
        return LearningResult.builder()
                .rulesCreated(created)
                .rulesUpdated(changed.size() - created)
                .learningEffectiveness(effectiveness)
                .rules(changed)
                .build();
    }

    private static DefenseRule rule(DefenseTarget target, String value, Evidence e, double confidence, Instant expiresAt) {
        return DefenseRule.builder()
                .target(target)
                .value(value)
                .reason("Learned from replay: " + e.fraudulent + " of " + e.total + " recent events fraudulent, "
                        + e.missed + " not blocked")
                .confidence((int) Math.round(confidence))
                .origin(DefenseRuleOrigin.THREAT_REPLAY)
                .expiresAt(expiresAt)
                .build();
    }

    private static Map<String, Evidence> evidenceBy(List<ReplayResult> results, Function<ReplayResult, String> key) {
        Map<String, Evidence> byKey = new LinkedHashMap<>();
        for (ReplayResult result : results) {
            String value = key.apply(result);
            if (value == null || value.isBlank() || UNKNOWN.equals(value)) {
                continue;
            }
            Evidence e = byKey.computeIfAbsent(value, v -> new Evidence());
            e.total++;
            if (result.isFraudulent()) e.fraudulent++;
            if (result.getOutcome() == ReplayOutcome.SHOULD_HAVE_BLOCKED) e.missed++;
        }
        return byKey;
    }

    private static final class Evidence {
        int total;
        int fraudulent;
        int missed;

        double rate() {
            return total == 0 ? 0.0 : (double) fraudulent / total;
        }
    }
}
