package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replays the most recent fraud logs against the defense rules in force and classifies
 * each one. Read-only: replay never counts as a rule hit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreatReplayService {

    static final int MAX_LIMIT = 500;

    private final FraudLogStore fraudLogStore;
    private final DefenseRuleRegistry registry;
    private final FraudGuardProperties properties;
    private final Clock clock;

    /**
     * @param limit events to replay, clamped to 1..500; null means the configured replay limit
     */
    public ThreatReplayReport replay(Integer limit) {
        int effective = limit == null
                ? properties.getDefense().getReplayLimit()
                : Math.max(1, Math.min(MAX_LIMIT, limit));
        List<FraudLog> logs = fraudLogStore.recent(effective);

        List<ReplayResult> results = new ArrayList<>(logs.size());
        int[] counts = new int[ReplayOutcome.values().length];
        for (FraudLog fraudLog : logs) {
            Optional<DefenseRule> rule = registry.find(
                    fraudLog.getIpAddress(), fraudLog.getDeviceFingerprint(), fraudLog.getMerchantId());
            boolean fraudulent = isFraudulent(fraudLog);
            ReplayOutcome outcome = classify(fraudulent, rule.isPresent());
            counts[outcome.ordinal()]++;
            results.add(ReplayResult.builder()
                    .fraudLogId(fraudLog.getId())
                    .timestamp(fraudLog.getTimestamp())
                    .ipAddress(fraudLog.getIpAddress())
                    .deviceFingerprint(fraudLog.getDeviceFingerprint())
                    .merchantId(fraudLog.getMerchantId())
                    .failureReason(fraudLog.getFailureReason())
                    .severity(fraudLog.getSeverity())
                    .originallyBlocked(fraudLog.isBlocked())
                    .fraudulent(fraudulent)
                    .matchedRuleId(rule.map(DefenseRule::getId).orElse(null))
                    .outcome(outcome)
                    .build());
        }

        int correct = counts[ReplayOutcome.BLOCKED_CORRECTLY.ordinal()] + counts[ReplayOutcome.IGNORED.ordinal()];
        double accuracy = results.isEmpty() ? 0.0 : Math.round(correct * 10000.0 / results.size()) / 10000.0;
        log.info("Threat replay over {} events: blockedCorrectly={}, shouldHaveBlocked={}, falsePositives={}, ignored={}",
                results.size(), counts[ReplayOutcome.BLOCKED_CORRECTLY.ordinal()],
                counts[ReplayOutcome.SHOULD_HAVE_BLOCKED.ordinal()], counts[ReplayOutcome.FALSE_POSITIVE.ordinal()],
                counts[ReplayOutcome.IGNORED.ordinal()]);
        return ThreatReplayReport.builder()
                .totalReplayed(results.size())
                .blockedCorrectly(counts[ReplayOutcome.BLOCKED_CORRECTLY.ordinal()])
                .shouldHaveBlocked(counts[ReplayOutcome.SHOULD_HAVE_BLOCKED.ordinal()])
                .falsePositives(counts[ReplayOutcome.FALSE_POSITIVE.ordinal()])
                .ignored(counts[ReplayOutcome.IGNORED.ordinal()])
                .accuracy(accuracy)
                .replayedAt(clock.instant())
                .results(results)
                .build();
    }

    static boolean isFraudulent(FraudLog fraudLog) {
        return fraudLog.getSeverity() != null
                && fraudLog.getSeverity().getWeight() >= FraudSeverity.MEDIUM.getWeight();
    }

    static ReplayOutcome classify(boolean fraudulent, boolean covered) {
        if (covered) {
            return fraudulent ? ReplayOutcome.BLOCKED_CORRECTLY : ReplayOutcome.FALSE_POSITIVE;
        }
        return fraudulent ? ReplayOutcome.SHOULD_HAVE_BLOCKED : ReplayOutcome.IGNORED;
    }
}
