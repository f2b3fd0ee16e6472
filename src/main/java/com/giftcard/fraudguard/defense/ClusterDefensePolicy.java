package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseTarget;
import com.giftcard.fraudguard.domain.FraudCluster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Turns a created or grown cluster into a block on its group key. IP clusters block the
 * IP once severity reaches the configured minimum; device clusters block the device once
 * the score does. Block length is severity times the per-severity step, capped.
 * Velocity and user-agent clusters have no single key to block and raise nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterDefensePolicy {

    static final String UNKNOWN = "unknown";

    private final DefenseRuleService ruleService;
    private final FraudGuardProperties properties;
    private final Clock clock;

    public Optional<DefenseRuleChange> apply(FraudCluster cluster) {
        if (!properties.getDefense().isEnabled()) {
            return Optional.empty();
        }
        String key = cluster.getGroupKey();
        if (key == null || key.isBlank() || UNKNOWN.equals(key)) {
            return Optional.empty();
        }
        FraudGuardProperties.ClusterPolicy policy = properties.getDefense().getClusterPolicy();
        switch (cluster.getPatternType()) {
            case IP_BASED:
                if (cluster.getSeverity() < policy.getIpBlockMinSeverity()) {
                    return Optional.empty();
                }
                return Optional.of(ruleService.enforce(rule(cluster, DefenseTarget.IP,
                        blockFor(policy.getIpBlockPerSeverity(), cluster.getSeverity(), policy.getIpBlockMax()))));
            case DEVICE_FINGERPRINT:
                if (cluster.getScore() < policy.getDeviceBlockMinScore()) {
                    return Optional.empty();
                }
                return Optional.of(ruleService.enforce(rule(cluster, DefenseTarget.DEVICE,
                        blockFor(policy.getDeviceBlockPerSeverity(), cluster.getSeverity(), policy.getDeviceBlockMax()))));
            default:
                return Optional.empty();
        }
    }

    private DefenseRule rule(FraudCluster cluster, DefenseTarget target, Duration blockFor) {
        return DefenseRule.builder()
                .target(target)
                .value(cluster.getGroupKey())
                .reason("Cluster " + cluster.getLabel() + " (severity " + cluster.getSeverity()
                        + ", score " + cluster.getScore() + ")")
                .confidence(confidence(cluster.getScore()))
                .origin(DefenseRuleOrigin.CLUSTER_POLICY)
                .clusterId(cluster.getId())
                .expiresAt(clock.instant().plus(blockFor))
                .build();
    }

    static Duration blockFor(Duration perSeverity, int severity, Duration max) {
        Duration length = perSeverity.multipliedBy(Math.max(1, severity));
        return length.compareTo(max) > 0 ? max : length;
    }

    /** Cluster score 0..10 scaled to 0..100. */
    static int confidence(double score) {
        return (int) Math.max(0, Math.min(100, Math.round(score * 10)));
    }
}
