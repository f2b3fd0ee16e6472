package com.giftcard.fraudguard.cluster;

import com.giftcard.fraudguard.domain.ClusterMetadata;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.domain.PatternType;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Cluster risk score (0..10) and severity (1..5). A pure function of the member logs:
 * volume weighted by pattern type, concentration on few IPs, the severity mix, how
 * tightly the logs are packed in time and whether they share one failure reason.
 */
public final class ClusterScorer {

    static final double MAX_SCORE = 10.0;
    private static final double MAX_CONCENTRATION_BONUS = 3.0;
    private static final double CONCENTRATION_FACTOR = 0.75;
    private static final double SINGLE_REASON_BONUS = 1.5;

    private ClusterScorer() {
    }

    public static double typeWeight(PatternType type) {
        switch (type) {
            case IP_BASED:
                return 1.5;
            case DEVICE_FINGERPRINT:
                return 2.0;
            default:
                return 1.0;
        }
    }

    public static double score(PatternType type, List<FraudLog> members) {
        int count = members.size();
        if (count == 0) return 0.0;
        ClusterMetadata metadata = metadata(members);

        double score = count * typeWeight(type);
        double perIp = (double) count / Math.max(1, metadata.getUniqueIps());
        score += Math.min(MAX_CONCENTRATION_BONUS, Math.max(0.0, (perIp - 1) * CONCENTRATION_FACTOR));
        score += members.stream()
                .mapToInt(m -> (m.getSeverity() != null ? m.getSeverity() : FraudSeverity.LOW).getWeight())
                .average()
                .orElse(1.0) - 1.0;
        score += timeProximityBonus(metadata.getTimeSpanMs());
        if (metadata.getThreatTypes().size() == 1) {
            score += SINGLE_REASON_BONUS;
        }
        return round2(Math.min(MAX_SCORE, score));
    }

    static double timeProximityBonus(long timeSpanMs) {
        if (timeSpanMs < 60_000L) return 3.0;
        if (timeSpanMs < 5 * 60_000L) return 2.0;
        if (timeSpanMs < 60 * 60_000L) return 1.0;
        return 0.0;
    }

    public static int severity(double score, int threatCount) {
        if (score >= 8.0 || threatCount >= 10) return 5;
        if (score >= 6.0 || threatCount >= 7) return 4;
        if (score >= 4.0 || threatCount >= 5) return 3;
        if (score >= 2.0 || threatCount >= 3) return 2;
        return 1;
    }

    public static ClusterMetadata metadata(List<FraudLog> members) {
        long min = members.stream().mapToLong(m -> m.getTimestamp().toEpochMilli()).min().orElse(0L);
        long max = members.stream().mapToLong(m -> m.getTimestamp().toEpochMilli()).max().orElse(0L);
        List<FailureReason> reasons = members.stream()
                .map(FraudLog::getFailureReason)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Comparator.comparing(Enum::name))
                .collect(Collectors.toList());
        return ClusterMetadata.builder()
                .uniqueIps((int) members.stream().map(FraudLog::getIpAddress).filter(Objects::nonNull).distinct().count())
                .uniqueDevices((int) members.stream().map(FraudLog::getDeviceFingerprint).filter(Objects::nonNull).distinct().count())
                .timeSpanMs(max - min)
                .threatTypes(reasons)
                .build();
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
