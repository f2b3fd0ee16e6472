package com.giftcard.fraudguard.cluster;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.FraudCluster;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.PatternType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups fraud logs into cluster candidates. Pure and deterministic: the output depends
 * only on the rows, the ids already assigned to a cluster and the open clusters.
 * <p>
 * Pattern types are tried in declaration order of {@link PatternType}; a row taken by an
 * earlier type is not offered to later ones, and rows already assigned in an earlier run
 * are never offered at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreatClusterer {

    static final String VELOCITY_KEY = "velocity";
    private static final String UNKNOWN_IP = "unknown";
    private static final Comparator<FraudLog> EVENT_ORDER =
            Comparator.comparing(FraudLog::getTimestamp).thenComparing(FraudLog::getId);

    private final FraudGuardProperties properties;

    public GroupingResult group(List<FraudLog> rows, Set<String> alreadyAssigned, List<FraudCluster> openClusters) {
        List<FraudLog> valid = new ArrayList<>(rows.size());
        int skipped = 0;
        for (FraudLog row : rows) {
            if (row == null || row.getId() == null || row.getTimestamp() == null || row.getFailureReason() == null) {
                skipped++;
                continue;
            }
            valid.add(row);
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed fraud log rows (MALFORMED_LOG_ROW)", skipped);
        }
        valid.sort(EVENT_ORDER);

        Set<String> taken = new HashSet<>(alreadyAssigned);
        List<ClusterCandidate> candidates = new ArrayList<>();
        for (PatternType type : PatternType.values()) {
            List<FraudLog> pool = valid.stream()
                    .filter(row -> !taken.contains(row.getId()))
                    .collect(Collectors.toList());
            List<ClusterCandidate> found = type == PatternType.VELOCITY
                    ? groupVelocity(pool, openClusters)
                    : groupByKey(type, pool, openClusters);
            for (ClusterCandidate candidate : found) {
                candidate.getMembers().forEach(m -> taken.add(m.getId()));
            }
            candidates.addAll(found);
        }
        int analyzed = (int) valid.stream().filter(row -> !alreadyAssigned.contains(row.getId())).count();
        return new GroupingResult(candidates, skipped, analyzed);
    }

    private List<ClusterCandidate> groupByKey(PatternType type, List<FraudLog> pool, List<FraudCluster> openClusters) {
        FraudGuardProperties.Grouping grouping = grouping(type);
        Duration window = grouping.getWindow();

        Map<String, List<FraudLog>> byKey = new TreeMap<>();
        for (FraudLog row : pool) {
            String key = keyOf(type, row);
            if (key != null) {
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        double similarity = type == PatternType.USER_AGENT
                ? properties.getClustering().getUserAgent().getSimilarity()
                : 1.0;
        List<ClusterCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, List<FraudLog>> entry : byKey.entrySet()) {
            for (List<FraudLog> session : sessions(entry.getValue(), window)) {
                FraudCluster target = findOpen(openClusters, type, entry.getKey(), session.get(0).getTimestamp(), window);
                if (target == null && !qualifies(type, session, grouping)) {
                    continue;
                }
                Map<String, Double> similarities = new LinkedHashMap<>();
                session.forEach(m -> similarities.put(m.getId(), similarity));
                candidates.add(new ClusterCandidate(type, entry.getKey(), target, session, similarities));
            }
        }
        return candidates;
    }

    private boolean qualifies(PatternType type, List<FraudLog> session, FraudGuardProperties.Grouping grouping) {
        if (session.size() < grouping.getMinThreatCount()) return false;
        if (type == PatternType.USER_AGENT) {
            long distinctIps = session.stream().map(FraudLog::getIpAddress).filter(Objects::nonNull).distinct().count();
            return distinctIps >= properties.getClustering().getUserAgent().getMinDistinctIps();
        }
        return true;
    }

    private List<ClusterCandidate> groupVelocity(List<FraudLog> pool, List<FraudCluster> openClusters) {
        FraudGuardProperties.Grouping grouping = properties.getClustering().getVelocity();
        Duration window = grouping.getWindow();
        List<ClusterCandidate> candidates = new ArrayList<>();
        for (List<FraudLog> chain : sessions(pool, window)) {
            FraudCluster target = findOpen(openClusters, PatternType.VELOCITY, VELOCITY_KEY, chain.get(0).getTimestamp(), window);
            if (target == null && !hasBurst(chain, grouping.getMinThreatCount(), window)) {
                continue;
            }
            candidates.add(new ClusterCandidate(PatternType.VELOCITY, VELOCITY_KEY, target, chain,
                    velocitySimilarities(chain, target, window)));
        }
        return candidates;
    }

    /**
     * True when some {@code minCount} consecutive rows of the chain fall inside {@code window}.
     */
    static boolean hasBurst(List<FraudLog> chain, int minCount, Duration window) {
        for (int i = 0; i + minCount - 1 < chain.size(); i++) {
            Duration span = Duration.between(chain.get(i).getTimestamp(), chain.get(i + minCount - 1).getTimestamp());
            if (span.compareTo(window) <= 0) return true;
        }
        return false;
    }

    private static Map<String, Double> velocitySimilarities(List<FraudLog> chain, FraudCluster target, Duration window) {
        double windowMs = window.toMillis();
        Map<String, Double> similarities = new LinkedHashMap<>();
        for (int i = 0; i < chain.size(); i++) {
            long nearest = Long.MAX_VALUE;
            long ts = chain.get(i).getTimestamp().toEpochMilli();
            if (i > 0) nearest = Math.min(nearest, ts - chain.get(i - 1).getTimestamp().toEpochMilli());
            if (i < chain.size() - 1) nearest = Math.min(nearest, chain.get(i + 1).getTimestamp().toEpochMilli() - ts);
            if (nearest == Long.MAX_VALUE && target != null && target.getLastSeenAt() != null) {
                nearest = Math.abs(ts - target.getLastSeenAt().toEpochMilli());
            }
            double similarity = nearest == Long.MAX_VALUE ? 0.0 : Math.max(0.0, 1.0 - nearest / windowMs);
            similarities.put(chain.get(i).getId(), ClusterScorer.round2(similarity));
        }
        return similarities;
    }

    /**
     * Split time-ordered rows wherever the gap between neighbours exceeds {@code window}.
     */
    static List<List<FraudLog>> sessions(List<FraudLog> ordered, Duration window) {
        List<List<FraudLog>> sessions = new ArrayList<>();
        List<FraudLog> current = new ArrayList<>();
        for (FraudLog row : ordered) {
            if (!current.isEmpty()) {
                Instant previous = current.get(current.size() - 1).getTimestamp();
                if (Duration.between(previous, row.getTimestamp()).compareTo(window) > 0) {
                    sessions.add(current);
                    current = new ArrayList<>();
                }
            }
            current.add(row);
        }
        if (!current.isEmpty()) sessions.add(current);
        return sessions;
    }

    /**
     * Open cluster of the same type and key whose newest member is within {@code window}
     * of {@code sessionStart}; the most recently active one when there are several.
     */
    static FraudCluster findOpen(List<FraudCluster> openClusters, PatternType type, String groupKey,
                                 Instant sessionStart, Duration window) {
        Instant horizon = sessionStart.minus(window);
        FraudCluster best = null;
        for (FraudCluster cluster : openClusters) {
            if (cluster.getPatternType() != type || !groupKey.equals(cluster.getGroupKey())) continue;
            if (cluster.getLastSeenAt() == null || cluster.getLastSeenAt().isBefore(horizon)) continue;
            if (best == null || cluster.getLastSeenAt().isAfter(best.getLastSeenAt())) {
                best = cluster;
            }
        }
        return best;
    }

    private String keyOf(PatternType type, FraudLog row) {
        switch (type) {
            case IP_BASED:
                String ip = row.getIpAddress();
                return ip == null || ip.isBlank() || UNKNOWN_IP.equals(ip) ? null : ip;
            case DEVICE_FINGERPRINT:
                String device = row.getDeviceFingerprint();
                return device == null || device.isBlank() ? null : device;
            case USER_AGENT:
                int shortLength = properties.getClustering().getUserAgent().getShortLength();
                return UserAgentSignature.isUnusual(row.getUserAgent(), shortLength)
                        ? UserAgentSignature.of(row.getUserAgent())
                        : null;
            default:
                return null;
        }
    }

    private FraudGuardProperties.Grouping grouping(PatternType type) {
        FraudGuardProperties.Clustering clustering = properties.getClustering();
        switch (type) {
            case IP_BASED:
                return clustering.getIp();
            case DEVICE_FINGERPRINT:
                return clustering.getDevice();
            case USER_AGENT:
                return clustering.getUserAgent();
            default:
                return clustering.getVelocity();
        }
    }

    public static String label(PatternType type, String groupKey, int threatCount, long timeSpanMs) {
        switch (type) {
            case IP_BASED:
                return "IP Cluster: " + groupKey;
            case DEVICE_FINGERPRINT:
                return "Device Cluster: " + (groupKey.length() > 8 ? groupKey.substring(0, 8) + "..." : groupKey);
            case VELOCITY:
                return "Velocity Attack: " + threatCount + " threats in " + Math.max(1L, (timeSpanMs + 999) / 1000) + "s";
            default:
                return "User Agent Pattern: " + groupKey;
        }
    }
}
