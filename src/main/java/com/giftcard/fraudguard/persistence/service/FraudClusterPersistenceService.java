package com.giftcard.fraudguard.persistence.service;

import com.giftcard.fraudguard.cluster.ClusterCandidate;
import com.giftcard.fraudguard.cluster.ClusterScorer;
import com.giftcard.fraudguard.cluster.ThreatClusterer;
import com.giftcard.fraudguard.domain.ClusterMetadata;
import com.giftcard.fraudguard.domain.ClusterPattern;
import com.giftcard.fraudguard.domain.ClusterStats;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudCluster;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.PatternType;
import com.giftcard.fraudguard.persistence.entity.ClusterPatternEntity;
import com.giftcard.fraudguard.persistence.entity.FraudClusterEntity;
import com.giftcard.fraudguard.persistence.repository.ClusterPatternRepository;
import com.giftcard.fraudguard.persistence.repository.FraudClusterRepository;
import com.giftcard.fraudguard.persistence.repository.FraudLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Persists fraud clusters and their patterns for the clustering engine and serves the
 * admin read side. Each create or merge runs in its own transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudClusterPersistenceService {

    private final FraudClusterRepository clusterRepository;
    private final ClusterPatternRepository patternRepository;
    private final FraudLogRepository fraudLogRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<FraudCluster> findOpenClusters(Instant lastSeenSince) {
        return clusterRepository.findByLastSeenAtGreaterThanEqualOrderByCreatedAtAscIdAsc(lastSeenSince).stream()
                .map(e -> toDomain(e, null))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Set<String> findAssignedFraudLogIds(Instant since) {
        return new HashSet<>(patternRepository.findAssignedFraudLogIdsSince(since));
    }

    @Transactional
    public FraudCluster create(ClusterCandidate candidate, String runId) {
        Instant now = clock.instant();
        List<FraudLog> members = candidate.getMembers();
        ClusterMetadata metadata = ClusterScorer.metadata(members);
        double score = ClusterScorer.score(candidate.getPatternType(), members);

        FraudClusterEntity entity = FraudClusterEntity.builder()
                .id(UUID.randomUUID().toString())
                .label(ThreatClusterer.label(candidate.getPatternType(), candidate.getGroupKey(),
                        members.size(), metadata.getTimeSpanMs()))
                .patternType(candidate.getPatternType())
                .groupKey(candidate.getGroupKey())
                .score(score)
                .severity(ClusterScorer.severity(score, members.size()))
                .threatCount(members.size())
                .firstSeenAt(members.get(0).getTimestamp())
                .lastSeenAt(members.get(members.size() - 1).getTimestamp())
                .createdAt(now)
                .updatedAt(now)
                .build();
        applyMetadata(entity, metadata);
        FraudClusterEntity saved = clusterRepository.save(entity);
        savePatterns(saved.getId(), candidate, runId);

        log.info("Created cluster: id={}, label={}, threats={}, score={}, severity={}",
                saved.getId(), saved.getLabel(), saved.getThreatCount(), saved.getScore(), saved.getSeverity());
        return toDomain(saved, null);
    }

    /**
     * Extend an open cluster. Metrics are recomputed over all members; score and severity
     * never go down.
     */
    @Transactional
    public FraudCluster merge(ClusterCandidate candidate, String runId) {
        FraudClusterEntity entity = clusterRepository.findById(candidate.getTarget().getId())
                .orElseThrow(() -> new IllegalStateException("Merge target cluster disappeared: " + candidate.getTarget().getId()));

        List<String> existingIds = patternRepository.findByClusterIdOrderByEventTimestampAscIdAsc(entity.getId()).stream()
                .map(ClusterPatternEntity::getFraudLogId)
                .collect(Collectors.toList());
        List<FraudLog> all = new ArrayList<>();
        fraudLogRepository.findAllById(existingIds).forEach(e -> all.add(FraudLogStore.toDomain(e)));
        all.addAll(candidate.getMembers());
        all.sort(Comparator.comparing(FraudLog::getTimestamp).thenComparing(FraudLog::getId));

        ClusterMetadata metadata = ClusterScorer.metadata(all);
        int threatCount = entity.getThreatCount() + candidate.getMembers().size();
        double score = Math.max(entity.getScore(), ClusterScorer.score(entity.getPatternType(), all));
        int severity = Math.max(entity.getSeverity(), ClusterScorer.severity(score, threatCount));

        entity.setScore(score);
        entity.setSeverity(severity);
        entity.setThreatCount(threatCount);
        entity.setLabel(ThreatClusterer.label(entity.getPatternType(), entity.getGroupKey(), threatCount, metadata.getTimeSpanMs()));
        applyMetadata(entity, metadata);
        Instant first = all.get(0).getTimestamp();
        Instant last = all.get(all.size() - 1).getTimestamp();
        entity.setFirstSeenAt(entity.getFirstSeenAt() == null || first.isBefore(entity.getFirstSeenAt()) ? first : entity.getFirstSeenAt());
        entity.setLastSeenAt(entity.getLastSeenAt() == null || last.isAfter(entity.getLastSeenAt()) ? last : entity.getLastSeenAt());
        entity.setUpdatedAt(clock.instant());
        FraudClusterEntity saved = clusterRepository.save(entity);
        savePatterns(saved.getId(), candidate, runId);

        log.info("Merged {} threats into cluster: id={}, threats={}, score={}, severity={}",
                candidate.getMembers().size(), saved.getId(), saved.getThreatCount(), saved.getScore(), saved.getSeverity());
        return toDomain(saved, null);
    }

    @Transactional(readOnly = true)
    public List<FraudCluster> recent(Integer limit) {
        int effective = FraudLogStore.clampLimit(limit);
        return clusterRepository.findByOrderByUpdatedAtDescIdAsc(PageRequest.of(0, effective)).stream()
                .map(e -> toDomain(e, null))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Optional<FraudCluster> findWithPatterns(String clusterId) {
        return clusterRepository.findById(clusterId).map(entity -> {
            List<ClusterPattern> patterns = patternRepository.findByClusterIdOrderByEventTimestampAscIdAsc(clusterId).stream()
                    .map(FraudClusterPersistenceService::toDomain)
                    .collect(Collectors.toList());
            return toDomain(entity, patterns);
        });
    }

    @Transactional(readOnly = true)
    public ClusterStats stats() {
        Map<String, Long> byType = new TreeMap<>();
        for (Object[] row : clusterRepository.countPerPatternType()) {
            byType.put(((PatternType) row[0]).getWireName(), ((Number) row[1]).longValue());
        }
        Double avg = clusterRepository.averageSeverity();
        return ClusterStats.builder()
                .totalClusters(clusterRepository.count())
                .recentClusters(clusterRepository.countByCreatedAtGreaterThanEqual(clock.instant().minus(Duration.ofHours(24))))
                .avgSeverity(avg == null ? 0.0 : Math.round(avg * 100.0) / 100.0)
                .patternTypes(byType)
                .build();
    }

    private void savePatterns(String clusterId, ClusterCandidate candidate, String runId) {
        List<ClusterPatternEntity> patterns = candidate.getMembers().stream()
                .map(m -> ClusterPatternEntity.builder()
                        .id(UUID.randomUUID().toString())
                        .clusterId(clusterId)
                        .fraudLogId(m.getId())
                        .similarity(candidate.getSimilarities().getOrDefault(m.getId(), 1.0))
                        .ipAddress(m.getIpAddress())
                        .userAgent(m.getUserAgent())
                        .deviceFingerprint(m.getDeviceFingerprint())
                        .eventTimestamp(m.getTimestamp())
                        .runId(runId)
                        .build())
                .collect(Collectors.toList());
        patternRepository.saveAll(patterns);
    }

    private static void applyMetadata(FraudClusterEntity entity, ClusterMetadata metadata) {
        entity.setUniqueIps(metadata.getUniqueIps());
        entity.setUniqueDevices(metadata.getUniqueDevices());
        entity.setTimeSpanMs(metadata.getTimeSpanMs());
        if (entity.getThreatTypes() == null) {
            entity.setThreatTypes(new HashSet<>());
        }
        entity.getThreatTypes().clear();
        entity.getThreatTypes().addAll(metadata.getThreatTypes());
    }

    static FraudCluster toDomain(FraudClusterEntity entity, List<ClusterPattern> patterns) {
        List<FailureReason> threatTypes = entity.getThreatTypes().stream()
                .sorted(Comparator.comparing(Enum::name))
                .collect(Collectors.toList());
        return FraudCluster.builder()
                .id(entity.getId())
                .label(entity.getLabel())
                .patternType(entity.getPatternType())
                .groupKey(entity.getGroupKey())
                .score(entity.getScore())
                .severity(entity.getSeverity())
                .threatCount(entity.getThreatCount())
                .metadata(ClusterMetadata.builder()
                        .uniqueIps(entity.getUniqueIps())
                        .uniqueDevices(entity.getUniqueDevices())
                        .timeSpanMs(entity.getTimeSpanMs())
                        .threatTypes(threatTypes)
                        .build())
                .firstSeenAt(entity.getFirstSeenAt())
                .lastSeenAt(entity.getLastSeenAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .patterns(patterns)
                .build();
    }

    static ClusterPattern toDomain(ClusterPatternEntity entity) {
        return ClusterPattern.builder()
                .id(entity.getId())
                .clusterId(entity.getClusterId())
                .fraudLogId(entity.getFraudLogId())
                .similarity(entity.getSimilarity())
                .runId(entity.getRunId())
                .metadata(ClusterPattern.Snapshot.builder()
                        .ipAddress(entity.getIpAddress())
                        .userAgent(entity.getUserAgent())
                        .deviceFingerprint(entity.getDeviceFingerprint())
                        .timestamp(entity.getEventTimestamp())
                        .build())
                .build();
    }
}
