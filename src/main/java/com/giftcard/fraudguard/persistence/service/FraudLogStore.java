package com.giftcard.fraudguard.persistence.service;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudStatistics;
import com.giftcard.fraudguard.persistence.entity.FraudLogEntity;
import com.giftcard.fraudguard.persistence.repository.FraudLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only persistence of {@link FraudLog} rows plus the read side used by monitoring
 * and clustering. Write failures propagate: the redemption guard decides what to do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudLogStore {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;
    private static final int TOP_REASONS = 5;
    private static final int HOURLY_BUCKETS = 24;

    private final FraudLogRepository repository;
    private final FraudGuardProperties properties;
    private final Clock clock;

    @Transactional
    public FraudLog append(FraudLog fraudLog) {
        FraudLogEntity entity = FraudLogEntity.builder()
                .id(fraudLog.getId() != null ? fraudLog.getId() : UUID.randomUUID().toString())
                .ipAddress(fraudLog.getIpAddress())
                .userAgent(truncate(fraudLog.getUserAgent(), 512))
                .deviceFingerprint(fraudLog.getDeviceFingerprint())
                .merchantId(fraudLog.getMerchantId())
                .codeAttempted(fraudLog.getCodeAttempted())
                .failureReason(fraudLog.getFailureReason())
                .severity(fraudLog.getSeverity())
                .blocked(fraudLog.isBlocked())
                .source(fraudLog.getSource())
                .detail(truncate(fraudLog.getDetail(), 500))
                .timestamp(fraudLog.getTimestamp() != null ? fraudLog.getTimestamp() : clock.instant())
                .build();
        FraudLogEntity saved = repository.save(entity);
        log.debug("Persisted fraud log: id={}, reason={}, severity={}, blocked={}",
                saved.getId(), saved.getFailureReason(), saved.getSeverity(), saved.isBlocked());
        return toDomain(saved);
    }

    /**
     * Newest first. {@code limit} is clamped to 1..500; null means 50.
     */
    @Transactional(readOnly = true)
    public List<FraudLog> recent(Integer limit) {
        int effective = clampLimit(limit);
        return repository.findByOrderByTimestampDescIdDesc(PageRequest.of(0, effective)).stream()
                .map(FraudLogStore::toDomain)
                .collect(Collectors.toList());
    }

    /** Newest first, only rows carrying {@code merchantId}. Same limit clamping as {@link #recent}. */
    @Transactional(readOnly = true)
    public List<FraudLog> recentForMerchant(String merchantId, Integer limit) {
        return repository.findByMerchantIdOrderByTimestampDescIdDesc(merchantId, PageRequest.of(0, clampLimit(limit))).stream()
                .map(FraudLogStore::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Rows at or after {@code since} not yet assigned to a cluster, oldest first (ties by id).
     * When there are more than the per-run maximum, the newest ones are returned so a
     * backlog of unclusterable rows never hides fresh activity.
     */
    @Transactional(readOnly = true)
    public List<FraudLog> findUnclusteredSince(Instant since) {
        int max = properties.getClustering().getMaxLogsPerRun();
        List<FraudLog> rows = repository.findUnclusteredSince(since, PageRequest.of(0, max)).stream()
                .map(FraudLogStore::toDomain)
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(rows);
        if (rows.size() == max) {
            log.info("Clustering read hit the per-run maximum of {} rows; older unclustered rows wait for a later run", max);
        }
        return rows;
    }

    @Transactional(readOnly = true)
    public FraudStatistics statistics() {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofHours(24));

        long total = repository.count();
        long blocked = repository.countByBlockedTrue();
        double blockRate = total == 0 ? 0.0 : Math.round(blocked * 10000.0 / total) / 10000.0;

        List<FraudStatistics.ReasonCount> topReasons = new ArrayList<>();
        for (Object[] row : repository.countByReasonSince(since)) {
            if (topReasons.size() >= TOP_REASONS) break;
            topReasons.add(FraudStatistics.ReasonCount.builder()
                    .reason((FailureReason) row[0])
                    .count(((Number) row[1]).longValue())
                    .build());
        }

        return FraudStatistics.builder()
                .totalAttempts(total)
                .blocked(blocked)
                .blockRate(blockRate)
                .last24Hours(repository.countByTimestampGreaterThanEqual(since))
                .uniqueIps24h(repository.countDistinctIpSince(since))
                .topThreatTypes(topReasons)
                .hourlyBuckets(hourlyBuckets(now))
                .build();
    }

    private List<FraudStatistics.HourlyBucket> hourlyBuckets(Instant now) {
        Instant currentHour = now.truncatedTo(ChronoUnit.HOURS);
        Instant firstHour = currentHour.minus(Duration.ofHours(HOURLY_BUCKETS - 1));
        long[] counts = new long[HOURLY_BUCKETS];
        for (Instant ts : repository.findTimestampsSince(firstHour)) {
            int index = (int) Duration.between(firstHour, ts).toHours();
            if (index >= 0 && index < HOURLY_BUCKETS) {
                counts[index]++;
            }
        }
        List<FraudStatistics.HourlyBucket> buckets = new ArrayList<>(HOURLY_BUCKETS);
        for (int i = 0; i < HOURLY_BUCKETS; i++) {
            buckets.add(FraudStatistics.HourlyBucket.builder()
                    .hourStart(firstHour.plus(Duration.ofHours(i)))
                    .count(counts[i])
                    .build());
        }
        return buckets;
    }

    static int clampLimit(Integer limit) {
        if (limit == null) return DEFAULT_LIMIT;
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    static FraudLog toDomain(FraudLogEntity entity) {
        return FraudLog.builder()
                .id(entity.getId())
                .ipAddress(entity.getIpAddress())
                .userAgent(entity.getUserAgent())
                .deviceFingerprint(entity.getDeviceFingerprint())
                .merchantId(entity.getMerchantId())
                .codeAttempted(entity.getCodeAttempted())
                .failureReason(entity.getFailureReason())
                .severity(entity.getSeverity())
                .blocked(entity.isBlocked())
                .source(entity.getSource())
                .detail(entity.getDetail())
                .timestamp(entity.getTimestamp())
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
