package com.giftcard.fraudguard.persistence.service;

import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseStats;
import com.giftcard.fraudguard.domain.DefenseTarget;
import com.giftcard.fraudguard.persistence.entity.DefenseRuleEntity;
import com.giftcard.fraudguard.persistence.repository.DefenseRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Persistence of defense rules. Rules are never deleted: deactivation and expiry keep the
 * row for the admin history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefenseRuleStore {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 500;

    private final DefenseRuleRepository repository;
    private final Clock clock;

    @Transactional
    public DefenseRule create(DefenseRule rule) {
        DefenseRuleEntity entity = DefenseRuleEntity.builder()
                .id(rule.getId() != null ? rule.getId() : UUID.randomUUID().toString())
                .target(rule.getTarget())
                .ruleValue(rule.getValue())
                .reason(truncate(rule.getReason(), 500))
                .confidence(clampConfidence(rule.getConfidence()))
                .origin(rule.getOrigin())
                .clusterId(rule.getClusterId())
                .active(true)
                .hitCount(0)
                .createdAt(clock.instant())
                .expiresAt(rule.getExpiresAt())
                .build();
        DefenseRuleEntity saved = repository.save(entity);
        log.debug("Persisted defense rule: id={}, target={}, origin={}, expiresAt={}",
                saved.getId(), saved.getTarget(), saved.getOrigin(), saved.getExpiresAt());
        return toDomain(saved);
    }

    /** The in-force rule on {@code target}/{@code value} that expires last, if any. */
    @Transactional(readOnly = true)
    public Optional<DefenseRule> findInForce(DefenseTarget target, String value) {
        return repository.findFirstByTargetAndRuleValueAndActiveTrueAndExpiresAtAfterOrderByExpiresAtDesc(
                        target, value, clock.instant())
                .map(DefenseRuleStore::toDomain);
    }

    @Transactional(readOnly = true)
    public List<DefenseRule> findInForce() {
        return repository.findByActiveTrueAndExpiresAtAfter(clock.instant()).stream()
                .map(DefenseRuleStore::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Raises confidence and pushes out the expiry of an existing rule. Neither value ever
     * goes down.
     */
    @Transactional
    public Optional<DefenseRule> strengthen(String id, int confidence, Instant expiresAt) {
        return repository.findById(id).map(entity -> {
            entity.setConfidence(Math.max(entity.getConfidence(), clampConfidence(confidence)));
            if (expiresAt != null && expiresAt.isAfter(entity.getExpiresAt())) {
                entity.setExpiresAt(expiresAt);
            }
            return toDomain(repository.save(entity));
        });
    }

    /** Empty when no rule has this id. Deactivating an inactive rule is a no-op. */
    @Transactional
    public Optional<DefenseRule> deactivate(String id) {
        return repository.findById(id).map(entity -> {
            if (entity.isActive()) {
                entity.setActive(false);
                entity.setDeactivatedAt(clock.instant());
                entity = repository.save(entity);
            }
            return toDomain(entity);
        });
    }

    @Transactional
    public void recordHits(String id, long hits, Instant at) {
        if (repository.addHits(id, hits, at) == 0) {
            log.debug("Dropped {} hits for missing defense rule {}", hits, id);
        }
    }

    /** Newest first. {@code limit} is clamped to 1..500; null means 100. */
    @Transactional(readOnly = true)
    public List<DefenseRule> recent(Integer limit) {
        return repository.findByOrderByCreatedAtDescIdDesc(PageRequest.of(0, clampLimit(limit))).stream()
                .map(DefenseRuleStore::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<DefenseRule> recentByOrigin(DefenseRuleOrigin origin, Integer limit) {
        return repository.findByOriginOrderByCreatedAtDescIdDesc(origin, PageRequest.of(0, clampLimit(limit))).stream()
                .map(DefenseRuleStore::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DefenseStats stats() {
        Instant now = clock.instant();
        List<DefenseRuleEntity> inForce = repository.findByActiveTrueAndExpiresAtAfter(now);
        double avgConfidence = inForce.stream().mapToInt(DefenseRuleEntity::getConfidence).average().orElse(0.0);
        return DefenseStats.builder()
                .totalRules(repository.count())
                .activeRules(inForce.size())
                .blockedIps(countTarget(inForce, DefenseTarget.IP))
                .blockedDevices(countTarget(inForce, DefenseTarget.DEVICE))
                .quarantinedMerchants(countTarget(inForce, DefenseTarget.MERCHANT))
                .triggeredLast24h(repository.countByLastTriggeredAtGreaterThanEqual(now.minus(Duration.ofHours(24))))
                .averageConfidence(Math.round(avgConfidence * 10.0) / 10.0)
                .build();
    }

    private static long countTarget(List<DefenseRuleEntity> rules, DefenseTarget target) {
        return rules.stream().filter(r -> r.getTarget() == target).count();
    }

    static int clampLimit(Integer limit) {
        if (limit == null) return DEFAULT_LIMIT;
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private static int clampConfidence(int confidence) {
        return Math.max(0, Math.min(100, confidence));
    }

    static DefenseRule toDomain(DefenseRuleEntity entity) {
        return DefenseRule.builder()
                .id(entity.getId())
                .target(entity.getTarget())
                .value(entity.getRuleValue())
                .reason(entity.getReason())
                .confidence(entity.getConfidence())
                .origin(entity.getOrigin())
                .clusterId(entity.getClusterId())
                .active(entity.isActive())
                .hitCount(entity.getHitCount())
                .createdAt(entity.getCreatedAt())
                .expiresAt(entity.getExpiresAt())
                .lastTriggeredAt(entity.getLastTriggeredAt())
                .deactivatedAt(entity.getDeactivatedAt())
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
