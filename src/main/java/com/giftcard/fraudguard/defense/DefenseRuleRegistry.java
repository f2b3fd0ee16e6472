package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseTarget;
import com.giftcard.fraudguard.persistence.service.DefenseRuleStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory index of the defense rules in force, consulted by the redemption guard on
 * every request without touching the database. The index is rebuilt from the store on a
 * fixed delay; rules created or deactivated in this process are applied immediately.
 * <p>
 * Hits are counted in memory and flushed to the store on each refresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefenseRuleRegistry {

    private final DefenseRuleStore store;
    private final FraudGuardProperties properties;
    private final Clock clock;

    private final Map<String, LongAdder> pendingHits = new ConcurrentHashMap<>();
    private volatile Map<String, DefenseRule> rules = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        try {
            refresh();
            log.info("DefenseRuleRegistry loaded {} rules in force (enabled={})",
                    rules.size(), properties.getDefense().isEnabled());
        } catch (Exception e) {
            log.warn("Defense rules not loaded at startup, retrying on the next refresh: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${fraudguard.defense.refresh-interval:PT30S}",
            initialDelayString = "${fraudguard.defense.refresh-interval:PT30S}")
    public void refreshScheduled() {
        try {
            refresh();
        } catch (Exception e) {
            log.error("Defense rule refresh failed, keeping {} cached rules", rules.size(), e);
        }
    }

    /** Flush pending hit counts, then reload the rules in force. */
    public void refresh() {
        flushHits();
        Map<String, DefenseRule> loaded = new ConcurrentHashMap<>();
        for (DefenseRule rule : store.findInForce()) {
            loaded.merge(key(rule.getTarget(), rule.getValue()), rule, DefenseRuleRegistry::laterExpiry);
        }
        rules = loaded;
    }

    /**
     * First rule in force covering the IP, then the device, then the merchant. A match
     * counts as a hit on the rule.
     */
    public Optional<DefenseRule> match(String ip, String deviceId, String merchantId) {
        Optional<DefenseRule> rule = find(ip, deviceId, merchantId);
        rule.ifPresent(r -> pendingHits.computeIfAbsent(r.getId(), id -> new LongAdder()).increment());
        return rule;
    }

    /** Like {@link #match} without counting a hit. */
    public Optional<DefenseRule> find(String ip, String deviceId, String merchantId) {
        if (!properties.getDefense().isEnabled()) {
            return Optional.empty();
        }
        Map<String, DefenseRule> current = rules;
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        DefenseRule rule = inForce(current, DefenseTarget.IP, ip, now);
        if (rule == null) rule = inForce(current, DefenseTarget.DEVICE, deviceId, now);
        if (rule == null) rule = inForce(current, DefenseTarget.MERCHANT, merchantId, now);
        return Optional.ofNullable(rule);
    }

    public void register(DefenseRule rule) {
        rules.merge(key(rule.getTarget(), rule.getValue()), rule,
                (existing, incoming) -> existing.getId().equals(incoming.getId()) ? incoming : laterExpiry(existing, incoming));
    }

    public void unregister(DefenseRule rule) {
        rules.computeIfPresent(key(rule.getTarget(), rule.getValue()),
                (k, existing) -> existing.getId().equals(rule.getId()) ? null : existing);
        log.debug("Defense rule {} removed from the registry: target={}", rule.getId(), rule.getTarget());
    }

    public int size() {
        return rules.size();
    }

    private void flushHits() {
        Instant now = clock.instant();
        for (Map.Entry<String, LongAdder> entry : pendingHits.entrySet()) {
            long hits = entry.getValue().sumThenReset();
            if (hits == 0) {
                continue;
            }
            try {
                store.recordHits(entry.getKey(), hits, now);
            } catch (RuntimeException e) {
                entry.getValue().add(hits);
                throw e;
            }
        }
    }

    private static DefenseRule inForce(Map<String, DefenseRule> current, DefenseTarget target, String value, Instant now) {
        if (value == null || value.isBlank()) {
            return null;
        }
        DefenseRule rule = current.get(key(target, value));
        return rule != null && rule.isInForce(now) ? rule : null;
    }

    private static DefenseRule laterExpiry(DefenseRule a, DefenseRule b) {
        return b.getExpiresAt().isAfter(a.getExpiresAt()) ? b : a;
    }

    static String key(DefenseTarget target, String value) {
        return target.name() + ":" + value;
    }
}
