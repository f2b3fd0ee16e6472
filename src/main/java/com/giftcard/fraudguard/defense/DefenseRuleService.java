package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.alert.AlertEventType;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseStats;
import com.giftcard.fraudguard.persistence.service.DefenseRuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Write side of auto-defense. At most one rule is in force per target and value: a new
 * finding on an already blocked target strengthens the existing rule instead of adding
 * another. Changes reach the guard's registry before this returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefenseRuleService {

    private final DefenseRuleStore store;
    private final DefenseRuleRegistry registry;
    private final AlertBroadcaster alertBroadcaster;

    public synchronized DefenseRuleChange enforce(DefenseRule candidate) {
        Optional<DefenseRule> existing = store.findInForce(candidate.getTarget(), candidate.getValue());
        DefenseRuleChange change;
        if (existing.isPresent()) {
            DefenseRule strengthened = store.strengthen(existing.get().getId(), candidate.getConfidence(), candidate.getExpiresAt())
                    .orElse(existing.get());
            change = new DefenseRuleChange(strengthened, false);
            log.info("Defense rule {} strengthened: target={}, confidence={}, expiresAt={}",
                    strengthened.getId(), strengthened.getTarget(), strengthened.getConfidence(), strengthened.getExpiresAt());
        } else {
            DefenseRule created = store.create(candidate);
            change = new DefenseRuleChange(created, true);
            log.warn("Defense rule {} created: target={}, origin={}, confidence={}, expiresAt={}, reason={}",
                    created.getId(), created.getTarget(), created.getOrigin(), created.getConfidence(),
                    created.getExpiresAt(), created.getReason());
            alertBroadcaster.publish(AlertEventType.DEFENSE_ACTION, created);
        }
        registry.register(change.rule());
        return change;
    }

    /** Empty when no rule has this id. */
    public synchronized Optional<DefenseRule> deactivate(String id) {
        Optional<DefenseRule> rule = store.deactivate(id);
        rule.ifPresent(r -> {
            registry.unregister(r);
            log.info("Defense rule {} deactivated: target={}, hits={}", r.getId(), r.getTarget(), r.getHitCount());
        });
        return rule;
    }

    public List<DefenseRule> rules(Integer limit) {
        return store.recent(limit);
    }

    /** Rules raised by the cluster policy, newest first, including expired and deactivated ones. */
    public List<DefenseRule> clusterActions(Integer limit) {
        return store.recentByOrigin(DefenseRuleOrigin.CLUSTER_POLICY, limit);
    }

    public DefenseStats stats() {
        return store.stats();
    }
}
