package com.giftcard.fraudguard.persistence.entity;

import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseTarget;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "defense_rules", indexes = {
    @Index(name = "idx_defense_target", columnList = "target, rule_value"),
    @Index(name = "idx_defense_active_expires", columnList = "active, expires_at"),
    @Index(name = "idx_defense_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefenseRuleEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "target", nullable = false)
    private DefenseTarget target;

    @Column(name = "rule_value", nullable = false)
    private String ruleValue;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "confidence", nullable = false)
    private int confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "origin", nullable = false)
    private DefenseRuleOrigin origin;

    @Column(name = "cluster_id")
    private String clusterId;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "hit_count", nullable = false)
    private long hitCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;
}
