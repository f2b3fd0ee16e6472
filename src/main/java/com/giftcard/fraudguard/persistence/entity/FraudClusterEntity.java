package com.giftcard.fraudguard.persistence.entity;

import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.PatternType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Persistent fraud cluster. Only the clustering engine writes these rows.
 */
@Entity
@Table(name = "fraud_clusters", indexes = {
    @Index(name = "idx_cluster_group", columnList = "pattern_type, group_key"),
    @Index(name = "idx_cluster_updated_at", columnList = "updated_at"),
    @Index(name = "idx_cluster_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudClusterEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "label", nullable = false)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false)
    private PatternType patternType;

    @Column(name = "group_key", nullable = false)
    private String groupKey;

    @Column(name = "score", nullable = false)
    private double score;

    @Column(name = "severity", nullable = false)
    private int severity;

    @Column(name = "threat_count", nullable = false)
    private int threatCount;

    @Column(name = "unique_ips", nullable = false)
    private int uniqueIps;

    @Column(name = "unique_devices", nullable = false)
    private int uniqueDevices;

    @Column(name = "time_span_ms", nullable = false)
    private long timeSpanMs;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "fraud_cluster_threat_types", joinColumns = @JoinColumn(name = "cluster_id"))
    @Column(name = "failure_reason", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Set<FailureReason> threatTypes = new HashSet<>();

    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
