package com.giftcard.fraudguard.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Assignment of a fraud log to a cluster. The unique constraint on {@code fraud_log_id}
 * keeps a log in at most one cluster.
 */
@Entity
@Table(name = "cluster_patterns",
        uniqueConstraints = @UniqueConstraint(name = "uk_cluster_pattern_fraud_log", columnNames = "fraud_log_id"),
        indexes = {
            @Index(name = "idx_cluster_pattern_cluster", columnList = "cluster_id"),
            @Index(name = "idx_cluster_pattern_event_time", columnList = "event_time")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterPatternEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "cluster_id", nullable = false, updatable = false)
    private String clusterId;

    @Column(name = "fraud_log_id", nullable = false, updatable = false)
    private String fraudLogId;

    @Column(name = "similarity", nullable = false, updatable = false)
    private double similarity;

    @Column(name = "ip_address", updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Column(name = "device_fingerprint", length = 128, updatable = false)
    private String deviceFingerprint;

    @Column(name = "event_time", updatable = false)
    private Instant eventTimestamp;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;
}
