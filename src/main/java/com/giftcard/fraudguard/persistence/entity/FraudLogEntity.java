package com.giftcard.fraudguard.persistence.entity;

import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.domain.LogSource;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only fraud log row. Every column is insert-only; there are no setters.
 */
@Entity
@Table(name = "fraud_logs", indexes = {
    @Index(name = "idx_fraud_log_timestamp", columnList = "event_time"),
    @Index(name = "idx_fraud_log_ip", columnList = "ip_address"),
    @Index(name = "idx_fraud_log_device", columnList = "device_fingerprint"),
    @Index(name = "idx_fraud_log_reason", columnList = "failure_reason")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudLogEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "ip_address", nullable = false, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Column(name = "device_fingerprint", length = 128, updatable = false)
    private String deviceFingerprint;

    @Column(name = "merchant_id", updatable = false)
    private String merchantId;

    @Column(name = "code_attempted", length = 32, updatable = false)
    private String codeAttempted;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", nullable = false, updatable = false)
    private FailureReason failureReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, updatable = false)
    private FraudSeverity severity;

    @Column(name = "blocked", nullable = false, updatable = false)
    private boolean blocked;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false)
    private LogSource source;

    @Column(name = "detail", length = 500, updatable = false)
    private String detail;

    @Column(name = "event_time", nullable = false, updatable = false)
    private Instant timestamp;
}
