package com.giftcard.fraudguard.cluster;

import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.domain.LogSource;

import java.time.Instant;

/**
 * Fraud log fixtures for clustering tests.
 */
final class ClusterTestLogs {

    static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    static final String BROWSER_UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/124.0.0.0";

    private ClusterTestLogs() {
    }

    static FraudLog row(String id, String ip, String device, String userAgent, long secondsAfterT0) {
        return FraudLog.builder()
                .id(id)
                .ipAddress(ip)
                .deviceFingerprint(device)
                .userAgent(userAgent)
                .codeAttempted("****0001")
                .failureReason(FailureReason.INVALID_CODE)
                .severity(FraudSeverity.LOW)
                .blocked(true)
                .source(LogSource.GUARD)
                .timestamp(T0.plusSeconds(secondsAfterT0))
                .build();
    }
}
