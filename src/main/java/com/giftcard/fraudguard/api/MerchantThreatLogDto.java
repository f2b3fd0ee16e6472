package com.giftcard.fraudguard.api;

import com.giftcard.fraudguard.compliance.CodeMasker;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fraud log as a merchant sees it: no device fingerprint, user agent or code, and the
 * IP with its last octet masked.
 */
@Value
@Builder
public class MerchantThreatLogDto {

    String id;
    Instant timestamp;
    FailureReason type;
    FraudSeverity severity;
    String ipAddress;
    boolean blocked;
    String description;

    public static MerchantThreatLogDto from(FraudLog fraudLog) {
        return MerchantThreatLogDto.builder()
                .id(fraudLog.getId())
                .timestamp(fraudLog.getTimestamp())
                .type(fraudLog.getFailureReason())
                .severity(fraudLog.getSeverity())
                .ipAddress(CodeMasker.maskIp(fraudLog.getIpAddress()))
                .blocked(fraudLog.isBlocked())
                .description(fraudLog.getDetail())
                .build();
    }
}
