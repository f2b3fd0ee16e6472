package com.giftcard.fraudguard.api;

import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.alert.AlertEventType;
import com.giftcard.fraudguard.compliance.CodeMasker;
import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.FraudSeverity;
import com.giftcard.fraudguard.domain.LogSource;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Receives fraud alerts from external systems. Each alert becomes a non-blocking
 * SUSPICIOUS_ACTIVITY fraud log, so it takes part in clustering and statistics, and is
 * broadcast to live alert subscribers.
 */
@Slf4j
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Inbound fraud alerts from external systems")
public class FraudAlertWebhookController {

    private final FraudLogStore fraudLogStore;
    private final AlertBroadcaster alertBroadcaster;
    private final Clock clock;

    @PostMapping("/fraud-alert")
    @Operation(summary = "Report a fraud alert", description = "ip and reason are required; gan is stored masked")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert recorded and broadcast"),
            @ApiResponse(responseCode = "400", description = "Malformed alert")
    })
    public ResponseEntity<Map<String, Object>> fraudAlert(@Valid @RequestBody FraudAlertWebhookDto dto) {
        FraudLog fraudLog = FraudLog.builder()
                .ipAddress(dto.getIp().trim())
                .merchantId(dto.getMerchantId())
                .codeAttempted(dto.getGan() != null && !dto.getGan().isBlank() ? CodeMasker.maskCode(dto.getGan().trim()) : null)
                .failureReason(FailureReason.SUSPICIOUS_ACTIVITY)
                .severity(FraudSeverity.MEDIUM)
                .blocked(false)
                .source(LogSource.WEBHOOK)
                .detail(dto.getReason())
                .timestamp(dto.getTimestamp() != null ? dto.getTimestamp() : clock.instant())
                .build();

        FraudLog saved = fraudLogStore.append(fraudLog);
        log.info("Fraud alert received via webhook: ip={}, merchant={}, logId={}",
                CodeMasker.maskIp(saved.getIpAddress()), saved.getMerchantId(), saved.getId());
        alertBroadcaster.publish(AlertEventType.FRAUD_ALERT, saved);

        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Fraud alert processed"));
    }
}
