package com.giftcard.fraudguard.compliance;

import com.giftcard.fraudguard.domain.GuardDecision;
import com.giftcard.fraudguard.domain.RedemptionAttempt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of redemption attempts and their outcomes. Codes are masked; the audit
 * lines can be shipped to a dedicated retention store by log routing on the
 * {@code [AUDIT]} prefix.
 */
@Slf4j
@Component
public class RedemptionAuditLogger {

    public void logAttempt(RedemptionAttempt attempt, String clientIp) {
        log.info("[AUDIT] REDEMPTION_ATTEMPT code={} merchantId={} redeemedBy={} amount={} ip={}",
                CodeMasker.maskCode(attempt.getCode()),
                attempt.getMerchantId(),
                attempt.getRedeemedBy(),
                attempt.getAmount(),
                CodeMasker.maskIp(clientIp));
    }

    public void logDecision(RedemptionAttempt attempt, GuardDecision decision) {
        if (decision.isAllowed()) {
            log.info("[AUDIT] REDEMPTION_RESULT code={} merchantId={} allowed=true amount={} remainingBalance={}",
                    CodeMasker.maskCode(attempt.getCode()),
                    attempt.getMerchantId(),
                    decision.getAmount(),
                    decision.getRemainingBalance());
        } else {
            log.info("[AUDIT] REDEMPTION_RESULT code={} merchantId={} allowed=false denial={} reason={}",
                    CodeMasker.maskCode(attempt.getCode()),
                    attempt.getMerchantId(),
                    decision.getDenialCode(),
                    decision.getFailureReason());
        }
    }
}
