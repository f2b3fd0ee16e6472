package com.giftcard.fraudguard.api;

import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/merchant")
@RequiredArgsConstructor
@Tag(name = "Merchant Threats", description = "Fraud activity against the calling merchant")
public class MerchantThreatController {

    private final FraudLogStore fraudLogStore;
    private final CallerAuthorizer callerAuthorizer;

    @GetMapping("/threat-logs")
    @Operation(summary = "The merchant's recent fraud logs",
            description = "Newest first, IPs masked. Requires the MERCHANT role and X-Merchant-Id. limit defaults to 50, capped at 500.")
    public ResponseEntity<Map<String, Object>> threatLogs(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @RequestHeader(value = CallerAuthorizer.MERCHANT_HEADER, required = false) String merchantId,
            @Parameter(description = "Max logs to return") @RequestParam(required = false) Integer limit) {
        String merchant = callerAuthorizer.requireMerchant(role, merchantId);
        List<MerchantThreatLogDto> logs = fraudLogStore.recentForMerchant(merchant, limit).stream()
                .map(MerchantThreatLogDto::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "threatLogs", logs,
                "total", logs.size()));
    }
}
