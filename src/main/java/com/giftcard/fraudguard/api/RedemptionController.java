package com.giftcard.fraudguard.api;

import com.giftcard.fraudguard.core.RedemptionGuard;
import com.giftcard.fraudguard.core.fingerprint.FingerprintExtractor;
import com.giftcard.fraudguard.core.fingerprint.RequestMetadata;
import com.giftcard.fraudguard.domain.GuardDecision;
import com.giftcard.fraudguard.domain.RedemptionAttempt;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Public gift-card redemption endpoint, guarded by {@link RedemptionGuard}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Redemption", description = "Redeem gift cards with replay and abuse protection")
public class RedemptionController {

    /** Headers the fingerprint is derived from. */
    static final List<String> FINGERPRINT_HEADERS = List.of(
            HttpHeaders.USER_AGENT, HttpHeaders.ACCEPT_LANGUAGE, HttpHeaders.ACCEPT_ENCODING, HttpHeaders.ACCEPT,
            "X-Forwarded-For", "X-Real-IP", FingerprintExtractor.DEVICE_HEADER);

    private final RedemptionGuard redemptionGuard;

    @PostMapping("/redeem")
    @Operation(
            summary = "Redeem a gift card",
            description = "Redeems the card identified by code. Requests are rate limited per IP, device and merchant, "
                    + "and a code can only ever be redeemed once. Send X-Device-Fingerprint for a stable device identity.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Redeemed. Body: { success: true, amount, remainingBalance }",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = RedemptionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Card inactive or rejected, or the request body is invalid"),
            @ApiResponse(responseCode = "403", description = "Card already redeemed, or the caller is blocked by a defense rule"),
            @ApiResponse(responseCode = "404", description = "Gift card not found"),
            @ApiResponse(responseCode = "429", description = "Too many attempts. Retry-After header gives the wait in seconds"),
            @ApiResponse(responseCode = "503", description = "Gift-card store unavailable, nothing was redeemed. Retry later")
    })
    public ResponseEntity<RedemptionResponseDto> redeem(@Valid @RequestBody RedemptionRequestDto dto,
                                                        HttpServletRequest httpRequest) {
        RedemptionAttempt attempt = RedemptionAttempt.builder()
                .code(dto.getCode().trim())
                .redeemedBy(dto.getRedeemedBy())
                .merchantId(dto.getMerchantId())
                .amount(dto.getAmount())
                .requestMetadata(requestMetadata(httpRequest))
                .build();

        GuardDecision decision = redemptionGuard.evaluate(attempt);
        if (decision.isAllowed()) {
            return ResponseEntity.ok(RedemptionResponseDto.allowed(decision));
        }

        switch (decision.getDenialCode()) {
            case RATE_LIMITED:
                long seconds = retryAfterSeconds(decision.getRetryAfter());
                return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                        .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                        .body(RedemptionResponseDto.rateLimited(seconds));
            case DEFENSE_BLOCKED:
                return ResponseEntity.status(HttpStatus.FORBIDDEN)
                        .body(RedemptionResponseDto.denied(RedemptionResponseDto.BLOCKED));
            case REPLAYED_CODE:
            case RESERVATION_CONFLICT:
                return ResponseEntity.status(HttpStatus.FORBIDDEN)
                        .body(RedemptionResponseDto.denied(RedemptionResponseDto.ALREADY_REDEEMED));
            case INVALID_CODE:
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(RedemptionResponseDto.denied(RedemptionResponseDto.NOT_FOUND));
            case REJECTED_CODE:
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(RedemptionResponseDto.denied(RedemptionResponseDto.REJECTED));
            default:
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(RedemptionResponseDto.denied(RedemptionResponseDto.UNAVAILABLE));
        }
    }

    /** Whole seconds, rounded up, never below one. */
    static long retryAfterSeconds(Duration retryAfter) {
        if (retryAfter == null) return 1L;
        long seconds = (retryAfter.toMillis() + 999) / 1000;
        return Math.max(1L, seconds);
    }

    private static RequestMetadata requestMetadata(HttpServletRequest request) {
        RequestMetadata.RequestMetadataBuilder builder = RequestMetadata.builder()
                .remoteAddress(request.getRemoteAddr());
        for (String name : FINGERPRINT_HEADERS) {
            String value = request.getHeader(name);
            if (value != null) {
                builder.header(name, value);
            }
        }
        return builder.build();
    }
}
