package com.giftcard.fraudguard.core.fingerprint;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Set;

/**
 * Derives a stable (ip, device, user-agent) identity from request metadata.
 * Pure: no I/O, never rejects. Missing headers only lower the confidence.
 * <p>
 * Forwarded-address headers are believed only from configured trusted proxies; with no
 * proxies configured they are believed from any peer.
 */
@Component
public class FingerprintExtractor {

    public static final String DEVICE_HEADER = "X-Device-Fingerprint";
    static final String UNKNOWN_IP = "unknown";
    private static final int MAX_DEVICE_ID_LENGTH = 128;

    private final Set<String> trustedProxies;

    public FingerprintExtractor(FraudGuardProperties properties) {
        this.trustedProxies = new HashSet<>();
        for (String proxy : properties.getFingerprint().getTrustedProxies()) {
            String trimmed = trimToNull(proxy);
            if (trimmed != null) trustedProxies.add(trimmed);
        }
    }

    public Fingerprint extract(RequestMetadata metadata) {
        String userAgent = trimToNull(metadata.header("User-Agent"));
        String supplied = trimToNull(metadata.header(DEVICE_HEADER));

        String deviceId;
        FingerprintConfidence confidence;
        if (supplied != null) {
            deviceId = supplied.length() > MAX_DEVICE_ID_LENGTH ? supplied.substring(0, MAX_DEVICE_ID_LENGTH) : supplied;
            confidence = FingerprintConfidence.HIGH;
        } else {
            String acceptLanguage = trimToNull(metadata.header("Accept-Language"));
            String acceptEncoding = trimToNull(metadata.header("Accept-Encoding"));
            String accept = trimToNull(metadata.header("Accept"));
            boolean nothing = userAgent == null && acceptLanguage == null && acceptEncoding == null && accept == null;
            String material = String.join("|",
                    nullToEmpty(userAgent), nullToEmpty(acceptLanguage), nullToEmpty(acceptEncoding), nullToEmpty(accept));
            deviceId = sha256Hex(material).substring(0, 32);
            confidence = nothing ? FingerprintConfidence.DEGRADED : FingerprintConfidence.LOW;
        }

        return Fingerprint.builder()
                .ip(clientIp(metadata))
                .deviceId(deviceId)
                .userAgentHash(sha256Hex(nullToEmpty(userAgent)).substring(0, 16))
                .userAgent(userAgent)
                .confidence(confidence)
                .build();
    }

    String clientIp(RequestMetadata metadata) {
        String remote = trimToNull(metadata.getRemoteAddress());
        if (!trustedProxies.isEmpty() && (remote == null || !trustedProxies.contains(remote))) {
            return remote != null ? remote : UNKNOWN_IP;
        }
        String xff = metadata.header("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            String first = xff.split(",")[0].trim();
            if (!first.isEmpty()) return first;
        }
        String xri = metadata.header("X-Real-IP");
        if (xri != null && !xri.isBlank()) return xri.trim();
        return remote != null ? remote : UNKNOWN_IP;
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
