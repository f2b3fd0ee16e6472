package com.giftcard.fraudguard.cluster;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Normalized user-agent signatures. Version numbers are collapsed so that
 * {@code python-requests/2.31.0} and {@code python-requests/2.28.1} share a signature.
 */
public final class UserAgentSignature {

    static final List<String> AUTOMATION_MARKERS = List.of(
            "bot", "crawler", "spider", "curl", "wget", "python", "headless", "java/", "okhttp", "go-http");

    private UserAgentSignature() {
    }

    public static String of(String userAgent) {
        String simplified = (userAgent == null ? "" : userAgent)
                .replaceAll("[\\d.]+", "X")
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
        return DigestUtils.md5DigestAsHex(simplified.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }

    /**
     * Blank, shorter than {@code shortLength}, or carrying an automation marker.
     */
    public static boolean isUnusual(String userAgent, int shortLength) {
        if (userAgent == null || userAgent.isBlank()) return true;
        String trimmed = userAgent.trim();
        if (trimmed.length() < shortLength) return true;
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return AUTOMATION_MARKERS.stream().anyMatch(lower::contains);
    }
}
