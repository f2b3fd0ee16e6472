package com.giftcard.fraudguard.compliance;

/**
 * Redacts redemption codes and client identifiers so they are safe to log and store.
 * A full code is never written anywhere outside the gift-card store.
 */
public final class CodeMasker {

    private static final int VISIBLE_CHARS = 4;
    private static final String MASK = "****";

    private CodeMasker() {}

    /** Keeps the last four characters (e.g. "GAN-1234-5678" -> "****5678"). */
    public static String maskCode(String code) {
        if (code == null || code.isBlank()) return null;
        String trimmed = code.trim();
        if (trimmed.length() <= VISIBLE_CHARS) return MASK;
        return MASK + trimmed.substring(trimmed.length() - VISIBLE_CHARS);
    }

    /** Drops the last IPv4 octet or the tail of an IPv6 address (e.g. "10.1.2.3" -> "10.1.2.***"). */
    public static String maskIp(String ip) {
        if (ip == null || ip.isBlank()) return null;
        int dot = ip.lastIndexOf('.');
        if (dot > 0) return ip.substring(0, dot) + ".***";
        int colon = ip.lastIndexOf(':');
        if (colon > 0) return ip.substring(0, colon) + ":***";
        return "***";
    }

    /** First eight characters of a device id. */
    public static String maskDevice(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) return null;
        return deviceId.length() <= 8 ? MASK : deviceId.substring(0, 8) + "...";
    }
}
