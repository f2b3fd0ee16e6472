package com.giftcard.fraudguard.api;

import org.springframework.stereotype.Component;

/**
 * Checks the caller role and merchant id forwarded by the host's authentication layer.
 * Tokens are never parsed here; the headers are trusted as-is.
 */
@Component
public class CallerAuthorizer {

    public static final String ROLE_HEADER = "X-Caller-Role";
    public static final String MERCHANT_HEADER = "X-Merchant-Id";
    static final String ADMIN_ROLE = "ADMIN";
    static final String MERCHANT_ROLE = "MERCHANT";

    public void requireAdmin(String role) {
        if (!hasRole(role, ADMIN_ROLE)) {
            throw new CallerAccessDeniedException("Admin role required");
        }
    }

    /**
     * Merchants and admins may read merchant-scoped data; the merchant id header names
     * which merchant.
     *
     * @return the trimmed merchant id
     */
    public String requireMerchant(String role, String merchantId) {
        if (!hasRole(role, MERCHANT_ROLE) && !hasRole(role, ADMIN_ROLE)) {
            throw new CallerAccessDeniedException("Merchant role required");
        }
        if (merchantId == null || merchantId.isBlank()) {
            throw new IllegalArgumentException(MERCHANT_HEADER + " header is required");
        }
        return merchantId.trim();
    }

    private static boolean hasRole(String role, String expected) {
        return role != null && expected.equalsIgnoreCase(role.trim());
    }
}
