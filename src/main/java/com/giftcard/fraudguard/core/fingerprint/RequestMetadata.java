package com.giftcard.fraudguard.core.fingerprint;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Map;

/**
 * Transport metadata of an inbound request: the socket's remote address and the header
 * set. Header names are matched case-insensitively.
 */
@Value
@Builder
public class RequestMetadata {

    String remoteAddress;
    @Singular
    Map<String, String> headers;

    public String header(String name) {
        if (headers == null || name == null) return null;
        String direct = headers.get(name);
        if (direct != null) return direct;
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().toLowerCase(Locale.ROOT).equals(lower)) {
                return e.getValue();
            }
        }
        return null;
    }
}
