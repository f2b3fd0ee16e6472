package com.giftcard.fraudguard.core.fingerprint;

import lombok.Builder;
import lombok.Value;

/**
 * Identity tuple used to key rate limits and fraud logs.
 */
@Value
@Builder
public class Fingerprint {

    String ip;
    String deviceId;
    String userAgentHash;
    /** Raw user agent, kept for fraud logs and user-agent clustering. */
    String userAgent;
    FingerprintConfidence confidence;
}
