package com.giftcard.fraudguard.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DefenseStats {

    long totalRules;
    /** Active and not yet expired. */
    long activeRules;
    long blockedIps;
    long blockedDevices;
    long quarantinedMerchants;
    long triggeredLast24h;
    /** Mean confidence of the rules in force, one decimal; 0 when none. */
    double averageConfidence;
}
