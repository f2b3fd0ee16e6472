package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A block on one IP, device or merchant that the redemption guard enforces before any
 * rate check. Every rule expires; an admin can deactivate it earlier.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DefenseRule {

    String id;
    DefenseTarget target;
    String value;
    String reason;
    /** 0..100. */
    int confidence;
    DefenseRuleOrigin origin;
    /** Cluster that raised the rule; null for learned rules. */
    String clusterId;
    boolean active;
    /** Requests denied by this rule, as of the last hit flush. */
    long hitCount;
    Instant createdAt;
    Instant expiresAt;
    Instant lastTriggeredAt;
    Instant deactivatedAt;

    public boolean isInForce(Instant now) {
        return active && expiresAt != null && now.isBefore(expiresAt);
    }
}
