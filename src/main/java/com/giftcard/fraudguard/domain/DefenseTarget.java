package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a defense rule blocks. The guard consults them in declaration order.
 */
public enum DefenseTarget {
    IP("ip"),
    DEVICE("device"),
    /** Quarantines every redemption carrying the merchant id. */
    MERCHANT("merchant");

    private final String wireName;

    DefenseTarget(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
