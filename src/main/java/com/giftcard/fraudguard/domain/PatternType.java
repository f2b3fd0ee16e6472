package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the logs of a fraud cluster are related. Declaration order is the order in which
 * the clustering engine assigns logs within a run.
 */
public enum PatternType {
    IP_BASED("ip_based"),
    DEVICE_FINGERPRINT("device_fingerprint"),
    VELOCITY("velocity"),
    USER_AGENT("user_agent");

    private final String wireName;

    PatternType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
