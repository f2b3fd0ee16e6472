package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DefenseRuleOrigin {
    /** Raised by the clustering engine when a cluster crosses a block threshold. */
    CLUSTER_POLICY("cluster_policy"),
    /** Learned by replaying recent fraud logs against the rules in force. */
    THREAT_REPLAY("threat_replay");

    private final String wireName;

    DefenseRuleOrigin(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
