package com.giftcard.fraudguard.alert;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertEventType {
    /** A fraud log was written. */
    FRAUD_ALERT("fraud-alert"),
    /** A cluster was created or grew. */
    FRAUD_CLUSTER("fraud-cluster"),
    /** A redemption was allowed. */
    TRANSACTION_FEED("transaction-feed"),
    /** A defense rule was raised from a cluster or learned from replay. */
    DEFENSE_ACTION("defense-action");

    private final String eventName;

    AlertEventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }
}
