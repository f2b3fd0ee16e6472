package com.giftcard.fraudguard.defense;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the rules in force would have treated a past fraud event. An event is fraudulent
 * when its severity is at least MEDIUM.
 */
public enum ReplayOutcome {
    /** Fraudulent and covered by a rule. */
    BLOCKED_CORRECTLY("blocked_correctly"),
    /** Fraudulent with no rule covering it. */
    SHOULD_HAVE_BLOCKED("should_have_blocked"),
    /** Covered by a rule but not fraudulent. */
    FALSE_POSITIVE("false_positive"),
    IGNORED("ignored");

    private final String wireName;

    ReplayOutcome(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
