package com.giftcard.fraudguard.core.replay;

/**
 * Permanent set of redeemed codes. Entries are never removed.
 */
public interface RedeemedCodeStore {

    boolean isRedeemed(String code);

    void record(RedeemedCodeRecord record);
}
