package com.giftcard.fraudguard.core.replay;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "fraudguard.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRedeemedCodeStore implements RedeemedCodeStore {

    private final Map<String, RedeemedCodeRecord> redeemed = new ConcurrentHashMap<>();

    @Override
    public boolean isRedeemed(String code) {
        return redeemed.containsKey(code);
    }

    @Override
    public void record(RedeemedCodeRecord record) {
        redeemed.putIfAbsent(record.getCode(), record);
    }
}
