package com.giftcard.fraudguard.core.replay;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redeemed-code record shared across instances. Keys have no TTL: a redeemed code stays
 * redeemed. Read failures propagate so the replay guard can fail closed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraudguard.store.type", havingValue = "redis")
public class RedisRedeemedCodeStore implements RedeemedCodeStore {

    private static final String KEY_PREFIX = "fraudguard:redeemed:";

    private final RedisTemplate<String, RedeemedCodeRecord> redeemedCodeRedisTemplate;

    @Override
    public boolean isRedeemed(String code) {
        return Boolean.TRUE.equals(redeemedCodeRedisTemplate.hasKey(KEY_PREFIX + code));
    }

    @Override
    public void record(RedeemedCodeRecord record) {
        Boolean stored = redeemedCodeRedisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + record.getCode(), record);
        if (!Boolean.TRUE.equals(stored)) {
            log.debug("Redeemed-code record already present");
        }
    }
}
