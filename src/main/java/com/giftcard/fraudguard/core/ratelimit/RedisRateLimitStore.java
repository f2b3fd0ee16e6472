package com.giftcard.fraudguard.core.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Rate-limit store shared by every instance of the service. One Redis key per window
 * ({@code INCR} is atomic); the key expires after twice the window so Redis does the
 * eviction. When Redis is unavailable the check fails open: the replay guard, not the
 * rate limiter, is what prevents double redemption.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraudguard.store.type", havingValue = "redis")
public class RedisRateLimitStore implements RateLimitStore {

    private static final String KEY_PREFIX = "fraudguard:rl:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision checkAndIncrement(RateLimitScope scope, String key, int limit, Duration window) {
        long now = clock.millis();
        String redisKey = redisKey(scope, key, RateLimitStore.windowStart(now, window));
        try {
            Long count = redisTemplate.opsForValue().increment(redisKey);
            if (count == null) {
                return RateLimitDecision.allowed(0, limit);
            }
            if (count == 1L) {
                redisTemplate.expire(redisKey, window.multipliedBy(2));
            }
            if (count > limit) {
                return RateLimitDecision.denied(count, limit, RateLimitStore.retryAfter(now, window));
            }
            return RateLimitDecision.allowed(count, limit);
        } catch (Exception e) {
            log.warn("Rate-limit store unavailable for scope={} (failing open): {}", scope, e.getMessage());
            return RateLimitDecision.allowed(0, limit);
        }
    }

    @Override
    public long currentCount(RateLimitScope scope, String key, Duration window) {
        String redisKey = redisKey(scope, key, RateLimitStore.windowStart(clock.millis(), window));
        try {
            String value = redisTemplate.opsForValue().get(redisKey);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (Exception e) {
            log.warn("Rate-limit count read failed for scope={}: {}", scope, e.getMessage());
            return 0L;
        }
    }

    @Override
    public int evictExpired() {
        // Redis TTLs expire the windows.
        return 0;
    }

    static String redisKey(RateLimitScope scope, String key, long windowStart) {
        return KEY_PREFIX + scope.name().toLowerCase() + ":" + key + ":" + windowStart;
    }
}
