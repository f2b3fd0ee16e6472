package com.giftcard.fraudguard.core.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local rate-limit store. Each (scope, key) maps to the counter of its current
 * window; {@link ConcurrentHashMap#compute} serializes updates per key while different
 * keys proceed in parallel. A stale window is replaced on the next access of its key,
 * and idle keys are swept periodically.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraudguard.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<CounterKey, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitDecision checkAndIncrement(RateLimitScope scope, String key, int limit, Duration window) {
        long now = clock.millis();
        long start = RateLimitStore.windowStart(now, window);
        Window updated = windows.compute(new CounterKey(scope, key), (k, current) -> {
            if (current == null || current.start != start || current.durationMs != window.toMillis()) {
                return new Window(start, window.toMillis(), 1, now);
            }
            return new Window(start, current.durationMs, current.count + 1, now);
        });
        if (updated.count > limit) {
            return RateLimitDecision.denied(updated.count, limit, RateLimitStore.retryAfter(now, window));
        }
        return RateLimitDecision.allowed(updated.count, limit);
    }

    @Override
    public long currentCount(RateLimitScope scope, String key, Duration window) {
        Window current = windows.get(new CounterKey(scope, key));
        if (current == null) return 0;
        long start = RateLimitStore.windowStart(clock.millis(), window);
        return current.start == start ? current.count : 0;
    }

    @Override
    @Scheduled(fixedDelayString = "${fraudguard.rate-limit.sweep-interval:PT1M}")
    public int evictExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.entrySet().removeIf(e -> now - e.getValue().lastAccessMs >= 2 * e.getValue().durationMs);
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit windows ({} remaining)", evicted, windows.size());
        }
        return evicted;
    }

    int size() {
        return windows.size();
    }

    private record CounterKey(RateLimitScope scope, String key) {}

    private record Window(long start, long durationMs, long count, long lastAccessMs) {}
}
