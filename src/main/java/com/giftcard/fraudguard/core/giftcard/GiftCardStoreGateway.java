package com.giftcard.fraudguard.core.giftcard;

import com.giftcard.fraudguard.api.UpstreamUnavailableException;
import com.giftcard.fraudguard.config.FraudGuardProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounded access to the {@link GiftCardStore}. Every call runs under the
 * {@code giftCardStore} circuit breaker and a time limit; a timeout, an error or an open
 * circuit all surface as {@link UpstreamUnavailableException} so callers can fail closed.
 */
@Slf4j
@Service
public class GiftCardStoreGateway {

    static final String CIRCUIT_BREAKER = "giftCardStore";

    private final GiftCardStore store;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final FraudGuardProperties properties;
    private final ExecutorService executor;

    private TimeLimiter timeLimiter;

    public GiftCardStoreGateway(GiftCardStore store,
                                CircuitBreakerRegistry circuitBreakerRegistry,
                                FraudGuardProperties properties,
                                @Value("${fraudguard.upstream.pool-size:16}") int poolSize) {
        this.store = store;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.properties = properties;
        this.executor = Executors.newFixedThreadPool(poolSize);
    }

    @PostConstruct
    void init() {
        timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(properties.getUpstream().getTimeout())
                .cancelRunningFuture(true)
                .build());
        log.info("GiftCardStoreGateway configured: store={}, timeout={}, circuitBreaker={}",
                store.getStoreName(), properties.getUpstream().getTimeout(), CIRCUIT_BREAKER);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    public Optional<GiftCardStatus> lookup(String gan) {
        return call("lookup", () -> store.lookup(gan));
    }

    /**
     * Durable redeemed check. An unknown code is not redeemed.
     */
    public boolean isRedeemed(String gan) {
        return lookup(gan).map(GiftCardStatus::isRedeemed).orElse(false);
    }

    public RedemptionOutcome redeem(String gan, String redeemedBy, String merchantId, BigDecimal amount) {
        RedemptionOutcome outcome = call("redeem", () -> store.redeem(gan, redeemedBy, merchantId, amount));
        if (outcome == null || outcome.getStatus() == null) {
            throw new UpstreamUnavailableException("Gift-card store returned no redemption outcome");
        }
        return outcome;
    }

    private <T> T call(String operation, Supplier<T> supplier) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        try {
            return cb.executeCallable(() -> timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(supplier, executor)));
        } catch (CallNotPermittedException e) {
            log.warn("Gift-card store circuit open, rejecting {} call", operation);
            throw new UpstreamUnavailableException("Gift-card store circuit is open", e);
        } catch (TimeoutException e) {
            log.warn("Gift-card store {} timed out after {}", operation, properties.getUpstream().getTimeout());
            throw new UpstreamUnavailableException("Gift-card store timed out", e);
        } catch (Exception e) {
            log.warn("Gift-card store {} failed: {}", operation, e.getMessage());
            throw new UpstreamUnavailableException("Gift-card store call failed", e);
        }
    }
}
