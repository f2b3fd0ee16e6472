package com.giftcard.fraudguard.alert;

import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.LogSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Forwards fraud logs to an external alerting endpoint ({@code fraudguard.webhook.url}).
 * Delivery is asynchronous and retried with linear backoff; it never blocks or fails a
 * redemption. Logs that came in through the inbound webhook are not echoed back out.
 */
@Slf4j
@Service
public class FraudWebhookNotifier {

    static final String USER_AGENT = "GiftCard-FraudGuard/1.0";

    private final RestTemplate restTemplate;
    private final ScheduledExecutorService executorService;

    @Value("${fraudguard.webhook.url:}")
    private String webhookUrl;

    @Value("${fraudguard.webhook.max-retries:3}")
    private int maxRetries;

    @Value("${fraudguard.webhook.retry-delay-ms:1000}")
    private long retryDelayMs;

    @Autowired
    public FraudWebhookNotifier(@Value("${fraudguard.webhook.timeout-ms:5000}") int timeoutMs) {
        this.restTemplate = new RestTemplate();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        restTemplate.setRequestFactory(factory);
        this.executorService = Executors.newScheduledThreadPool(2);
    }

    FraudWebhookNotifier(RestTemplate restTemplate, ScheduledExecutorService executorService) {
        this.restTemplate = restTemplate;
        this.executorService = executorService;
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public void notifyFraud(FraudLog fraudLog) {
        if (!isEnabled() || fraudLog.getSource() == LogSource.WEBHOOK) {
            return;
        }
        FraudWebhookPayload payload = FraudWebhookPayload.builder()
                .gan(fraudLog.getCodeAttempted())
                .ip(fraudLog.getIpAddress())
                .reason(fraudLog.getFailureReason() != null ? fraudLog.getFailureReason().name() : null)
                .merchantId(fraudLog.getMerchantId())
                .timestamp(fraudLog.getTimestamp())
                .build();
        CompletableFuture.runAsync(() -> sendWithRetry(payload, fraudLog.getId(), 0), executorService)
                .exceptionally(ex -> {
                    log.error("Failed to schedule fraud webhook delivery for fraudLog {}", fraudLog.getId(), ex);
                    return null;
                });
    }

    void sendWithRetry(FraudWebhookPayload payload, String fraudLogId, int attempt) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
            restTemplate.postForEntity(webhookUrl, new HttpEntity<>(payload, headers), String.class);
            log.info("Delivered fraud webhook for fraudLog {} (attempt {})", fraudLogId, attempt + 1);
        } catch (Exception e) {
            if (attempt < maxRetries) {
                long delay = retryDelayMs * (attempt + 1);
                log.warn("Fraud webhook delivery failed for fraudLog {} (attempt {}), retrying in {}ms: {}",
                        fraudLogId, attempt + 1, delay, e.getMessage());
                executorService.schedule(() -> sendWithRetry(payload, fraudLogId, attempt + 1),
                        delay, TimeUnit.MILLISECONDS);
            } else {
                log.error("Failed to deliver fraud webhook for fraudLog {} after {} attempts",
                        fraudLogId, maxRetries + 1, e);
            }
        }
    }

    @PreDestroy
    void shutdown() {
        executorService.shutdown();
    }
}
